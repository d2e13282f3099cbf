package com.panwatch.mapper;

import com.panwatch.domain.model.AiModel;
import com.panwatch.entity.AiModelEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface AiModelMapper {

    AiModelEntity toEntity(AiModel model);

    AiModel toDomain(AiModelEntity entity);

    List<AiModel> toDomainList(List<AiModelEntity> entities);
}
