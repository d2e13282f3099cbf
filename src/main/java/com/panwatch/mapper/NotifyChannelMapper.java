package com.panwatch.mapper;

import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.entity.NotifyChannelEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/** MapStruct mapper between NotifyChannel and NotifyChannelEntity (config kept as JSON text). */
@Mapper
public interface NotifyChannelMapper {

    @Mapping(source = "config", target = "config", qualifiedByName = "configToJson")
    NotifyChannelEntity toEntity(NotifyChannel channel);

    @Mapping(source = "config", target = "config", qualifiedByName = "jsonToConfig")
    NotifyChannel toDomain(NotifyChannelEntity entity);

    List<NotifyChannel> toDomainList(List<NotifyChannelEntity> entities);

    @Named("configToJson")
    default String configToJson(Map<String, String> config) {
        return JsonHelper.toJson(config == null ? Map.of() : config);
    }

    @Named("jsonToConfig")
    default Map<String, String> jsonToConfig(String json) {
        return JsonHelper.readStringMap(json);
    }
}
