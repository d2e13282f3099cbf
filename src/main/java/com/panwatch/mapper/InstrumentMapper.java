package com.panwatch.mapper;

import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.InstrumentAgentBinding;
import com.panwatch.entity.InstrumentAgentEntity;
import com.panwatch.entity.InstrumentEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/** MapStruct mapper for instruments and their agent bindings. */
@Mapper
public interface InstrumentMapper {

    InstrumentEntity toEntity(Instrument instrument);

    Instrument toDomain(InstrumentEntity entity);

    List<Instrument> toDomainList(List<InstrumentEntity> entities);

    @Mapping(source = "notifyChannelIds", target = "notifyChannelIds", qualifiedByName = "idsToJson")
    InstrumentAgentEntity toBindingEntity(InstrumentAgentBinding binding);

    @Mapping(source = "notifyChannelIds", target = "notifyChannelIds", qualifiedByName = "jsonToIds")
    InstrumentAgentBinding toBinding(InstrumentAgentEntity entity);

    List<InstrumentAgentBinding> toBindingList(List<InstrumentAgentEntity> entities);

    /** Empty override list is stored as null so the column reads as "inherit". */
    @Named("idsToJson")
    default String idsToJson(List<Long> ids) {
        return ids == null || ids.isEmpty() ? null : JsonHelper.toJson(ids);
    }

    @Named("jsonToIds")
    default List<Long> jsonToIds(String json) {
        return JsonHelper.readList(json, Long.class);
    }
}
