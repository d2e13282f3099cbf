package com.panwatch.mapper;

import com.panwatch.domain.model.AgentDefinition;
import com.panwatch.entity.AgentConfigEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between AgentDefinition and AgentConfigEntity.
 * Channel ids and the parameter map are JSON text in the entity.
 */
@Mapper
public interface AgentConfigMapper {

    @Mapping(source = "notifyChannelIds", target = "notifyChannelIds", qualifiedByName = "idsToJson")
    @Mapping(source = "config", target = "config", qualifiedByName = "configToJson")
    AgentConfigEntity toEntity(AgentDefinition agent);

    @Mapping(source = "notifyChannelIds", target = "notifyChannelIds", qualifiedByName = "jsonToIds")
    @Mapping(source = "config", target = "config", qualifiedByName = "jsonToConfig")
    AgentDefinition toDomain(AgentConfigEntity entity);

    List<AgentDefinition> toDomainList(List<AgentConfigEntity> entities);

    @Named("idsToJson")
    default String idsToJson(List<Long> ids) {
        return JsonHelper.toJson(ids == null ? List.of() : ids);
    }

    @Named("jsonToIds")
    default List<Long> jsonToIds(String json) {
        return JsonHelper.readList(json, Long.class);
    }

    @Named("configToJson")
    default String configToJson(Map<String, Object> config) {
        return JsonHelper.toJson(config == null ? Map.of() : config);
    }

    @Named("jsonToConfig")
    default Map<String, Object> jsonToConfig(String json) {
        return JsonHelper.readObjectMap(json);
    }
}
