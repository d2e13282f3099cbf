package com.panwatch.mapper;

import com.panwatch.domain.model.DataSourceBinding;
import com.panwatch.entity.DataSourceEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper
public interface DataSourceMapper {

    @Mapping(source = "testSymbols", target = "testSymbols", qualifiedByName = "symbolsToJson")
    @Mapping(source = "config", target = "config", qualifiedByName = "configToJson")
    DataSourceEntity toEntity(DataSourceBinding binding);

    @Mapping(source = "testSymbols", target = "testSymbols", qualifiedByName = "jsonToSymbols")
    @Mapping(source = "config", target = "config", qualifiedByName = "jsonToConfig")
    DataSourceBinding toDomain(DataSourceEntity entity);

    List<DataSourceBinding> toDomainList(List<DataSourceEntity> entities);

    @Named("symbolsToJson")
    default String symbolsToJson(List<String> symbols) {
        return JsonHelper.toJson(symbols == null ? List.of() : symbols);
    }

    @Named("jsonToSymbols")
    default List<String> jsonToSymbols(String json) {
        return JsonHelper.readList(json, String.class);
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
