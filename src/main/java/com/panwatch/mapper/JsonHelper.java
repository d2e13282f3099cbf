package com.panwatch.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON helper for the text columns that hold lists and maps
 * (channel id lists, test symbols, agent/provider/channel config).
 *
 * <p>Reads never return null so domain collections stay mutable and non-null.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private JsonHelper() {}

    /** Serialize to JSON, null stays null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} to JSON", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON to {}: {}", type.getSimpleName(), json, e);
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }

    public static <T> List<T> readList(String json, Class<T> elementType) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return OBJECT_MAPPER.readValue(
                    json, OBJECT_MAPPER.getTypeFactory().constructCollectionType(ArrayList.class, elementType));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON list of {}: {}", elementType.getSimpleName(), json, e);
            throw new IllegalStateException("JSON list deserialization failed", e);
        }
    }

    public static Map<String, Object> readObjectMap(String json) {
        return readMap(json, OBJECT_MAP);
    }

    public static Map<String, String> readStringMap(String json) {
        return readMap(json, STRING_MAP);
    }

    private static <V> Map<String, V> readMap(String json, TypeReference<Map<String, V>> typeRef) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        try {
            return new HashMap<>(OBJECT_MAPPER.readValue(json, typeRef));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON map: {}", json, e);
            throw new IllegalStateException("JSON map deserialization failed", e);
        }
    }

    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }
}
