package com.alertaggregator.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utility for JSON serialization/deserialization used by MapStruct mappers.
 *
 * <p>The alerts table keeps tags and metadata as JSON text columns. Metadata is read back into
 * a {@link LinkedHashMap} so key order survives a round trip through the store.
 *
 * <p>Uses a shared ObjectMapper with ISO-8601 date output.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private JsonHelper() {}

    /** Serialize an object to JSON string. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Deserialize a JSON object into an insertion-ordered map. Returns an empty map for null input. */
    public static Map<String, Object> fromJsonMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return OBJECT_MAPPER.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON map: {}", json, e);
            throw new IllegalStateException("JSON map deserialization failed", e);
        }
    }

    /** Deserialize a JSON array string to a List. Returns empty list if input is null. */
    public static <T> List<T> fromJsonList(String json, Class<T> elementType) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return OBJECT_MAPPER.readValue(
                    json, OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, elementType));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON list of {}: {}", elementType.getSimpleName(), json, e);
            throw new IllegalStateException("JSON list deserialization failed", e);
        }
    }
}
