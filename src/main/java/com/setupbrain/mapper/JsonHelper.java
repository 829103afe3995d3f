package com.setupbrain.mapper;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON helper for MapStruct mappers and log formatting.
 *
 * <p>Used to store the decision log's data context map in a TEXT column. Dates are
 * written as ISO-8601 strings; BigDecimal values are written as plain numbers.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
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

    /** Deserialize a JSON string to an object. Returns null if input is null or empty. */
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

    /** Deserialize a JSON string to a generic type (e.g., Map&lt;String, Object&gt;). */
    public static <T> T fromJson(String json, TypeReference<T> typeRef) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON to {}: {}", typeRef.getType(), json, e);
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }
}
