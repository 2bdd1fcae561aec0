package com.packsync.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON helpers shared by the seat pack mapper and the vendor gateway.
 *
 * <p>Seat keys and lineage ids are stored as JSON string arrays in TEXT columns. A null or
 * blank column reads back as an empty list so domain code never sees null collections.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

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
            log.error("Failed to serialize {} to JSON", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** An empty list is stored as {@code []}, never as null. */
    public static String stringListToJson(List<String> values) {
        return toJson(values != null ? values : List.of());
    }

    public static List<String> jsonToStringList(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(OBJECT_MAPPER.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            log.error("Failed to read string list from JSON: {}", json, e);
            throw new IllegalStateException("JSON list deserialization failed", e);
        }
    }

    /** Parses a vendor response body. Returns null for an empty body. */
    public static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Response body is not JSON: {}", json);
            return null;
        }
    }
}
