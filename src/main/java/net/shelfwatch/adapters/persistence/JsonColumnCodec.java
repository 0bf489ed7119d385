package net.shelfwatch.adapters.persistence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Serializes values stored in {@code jsonb} columns.
 */
@Component
class JsonColumnCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    JsonColumnCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize column value: " + value.getClass().getSimpleName(), ex);
        }
    }

    /**
     * Reads a JSON object. Top-level nulls are dropped since domain maps are immutable copies.
     */
    Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Map.of();
        }
        Map<String, Object> raw = read(json, MAP_TYPE);
        Map<String, Object> cleaned = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (value != null) {
                cleaned.put(key, value);
            }
        });
        return cleaned;
    }

    <T> List<T> readList(String json, TypeReference<List<T>> type) {
        if (!StringUtils.hasText(json)) {
            return List.of();
        }
        List<T> values = read(json, type);
        return values == null ? List.of() : values;
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Persisted JSON column is invalid", ex);
        }
    }
}
