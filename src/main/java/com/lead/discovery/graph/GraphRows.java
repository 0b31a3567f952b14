package com.lead.discovery.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for reading graph result rows and for the JSON-encoded properties
 * that graph repositories store as strings.
 */
public final class GraphRows {
    private static final Logger log = LoggerFactory.getLogger(GraphRows.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private GraphRows() {
    }

    /**
     * Reads a string column, mapping the empty string the repositories write for null back to null.
     */
    public static String string(Map<String, Object> row, String key) {
        Object value = row.get(key);
        if (value == null) {
            return null;
        }
        String s = value.toString();
        return s.isEmpty() ? null : s;
    }

    public static long longValue(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value instanceof Number n ? n.longValue() : 0L;
    }

    public static double doubleValue(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    public static Double nullableDouble(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    public static boolean bool(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(value));
    }

    public static Instant instant(Map<String, Object> row, String key) {
        String value = string(row, key);
        return value != null ? Instant.parse(value) : null;
    }

    public static Set<String> stringSet(Map<String, Object> row, String key) {
        Set<String> result = new LinkedHashSet<>();
        if (row.get(key) instanceof Collection<?> values) {
            values.forEach(v -> result.add(String.valueOf(v)));
        }
        return result;
    }

    public static List<String> stringList(Map<String, Object> row, String key) {
        if (row.get(key) instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    public static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public static String orEmpty(Instant value) {
        return value != null ? timestamp(value) : "";
    }

    /**
     * Fixed-width UTC form so that stored timestamps compare correctly as strings.
     */
    public static String timestamp(Instant value) {
        return TIMESTAMP.format(value);
    }

    public static String toJson(Object value) {
        if (value == null) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("graph.json serialize failed type={} error={}", value.getClass().getSimpleName(), e.getMessage());
            return "{}";
        }
    }

    public static Map<String, Object> mapFromJson(String json) {
        if (json == null || json.isBlank() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("graph.json deserialize failed error={}", e.getMessage());
            return Map.of();
        }
    }

    public static <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("graph.json deserialize failed type={} error={}", type.getType(), e.getMessage());
            return fallback;
        }
    }
}
