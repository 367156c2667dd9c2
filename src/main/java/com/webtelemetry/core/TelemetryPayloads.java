package com.webtelemetry.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Converts loosely-typed instrumentation payloads ({@code Map<String, Object>}
 * as produced by injected scripts or CDP bridges) into the typed event records.
 *
 * Top-level keys and the keys of the nested {@code timing} and {@code location}
 * objects may be snake_case or camelCase. Header maps are passed through as-is.
 * Unknown keys are ignored. A top-level value that does not fit its field (a string
 * status, a string initiator) is dropped and the rest of the payload still converts.
 */
public final class TelemetryPayloads {

    private static final Set<String> NESTED_OBJECTS = Set.of("timing", "location");

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private TelemetryPayloads() {}

    public static <T> T convert(Map<String, ?> payload, Class<T> type) {
        return convert(payload, type, field -> { });
    }

    /**
     * Converts {@code payload}, dropping every top-level field whose value cannot be
     * bound. Each dropped field name is handed to {@code onDropped}; when the failing
     * field cannot be identified the whole payload is dropped and reported as "*".
     */
    public static <T> T convert(Map<String, ?> payload, Class<T> type, Consumer<String> onDropped) {
        Map<String, Object> normalized = payload != null ? normalize(payload, true) : new LinkedHashMap<>();
        int attempts = normalized.size() + 1;
        while (attempts-- > 0) {
            try {
                return MAPPER.convertValue(normalized, type);
            } catch (IllegalArgumentException e) {
                String field = failingField(e);
                if (field == null || !normalized.containsKey(field)) {
                    break;
                }
                normalized.remove(field);
                onDropped.accept(field);
            }
        }
        onDropped.accept("*");
        return MAPPER.convertValue(Map.of(), type);
    }

    private static String failingField(IllegalArgumentException e) {
        if (!(e.getCause() instanceof JsonMappingException mapping)) return null;
        List<JsonMappingException.Reference> path = mapping.getPath();
        return path.isEmpty() ? null : path.get(0).getFieldName();
    }

    private static Map<String, Object> normalize(Map<?, ?> source, boolean topLevel) {
        Map<String, Object> out = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            String key = toCamelCase(String.valueOf(k));
            Object value = v;
            if (topLevel && NESTED_OBJECTS.contains(key) && v instanceof Map<?, ?> nested) {
                value = normalize(nested, false);
            }
            out.put(key, value);
        });
        return out;
    }

    static String toCamelCase(String key) {
        if (key.indexOf('_') < 0) return key;
        StringBuilder sb = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = sb.length() > 0;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** The shared mapper, for callers that serialize exports. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
