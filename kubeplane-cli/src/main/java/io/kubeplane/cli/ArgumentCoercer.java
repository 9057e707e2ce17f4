package io.kubeplane.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts {@code key=value} command line arguments to the JSON types a tool declares.
 * Parameters without a declared type stay strings so the server-side validation can name them.
 */
final class ArgumentCoercer {
    private final Map<String, String> declaredTypes;
    private final ObjectMapper mapper;

    ArgumentCoercer(Map<String, String> declaredTypes, ObjectMapper mapper) {
        this.declaredTypes = declaredTypes;
        this.mapper = mapper;
    }

    Map<String, Object> coerce(Map<String, String> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((key, value) -> out.put(key, convert(key, value)));
        return out;
    }

    private Object convert(String key, String value) {
        String type = declaredTypes.getOrDefault(key, "string");
        switch (type) {
            case "integer":
                try {
                    return Long.parseLong(value.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("argument " + key + " must be an integer: " + value, e);
                }
            case "boolean":
                String normalized = value.trim().toLowerCase(Locale.ROOT);
                if (!normalized.equals("true") && !normalized.equals("false")) {
                    throw new IllegalArgumentException("argument " + key + " must be true or false: " + value);
                }
                return Boolean.parseBoolean(normalized);
            case "object":
            case "array":
                try {
                    return mapper.readValue(value, Object.class);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("argument " + key + " must be JSON: " + e.getOriginalMessage(), e);
                }
            default:
                return value;
        }
    }
}
