package io.kubeplane.core.tool;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Map;

public enum ParameterType {
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array");

    private final String schemaName;

    ParameterType(String schemaName) {
        this.schemaName = schemaName;
    }

    @JsonValue
    public String schemaName() {
        return schemaName;
    }

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map<?, ?>;
            case ARRAY -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
        };
    }

    static String describe(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
