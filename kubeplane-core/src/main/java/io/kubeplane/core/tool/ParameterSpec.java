package io.kubeplane.core.tool;

import java.util.Objects;

/**
 * One declared tool parameter. {@code minimum} and {@code maximum} bound {@link ParameterType#INTEGER}
 * values and are {@code null} when unbounded.
 */
public record ParameterSpec(
    String name,
    ParameterType type,
    boolean required,
    String description,
    Long minimum,
    Long maximum
) {
    public ParameterSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("parameter name must not be blank");
        }
        Objects.requireNonNull(type, "type must not be null");
        description = description == null ? "" : description;
        if ((minimum != null || maximum != null) && type != ParameterType.INTEGER) {
            throw new IllegalArgumentException("only integer parameters take bounds: " + name);
        }
        if (minimum != null && maximum != null && minimum > maximum) {
            throw new IllegalArgumentException("minimum exceeds maximum for parameter " + name);
        }
    }

    public ParameterSpec(String name, ParameterType type, boolean required, String description) {
        this(name, type, required, description, null, null);
    }

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return new ParameterSpec(name, type, true, description);
    }

    public static ParameterSpec optional(String name, ParameterType type, String description) {
        return new ParameterSpec(name, type, false, description);
    }

    public ParameterSpec between(long newMinimum, long newMaximum) {
        return new ParameterSpec(name, type, required, description, newMinimum, newMaximum);
    }

    boolean inRange(long value) {
        return (minimum == null || value >= minimum) && (maximum == null || value <= maximum);
    }
}
