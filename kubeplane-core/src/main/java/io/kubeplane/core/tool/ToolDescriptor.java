package io.kubeplane.core.tool;

import io.kubeplane.core.handler.Verb;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one tool: the resource kind and verb it maps to and the parameters it
 * accepts, in declaration order.
 */
public record ToolDescriptor(
    String name,
    String description,
    String kind,
    Verb verb,
    List<ParameterSpec> parameters
) {
    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(verb, "verb must not be null");
        description = description == null ? "" : description;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        Set<String> seen = new HashSet<>();
        for (ParameterSpec parameter : parameters) {
            if (!seen.add(parameter.name())) {
                throw new IllegalArgumentException("Duplicate parameter " + parameter.name() + " in tool " + name);
            }
        }
    }

    public Optional<ParameterSpec> parameter(String parameterName) {
        return parameters.stream().filter(parameter -> parameter.name().equals(parameterName)).findFirst();
    }

    public boolean mutating() {
        return verb.mutating();
    }

    public Map<String, Object> inputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ParameterSpec parameter : parameters) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", parameter.type().schemaName());
            if (!parameter.description().isBlank()) {
                property.put("description", parameter.description());
            }
            if (parameter.minimum() != null) {
                property.put("minimum", parameter.minimum());
            }
            if (parameter.maximum() != null) {
                property.put("maximum", parameter.maximum());
            }
            properties.put(parameter.name(), property);
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }
}
