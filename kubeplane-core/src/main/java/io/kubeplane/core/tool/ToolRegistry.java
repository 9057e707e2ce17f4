package io.kubeplane.core.tool;

import io.kubeplane.core.error.DuplicateToolException;
import io.kubeplane.core.error.InvalidParameterException;
import io.kubeplane.core.error.UnknownToolException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ToolRegistry {
    private final Map<String, ToolDescriptor> tools = new ConcurrentHashMap<>();

    public void register(ToolDescriptor descriptor) {
        ToolDescriptor previous = tools.putIfAbsent(descriptor.name(), descriptor);
        if (previous != null) {
            throw new DuplicateToolException(descriptor.name());
        }
    }

    public Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolDescriptor> all() {
        return tools.values().stream().sorted(Comparator.comparing(ToolDescriptor::name)).toList();
    }

    public int size() {
        return tools.size();
    }

    /**
     * Resolves the invocation's tool and checks its parameters. Unknown parameters are rejected
     * before required or type checks run. A parameter whose value is {@code null} counts as absent;
     * a required string must also be non-blank, and integers must lie within the declared bounds.
     */
    public ToolDescriptor validate(ToolInvocation invocation) {
        ToolDescriptor descriptor = find(invocation.toolName())
            .orElseThrow(() -> new UnknownToolException(invocation.toolName()));

        for (String supplied : invocation.parameters().keySet()) {
            if (descriptor.parameter(supplied).isEmpty()) {
                throw new InvalidParameterException(supplied, "unknown parameter for tool " + descriptor.name());
            }
        }

        for (ParameterSpec parameter : descriptor.parameters()) {
            Object value = invocation.parameters().get(parameter.name());
            if (value == null) {
                if (parameter.required()) {
                    throw new InvalidParameterException(parameter.name(), "is required");
                }
                continue;
            }
            if (!parameter.type().accepts(value)) {
                throw new InvalidParameterException(
                    parameter.name(),
                    "expected " + parameter.type().schemaName() + " but got " + ParameterType.describe(value)
                );
            }
            if (parameter.required() && value instanceof String text && text.isBlank()) {
                throw new InvalidParameterException(parameter.name(), "must not be blank");
            }
            if (value instanceof Number number && !parameter.inRange(number.longValue())) {
                throw new InvalidParameterException(parameter.name(), outOfRange(parameter, number.longValue()));
            }
        }
        return descriptor;
    }

    private static String outOfRange(ParameterSpec parameter, long value) {
        if (parameter.minimum() != null && value < parameter.minimum()) {
            return "must be at least " + parameter.minimum() + " but was " + value;
        }
        return "must be at most " + parameter.maximum() + " but was " + value;
    }
}
