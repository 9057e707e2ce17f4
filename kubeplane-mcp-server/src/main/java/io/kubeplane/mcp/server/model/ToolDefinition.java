package io.kubeplane.mcp.server.model;

import io.kubeplane.core.tool.ToolDescriptor;
import java.util.Map;

public record ToolDefinition(
    String name,
    String description,
    Map<String, Object> inputSchema,
    String kind,
    String verb,
    boolean mutating
) {
    public static ToolDefinition from(ToolDescriptor descriptor) {
        return new ToolDefinition(
            descriptor.name(),
            descriptor.description(),
            descriptor.inputSchema(),
            descriptor.kind(),
            descriptor.verb().label(),
            descriptor.mutating()
        );
    }
}
