package io.kubeplane.core.tool;

import io.kubeplane.core.cluster.ClusterSelector;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolInvocation(String toolName, Map<String, Object> parameters, ClusterSelector selector) {
    public ToolInvocation {
        toolName = toolName == null ? "" : toolName.trim();
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        selector = selector == null ? ClusterSelector.allClusters() : selector;
    }

    public ToolInvocation(String toolName, Map<String, Object> parameters) {
        this(toolName, parameters, ClusterSelector.allClusters());
    }
}
