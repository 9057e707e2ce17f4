package io.kubeplane.mcp.server.model;

import io.kubeplane.core.cluster.ClusterContext;

/** Public view of a registered cluster. Credentials never leave the process. */
public record ClusterView(String name, String endpoint, String defaultNamespace) {
    public static ClusterView from(ClusterContext context) {
        return new ClusterView(context.name(), context.endpoint(), context.defaultNamespace());
    }
}
