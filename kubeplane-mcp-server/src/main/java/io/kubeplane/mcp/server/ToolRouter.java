package io.kubeplane.mcp.server;

import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.cluster.ClusterSelector;
import io.kubeplane.core.dispatch.AggregatedResponse;
import io.kubeplane.core.tool.ToolInvocation;
import io.kubeplane.mcp.server.model.CallRequest;
import io.kubeplane.mcp.server.model.ClusterView;
import io.kubeplane.mcp.server.model.ToolDefinition;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

public final class ToolRouter {
    private final KubeplaneRuntime runtime;

    public ToolRouter(KubeplaneRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    public List<ToolDefinition> listTools() {
        return runtime.tools().all().stream().map(ToolDefinition::from).toList();
    }

    public List<ClusterView> listClusters() {
        return runtime.clusters().contexts().stream().map(ClusterView::from).toList();
    }

    /**
     * Throws {@link IllegalArgumentException} for a malformed selector and
     * {@link io.kubeplane.core.error.UnknownClusterException} when it names an unregistered cluster.
     */
    public AggregatedResponse callTool(CallRequest request) {
        ClusterSelector selector = ClusterSelector.parse(request.clusters(), runtime.defaultSelector());
        Duration deadline = request.timeoutSeconds() == null || request.timeoutSeconds() <= 0
            ? null
            : Duration.ofSeconds(request.timeoutSeconds());
        return runtime.engine().dispatch(new ToolInvocation(request.name(), request.arguments(), selector), deadline);
    }
}
