package io.kubeplane.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.dispatch.AggregatedResponse;
import io.kubeplane.core.dispatch.DispatchStatus;
import io.kubeplane.mcp.server.model.CallRequest;
import io.kubeplane.mcp.server.model.ToolDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRouterTest {

    @Test
    void callWithoutClustersTargetsConfiguredDefault() {
        try (KubeplaneRuntime runtime = StubRuntimes.twoClusters("a")) {
            ToolRouter router = new ToolRouter(runtime);

            AggregatedResponse response = router.callTool(new CallRequest("list_pods", Map.of(), null, null));

            assertThat(response.status()).isEqualTo(DispatchStatus.SUCCESS);
            assertThat(response.clusters()).containsExactly("a");
        }
    }

    @Test
    void callWithoutClustersAndNoDefaultTargetsAll() {
        try (KubeplaneRuntime runtime = StubRuntimes.twoClusters(null)) {
            ToolRouter router = new ToolRouter(runtime);

            AggregatedResponse response = router.callTool(new CallRequest("list_pods", null, "", 5));

            assertThat(response.clusters()).containsExactly("a", "b");
            assertThat(response.status()).isEqualTo(DispatchStatus.PARTIAL_FAILURE);
        }
    }

    @Test
    void namespaceDefaultsPerCluster() {
        try (KubeplaneRuntime runtime = StubRuntimes.twoClusters(null)) {
            AggregatedResponse response = new ToolRouter(runtime)
                .callTool(new CallRequest("list_pods", Map.of(), List.of("a"), null));

            assertThat(response.results().get(0).payload())
                .isEqualTo(List.of(
                    Map.of("name", "pod1", "namespace", "default"),
                    Map.of("name", "pod2", "namespace", "default")
                ));
        }
    }

    @Test
    void malformedSelectorIsRejected() {
        try (KubeplaneRuntime runtime = StubRuntimes.twoClusters(null)) {
            ToolRouter router = new ToolRouter(runtime);

            assertThatThrownBy(() -> router.callTool(new CallRequest("list_pods", Map.of(), 42, null)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> router.callTool(new CallRequest("list_pods", Map.of(), List.of(), null)))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void listsToolDefinitionsWithMutatingFlag() {
        try (KubeplaneRuntime runtime = StubRuntimes.twoClusters(null)) {
            List<ToolDefinition> tools = new ToolRouter(runtime).listTools();

            assertThat(tools).extracting(ToolDefinition::name).containsExactly("get_pod", "list_pods");
            assertThat(tools).noneMatch(ToolDefinition::mutating);
            assertThat(tools.get(1).kind()).isEqualTo("pods");
        }
    }
}
