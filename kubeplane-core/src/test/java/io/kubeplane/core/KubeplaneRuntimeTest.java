package io.kubeplane.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kubeplane.core.cluster.ClusterCapability;
import io.kubeplane.core.cluster.ClusterSelector;
import io.kubeplane.core.config.model.ClusterConfig;
import io.kubeplane.core.config.model.KubeplaneConfig;
import io.kubeplane.core.handler.HandlerRegistry;
import io.kubeplane.core.tool.ToolDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

class KubeplaneRuntimeTest {

    @Test
    void defaultSelectorUsesConfiguredDefaultCluster() {
        try (KubeplaneRuntime runtime = runtime(config("b", false))) {
            assertThat(runtime.defaultSelector()).isEqualTo(ClusterSelector.single("b"));
            assertThat(runtime.clusters().contexts()).hasSize(2);
        }
    }

    @Test
    void defaultSelectorFallsBackToAllClusters() {
        try (KubeplaneRuntime runtime = runtime(config(null, false))) {
            assertThat(runtime.defaultSelector()).isEqualTo(ClusterSelector.allClusters());
        }
    }

    @Test
    void unknownDefaultClusterIsRejected() {
        assertThatThrownBy(() -> runtime(config("missing", false)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void readOnlyExposesNoMutatingTools() {
        try (KubeplaneRuntime runtime = runtime(config(null, true))) {
            assertThat(runtime.tools().all()).isNotEmpty().noneMatch(ToolDescriptor::mutating);
            assertThat(runtime.tools().find("list_pods")).isPresent();
            assertThat(runtime.tools().find("delete_pod")).isEmpty();
        }
    }

    private static KubeplaneRuntime runtime(KubeplaneConfig config) {
        return KubeplaneRuntime.create(
            config,
            context -> new ClusterCapability(context.name(), null),
            HandlerRegistry.kubernetesDefaults()
        );
    }

    private static KubeplaneConfig config(String defaultCluster, boolean readOnly) {
        return new KubeplaneConfig(
            defaultCluster,
            readOnly,
            false,
            null,
            List.of(
                new ClusterConfig("a", "https://a.example", null, null),
                new ClusterConfig("b", "https://b.example", "team-b", null)
            )
        );
    }
}
