package io.kubeplane.core.cluster;

import io.fabric8.kubernetes.client.KubernetesClient;

public record ClusterCapability(String clusterName, KubernetesClient client) implements AutoCloseable {

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }
}
