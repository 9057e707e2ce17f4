package io.kubeplane.core.error;

public final class DuplicateClusterException extends KubeplaneException {
    public DuplicateClusterException(String clusterName) {
        super(ErrorKind.DUPLICATE_CLUSTER, "Cluster already registered: " + clusterName);
    }
}
