package io.kubeplane.core.error;

public final class UnknownClusterException extends KubeplaneException {
    private final String clusterName;

    public UnknownClusterException(String clusterName) {
        super(ErrorKind.UNKNOWN_CLUSTER, "Unknown cluster: " + clusterName);
        this.clusterName = clusterName;
    }

    public String clusterName() {
        return clusterName;
    }
}
