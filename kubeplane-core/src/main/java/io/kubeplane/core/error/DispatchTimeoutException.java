package io.kubeplane.core.error;

import java.time.Duration;

public final class DispatchTimeoutException extends KubeplaneException {
    public DispatchTimeoutException(String clusterName, Duration deadline) {
        super(ErrorKind.TIMEOUT, "Cluster " + clusterName + " did not complete within " + deadline.toMillis() + " ms");
    }
}
