package io.kubeplane.core.dispatch;

import java.time.Duration;
import java.util.Objects;

public record DispatchSettings(int maxInFlight, Duration timeout, RetryPolicy retryPolicy) {
    public DispatchSettings {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be at least 1");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(8, Duration.ofSeconds(30), RetryPolicy.defaults());
    }
}
