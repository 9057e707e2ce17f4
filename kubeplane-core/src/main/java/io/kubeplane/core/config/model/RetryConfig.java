package io.kubeplane.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kubeplane.core.dispatch.RetryPolicy;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryConfig(
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis,
    double multiplier
) {

    public static RetryConfig defaults() {
        return new RetryConfig(3, 200, 2000, 2.0);
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(
            maxAttempts,
            Duration.ofMillis(initialBackoffMillis),
            Duration.ofMillis(maxBackoffMillis),
            multiplier
        );
    }
}
