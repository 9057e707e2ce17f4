package io.kubeplane.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kubeplane.core.dispatch.DispatchSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchConfig(
    int maxInFlight,
    int timeoutSeconds,
    RetryConfig retry
) {

    public static DispatchConfig defaults() {
        return new DispatchConfig(8, 30, RetryConfig.defaults());
    }

    public DispatchSettings toSettings() {
        RetryConfig effectiveRetry = retry == null ? RetryConfig.defaults() : retry;
        return new DispatchSettings(maxInFlight, Duration.ofSeconds(timeoutSeconds), effectiveRetry.toPolicy());
    }
}
