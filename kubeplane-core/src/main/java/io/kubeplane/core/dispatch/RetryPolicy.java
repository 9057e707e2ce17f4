package io.kubeplane.core.dispatch;

import io.kubeplane.core.error.KubeplaneException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff around one per-cluster operation. Only errors whose kind is retryable are
 * retried; everything else propagates on the first attempt.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(2), 2.0);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public <T> T execute(String clusterName, Supplier<T> operation) throws InterruptedException {
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (KubeplaneException e) {
                if (!e.kind().retryable() || attempt >= maxAttempts) {
                    throw e;
                }
                Duration wait = backoff(attempt);
                LOG.debug("Attempt {}/{} on cluster {} failed ({}); retrying in {} ms",
                    attempt, maxAttempts, clusterName, e.getMessage(), wait.toMillis());
                Thread.sleep(wait.toMillis());
                attempt++;
            }
        }
    }

    Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
