package io.litecluster.forwarding;

import io.litecluster.common.Ticker;

import java.time.Duration;
import java.util.Objects;

public record ForwardingConfig(
    boolean enabled,
    String primaryUrl,
    Duration connectTimeout,
    Duration readTimeout,
    int maxRetries,
    Duration retryBackoffBase,
    Duration maxBackoff,
    int circuitBreakerThreshold,
    Duration circuitBreakerResetTimeout,
    boolean circuitBreakerEnabled
) {
    public ForwardingConfig {
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(readTimeout, "readTimeout must not be null");
        Objects.requireNonNull(retryBackoffBase, "retryBackoffBase must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        Objects.requireNonNull(circuitBreakerResetTimeout, "circuitBreakerResetTimeout must not be null");
        if (connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isZero() || readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        if (maxRetries > RetryPolicy.MAX_RETRIES) {
            throw new IllegalArgumentException("maxRetries must be at most " + RetryPolicy.MAX_RETRIES);
        }
        if (circuitBreakerThreshold < 1) {
            throw new IllegalArgumentException("circuitBreakerThreshold must be at least 1");
        }
        if (primaryUrl != null && primaryUrl.isBlank()) {
            primaryUrl = null;
        }
    }

    public static ForwardingConfig defaults() {
        return new ForwardingConfig(
            true,
            null,
            Duration.ofSeconds(5),
            Duration.ofSeconds(30),
            3,
            Duration.ofSeconds(1),
            Duration.ofSeconds(30),
            5,
            Duration.ofSeconds(30),
            true
        );
    }

    public ForwardingConfig withPrimaryUrl(String url) {
        return new ForwardingConfig(
            enabled, url, connectTimeout, readTimeout, maxRetries, retryBackoffBase, maxBackoff,
            circuitBreakerThreshold, circuitBreakerResetTimeout, circuitBreakerEnabled
        );
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, retryBackoffBase, maxBackoff);
    }

    public CircuitBreaker circuitBreaker(Ticker ticker) {
        return new CircuitBreaker(circuitBreakerThreshold, circuitBreakerResetTimeout, !circuitBreakerEnabled, ticker);
    }
}
