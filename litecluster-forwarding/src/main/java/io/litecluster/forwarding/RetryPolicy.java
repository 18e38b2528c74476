package io.litecluster.forwarding;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Retry budget for forwarding a write to the primary. Attempt numbers are 1-based; the delay before
 * attempt {@code k >= 2} is {@code min(backoffBase * 2^(k-2), maxBackoff)}.
 */
public record RetryPolicy(int maxRetries, Duration backoffBase, Duration maxBackoff) {

    public static final int MAX_RETRIES = 100;

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(502, 503, 504);

    public RetryPolicy {
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        if (maxRetries > MAX_RETRIES) {
            throw new IllegalArgumentException("maxRetries must be at most " + MAX_RETRIES + ", got: " + maxRetries);
        }
        if (backoffBase.isZero() || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be positive");
        }
        if (maxBackoff.isZero() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("maxBackoff must be positive");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Duration backoffBefore(int attempt) {
        if (attempt < 2) {
            throw new IllegalArgumentException("backoff applies from the second attempt, got: " + attempt);
        }
        int exponent = attempt - 2;
        long baseNanos = backoffBase.toNanos();
        long maxNanos = maxBackoff.toNanos();
        if (exponent >= 62 || baseNanos > (maxNanos >> exponent)) {
            return maxBackoff;
        }
        return Duration.ofNanos(Math.min(baseNanos << exponent, maxNanos));
    }

    public boolean isRetryableStatus(int statusCode) {
        return RETRYABLE_STATUSES.contains(statusCode);
    }

    public boolean isTransient(Throwable error) {
        if (error instanceof SocketException
            || error instanceof SocketTimeoutException
            || error instanceof HttpTimeoutException
            || error instanceof TimeoutException) {
            return true;
        }
        Throwable cause = error.getCause();
        return cause != null && cause != error && isTransient(cause);
    }
}
