package io.litecluster.forwarding;

import io.litecluster.common.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Forwards writes to the primary through a {@link CircuitBreaker} and a {@link RetryPolicy}.
 *
 * <p>Transient failures (connection errors, timeouts, 502/503/504) are retried with exponential
 * backoff. Any other response is returned to the caller as-is. The breaker sees one outcome per
 * forwarded request, after retries; a HALF_OPEN probe gets a single attempt. When the primary cannot
 * be reached the caller receives a local 503 with a {@code Retry-After} header.
 */
public final class ResilientForwarder {
    private static final Logger log = LoggerFactory.getLogger(ResilientForwarder.class);

    public static final long DEFAULT_RETRY_AFTER_SECONDS = 5;

    private final ForwardingPort port;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final Sleeper sleeper;

    public ResilientForwarder(ForwardingPort port, RetryPolicy retryPolicy, CircuitBreaker circuitBreaker) {
        this(port, retryPolicy, circuitBreaker, Sleeper.system());
    }

    public ResilientForwarder(
            ForwardingPort port,
            RetryPolicy retryPolicy,
            CircuitBreaker circuitBreaker,
            Sleeper sleeper) {
        this.port = Objects.requireNonNull(port, "port must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public ForwardingResult forward(String primaryUrl, ForwardRequest request) {
        Objects.requireNonNull(primaryUrl, "primaryUrl must not be null");
        Objects.requireNonNull(request, "request must not be null");

        CircuitBreaker.Decision decision = circuitBreaker.tryAcquire();
        if (!decision.allowed()) {
            log.atDebug()
                .addKeyValue("method", request.method())
                .addKeyValue("path", request.path())
                .addKeyValue("retryAfter", decision.retryAfterSeconds())
                .log("Circuit open, rejecting forward");
            return ForwardingResult.serviceUnavailable(
                decision.retryAfterSeconds(), "Primary unavailable: circuit open");
        }

        int maxAttempts = decision.probe() ? 1 : retryPolicy.maxAttempts();
        ForwardingResult result = attemptWithRetry(primaryUrl, request, maxAttempts);

        if (result != null && result.isSuccess()) {
            circuitBreaker.recordSuccess(decision);
            return result;
        }
        circuitBreaker.recordFailure(decision);
        if (result != null) {
            return result;
        }

        long retryAfter = circuitBreaker.retryAfterSeconds();
        return ForwardingResult.serviceUnavailable(
            retryAfter > 0 ? retryAfter : DEFAULT_RETRY_AFTER_SECONDS,
            "Primary unavailable");
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * Returns the primary's response when it gave a definitive answer, or null when every attempt
     * failed transiently or the failure was not worth retrying.
     */
    private ForwardingResult attemptWithRetry(String primaryUrl, ForwardRequest request, int maxAttempts) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                Duration backoff = retryPolicy.backoffBefore(attempt);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off before forward attempt {}", attempt);
                    return null;
                }
            }

            ForwardingResult result;
            try {
                result = port.forwardRequest(primaryUrl, request);
            } catch (IOException | RuntimeException e) {
                if (!retryPolicy.isTransient(e)) {
                    log.atWarn()
                        .addKeyValue("primary", primaryUrl)
                        .addKeyValue("path", request.path())
                        .setCause(e)
                        .log("Forward failed with non-retryable error");
                    return null;
                }
                log.atDebug()
                    .addKeyValue("attempt", attempt)
                    .addKeyValue("maxAttempts", maxAttempts)
                    .addKeyValue("error", e.toString())
                    .log("Transient forward failure");
                continue;
            }

            if (!retryPolicy.isRetryableStatus(result.statusCode())) {
                return result;
            }
            log.atDebug()
                .addKeyValue("attempt", attempt)
                .addKeyValue("maxAttempts", maxAttempts)
                .addKeyValue("status", result.statusCode())
                .log("Primary returned retryable status");
        }

        log.atWarn()
            .addKeyValue("primary", primaryUrl)
            .addKeyValue("attempts", maxAttempts)
            .log("Forward attempts exhausted");
        return null;
    }
}
