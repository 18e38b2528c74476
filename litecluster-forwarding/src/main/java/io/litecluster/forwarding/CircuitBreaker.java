package io.litecluster.forwarding;

import io.litecluster.common.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-state breaker guarding calls to the primary.
 *
 * <p>Callers ask for a permit with {@link #tryAcquire()}, perform the call without holding any lock,
 * then hand the permit back with {@link #recordSuccess(Decision)} or {@link #recordFailure(Decision)}.
 * Once the reset timeout has elapsed an OPEN breaker hands out exactly one probe permit and moves to
 * HALF_OPEN; further callers are rejected until the probe reports back.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int failureThreshold;
    private final Duration resetTimeout;
    private final boolean disabled;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private long openedAtNanos;
    private boolean probeInFlight;

    public CircuitBreaker(int failureThreshold, Duration resetTimeout) {
        this(failureThreshold, resetTimeout, false, Ticker.system());
    }

    public CircuitBreaker(int failureThreshold, Duration resetTimeout, boolean disabled, Ticker ticker) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        if (resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must not be negative");
        }
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.disabled = disabled;
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
    }

    public record Decision(boolean allowed, boolean probe, long retryAfterSeconds) {

        private static final Decision PASS = new Decision(true, false, 0);
        private static final Decision PROBE = new Decision(true, true, 0);

        static Decision rejected(long retryAfterSeconds) {
            return new Decision(false, false, Math.max(1, retryAfterSeconds));
        }
    }

    public Decision tryAcquire() {
        if (disabled) {
            return Decision.PASS;
        }
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> Decision.PASS;
                case OPEN -> {
                    long elapsed = ticker.nanos() - openedAtNanos;
                    if (elapsed < resetTimeout.toNanos()) {
                        yield Decision.rejected(secondsUntilReset(elapsed));
                    }
                    state = CircuitState.HALF_OPEN;
                    probeInFlight = true;
                    log.atInfo()
                        .addKeyValue("failureCount", failureCount)
                        .log("Circuit half-open, allowing probe request");
                    yield Decision.PROBE;
                }
                case HALF_OPEN -> {
                    if (probeInFlight) {
                        yield Decision.rejected(1);
                    }
                    probeInFlight = true;
                    yield Decision.PROBE;
                }
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports a successful call made under {@code permit}. Only the probe permit can close a HALF_OPEN
     * breaker; outcomes of permits handed out before the circuit opened leave the open window alone.
     */
    public void recordSuccess(Decision permit) {
        requireGranted(permit);
        lock.lock();
        try {
            switch (state) {
                case HALF_OPEN -> {
                    if (permit.probe()) {
                        state = CircuitState.CLOSED;
                        failureCount = 0;
                        probeInFlight = false;
                        log.info("Circuit closed after successful probe");
                    }
                }
                case CLOSED -> failureCount = 0;
                case OPEN -> {
                    // admitted before the circuit opened; the open window still stands
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure(Decision permit) {
        requireGranted(permit);
        lock.lock();
        try {
            switch (state) {
                case HALF_OPEN -> {
                    if (permit.probe()) {
                        open(1);
                        log.warn("Circuit re-opened after failed probe");
                    } else {
                        failureCount++;
                    }
                }
                case CLOSED -> {
                    failureCount++;
                    if (failureCount >= failureThreshold) {
                        open(failureCount);
                        log.atWarn()
                            .addKeyValue("failureCount", failureCount)
                            .addKeyValue("resetTimeoutMs", resetTimeout.toMillis())
                            .log("Circuit opened");
                    }
                }
                case OPEN -> failureCount++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seconds a rejected caller should wait before trying again, or zero when calls are currently let
     * through.
     */
    public long retryAfterSeconds() {
        lock.lock();
        try {
            if (disabled || state != CircuitState.OPEN) {
                return 0;
            }
            long elapsed = ticker.nanos() - openedAtNanos;
            return elapsed >= resetTimeout.toNanos() ? 0 : Math.max(1, secondsUntilReset(elapsed));
        } finally {
            lock.unlock();
        }
    }

    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int failureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public OptionalLong openedAtNanos() {
        lock.lock();
        try {
            return state == CircuitState.CLOSED ? OptionalLong.empty() : OptionalLong.of(openedAtNanos);
        } finally {
            lock.unlock();
        }
    }

    public boolean isDisabled() {
        return disabled;
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public Duration resetTimeout() {
        return resetTimeout;
    }

    private static void requireGranted(Decision permit) {
        Objects.requireNonNull(permit, "permit must not be null");
        if (!permit.allowed()) {
            throw new IllegalArgumentException("outcome reported for a rejected permit");
        }
    }

    private void open(int failures) {
        state = CircuitState.OPEN;
        failureCount = failures;
        openedAtNanos = ticker.nanos();
        probeInFlight = false;
    }

    private long secondsUntilReset(long elapsedNanos) {
        long remaining = resetTimeout.toNanos() - elapsedNanos;
        long seconds = TimeUnit.NANOSECONDS.toSeconds(remaining);
        return TimeUnit.SECONDS.toNanos(seconds) < remaining ? seconds + 1 : seconds;
    }
}
