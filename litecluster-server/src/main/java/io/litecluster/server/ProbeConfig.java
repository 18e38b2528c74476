package io.litecluster.server;

import java.time.Duration;
import java.util.Objects;

public record ProbeConfig(
    int healthPort,
    String healthPath,
    Duration connectTimeout,
    Duration readTimeout
) {
    public ProbeConfig {
        if (healthPort <= 0 || healthPort > 65535) {
            throw new IllegalArgumentException("healthPort must be between 1 and 65535");
        }
        Objects.requireNonNull(healthPath, "healthPath must not be null");
        if (!healthPath.startsWith("/")) {
            throw new IllegalArgumentException("healthPath must start with '/'");
        }
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(readTimeout, "readTimeout must not be null");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
    }

    public static ProbeConfig defaults() {
        return new ProbeConfig(8080, "/health/status", Duration.ofSeconds(2), Duration.ofSeconds(5));
    }
}
