package io.litecluster.failover;

import java.util.Objects;
import java.util.Optional;

public record FailoverEvent(FailoverEventType type, String reason) {

    public FailoverEvent {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static FailoverEvent of(FailoverEventType type) {
        return new FailoverEvent(type, null);
    }

    public Optional<String> reasonIfPresent() {
        return Optional.ofNullable(reason);
    }
}
