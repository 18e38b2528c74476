package io.litecluster.forwarding;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
