package io.litecluster.failover;

public enum NodeState {
    PRIMARY,
    REPLICA
}
