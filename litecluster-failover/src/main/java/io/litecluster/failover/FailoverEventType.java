package io.litecluster.failover;

public enum FailoverEventType {
    PROMOTED_TO_PRIMARY,
    DEMOTED_TO_REPLICA,
    HEALTH_DEMOTION,
    QUORUM_LOSS_DEMOTION,
    GRACEFUL_HANDOFF
}
