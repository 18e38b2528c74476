package io.litecluster.failover;

import io.litecluster.raft.RaftLeaderElectionPort;

import java.util.Objects;

/**
 * PRIMARY/REPLICA state machine for one node.
 *
 * <p>Every operation that changes {@link #state()} emits exactly one {@link FailoverEvent}; calls that
 * leave the state unchanged emit nothing and do not touch the election port. Not thread-safe: one
 * coordinator per node, driven from a single thread.
 */
public final class FailoverCoordinator {

    private final RaftLeaderElectionPort election;
    private final EventEmitterPort events;
    private final LoggingPort logger;

    private volatile NodeState state;
    private volatile boolean healthy = true;

    public FailoverCoordinator(RaftLeaderElectionPort election) {
        this(election, null, null);
    }

    /**
     * @param events optional, may be null
     * @param logger optional, may be null
     */
    public FailoverCoordinator(RaftLeaderElectionPort election, EventEmitterPort events, LoggingPort logger) {
        this.election = Objects.requireNonNull(election, "election must not be null");
        this.events = events;
        this.logger = logger;
        this.state = election.isLeaderElected() ? NodeState.PRIMARY : NodeState.REPLICA;
    }

    public NodeState state() {
        return state;
    }

    public boolean isPrimary() {
        return state == NodeState.PRIMARY;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void markHealthy() {
        healthy = true;
    }

    public void markUnhealthy() {
        healthy = false;
    }

    /**
     * Aligns {@link #state()} with the election outcome.
     */
    public void coordinateTransition() {
        boolean elected = election.isLeaderElected();
        if (elected && state == NodeState.REPLICA) {
            election.electAsLeader();
            state = NodeState.PRIMARY;
            emit(FailoverEventType.PROMOTED_TO_PRIMARY, "elected as leader");
        } else if (!elected && state == NodeState.PRIMARY) {
            election.demoteFromLeader();
            state = NodeState.REPLICA;
            emit(FailoverEventType.DEMOTED_TO_REPLICA, "leadership lost");
        }
    }

    public boolean canBecomeLeader() {
        return checkGuards("Cannot become leader");
    }

    public boolean canMaintainLeadership() {
        return checkGuards("Cannot maintain leadership");
    }

    public void demoteForHealth() {
        forceReplica(FailoverEventType.HEALTH_DEMOTION, "health check failed");
    }

    public void demoteForQuorumLoss() {
        forceReplica(FailoverEventType.QUORUM_LOSS_DEMOTION, "quorum lost");
    }

    public void performGracefulHandoff() {
        forceReplica(FailoverEventType.GRACEFUL_HANDOFF, "graceful handoff requested");
    }

    private boolean checkGuards(String action) {
        if (!healthy) {
            warn(action + ": node is unhealthy");
            return false;
        }
        if (!election.isQuorumReached()) {
            warn(action + ": quorum not reached");
            return false;
        }
        return true;
    }

    private void forceReplica(FailoverEventType type, String reason) {
        if (state != NodeState.PRIMARY) {
            return;
        }
        election.demoteFromLeader();
        state = NodeState.REPLICA;
        emit(type, reason);
    }

    private void emit(FailoverEventType type, String reason) {
        if (events != null) {
            events.emit(new FailoverEvent(type, reason));
        }
    }

    private void warn(String message) {
        if (logger != null) {
            logger.warning(message);
        }
    }
}
