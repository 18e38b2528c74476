package io.litecluster.raft;

import java.util.Objects;

public record RaftNodeState(String nodeId, boolean isLeader) {

    public RaftNodeState {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        if (nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
    }

    public static RaftNodeState leader(String nodeId) {
        return new RaftNodeState(nodeId, true);
    }

    public static RaftNodeState replica(String nodeId) {
        return new RaftNodeState(nodeId, false);
    }
}
