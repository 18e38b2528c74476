package io.litecluster.raft;

import java.util.List;
import java.util.Objects;

public record SplitBrainStatus(boolean isSplitBrain, List<RaftNodeState> leaderNodes) {

    public SplitBrainStatus {
        Objects.requireNonNull(leaderNodes, "leaderNodes must not be null");
        for (RaftNodeState node : leaderNodes) {
            if (!node.isLeader()) {
                throw new IllegalArgumentException("leaderNodes must only contain leaders, got: " + node.nodeId());
            }
        }
        if (isSplitBrain != (leaderNodes.size() >= 2)) {
            throw new IllegalArgumentException(
                "isSplitBrain must be true exactly when two or more leaders are present, got "
                    + isSplitBrain + " with " + leaderNodes.size() + " leaders");
        }
        leaderNodes = List.copyOf(leaderNodes);
    }

    public static SplitBrainStatus of(RaftClusterState state) {
        List<RaftNodeState> leaders = state.getLeaderNodes();
        return new SplitBrainStatus(leaders.size() >= 2, leaders);
    }

    public int leaderCount() {
        return leaderNodes.size();
    }
}
