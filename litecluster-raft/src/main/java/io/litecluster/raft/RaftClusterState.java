package io.litecluster.raft;

import java.util.List;
import java.util.Objects;

/**
 * Leadership claims of every node in the cluster at one point in time. A healthy cluster has exactly
 * one leader; two or more is a split-brain; zero means an election is pending.
 */
public record RaftClusterState(List<RaftNodeState> nodes) {

    public RaftClusterState {
        Objects.requireNonNull(nodes, "nodes must not be null");
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("nodes must not be empty");
        }
        nodes = List.copyOf(nodes);
    }

    public static RaftClusterState of(RaftNodeState... nodes) {
        return new RaftClusterState(List.of(nodes));
    }

    public int countLeaders() {
        int count = 0;
        for (RaftNodeState node : nodes) {
            if (node.isLeader()) {
                count++;
            }
        }
        return count;
    }

    public boolean hasSingleLeader() {
        return countLeaders() == 1;
    }

    public List<RaftNodeState> getLeaderNodes() {
        return nodes.stream().filter(RaftNodeState::isLeader).toList();
    }

    public List<RaftNodeState> getReplicaNodes() {
        return nodes.stream().filter(node -> !node.isLeader()).toList();
    }
}
