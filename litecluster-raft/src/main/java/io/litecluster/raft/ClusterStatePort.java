package io.litecluster.raft;

@FunctionalInterface
public interface ClusterStatePort {

    RaftClusterState getClusterState();
}
