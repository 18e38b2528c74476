package io.litecluster.raft;

import java.time.Duration;
import java.util.List;

/**
 * Leader election backed by a quorum-based consensus component. Exposes cluster membership and
 * timing facts in addition to the local leadership flag.
 */
public interface RaftLeaderElectionPort extends LeaderElectionPort {

    /**
     * Members in configuration order. Implementations return a copy; callers may mutate it freely.
     */
    List<String> getClusterMembers();

    boolean isMemberInCluster(String nodeId);

    Duration getElectionTimeout();

    Duration getHeartbeatInterval();

    boolean isQuorumReached();
}
