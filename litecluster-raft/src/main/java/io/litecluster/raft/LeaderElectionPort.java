package io.litecluster.raft;

/**
 * Local leadership flag as seen by this node. Both mutators are idempotent.
 */
public interface LeaderElectionPort {

    boolean isLeaderElected();

    void electAsLeader();

    void demoteFromLeader();
}
