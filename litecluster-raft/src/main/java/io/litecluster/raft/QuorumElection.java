package io.litecluster.raft;

import io.litecluster.common.ClusterMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory {@link RaftLeaderElectionPort}. Leadership is whatever was last set locally; every
 * configured member counts as reachable until reported otherwise.
 */
public final class QuorumElection implements RaftLeaderElectionPort {
    private static final Logger log = LoggerFactory.getLogger(QuorumElection.class);

    private final ElectionConfig config;
    private final AtomicBoolean leader = new AtomicBoolean(false);
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();

    public QuorumElection(ElectionConfig config) {
        this.config = config;
    }

    public ElectionConfig config() {
        return config;
    }

    public String nodeId() {
        return config.nodeId();
    }

    @Override
    public boolean isLeaderElected() {
        return leader.get();
    }

    @Override
    public void electAsLeader() {
        if (leader.compareAndSet(false, true)) {
            log.atInfo()
                .addKeyValue("nodeId", config.nodeId())
                .log("Elected as leader");
        }
    }

    @Override
    public void demoteFromLeader() {
        if (leader.compareAndSet(true, false)) {
            log.atInfo()
                .addKeyValue("nodeId", config.nodeId())
                .log("Demoted from leader");
        }
    }

    @Override
    public List<String> getClusterMembers() {
        return new ArrayList<>(config.clusterMembers());
    }

    @Override
    public boolean isMemberInCluster(String nodeId) {
        return nodeId != null && ElectionConfig.containsNode(config.clusterMembers(), nodeId);
    }

    @Override
    public Duration getElectionTimeout() {
        return config.electionTimeout();
    }

    @Override
    public Duration getHeartbeatInterval() {
        return config.heartbeatInterval();
    }

    @Override
    public boolean isQuorumReached() {
        return Quorum.isReached(reachableCount(), config.clusterSize());
    }

    public int reachableCount() {
        int count = 0;
        for (String member : config.clusterMembers()) {
            if (!unreachable.contains(member)) {
                count++;
            }
        }
        return count;
    }

    public void markUnreachable(String member) {
        requireMember(member);
        if (isSelf(member)) {
            throw new IllegalArgumentException("Local node is always reachable: " + member);
        }
        if (unreachable.add(member)) {
            log.atWarn()
                .addKeyValue("nodeId", config.nodeId())
                .addKeyValue("member", member)
                .log("Cluster member unreachable");
        }
    }

    public void markReachable(String member) {
        requireMember(member);
        if (unreachable.remove(member)) {
            log.atInfo()
                .addKeyValue("nodeId", config.nodeId())
                .addKeyValue("member", member)
                .log("Cluster member reachable again");
        }
    }

    private void requireMember(String member) {
        if (!config.clusterMembers().contains(member)) {
            throw new IllegalArgumentException("Not a cluster member: " + member);
        }
    }

    private boolean isSelf(String member) {
        return member.equals(config.nodeId()) || ClusterMember.nodeIdOf(member).equals(config.nodeId());
    }
}
