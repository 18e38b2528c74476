package io.litecluster.raft;

import io.litecluster.common.ClusterMember;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record ElectionConfig(
    String nodeId,
    List<String> clusterMembers,
    Duration electionTimeout,
    Duration heartbeatInterval
) {
    private static final Duration DEFAULT_ELECTION_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(1);

    public ElectionConfig {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(clusterMembers, "clusterMembers must not be null");
        Objects.requireNonNull(electionTimeout, "electionTimeout must not be null");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval must not be null");
        if (nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        if (clusterMembers.isEmpty()) {
            throw new IllegalArgumentException("clusterMembers must not be empty");
        }
        for (String member : clusterMembers) {
            if (member == null || member.isBlank()) {
                throw new IllegalArgumentException("clusterMembers must not contain blank entries");
            }
        }
        if (new HashSet<>(clusterMembers).size() != clusterMembers.size()) {
            throw new IllegalArgumentException("clusterMembers must not contain duplicates");
        }
        Set<String> nodeIds = new HashSet<>();
        for (String member : clusterMembers) {
            ClusterMember parsed;
            try {
                parsed = ClusterMember.parse(member);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid cluster member '" + member + "': " + e.getMessage(), e);
            }
            if (!nodeIds.add(parsed.nodeId())) {
                throw new IllegalArgumentException(
                    "clusterMembers must not contain duplicate node ids: " + parsed.nodeId());
            }
        }
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (electionTimeout.isZero() || electionTimeout.isNegative()) {
            throw new IllegalArgumentException("electionTimeout must be positive");
        }
        if (electionTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException(
                "electionTimeout must be greater than heartbeatInterval (" +
                electionTimeout.toMillis() + "ms <= " + heartbeatInterval.toMillis() + "ms)");
        }
        clusterMembers = List.copyOf(clusterMembers);
        if (!containsNode(clusterMembers, nodeId)) {
            throw new IllegalArgumentException(
                "nodeId '" + nodeId + "' must be a member of clusterMembers " + clusterMembers);
        }
    }

    public static ElectionConfig create(String nodeId, List<String> clusterMembers) {
        return new ElectionConfig(nodeId, clusterMembers, DEFAULT_ELECTION_TIMEOUT, DEFAULT_HEARTBEAT_INTERVAL);
    }

    public int clusterSize() {
        return clusterMembers.size();
    }

    public int quorumSize() {
        return Quorum.size(clusterSize());
    }

    /**
     * Matches either a full member entry or the host part of a {@code host:port} entry.
     */
    static boolean containsNode(List<String> members, String nodeId) {
        for (String member : members) {
            if (member.equals(nodeId) || ClusterMember.nodeIdOf(member).equals(nodeId)) {
                return true;
            }
        }
        return false;
    }
}
