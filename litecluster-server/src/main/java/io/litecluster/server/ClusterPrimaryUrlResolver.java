package io.litecluster.server;

import io.litecluster.common.ClusterMember;
import io.litecluster.forwarding.PrimaryUrlResolver;
import io.litecluster.raft.ClusterStatePort;
import io.litecluster.raft.RaftClusterState;
import io.litecluster.raft.RaftLeaderElectionPort;
import io.litecluster.raft.RaftNodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the primary from a fresh cluster snapshot. A primary is only known when exactly one node
 * claims leadership and that node is not the local one; its URL is built from the member entry that
 * carries its node id.
 */
public final class ClusterPrimaryUrlResolver implements PrimaryUrlResolver {
    private static final Logger log = LoggerFactory.getLogger(ClusterPrimaryUrlResolver.class);

    private final ClusterStatePort clusterState;
    private final RaftLeaderElectionPort election;
    private final String localNodeId;
    private final String scheme;

    public ClusterPrimaryUrlResolver(ClusterStatePort clusterState, RaftLeaderElectionPort election, String localNodeId) {
        this(clusterState, election, localNodeId, "http");
    }

    public ClusterPrimaryUrlResolver(
            ClusterStatePort clusterState,
            RaftLeaderElectionPort election,
            String localNodeId,
            String scheme) {
        this.clusterState = Objects.requireNonNull(clusterState, "clusterState must not be null");
        this.election = Objects.requireNonNull(election, "election must not be null");
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId must not be null");
        this.scheme = Objects.requireNonNull(scheme, "scheme must not be null");
        if (scheme.isBlank()) {
            throw new IllegalArgumentException("scheme must not be blank");
        }
    }

    @Override
    public Optional<String> resolvePrimaryUrl() {
        RaftClusterState state = clusterState.getClusterState();
        List<RaftNodeState> leaders = state.getLeaderNodes();
        if (leaders.size() != 1) {
            log.atDebug()
                .addKeyValue("leaders", leaders.size())
                .log("No single leader in cluster, primary unknown");
            return Optional.empty();
        }
        String leaderId = leaders.get(0).nodeId();
        for (String member : election.getClusterMembers()) {
            ClusterMember parsed = ClusterMember.parse(member);
            if (!parsed.nodeId().equals(leaderId)) {
                continue;
            }
            if (leaderId.equals(localNodeId) || member.equals(localNodeId)) {
                return Optional.empty();
            }
            return Optional.of(scheme + "://" + authority(parsed));
        }
        log.warn("Leader {} is not a configured cluster member", leaderId);
        return Optional.empty();
    }

    private static String authority(ClusterMember member) {
        String host = member.host().contains(":") && !member.host().startsWith("[")
            ? "[" + member.host() + "]"
            : member.host();
        return member.hasPort() ? host + ":" + member.port() : host;
    }
}
