package io.litecluster.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.litecluster.common.ClusterMember;
import io.litecluster.raft.ClusterStatePort;
import io.litecluster.raft.RaftClusterState;
import io.litecluster.raft.RaftLeaderElectionPort;
import io.litecluster.raft.RaftNodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a cluster snapshot by asking every remote member for its leadership flag over HTTP. The
 * local member's flag comes straight from the election port and is never probed.
 *
 * <p>A member that cannot be reached, answers with a non-2xx status, or returns a body without a
 * boolean {@code is_leader} field is reported as a non-leader.
 */
public final class HttpClusterStateAggregator implements ClusterStatePort {
    private static final Logger log = LoggerFactory.getLogger(HttpClusterStateAggregator.class);

    private final RaftLeaderElectionPort election;
    private final String localNodeId;
    private final ProbeConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpClusterStateAggregator(RaftLeaderElectionPort election, String localNodeId, ProbeConfig config) {
        this(
            election,
            localNodeId,
            config,
            HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.connectTimeout())
                .build()
        );
    }

    HttpClusterStateAggregator(
            RaftLeaderElectionPort election,
            String localNodeId,
            ProbeConfig config,
            HttpClient httpClient) {
        this.election = Objects.requireNonNull(election, "election must not be null");
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public RaftClusterState getClusterState() {
        List<String> members = election.getClusterMembers();
        List<RaftNodeState> nodes = new ArrayList<>(members.size());
        for (String member : members) {
            String nodeId = ClusterMember.nodeIdOf(member);
            boolean leader = nodeId.equals(localNodeId) || member.equals(localNodeId)
                ? election.isLeaderElected()
                : probeLeader(nodeId);
            nodes.add(new RaftNodeState(nodeId, leader));
        }
        return new RaftClusterState(nodes);
    }

    boolean probeLeader(String host) {
        URI uri = statusUri(host);
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(config.readTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.atDebug()
                    .addKeyValue("uri", uri)
                    .addKeyValue("status", response.statusCode())
                    .log("Peer status probe returned non-success status");
                return false;
            }
            JsonNode body = objectMapper.readTree(response.body());
            JsonNode isLeader = body == null ? null : body.get("is_leader");
            return isLeader != null && isLeader.isBoolean() && isLeader.booleanValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while probing {}", uri);
            return false;
        } catch (IOException | RuntimeException e) {
            log.atDebug()
                .addKeyValue("uri", uri)
                .addKeyValue("error", e.toString())
                .log("Peer status probe failed, treating peer as non-leader");
            return false;
        }
    }

    URI statusUri(String host) {
        String authority = host.contains(":") && !host.startsWith("[") ? "[" + host + "]" : host;
        return URI.create("http://" + authority + ":" + config.healthPort() + config.healthPath());
    }
}
