package io.litecluster.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.litecluster.failover.NodeState;

import java.util.Objects;

/**
 * Body of the health status endpoint that peers probe.
 */
public record NodeStatus(
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("is_leader") boolean isLeader,
    @JsonProperty("state") NodeState state,
    @JsonProperty("healthy") boolean healthy
) {
    public NodeStatus {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }
}
