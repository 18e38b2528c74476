package io.litecluster.server;

import io.litecluster.forwarding.ForwardingConfig;
import io.litecluster.raft.ElectionConfig;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record LiteClusterConfig(
    ElectionConfig election,
    ProbeConfig probe,
    ForwardingConfig forwarding,
    Duration healthCheckInterval,
    String statusBindAddress,
    int statusPort
) {
    public LiteClusterConfig {
        Objects.requireNonNull(election, "election must not be null");
        Objects.requireNonNull(probe, "probe must not be null");
        Objects.requireNonNull(forwarding, "forwarding must not be null");
        Objects.requireNonNull(healthCheckInterval, "healthCheckInterval must not be null");
        Objects.requireNonNull(statusBindAddress, "statusBindAddress must not be null");
        if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
            throw new IllegalArgumentException("healthCheckInterval must be positive");
        }
        if (statusPort < 0 || statusPort > 65535) {
            throw new IllegalArgumentException("statusPort must be between 0 and 65535");
        }
    }

    public static LiteClusterConfig create(String nodeId, List<String> clusterMembers) {
        ProbeConfig probe = ProbeConfig.defaults();
        return new LiteClusterConfig(
            ElectionConfig.create(nodeId, clusterMembers),
            probe,
            ForwardingConfig.defaults(),
            Duration.ofSeconds(1),
            "0.0.0.0",
            probe.healthPort()
        );
    }

    public String nodeId() {
        return election.nodeId();
    }
}
