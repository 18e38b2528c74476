package io.litecluster.raft;

import io.litecluster.common.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Classifies a cluster snapshot as split-brain when two or more nodes claim leadership. Holds no
 * mutable state, so a single instance may be shared across request threads.
 */
public final class SplitBrainDetector {
    private static final Logger log = LoggerFactory.getLogger(SplitBrainDetector.class);

    private final ClusterStatePort clusterState;
    private final MetricsPort metrics;

    public SplitBrainDetector(ClusterStatePort clusterState) {
        this(clusterState, null);
    }

    /**
     * @param metrics receives the split-brain flag after every detection; null disables export
     */
    public SplitBrainDetector(ClusterStatePort clusterState, MetricsPort metrics) {
        this.clusterState = Objects.requireNonNull(clusterState, "clusterState must not be null");
        this.metrics = MetricsPort.orNoop(metrics);
    }

    public SplitBrainStatus detectSplitBrain() {
        SplitBrainStatus status = SplitBrainStatus.of(clusterState.getClusterState());
        if (status.isSplitBrain()) {
            log.atWarn()
                .addKeyValue("leaders", status.leaderNodes().stream().map(RaftNodeState::nodeId).toList())
                .log("Split-brain detected: {} nodes claim leadership", status.leaderCount());
        }
        metrics.setSplitBrainDetected(status.isSplitBrain());
        return status;
    }
}
