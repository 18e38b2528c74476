package io.litecluster.common;

/**
 * Gauge sink for cluster state. Every call overwrites the previous value of its gauge.
 *
 * <p>Implementations must not throw; a failing backend drops the update.
 */
public interface MetricsPort {

    /** 1 when this node is PRIMARY, 0 when it is a REPLICA. */
    void setNodeState(boolean isPrimary);

    void setHealthStatus(HealthStatus status);

    void setSplitBrainDetected(boolean detected);

    void setLeaderElected(boolean elected);

    static MetricsPort noop() {
        return NoopMetrics.INSTANCE;
    }

    /**
     * Returns {@code metrics}, or the no-op sink when it is null.
     */
    static MetricsPort orNoop(MetricsPort metrics) {
        return metrics == null ? NoopMetrics.INSTANCE : metrics;
    }
}
