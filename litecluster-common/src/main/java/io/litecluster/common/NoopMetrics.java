package io.litecluster.common;

enum NoopMetrics implements MetricsPort {
    INSTANCE;

    @Override
    public void setNodeState(boolean isPrimary) {
    }

    @Override
    public void setHealthStatus(HealthStatus status) {
    }

    @Override
    public void setSplitBrainDetected(boolean detected) {
    }

    @Override
    public void setLeaderElected(boolean elected) {
    }
}
