package io.litecluster.common;

/**
 * Coarse node health as exported to monitoring.
 */
public enum HealthStatus {
    HEALTHY(1.0),
    DEGRADED(0.5),
    UNHEALTHY(0.0);

    private final double gaugeValue;

    HealthStatus(double gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    public double gaugeValue() {
        return gaugeValue;
    }
}
