package io.litecluster.server;

import io.litecluster.common.HealthStatus;
import io.litecluster.common.MetricsPort;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * In-memory gauges rendered in the Prometheus text exposition format. Gauge names are
 * {@code <prefix>_node_state}, {@code <prefix>_health_status}, {@code <prefix>_split_brain_detected}
 * and {@code <prefix>_is_leader_elected}. All gauges start at zero.
 */
public final class GaugeMetrics implements MetricsPort {

    public static final String DEFAULT_PREFIX = "litecluster";
    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private static final Pattern METRIC_NAME = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");

    private final String prefix;

    private volatile int nodeState;
    private volatile double healthStatus;
    private volatile int splitBrainDetected;
    private volatile int leaderElected;

    public GaugeMetrics() {
        this(DEFAULT_PREFIX);
    }

    public GaugeMetrics(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (!METRIC_NAME.matcher(prefix).matches()) {
            throw new IllegalArgumentException("prefix is not a valid metric name: " + prefix);
        }
        this.prefix = prefix;
    }

    @Override
    public void setNodeState(boolean isPrimary) {
        nodeState = isPrimary ? 1 : 0;
    }

    @Override
    public void setHealthStatus(HealthStatus status) {
        if (status != null) {
            healthStatus = status.gaugeValue();
        }
    }

    @Override
    public void setSplitBrainDetected(boolean detected) {
        splitBrainDetected = detected ? 1 : 0;
    }

    @Override
    public void setLeaderElected(boolean elected) {
        leaderElected = elected ? 1 : 0;
    }

    public int nodeState() {
        return nodeState;
    }

    public double healthStatus() {
        return healthStatus;
    }

    public int splitBrainDetected() {
        return splitBrainDetected;
    }

    public int leaderElected() {
        return leaderElected;
    }

    public String prefix() {
        return prefix;
    }

    public String render() {
        StringBuilder out = new StringBuilder(512);
        gauge(out, "node_state", "Current node state: 1=PRIMARY, 0=REPLICA", Integer.toString(nodeState));
        gauge(out, "health_status", "Health status: 1.0=healthy, 0.5=degraded, 0.0=unhealthy",
            Double.toString(healthStatus));
        gauge(out, "split_brain_detected", "Split-brain detected: 1=yes, 0=no", Integer.toString(splitBrainDetected));
        gauge(out, "is_leader_elected", "Leader election status: 1=elected, 0=not elected",
            Integer.toString(leaderElected));
        return out.toString();
    }

    private void gauge(StringBuilder out, String name, String help, String value) {
        String metric = prefix + "_" + name;
        out.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        out.append("# TYPE ").append(metric).append(" gauge\n");
        out.append(metric).append(' ').append(value).append('\n');
    }
}
