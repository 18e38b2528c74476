package io.litecluster.server;

import io.litecluster.common.MetricsPort;
import io.litecluster.common.Ticker;
import io.litecluster.failover.EventEmitterPort;
import io.litecluster.failover.FailoverCoordinator;
import io.litecluster.failover.FailoverSupervisor;
import io.litecluster.forwarding.ForwardRequest;
import io.litecluster.forwarding.ForwardingConfig;
import io.litecluster.forwarding.ForwardingResult;
import io.litecluster.forwarding.HttpForwardingAdapter;
import io.litecluster.forwarding.PrimaryUrlResolver;
import io.litecluster.forwarding.ResilientForwarder;
import io.litecluster.forwarding.StaticPrimaryUrlResolver;
import io.litecluster.raft.ClusterStatePort;
import io.litecluster.raft.QuorumElection;
import io.litecluster.raft.SplitBrainDetector;
import io.litecluster.raft.SplitBrainStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * One cluster node: election state, failover supervision, peer probing, split-brain detection,
 * write forwarding, metrics export, and the status endpoint peers probe.
 */
public final class LiteClusterNode implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LiteClusterNode.class);

    private final LiteClusterConfig config;
    private final QuorumElection election;
    private final FailoverCoordinator coordinator;
    private final FailoverSupervisor supervisor;
    private final ClusterStatePort clusterState;
    private final SplitBrainDetector splitBrainDetector;
    private final ResilientForwarder forwarder;
    private final PrimaryUrlResolver primaryUrlResolver;
    private final MetricsPort metrics;
    private final HealthStatusServer statusServer;

    public LiteClusterNode(LiteClusterConfig config) {
        this(config, null, null);
    }

    public LiteClusterNode(LiteClusterConfig config, BooleanSupplier healthProbe, EventEmitterPort events) {
        this(config, healthProbe, events, null);
    }

    /**
     * @param healthProbe refreshes the node's health before every supervision tick; null keeps the
     *                    flag under explicit control
     * @param events      receives failover events after they are logged; may be null
     * @param metrics     gauge sink; null installs {@link GaugeMetrics} and serves it next to the
     *                    status endpoint
     */
    public LiteClusterNode(
            LiteClusterConfig config,
            BooleanSupplier healthProbe,
            EventEmitterPort events,
            MetricsPort metrics) {
        this.config = config;
        String nodeId = config.nodeId();
        GaugeMetrics gauges = metrics == null ? new GaugeMetrics() : null;
        this.metrics = metrics == null ? gauges : metrics;

        this.election = new QuorumElection(config.election());
        this.coordinator = new FailoverCoordinator(
            election,
            new LoggingEventEmitter(nodeId, events),
            new Slf4jLoggingPort(nodeId)
        );
        this.supervisor = new FailoverSupervisor(coordinator, election, healthProbe, this.metrics);

        this.clusterState = new HttpClusterStateAggregator(election, nodeId, config.probe());
        this.splitBrainDetector = new SplitBrainDetector(clusterState, this.metrics);

        ForwardingConfig forwarding = config.forwarding();
        this.forwarder = new ResilientForwarder(
            HttpForwardingAdapter.from(forwarding),
            forwarding.retryPolicy(),
            forwarding.circuitBreaker(Ticker.system())
        );
        this.primaryUrlResolver = forwarding.primaryUrl() != null
            ? new StaticPrimaryUrlResolver(forwarding.primaryUrl())
            : new ClusterPrimaryUrlResolver(clusterState, election, nodeId);

        this.statusServer = new HealthStatusServer(
            config.statusBindAddress(),
            config.statusPort(),
            config.probe().healthPath(),
            this::status,
            gauges
        );
    }

    public void start() throws IOException {
        logger.info("Starting cluster node {}...", config.nodeId());
        statusServer.start();
        supervisor.publishMetrics();
        supervisor.start(config.healthCheckInterval());
        logger.atInfo()
            .addKeyValue("nodeId", config.nodeId())
            .addKeyValue("statusPort", statusServer.port())
            .addKeyValue("members", config.election().clusterMembers())
            .log("Cluster node started");
    }

    public NodeStatus status() {
        return new NodeStatus(
            config.nodeId(),
            election.isLeaderElected(),
            coordinator.state(),
            coordinator.isHealthy()
        );
    }

    public SplitBrainStatus detectSplitBrain() {
        return splitBrainDetector.detectSplitBrain();
    }

    /**
     * Forwards a write to the current primary. A configured primary URL takes precedence; otherwise the
     * primary is the single leader in a fresh cluster snapshot. When no primary is known the caller
     * gets a local 503.
     *
     * @throws IllegalStateException if forwarding is disabled or this node is the primary
     */
    public ForwardingResult forwardToPrimary(ForwardRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (!config.forwarding().enabled()) {
            throw new IllegalStateException("Write forwarding is disabled");
        }
        if (coordinator.isPrimary()) {
            throw new IllegalStateException("Node " + config.nodeId() + " is the primary; handle the write locally");
        }
        Optional<String> primaryUrl = primaryUrlResolver.resolvePrimaryUrl();
        if (primaryUrl.isEmpty()) {
            logger.atWarn()
                .addKeyValue("method", request.method())
                .addKeyValue("path", request.path())
                .log("No primary available for forwarding");
            return ForwardingResult.serviceUnavailable(
                ResilientForwarder.DEFAULT_RETRY_AFTER_SECONDS, "No primary available");
        }
        return forwarder.forward(primaryUrl.get(), request);
    }

    public boolean isPrimary() {
        return coordinator.isPrimary();
    }

    public LiteClusterConfig config() {
        return config;
    }

    public QuorumElection election() {
        return election;
    }

    public FailoverCoordinator coordinator() {
        return coordinator;
    }

    public FailoverSupervisor supervisor() {
        return supervisor;
    }

    public ClusterStatePort clusterState() {
        return clusterState;
    }

    public SplitBrainDetector splitBrainDetector() {
        return splitBrainDetector;
    }

    public ResilientForwarder forwarder() {
        return forwarder;
    }

    public PrimaryUrlResolver primaryUrlResolver() {
        return primaryUrlResolver;
    }

    public MetricsPort metrics() {
        return metrics;
    }

    public int statusPort() {
        return statusServer.port();
    }

    @Override
    public void close() {
        logger.info("Shutting down cluster node {}...", config.nodeId());
        supervisor.close();
        statusServer.close();
        logger.info("Cluster node {} shut down", config.nodeId());
    }
}
