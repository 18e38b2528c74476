package io.litecluster.failover;

import io.litecluster.common.HealthStatus;
import io.litecluster.common.MetricsPort;
import io.litecluster.raft.RaftLeaderElectionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Periodic driver for a {@link FailoverCoordinator}.
 *
 * <p>Each tick, a PRIMARY checks health first and quorum second, demoting on the first failed guard;
 * otherwise it re-aligns with the election. A REPLICA that has been elected is promoted only if it
 * may become leader. Ticks are serialized, so the coordinator sees a single writer.
 *
 * <p>After every tick the resulting node state, leadership flag and health are published to the
 * {@link MetricsPort}. Health is DEGRADED while the node is healthy but cannot see a quorum.
 */
public final class FailoverSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FailoverSupervisor.class);

    private final FailoverCoordinator coordinator;
    private final RaftLeaderElectionPort election;
    private final BooleanSupplier healthProbe;
    private final MetricsPort metrics;
    private final ScheduledExecutorService scheduler;
    private final AtomicReference<ScheduledFuture<?>> currentTimer = new AtomicReference<>();

    public FailoverSupervisor(FailoverCoordinator coordinator, RaftLeaderElectionPort election) {
        this(coordinator, election, null);
    }

    /**
     * @param healthProbe consulted at the start of every tick to refresh the coordinator's health
     *                    flag; null leaves the flag to explicit {@code markHealthy}/{@code markUnhealthy} calls
     */
    public FailoverSupervisor(
            FailoverCoordinator coordinator,
            RaftLeaderElectionPort election,
            BooleanSupplier healthProbe) {
        this(coordinator, election, healthProbe, null);
    }

    /**
     * @param metrics receives node gauges after every tick; null disables export
     */
    public FailoverSupervisor(
            FailoverCoordinator coordinator,
            RaftLeaderElectionPort election,
            BooleanSupplier healthProbe,
            MetricsPort metrics) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.election = Objects.requireNonNull(election, "election must not be null");
        this.healthProbe = healthProbe;
        this.metrics = MetricsPort.orNoop(metrics);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "failover-supervisor");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized NodeState tick() {
        refreshHealth();

        if (coordinator.isPrimary()) {
            if (coordinator.canMaintainLeadership()) {
                coordinator.coordinateTransition();
            } else if (!coordinator.isHealthy()) {
                coordinator.demoteForHealth();
            } else {
                coordinator.demoteForQuorumLoss();
            }
        } else if (election.isLeaderElected() && coordinator.canBecomeLeader()) {
            coordinator.coordinateTransition();
        }
        publishMetrics();
        return coordinator.state();
    }

    public synchronized void handoff() {
        coordinator.performGracefulHandoff();
    }

    public void start(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        cancel();

        ScheduledFuture<?> newTimer = scheduler.scheduleAtFixedRate(
            () -> {
                try {
                    tick();
                } catch (Exception e) {
                    log.error("Failover supervisor tick failed", e);
                }
            },
            0,
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        currentTimer.set(newTimer);

        log.atInfo()
            .addKeyValue("intervalMs", interval.toMillis())
            .addKeyValue("state", coordinator.state())
            .log("Failover supervisor started");
    }

    public void cancel() {
        ScheduledFuture<?> timer = currentTimer.getAndSet(null);
        if (timer != null && !timer.isDone()) {
            timer.cancel(false);
        }
    }

    public boolean isActive() {
        ScheduledFuture<?> timer = currentTimer.get();
        return timer != null && !timer.isDone();
    }

    @Override
    public void close() {
        cancel();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Publishes the current node gauges without running a tick.
     */
    public void publishMetrics() {
        try {
            metrics.setNodeState(coordinator.isPrimary());
            metrics.setLeaderElected(election.isLeaderElected());
            metrics.setHealthStatus(healthStatus());
        } catch (RuntimeException e) {
            log.debug("Dropping metrics update: {}", e.toString());
        }
    }

    private HealthStatus healthStatus() {
        if (!coordinator.isHealthy()) {
            return HealthStatus.UNHEALTHY;
        }
        return election.isQuorumReached() ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
    }

    private void refreshHealth() {
        if (healthProbe == null) {
            return;
        }
        boolean healthy;
        try {
            healthy = healthProbe.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Health probe failed, treating node as unhealthy: {}", e.getMessage());
            healthy = false;
        }
        if (healthy) {
            coordinator.markHealthy();
        } else {
            coordinator.markUnhealthy();
        }
    }
}
