package io.litecluster.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.litecluster.failover.FailoverEvent;
import io.litecluster.failover.FailoverEventType;
import io.litecluster.failover.NodeState;
import io.litecluster.forwarding.ForwardRequest;
import io.litecluster.forwarding.ForwardingConfig;
import io.litecluster.raft.ElectionConfig;
import io.litecluster.raft.RaftNodeState;
import io.litecluster.raft.SplitBrainStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LiteClusterNodeTest {

    private final List<AutoCloseable> resources = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable resource : resources) {
            resource.close();
        }
    }

    private static LiteClusterConfig config(
            String nodeId,
            List<String> members,
            String bindAddress,
            int statusPort,
            ForwardingConfig forwarding) {
        int probePort = statusPort == 0 ? 8080 : statusPort;
        return new LiteClusterConfig(
            ElectionConfig.create(nodeId, members),
            new ProbeConfig(probePort, "/health/status", Duration.ofSeconds(1), Duration.ofSeconds(2)),
            forwarding,
            Duration.ofMillis(50),
            bindAddress,
            statusPort
        );
    }

    private LiteClusterNode node(LiteClusterConfig config, BooleanSupplier healthProbe, List<FailoverEvent> events) {
        var node = new LiteClusterNode(config, healthProbe, events == null ? null : events::add);
        resources.add(node);
        return node;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private static boolean canBind(String address) {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getByName(address))) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    @Nested
    class Supervision {
        private LiteClusterNode standalone(BooleanSupplier healthProbe, List<FailoverEvent> events) {
            return node(
                config("node-a", List.of("node-a", "node-b", "node-c"), "127.0.0.1", 0, ForwardingConfig.defaults()),
                healthProbe,
                events
            );
        }

        @Test
        void startsAsReplica() {
            var node = standalone(null, null);

            assertEquals(NodeState.REPLICA, node.coordinator().state());
            assertFalse(node.status().isLeader());
            assertTrue(node.status().healthy());
        }

        @Test
        void electedNodeIsPromotedOnTick() {
            List<FailoverEvent> events = new ArrayList<>();
            var node = standalone(null, events);
            node.election().electAsLeader();

            node.supervisor().tick();

            assertEquals(NodeState.PRIMARY, node.status().state());
            assertTrue(node.status().isLeader());
            assertEquals(List.of(FailoverEventType.PROMOTED_TO_PRIMARY),
                events.stream().map(FailoverEvent::type).collect(Collectors.toList()));
        }

        @Test
        void failingHealthProbeDemotesPrimary() {
            List<FailoverEvent> events = new ArrayList<>();
            var healthy = new AtomicBoolean(true);
            var node = standalone(healthy::get, events);
            node.election().electAsLeader();
            node.supervisor().tick();

            healthy.set(false);
            node.supervisor().tick();

            assertEquals(NodeState.REPLICA, node.coordinator().state());
            assertFalse(node.election().isLeaderElected());
            assertFalse(node.status().healthy());
            assertEquals(FailoverEventType.HEALTH_DEMOTION, events.get(events.size() - 1).type());
        }

        @Test
        void quorumLossDemotesPrimary() {
            List<FailoverEvent> events = new ArrayList<>();
            var node = standalone(null, events);
            node.election().electAsLeader();
            node.supervisor().tick();

            node.election().markUnreachable("node-b");
            node.election().markUnreachable("node-c");
            node.supervisor().tick();

            assertEquals(NodeState.REPLICA, node.coordinator().state());
            assertEquals(FailoverEventType.QUORUM_LOSS_DEMOTION, events.get(events.size() - 1).type());
        }

        @Test
        void scheduledSupervisionPromotesAfterStart() throws Exception {
            List<FailoverEvent> events = new CopyOnWriteArrayList<>();
            var node = standalone(null, events);
            node.start();

            node.election().electAsLeader();

            awaitCondition(() -> node.coordinator().state() == NodeState.PRIMARY);
            assertTrue(node.supervisor().isActive());
            assertTrue(node.statusPort() > 0);
        }
    }

    @Nested
    class StatusEndpoint {
        @Test
        void servesStatusOnceStarted() throws Exception {
            var node = node(
                config("node-a", List.of("node-a"), "127.0.0.1", 0, ForwardingConfig.defaults()), null, null);
            node.start();
            node.election().electAsLeader();
            awaitCondition(() -> node.coordinator().isPrimary());

            var client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
            var request = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + node.statusPort() + "/health/status")).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertEquals(200, response.statusCode());
            var body = new ObjectMapper().readTree(response.body());
            assertEquals("node-a", body.get("node_id").asText());
            assertTrue(body.get("is_leader").booleanValue());
            assertEquals("PRIMARY", body.get("state").asText());
        }
    }

    @Nested
    class Forwarding {
        private HttpServer serve(String body, boolean leader) throws IOException {
            HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/health/status", exchange -> {
                byte[] status = ("{\"is_leader\": " + leader + "}").getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(200, status.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(status);
                }
                exchange.close();
            });
            server.createContext("/api", exchange -> {
                exchange.getRequestBody().readAllBytes();
                byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(201, bytes.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(bytes);
                }
                exchange.close();
            });
            server.start();
            resources.add(() -> server.stop(0));
            return server;
        }

        /**
         * node-a plus one loopback peer whose status endpoint listens on {@code peerPort}.
         */
        private LiteClusterConfig withPeer(int peerPort, ForwardingConfig forwarding) {
            return new LiteClusterConfig(
                ElectionConfig.create("node-a", List.of("node-a", "127.0.0.1:" + peerPort)),
                new ProbeConfig(peerPort, "/health/status", Duration.ofSeconds(1), Duration.ofSeconds(2)),
                forwarding,
                Duration.ofMillis(50),
                "127.0.0.1",
                0
            );
        }

        @Test
        void noKnownPrimaryYieldsServiceUnavailable() {
            var node = node(
                config("node-a", List.of("node-a"), "127.0.0.1", 0, ForwardingConfig.defaults()), null, null);

            var result = node.forwardToPrimary(ForwardRequest.of("POST", "/x"));

            assertEquals(503, result.statusCode());
            assertEquals(5L, result.retryAfter().getAsLong());
            assertTrue(result.bodyAsString().contains("No primary available"));
        }

        @Test
        void primaryRefusesToForward() {
            var forwarding = ForwardingConfig.defaults().withPrimaryUrl("http://127.0.0.1:1");
            var node = node(config("node-a", List.of("node-a"), "127.0.0.1", 0, forwarding), null, null);
            node.election().electAsLeader();
            node.supervisor().tick();

            assertTrue(node.isPrimary());
            assertThrows(IllegalStateException.class, () -> node.forwardToPrimary(ForwardRequest.of("POST", "/x")));
        }

        @Test
        void localLeaderIsNotAForwardingTarget() throws Exception {
            HttpServer peer = serve("peer", false);
            var node = node(withPeer(peer.getAddress().getPort(), ForwardingConfig.defaults()), null, null);
            node.election().electAsLeader();

            var result = node.forwardToPrimary(ForwardRequest.of("POST", "/api/items"));

            assertFalse(node.isPrimary());
            assertEquals(503, result.statusCode());
        }

        @Test
        void forwardsToLeaderFoundInCluster() throws Exception {
            HttpServer leader = serve("stored by leader", true);
            var node = node(withPeer(leader.getAddress().getPort(), ForwardingConfig.defaults()), null, null);

            assertEquals(Optional.of("http://127.0.0.1:" + leader.getAddress().getPort()),
                node.primaryUrlResolver().resolvePrimaryUrl());
            var result = node.forwardToPrimary(new ForwardRequest(
                "POST", "/api/items", null, "{}".getBytes(StandardCharsets.UTF_8), null));

            assertEquals(201, result.statusCode());
            assertEquals("stored by leader", result.bodyAsString());
        }

        @Test
        void configuredPrimaryWinsOverClusterLeader() throws Exception {
            HttpServer leader = serve("stored by leader", true);
            HttpServer configured = serve("stored by configured primary", false);
            var forwarding = ForwardingConfig.defaults()
                .withPrimaryUrl("http://127.0.0.1:" + configured.getAddress().getPort());
            var node = node(withPeer(leader.getAddress().getPort(), forwarding), null, null);

            var result = node.forwardToPrimary(ForwardRequest.of("POST", "/api/items"));

            assertEquals(201, result.statusCode());
            assertEquals("stored by configured primary", result.bodyAsString());
        }

        @Test
        void disabledForwardingIsRejected() {
            var disabled = new ForwardingConfig(
                false, "http://127.0.0.1:1", Duration.ofSeconds(1), Duration.ofSeconds(1), 0,
                Duration.ofMillis(10), Duration.ofMillis(10), 5, Duration.ofSeconds(30), true);
            var node = node(config("node-a", List.of("node-a"), "127.0.0.1", 0, disabled), null, null);

            assertThrows(IllegalStateException.class, () -> node.forwardToPrimary(ForwardRequest.of("POST", "/x")));
        }

        @Test
        void forwardsWritesToPrimary() throws Exception {
            HttpServer primary = serve("stored", false);
            var forwarding = ForwardingConfig.defaults()
                .withPrimaryUrl("http://127.0.0.1:" + primary.getAddress().getPort());
            var node = node(config("node-a", List.of("node-a"), "127.0.0.1", 0, forwarding), null, null);

            var result = node.forwardToPrimary(new ForwardRequest(
                "POST", "/api/items", null, "{}".getBytes(StandardCharsets.UTF_8), null));

            assertEquals(201, result.statusCode());
            assertEquals("stored", result.bodyAsString());
        }

        @Test
        void unreachablePrimaryYieldsServiceUnavailable() throws Exception {
            var forwarding = new ForwardingConfig(
                true, "http://127.0.0.1:" + freePort(), Duration.ofSeconds(1), Duration.ofSeconds(1), 1,
                Duration.ofMillis(10), Duration.ofMillis(10), 5, Duration.ofSeconds(30), true);
            var node = node(config("node-a", List.of("node-a"), "127.0.0.1", 0, forwarding), null, null);

            var result = node.forwardToPrimary(ForwardRequest.of("POST", "/api/items"));

            assertEquals(503, result.statusCode());
            assertTrue(result.retryAfter().isPresent());
        }
    }

    @Nested
    class Metrics {
        @Test
        void exportsGaugesAfterTick() throws Exception {
            var node = node(
                config("node-a", List.of("node-a"), "127.0.0.1", 0, ForwardingConfig.defaults()), null, null);
            node.election().electAsLeader();
            node.supervisor().tick();

            var gauges = assertInstanceOf(GaugeMetrics.class, node.metrics());
            assertEquals(1, gauges.nodeState());
            assertEquals(1, gauges.leaderElected());
            assertEquals(1.0, gauges.healthStatus());
            assertEquals(0, gauges.splitBrainDetected());
        }

        @Test
        void servesPrometheusText() throws Exception {
            var node = node(
                config("node-a", List.of("node-a"), "127.0.0.1", 0, ForwardingConfig.defaults()), null, null);
            node.start();
            node.election().electAsLeader();
            awaitCondition(() -> node.coordinator().isPrimary());
            node.supervisor().tick();

            var client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
            var request = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + node.statusPort() + "/metrics")).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertEquals(200, response.statusCode());
            assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
            assertTrue(response.body().contains("litecluster_node_state 1\n"));
            assertTrue(response.body().contains("litecluster_is_leader_elected 1\n"));
            assertTrue(response.body().contains("litecluster_health_status 1.0\n"));
        }

        @Test
        void splitBrainCheckFeedsSuppliedSink() {
            var sink = new GaugeMetrics("app");
            var node = new LiteClusterNode(
                config("node-a", List.of("node-a"), "127.0.0.1", 0, ForwardingConfig.defaults()), null, null, sink);
            resources.add(node);
            node.election().electAsLeader();

            node.detectSplitBrain();
            node.supervisor().tick();

            assertSame(sink, node.metrics());
            assertEquals(0, sink.splitBrainDetected());
            assertEquals(1, sink.nodeState());
            assertTrue(sink.render().contains("app_split_brain_detected 0\n"));
        }
    }

    /**
     * Three nodes on separate loopback addresses sharing one status port, so each can probe the
     * others the way a real deployment does.
     */
    @Nested
    class SplitBrainAcrossNodes {
        private static final String A = "127.0.0.1";
        private static final String B = "127.0.0.2";
        private static final String C = "127.0.0.3";

        private List<LiteClusterNode> startCluster() throws IOException {
            assumeTrue(canBind(B) && canBind(C), "loopback aliases unavailable");
            int port = freePort();
            List<String> members = List.of(A + ":" + port, B + ":" + port, C + ":" + port);
            List<LiteClusterNode> nodes = new ArrayList<>();
            for (String host : List.of(A, B, C)) {
                var node = node(config(host, members, host, port, ForwardingConfig.defaults()), null, null);
                node.start();
                nodes.add(node);
            }
            return nodes;
        }

        @Test
        void singleLeaderIsNotSplitBrain() throws Exception {
            var nodes = startCluster();
            nodes.get(0).election().electAsLeader();

            SplitBrainStatus status = nodes.get(1).detectSplitBrain();

            assertFalse(status.isSplitBrain());
            assertEquals(List.of(RaftNodeState.leader(A)), status.leaderNodes());
        }

        @Test
        void twoLeadersAreSplitBrain() throws Exception {
            var nodes = startCluster();
            nodes.get(0).election().electAsLeader();
            nodes.get(1).election().electAsLeader();

            SplitBrainStatus status = nodes.get(2).detectSplitBrain();

            assertTrue(status.isSplitBrain());
            assertEquals(Set.of(A, B),
                status.leaderNodes().stream().map(RaftNodeState::nodeId).collect(Collectors.toSet()));
        }

        @Test
        void stoppedPeerCountsAsReplica() throws Exception {
            var nodes = startCluster();
            nodes.get(1).election().electAsLeader();
            nodes.get(1).close();

            SplitBrainStatus status = nodes.get(0).detectSplitBrain();

            assertFalse(status.isSplitBrain());
            assertEquals(0, status.leaderCount());
        }
    }
}
