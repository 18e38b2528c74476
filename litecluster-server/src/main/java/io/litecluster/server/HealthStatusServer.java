package io.litecluster.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Serves the node status JSON that peers probe and, when a metrics source is given, the gauges at
 * {@value #METRICS_PATH}.
 */
public final class HealthStatusServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthStatusServer.class);

    public static final String METRICS_PATH = "/metrics";

    private final String bindAddress;
    private final int port;
    private final String path;
    private final Supplier<NodeStatus> status;
    private final GaugeMetrics metrics;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param port 0 binds an ephemeral port; see {@link #port()} once started
     */
    public HealthStatusServer(String bindAddress, int port, String path, Supplier<NodeStatus> status) {
        this(bindAddress, port, path, status, null);
    }

    /**
     * @param metrics gauges exposed at {@value #METRICS_PATH}; null leaves the endpoint out
     */
    public HealthStatusServer(
            String bindAddress,
            int port,
            String path,
            Supplier<NodeStatus> status,
            GaugeMetrics metrics) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535");
        }
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress must not be null");
        this.port = port;
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        if (metrics != null && METRICS_PATH.equals(path)) {
            throw new IllegalArgumentException("status path must not be " + METRICS_PATH + " when metrics are served");
        }
        this.metrics = metrics;
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Health status server already started");
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        created.createContext(path, exchange -> handle(
            exchange, path, "application/json", () -> objectMapper.writeValueAsBytes(status.get())));
        if (metrics != null) {
            created.createContext(METRICS_PATH, exchange -> handle(
                exchange, METRICS_PATH, GaugeMetrics.CONTENT_TYPE,
                () -> metrics.render().getBytes(StandardCharsets.UTF_8)));
        }
        executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "health-status");
            t.setDaemon(true);
            return t;
        });
        created.setExecutor(executor);
        created.start();
        server = created;

        log.atInfo()
            .addKeyValue("address", bindAddress)
            .addKeyValue("port", port())
            .addKeyValue("path", path)
            .log("Health status server started");
    }

    public synchronized int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        server.stop(0);
        server = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface Body {
        byte[] render() throws IOException;
    }

    private void handle(HttpExchange exchange, String contextPath, String contentType, Body body)
            throws IOException {
        try {
            if (!contextPath.equals(exchange.getRequestURI().getPath())) {
                exchange.sendResponseHeaders(404, -1);
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                exchange.sendResponseHeaders(405, -1);
                return;
            }

            byte[] bytes;
            try {
                bytes = body.render();
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to render {}", contextPath, e);
                exchange.sendResponseHeaders(500, -1);
                return;
            }
            exchange.getResponseHeaders().set("Content-Type", contentType);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        } finally {
            exchange.close();
        }
    }
}
