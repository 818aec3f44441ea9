package com.indicatorsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.indicatorsentinel.core.dashboard.DashboardSnapshot;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with
 * {@code {"status":"UP","runningExecutions":..,"activeIndicators":..,"systemHealth":..}}</li>
 * <li>{@code GET /readiness} – Same; Kubernetes readiness probe target</li>
 * </ul>
 *
 * <p>
 * If the dashboard cannot be computed the endpoints answer
 * {@code 503} with {@code {"status":"DOWN"}}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] DOWN_RESPONSE = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<DashboardSnapshot> dashboard;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    /**
     * @param dashboard supplier of the current dashboard snapshot
     */
    public HealthServer(Supplier<DashboardSnapshot> dashboard) {
        this.dashboard = Objects.requireNonNull(dashboard, "dashboard must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealthCheck);
            server.createContext("/readiness", this::handleHealthCheck);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", port);
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Render the status body for a snapshot.
     */
    String statusBody(DashboardSnapshot snapshot) throws JsonProcessingException {
        ObjectNode body = mapper.createObjectNode();
        body.put("status", "UP");
        body.put("runningExecutions", snapshot.getRunningIndicators());
        body.put("activeIndicators", snapshot.getActiveIndicators());
        body.put("systemHealth", snapshot.getSystemHealth().name());
        return mapper.writeValueAsString(body);
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        int status;
        byte[] response;
        try {
            response = statusBody(dashboard.get()).getBytes(StandardCharsets.UTF_8);
            status = 200;
        } catch (RuntimeException | JsonProcessingException e) {
            LOG.warn("Health check failed: {}", e.getMessage(), e);
            response = DOWN_RESPONSE;
            status = 503;
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }
}
