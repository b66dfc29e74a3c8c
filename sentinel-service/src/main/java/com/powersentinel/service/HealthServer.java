package com.powersentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.powersentinel.core.model.EngineStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
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
 * {@code {"status":"UP","historySize":n,"modelTrained":b,"lastTrained":t}}</li>
 * <li>{@code GET /readiness} – Same; readiness probe target</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no servlet container is
 * required. The body reflects the engine status at request time.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final Supplier<EngineStatus> statusSupplier;
    private final ObjectMapper mapper;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param statusSupplier source of the engine status, typically
     *                       {@code engine::status}
     */
    public HealthServer(Supplier<EngineStatus> statusSupplier) {
        this.statusSupplier = Objects.requireNonNull(statusSupplier, "status supplier must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
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

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        byte[] body = renderStatus(statusSupplier.get());
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    byte[] renderStatus(EngineStatus status) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", "UP");
        node.setAll((ObjectNode) mapper.valueToTree(status));
        return mapper.writeValueAsBytes(node);
    }
}
