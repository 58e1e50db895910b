package fr.lapetina.lineplanner.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.lineplanner.LinePlannerFactory;
import fr.lapetina.lineplanner.api.dto.BalanceResponse;
import fr.lapetina.lineplanner.api.dto.ErrorResponse;
import fr.lapetina.lineplanner.api.dto.LayoutRequest;
import fr.lapetina.lineplanner.api.dto.LayoutResponse;
import fr.lapetina.lineplanner.domain.balancing.CapacityPlanner;
import fr.lapetina.lineplanner.domain.catalog.MachineCatalog;
import fr.lapetina.lineplanner.domain.exception.LayoutException;
import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.LayoutErrorType;
import fr.lapetina.lineplanner.engine.GeneratedLayout;
import fr.lapetina.lineplanner.infrastructure.config.ConfigLoader;
import fr.lapetina.lineplanner.infrastructure.config.LinePlannerConfig;
import fr.lapetina.lineplanner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/layout - Balance and place a bulletin, returns placed entities
 * - POST /v1/balance - Balance only, returns machine counts
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final LinePlannerFactory factory;
    private final MachineCatalog catalog;

    public HttpServer(int port, int backlog, int workerThreads, LinePlannerFactory factory) throws IOException {
        this(new InetSocketAddress(port), backlog, workerThreads, factory);
    }

    public HttpServer(String host, int port, int backlog, int workerThreads, LinePlannerFactory factory)
            throws IOException {
        this(new InetSocketAddress(host, port), backlog, workerThreads, factory);
    }

    private HttpServer(InetSocketAddress address, int backlog, int workerThreads, LinePlannerFactory factory)
            throws IOException {
        this.factory = factory;
        this.catalog = MachineCatalog.defaultCatalog();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        this.server = com.sun.net.httpserver.HttpServer.create(address, backlog);
        this.executor = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "http-worker");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/v1/layout", new LayoutHandler());
        server.createContext("/v1/balance", new BalanceHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}", address);
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Bound port; differs from the configured one when 0 was requested.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== LAYOUT HANDLERS ====================

    private abstract class DemandHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, ErrorResponse.of("Method Not Allowed"));
                    return;
                }

                LayoutRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, LayoutRequest.class);
                } catch (JsonProcessingException e) {
                    log.warn("Unreadable request body: {}", e.getOriginalMessage());
                    sendError(exchange, 400, ErrorResponse.of(LayoutErrorType.INVALID_REQUEST,
                            "Invalid JSON: " + e.getOriginalMessage()));
                    return;
                }

                LinePlannerConfig.DemandConfig demand = factory.getConfig().getDemand();
                double target = request.getTargetOutput() != null
                        ? request.getTargetOutput()
                        : demand.getDefaultTargetOutput() != null ? demand.getDefaultTargetOutput() : 0;
                double minutes = request.getWorkingMinutes() != null
                        ? request.getWorkingMinutes()
                        : demand.getDefaultWorkingMinutes();

                respond(exchange, request, target, minutes);

            } catch (LayoutException e) {
                log.warn("Layout request rejected: type={}, reason={}", e.getErrorType(), e.getMessage());
                sendError(exchange, 400, ErrorResponse.of(e.getErrorType(), e.getMessage()));
            } catch (Exception e) {
                log.error("Error handling layout request", e);
                sendError(exchange, 500, ErrorResponse.of(LayoutErrorType.INTERNAL_ERROR,
                        "Internal server error: " + e.getMessage()));
            } finally {
                MDC.clear();
            }
        }

        abstract void respond(HttpExchange exchange, LayoutRequest request, double target, double minutes)
                throws IOException;
    }

    private class LayoutHandler extends DemandHandler {
        @Override
        void respond(HttpExchange exchange, LayoutRequest request, double target, double minutes) throws IOException {
            GeneratedLayout layout = factory.getGenerator()
                    .generateLayout(request.toOperations(), target, minutes);
            sendJson(exchange, 200, LayoutResponse.from(layout, catalog));
        }
    }

    private class BalanceHandler extends DemandHandler {
        @Override
        void respond(HttpExchange exchange, LayoutRequest request, double target, double minutes) throws IOException {
            List<BalancedOperation> balanced = factory.getGenerator()
                    .balance(request.toOperations(), target, minutes);
            sendJson(exchange, 200, BalanceResponse.from(balanced, CapacityPlanner.taktTime(target, minutes)));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, ErrorResponse.of("Method Not Allowed"));
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("transitionFixtures", factory.getGenerator().getSettings().transitionFixtures());
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, ErrorResponse.of("Method Not Allowed"));
                return;
            }

            MetricsRegistry metrics = factory.getMetricsRegistry();
            if (metrics == null) {
                sendError(exchange, 404, ErrorResponse.of("Metrics disabled"));
                return;
            }

            byte[] bytes = metrics.scrape().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            if (path.equals("/admin/reload") && "POST".equals(method)) {
                try {
                    factory.getConfigLoader().load();
                    sendJson(exchange, 200, Map.of(
                            "message", "Configuration reloaded",
                            "transitionFixtures", factory.getGenerator().getSettings().transitionFixtures()
                    ));
                } catch (ConfigLoader.ConfigurationException e) {
                    log.warn("Configuration reload rejected: {}", e.getMessage());
                    sendError(exchange, 422, ErrorResponse.of(LayoutErrorType.INVALID_REQUEST,
                            "Configuration rejected, keeping current: " + e.getMessage()));
                } catch (Exception e) {
                    log.error("Error reloading configuration", e);
                    sendError(exchange, 500, ErrorResponse.of(LayoutErrorType.INTERNAL_ERROR,
                            "Internal server error: " + e.getMessage()));
                }
            } else {
                sendError(exchange, 404, ErrorResponse.of("Not Found"));
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, ErrorResponse error) throws IOException {
        sendJson(exchange, statusCode, error);
    }
}
