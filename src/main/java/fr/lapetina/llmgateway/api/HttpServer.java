package fr.lapetina.llmgateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.llmgateway.api.dto.ApiCompletionRequest;
import fr.lapetina.llmgateway.api.dto.ApiCompletionResponse;
import fr.lapetina.llmgateway.api.dto.ApiModel;
import fr.lapetina.llmgateway.core.BenchmarkEntry;
import fr.lapetina.llmgateway.core.GatewayCore;
import fr.lapetina.llmgateway.domain.exception.AllProvidersFailedException;
import fr.lapetina.llmgateway.domain.exception.ModelNotFoundException;
import fr.lapetina.llmgateway.domain.exception.NoModelsAvailableException;
import fr.lapetina.llmgateway.domain.exception.ValidationException;
import fr.lapetina.llmgateway.domain.model.CompletionRequest;
import fr.lapetina.llmgateway.domain.model.CompletionResult;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.RoutingDecision;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;
import fr.lapetina.llmgateway.domain.model.TestResult;
import fr.lapetina.llmgateway.domain.stats.StatsSnapshot;
import fr.lapetina.llmgateway.infrastructure.config.ModelConfigMapper;
import fr.lapetina.llmgateway.infrastructure.health.HealthChecker;
import fr.lapetina.llmgateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmgateway.infrastructure.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/completions - Route and dispatch a completion; {@code "stream": true}
 *   answers with server-sent events ({@code delta} events, one {@code result}
 *   or {@code error} event, then {@code [DONE]})
 * - POST /v1/route - Routing decision without dispatch
 * - POST /v1/benchmark - Same conversation through every strategy
 * - GET /v1/models - List models
 * - POST /v1/models - Register a model
 * - GET /v1/models/{id} - Get a model
 * - DELETE /v1/models/{id} - Remove a model
 * - POST /v1/models/{id}/enable - Enable a model
 * - POST /v1/models/{id}/disable - Disable a model
 * - POST /v1/models/{id}/test - Test one model
 * - POST /v1/models/test - Test every model
 * - GET /v1/stats - Rolling statistics per model
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final GatewayCore gateway;
    private final HealthChecker healthChecker;
    private final MetricsRegistry metricsRegistry;
    private final ModelConfigMapper modelMapper;
    private final RoutingStrategy defaultStrategy;

    public HttpServer(
            int port,
            int backlog,
            GatewayCore gateway,
            HealthChecker healthChecker,
            MetricsRegistry metricsRegistry,
            ModelConfigMapper modelMapper,
            RoutingStrategy defaultStrategy
    ) throws IOException {
        this.gateway = gateway;
        this.healthChecker = healthChecker;
        this.metricsRegistry = metricsRegistry;
        this.modelMapper = modelMapper;
        this.defaultStrategy = defaultStrategy;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(port), backlog
        );

        // Handlers block on provider calls, so the pool grows with concurrent requests
        this.executor = Executors.newCachedThreadPool(new HandlerThreadFactory());
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/v1/completions", new CompletionHandler());
        server.createContext("/v1/route", new RouteHandler());
        server.createContext("/v1/benchmark", new BenchmarkHandler());
        server.createContext("/v1/models", new ModelsHandler());
        server.createContext("/v1/stats", new StatsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on port {}", getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Returns the bound port, useful when the server was created on port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    /**
     * Base handler: request id in the MDC and gateway exceptions mapped to status codes.
     */
    private abstract class GatewayHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = exchange.getRequestHeaders().getFirst("X-Request-ID");
            if (requestId == null || requestId.isBlank()) {
                requestId = UUID.randomUUID().toString();
            }
            MDC.put("requestId", requestId);
            exchange.getResponseHeaders().set("X-Request-ID", requestId);

            try {
                log.debug("Request received: method={}, path={}",
                        exchange.getRequestMethod(), exchange.getRequestURI().getPath());
                doHandle(exchange, exchange.getRequestURI().getPath(), exchange.getRequestMethod());
            } catch (Exception e) {
                sendFailure(exchange, e);
            } finally {
                MDC.clear();
                exchange.close();
            }
        }

        protected abstract void doHandle(HttpExchange exchange, String path, String method) throws IOException;
    }

    // ==================== COMPLETION HANDLERS ====================

    private class CompletionHandler extends GatewayHandler {
        @Override
        protected void doHandle(HttpExchange exchange, String path, String method) throws IOException {
            if (!"POST".equalsIgnoreCase(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            ApiCompletionRequest apiRequest = readJson(exchange, ApiCompletionRequest.class);
            CompletionRequest request = apiRequest.toCompletionRequest(defaultStrategy);
            if (apiRequest.isStreaming()) {
                streamCompletion(exchange, request);
                return;
            }

            CompletionResult result = gateway.complete(request).join();
            sendJson(exchange, 200, ApiCompletionResponse.fromResult(result));
        }

        /**
         * Failures before the first event keep the regular status mapping;
         * later ones can only be reported as an {@code error} event.
         */
        private void streamCompletion(HttpExchange exchange, CompletionRequest request) {
            SseWriter writer = new SseWriter(exchange);
            CompletionResult result;
            try {
                result = gateway.stream(request, delta -> writer.event("delta", Map.of("delta", delta))).join();
            } catch (CompletionException e) {
                if (!writer.isStarted()) {
                    throw e;
                }
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Stream interrupted: error={}", cause.getMessage());
                writer.event("error", Map.of("error", String.valueOf(cause.getMessage())));
                writer.finish();
                return;
            }
            writer.event("result", ApiCompletionResponse.fromResult(result));
            writer.finish();
        }
    }

    /**
     * Server-sent events over one exchange. Deltas arrive on provider threads,
     * hence the synchronization. Once finished, or once a write fails because
     * the client went away, later events are dropped and the provider call
     * runs to completion.
     */
    private final class SseWriter {
        private final HttpExchange exchange;
        private OutputStream out;
        private boolean closed;

        SseWriter(HttpExchange exchange) {
            this.exchange = exchange;
        }

        synchronized boolean isStarted() {
            return out != null;
        }

        synchronized void event(String name, Object data) {
            if (closed) {
                return;
            }
            try {
                if (out == null) {
                    exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
                    exchange.getResponseHeaders().set("Cache-Control", "no-cache");
                    exchange.sendResponseHeaders(200, 0);
                    out = exchange.getResponseBody();
                }
                write("event: " + name + "\ndata: " + objectMapper.writeValueAsString(data) + "\n\n");
            } catch (IOException e) {
                closed = true;
                log.warn("Client disconnected during stream: {}", e.getMessage());
            }
        }

        synchronized void finish() {
            if (out == null || closed) {
                return;
            }
            closed = true;
            try {
                write("data: [DONE]\n\n");
            } catch (IOException e) {
                log.warn("Client disconnected during stream: {}", e.getMessage());
            }
        }

        private void write(String text) throws IOException {
            out.write(text.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }

    private class RouteHandler extends GatewayHandler {
        @Override
        protected void doHandle(HttpExchange exchange, String path, String method) throws IOException {
            if (!"POST".equalsIgnoreCase(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            CompletionRequest request = readJson(exchange, ApiCompletionRequest.class)
                    .toCompletionRequest(defaultStrategy);

            RoutingDecision decision = gateway.route(request);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("strategy", decision.strategy().id());
            body.put("selected", decision.topCandidate());
            body.put("ranked", decision.rankedIds());
            body.put("reason", decision.reason());
            sendJson(exchange, 200, body);
        }
    }

    private class BenchmarkHandler extends GatewayHandler {
        @Override
        protected void doHandle(HttpExchange exchange, String path, String method) throws IOException {
            if (!"POST".equalsIgnoreCase(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            ApiCompletionRequest apiRequest = readJson(exchange, ApiCompletionRequest.class);
            List<BenchmarkEntry> entries = gateway.benchmark(apiRequest.toChatMessages()).join();

            List<Map<String, Object>> body = new ArrayList<>();
            for (BenchmarkEntry entry : entries) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("strategy", entry.strategy().id());
                info.put("success", entry.isSuccess());
                if (entry.isSuccess()) {
                    info.put("model", entry.result().modelId());
                    info.put("latency_ms", entry.result().latencyMs());
                    info.put("cost_usd", entry.result().cost());
                    info.put("reason", entry.result().routing().reason());
                } else {
                    info.put("error", entry.error());
                }
                body.add(info);
            }
            sendJson(exchange, 200, body);
        }
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler extends GatewayHandler {
        @Override
        protected void doHandle(HttpExchange exchange, String path, String method) throws IOException {
            ModelRegistry registry = gateway.registry();
            String[] parts = path.split("/");
            // "", "v1", "models", {id}, {action}

            if (parts.length == 3 && "GET".equals(method)) {
                boolean enabledOnly = "enabled=true".equals(exchange.getRequestURI().getQuery());
                sendJson(exchange, 200, registry.list(enabledOnly).stream().map(ApiModel::fromConfig).toList());
            } else if (parts.length == 3 && "POST".equals(method)) {
                ModelConfig model = modelMapper.toModelConfig(readJson(exchange, ApiModel.class).toModelEntry());
                registry.add(model);
                sendJson(exchange, 201, ApiModel.fromConfig(model));
            } else if (parts.length == 4 && "test".equals(parts[3]) && "POST".equals(method)) {
                List<TestResult> results = healthChecker.testAll().join();
                sendJson(exchange, 200, results.stream().map(HttpServer::testResultBody).toList());
            } else if (parts.length == 4 && "GET".equals(method)) {
                ModelConfig model = registry.get(parts[3]).orElseThrow(() -> new ModelNotFoundException(parts[3]));
                sendJson(exchange, 200, ApiModel.fromConfig(model));
            } else if (parts.length == 4 && "DELETE".equals(method)) {
                if (!registry.remove(parts[3])) {
                    throw new ModelNotFoundException(parts[3]);
                }
                sendJson(exchange, 200, Map.of("model", parts[3], "action", "removed"));
            } else if (parts.length == 5 && "POST".equals(method) && "enable".equals(parts[4])) {
                sendJson(exchange, 200, ApiModel.fromConfig(registry.enable(parts[3])));
            } else if (parts.length == 5 && "POST".equals(method) && "disable".equals(parts[4])) {
                sendJson(exchange, 200, ApiModel.fromConfig(registry.disable(parts[3])));
            } else if (parts.length == 5 && "POST".equals(method) && "test".equals(parts[4])) {
                sendJson(exchange, 200, testResultBody(healthChecker.testModel(parts[3]).join()));
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== STATS HANDLER ====================

    private class StatsHandler extends GatewayHandler {
        @Override
        protected void doHandle(HttpExchange exchange, String path, String method) throws IOException {
            if (!"GET".equalsIgnoreCase(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            for (Map.Entry<String, StatsSnapshot> entry : gateway.stats().entrySet()) {
                StatsSnapshot snapshot = entry.getValue();
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("samples", snapshot.sampleCount());
                info.put("avg_latency_ms", snapshot.hasLatencySamples()
                        ? snapshot.averageLatencyMs().getAsDouble() : null);
                info.put("success", snapshot.successCount());
                info.put("failure", snapshot.failureCount());
                info.put("error_rate", snapshot.errorRate());
                info.put("cost_usd", snapshot.cumulativeCost());
                body.put(entry.getKey(), info);
            }
            sendJson(exchange, 200, body);
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler extends GatewayHandler {
        @Override
        protected void doHandle(HttpExchange exchange, String path, String method) throws IOException {
            if (!"GET".equalsIgnoreCase(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            int registered = gateway.registry().size();
            int enabled = gateway.registry().list(true).size();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", enabled > 0 ? "UP" : "DOWN");
            health.put("timestamp", System.currentTimeMillis());
            health.put("models", registered);
            health.put("enabledModels", enabled);
            health.put("periodicChecks", healthChecker.isRunning());

            sendJson(exchange, enabled > 0 ? 200 : 503, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private <T> T readJson(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            T value = objectMapper.readValue(is, type);
            if (value == null) {
                throw new ValidationException("Request body is required");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON body: " + e.getOriginalMessage());
        }
    }

    private static Map<String, Object> testResultBody(TestResult result) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("model", result.modelId());
        info.put("success", result.success());
        info.put("latency_ms", result.latencyMs());
        result.errorMessage().ifPresent(error -> info.put("error", error));
        return info;
    }

    private void sendFailure(HttpExchange exchange, Throwable failure) throws IOException {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;

        if (cause instanceof ValidationException) {
            sendError(exchange, 400, cause.getMessage());
        } else if (cause instanceof ModelNotFoundException) {
            sendError(exchange, 404, cause.getMessage());
        } else if (cause instanceof NoModelsAvailableException) {
            sendError(exchange, 503, cause.getMessage());
        } else if (cause instanceof AllProvidersFailedException allFailed) {
            log.warn("All providers failed: failures={}", allFailed.getFailures().size());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", allFailed.getMessage());
            body.put("failures", allFailed.getFailures().stream()
                    .map(ApiCompletionResponse.Failure::from)
                    .toList());
            sendJson(exchange, 502, body);
        } else {
            log.error("Error handling request: path={}", exchange.getRequestURI().getPath(), cause);
            sendError(exchange, 500, "Internal server error: " + cause.getMessage());
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown error");
        sendJson(exchange, statusCode, error);
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "http-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
