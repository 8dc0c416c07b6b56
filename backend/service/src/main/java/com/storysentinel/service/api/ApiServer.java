package com.storysentinel.service.api;

import com.storysentinel.collectors.limit.FixedWindowRateLimiter;
import com.storysentinel.core.util.JsonUtils;
import com.storysentinel.service.config.ApiConfig;
import com.storysentinel.service.query.BestStoriesQueryService;
import com.storysentinel.service.runtime.RefreshOrchestrator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    static final String API_KEY_HEADER = "X-API-KEY";
    static final int MAX_STORIES = 200;

    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());

    private final ApiConfig config;
    private final BestStoriesQueryService queryService;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Supplier<RefreshOrchestrator.State> refreshState;
    private final Supplier<Optional<Instant>> lastPublishedAt;
    private final FixedWindowRateLimiter inboundLimiter;
    private final AtomicLong requestIds = new AtomicLong();

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            ApiConfig config,
            BestStoriesQueryService queryService,
            DiagnosticsTracker diagnosticsTracker,
            Supplier<RefreshOrchestrator.State> refreshState,
            Supplier<Optional<Instant>> lastPublishedAt
    ) {
        this.config = config;
        this.queryService = queryService;
        this.diagnosticsTracker = diagnosticsTracker;
        this.refreshState = refreshState;
        this.lastPublishedAt = lastPublishedAt;
        ApiConfig.RateLimit limit = config.rateLimit();
        this.inboundLimiter = new FixedWindowRateLimiter(limit.permitLimit(), limit.window(), limit.queueLimit());
    }

    public void start() {
        if (config.apiKey() == null) {
            LOGGER.warning("No API key configured; /api/best will reject every request");
        }
        try {
            server = HttpServer.create(new InetSocketAddress(config.port()), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/best", logged(this::handleBest));
            server.createContext("/api/health", logged(this::handleHealth));
            server.createContext("/api/metrics", logged(this::handleMetrics));
            server.start();
            LOGGER.info(() -> "API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return config.port();
        }
        return server.getAddress().getPort();
    }

    private void handleBest(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange) || !ensureApiKey(exchange)) {
            return;
        }

        FixedWindowRateLimiter.Permit permit;
        try {
            permit = inboundLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writeJson(exchange, 503, Map.of("error", "Server is shutting down"));
            return;
        }
        if (!permit.acquired()) {
            writeJson(exchange, 429, Map.of("error", "Too many requests"));
            return;
        }

        String raw = queryParams(exchange.getRequestURI()).get("n");
        if (raw == null || raw.isBlank()) {
            writeJson(exchange, 400, Map.of("error", "Parameter 'n' is required."));
            return;
        }
        int n;
        try {
            n = Integer.parseInt(raw.trim());
        } catch (NumberFormatException invalidNumber) {
            writeJson(exchange, 400, invalidRange(raw));
            return;
        }
        if (n < 1 || n > MAX_STORIES) {
            writeJson(exchange, 400, invalidRange(n));
            return;
        }
        writeJson(exchange, 200, queryService.bestStories(n));
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("refreshState", refreshState.get().name());
        lastPublishedAt.get().ifPresent(at -> health.put("lastPublishedAt", at.toString()));
        writeJson(exchange, 200, health);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange) || !ensureApiKey(exchange)) {
            return;
        }
        Map<String, Object> metrics = diagnosticsTracker.metricsSnapshot();
        metrics.put("inboundQueueDepth", inboundLimiter.queueDepth());
        writeJson(exchange, 200, metrics);
    }

    private HttpHandler logged(HttpHandler handler) {
        return exchange -> {
            long requestId = requestIds.incrementAndGet();
            long startedAt = System.nanoTime();
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Request " + requestId + " failed", e);
                if (exchange.getResponseCode() == -1) {
                    writeJson(exchange, 500, Map.of("error", "An unexpected error occurred."));
                }
            } finally {
                long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000;
                LOGGER.info(() -> "Request " + requestId + " " + exchange.getRequestMethod() + " "
                        + exchange.getRequestURI().getPath() + " -> " + exchange.getResponseCode()
                        + " in " + elapsedMillis + " ms");
                exchange.close();
            }
        };
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            exchange.sendResponseHeaders(405, -1);
            return false;
        }
        return true;
    }

    private boolean ensureApiKey(HttpExchange exchange) throws IOException {
        String provided = exchange.getRequestHeaders().getFirst(API_KEY_HEADER);
        if (provided == null || provided.isEmpty()) {
            writeJson(exchange, 401, Map.of("error", "API Key missing"));
            return false;
        }
        String expected = config.apiKey();
        if (expected == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            writeJson(exchange, 401, Map.of("error", "Invalid API Key"));
            return false;
        }
        return true;
    }

    private static Map<String, Object> invalidRange(Object receivedValue) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Invalid range for 'n'.");
        body.put("detail", "The number of stories (n) must be between 1 and " + MAX_STORIES + ".");
        body.put("receivedValue", receivedValue);
        return body;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
