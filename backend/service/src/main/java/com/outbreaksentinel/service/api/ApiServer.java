package com.outbreaksentinel.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.outbreaksentinel.core.error.SurveillanceException;
import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.util.JsonUtils;
import com.outbreaksentinel.engine.pipeline.SurveillanceEngine;
import com.outbreaksentinel.service.store.AlertTrail;
import com.outbreaksentinel.service.store.EventCodec;
import com.outbreaksentinel.service.store.EventStore;
import com.outbreaksentinel.service.surveillance.AggregateRequest;
import com.outbreaksentinel.service.surveillance.DetectRequest;
import com.outbreaksentinel.service.surveillance.FuseRequest;
import com.outbreaksentinel.service.surveillance.SurveillanceService;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON HTTP surface of the engine. Unknown method names and malformed parameters answer 400 with
 * {@code {"error", "message"}}, unknown paths 404 and wrong verbs 405.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final DiagnosticsTracker EMPTY_DIAGNOSTICS = DiagnosticsTracker.empty();
    private static final int DEFAULT_LIMIT = 200;

    private final int port;
    private final SurveillanceService surveillance;
    private final EventStore eventStore;
    private final AlertTrail alertTrail;
    private final SseBroadcaster sseBroadcaster;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Map<String, Object> catalog;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            SurveillanceService surveillance,
            EventStore eventStore,
            SseBroadcaster sseBroadcaster,
            DiagnosticsTracker diagnosticsTracker,
            Map<String, Object> catalog
    ) {
        this.port = port;
        this.surveillance = surveillance;
        this.eventStore = eventStore;
        this.alertTrail = new AlertTrail(eventStore);
        this.sseBroadcaster = sseBroadcaster;
        this.diagnosticsTracker = diagnosticsTracker;
        this.catalog = Map.copyOf(catalog);
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool(SurveillanceEngine.namedThreads("http"));
            server.setExecutor(executor);
            route("/api/health", "GET", exchange -> Map.of("status", "ok"));
            route("/api/aggregate", "GET", this::aggregate);
            route("/api/fuse", "POST", exchange -> surveillance.fuse(body(exchange, FuseRequest.class)));
            route("/api/outbreaks/detect", "POST",
                    exchange -> surveillance.detectOutbreaks(body(exchange, DetectRequest.class)));
            route("/api/estimates", "GET", this::estimates);
            route("/api/alerts", "GET", this::alerts);
            route("/api/alerts/resolve", "POST", this::resolve);
            route("/api/catalog", "GET", exchange -> catalog);
            route("/api/sources/status", "GET", exchange -> diagnostics().sourcesSnapshot());
            route("/api/metrics", "GET", exchange -> diagnostics().metricsSnapshot());
            route("/api/events", "GET", this::events);
            server.createContext("/api/stream", sseBroadcaster::handle);
            server.createContext("/", exchange -> writeJson(exchange, 404,
                    error("not_found", "No endpoint at " + exchange.getRequestURI().getPath())));
            server.start();
            LOGGER.info("API listening on port " + actualPort());
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
            return port;
        }
        return server.getAddress().getPort();
    }

    private Object aggregate(HttpExchange exchange) {
        Map<String, String> query = queryParams(exchange.getRequestURI());
        return surveillance.aggregate(new AggregateRequest(
                list(query.get("sources")),
                list(query.get("regions")),
                list(query.get("diseases")),
                query.get("from"),
                query.get("to"),
                query.get("method")
        ));
    }

    private Object estimates(HttpExchange exchange) {
        Map<String, String> query = queryParams(exchange.getRequestURI());
        return surveillance.estimates(query.get("region"), query.get("disease"), query.get("from"), query.get("to"));
    }

    private Object alerts(HttpExchange exchange) {
        Map<String, String> query = queryParams(exchange.getRequestURI());
        if (Boolean.parseBoolean(query.get("open"))) {
            return surveillance.openAlerts();
        }
        Instant since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
        return alertTrail.raised(since, limit(query));
    }

    private Object resolve(HttpExchange exchange) throws IOException {
        ResolveRequest request = body(exchange, ResolveRequest.class);
        Optional<Alert> resolved = surveillance.resolveAlert(request.region(), request.disease());
        if (resolved.isEmpty()) {
            throw new ApiException(404, "not_found",
                    "No open alert for " + request.region() + "/" + request.disease());
        }
        return Map.of("resolved", true, "alert", resolved.get());
    }

    private Object events(HttpExchange exchange) {
        Map<String, String> query = queryParams(exchange.getRequestURI());
        Instant since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
        Optional<String> type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
        if (type.isPresent() && !EventCodec.knownType(type.get())) {
            throw new IllegalArgumentException("Unknown event type: " + type.get());
        }
        return eventStore.query(since, type, limit(query));
    }

    private void route(String path, String method, Endpoint endpoint) {
        server.createContext(path, exchange -> {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    writeJson(exchange, 404, error("not_found", "No endpoint at " + exchange.getRequestURI().getPath()));
                    return;
                }
                if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                    exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
                    exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
                    exchange.sendResponseHeaders(204, -1);
                    return;
                }
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", method);
                    writeJson(exchange, 405, error("method_not_allowed", path + " accepts " + method));
                    return;
                }
                writeJson(exchange, 200, endpoint.handle(exchange));
            } catch (ApiException e) {
                writeJson(exchange, e.status, error(e.error, e.getMessage()));
            } catch (SurveillanceException e) {
                writeJson(exchange, 400, error(e.code(), e.getMessage()));
            } catch (JsonProcessingException e) {
                writeJson(exchange, 400, error("invalid_json", e.getOriginalMessage()));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                writeJson(exchange, 400, error("invalid_request", e.getMessage()));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Request to " + path + " failed", e);
                writeJson(exchange, 500, error("internal_error", "Request failed"));
            } finally {
                exchange.close();
            }
        });
    }

    private <T> T body(HttpExchange exchange, Class<T> type) throws IOException {
        byte[] payload;
        try (InputStream in = exchange.getRequestBody()) {
            payload = in.readAllBytes();
        }
        if (payload.length == 0) {
            payload = "{}".getBytes(StandardCharsets.UTF_8);
        }
        return JsonUtils.objectMapper().readValue(payload, type);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private static Map<String, String> error(String code, String message) {
        Map<String, String> body = new HashMap<>();
        body.put("error", code);
        body.put("message", message == null ? code : message);
        return body;
    }

    private static int limit(Map<String, String> query) {
        int limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_LIMIT;
        return Math.max(1, limit);
    }

    private static List<String> list(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(",")).map(String::trim).filter(value -> !value.isEmpty()).toList();
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

    private DiagnosticsTracker diagnostics() {
        return diagnosticsTracker != null ? diagnosticsTracker : EMPTY_DIAGNOSTICS;
    }

    @FunctionalInterface
    private interface Endpoint {
        Object handle(HttpExchange exchange) throws IOException;
    }

    private record ResolveRequest(String region, String disease) {
    }

    private static final class ApiException extends RuntimeException {
        private final int status;
        private final String error;

        private ApiException(int status, String error, String message) {
            super(message);
            this.status = status;
            this.error = error;
        }
    }
}
