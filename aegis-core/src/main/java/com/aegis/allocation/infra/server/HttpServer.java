/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.infra.server;

import com.aegis.allocation.api.exceptions.InvalidSelectionException;
import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationRequest;
import com.aegis.allocation.api.model.AllocationTrace;
import com.aegis.allocation.api.model.BatchAllocationResult;
import com.aegis.allocation.infra.management.AllocationEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight standalone HTTP server for the control allocator.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /allocate - Allocate controls for one intake submission</li>
 *   <li>POST /allocate/batch - Allocate a JSON array of submissions</li>
 *   <li>POST /allocate/explain - Rule-by-rule trace for a selection</li>
 *   <li>GET /rules - Ordered rule chain and Fast-Track template</li>
 *   <li>GET /monitoring/metrics - Allocation metrics</li>
 *   <li>GET /health - Readiness check</li>
 *   <li>GET / - Service info</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Handlers share one {@link AllocationEngine}, which holds only immutable
 * state and lock-free counters.
 */
public class HttpServer {
    private static final Logger logger = Logger.getLogger(HttpServer.class.getName());

    private static final TypeReference<List<AllocationRequest>> BATCH_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> SELECTION_TYPE = new TypeReference<>() {};

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final AllocationEngine engine;
    private final Tracer tracer;
    private final ObjectMapper objectMapper;

    /**
     * Creates a new HttpServer.
     *
     * @param port   the port to listen on, 0 for an ephemeral port
     * @param engine the allocation engine
     * @param tracer OpenTelemetry tracer for observability
     * @throws IOException if the server cannot be created
     */
    public HttpServer(int port, AllocationEngine engine, Tracer tracer) throws IOException {
        this.engine = Objects.requireNonNull(engine, "AllocationEngine cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.objectMapper = new ObjectMapper();
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 0);

        this.server.createContext("/allocate", new AllocateHandler());
        this.server.createContext("/allocate/batch", new BatchHandler());
        this.server.createContext("/allocate/explain", new ExplainHandler());
        this.server.createContext("/rules", new RulesHandler());
        this.server.createContext("/monitoring/metrics", new MetricsHandler());
        this.server.createContext("/health", new HealthHandler());
        this.server.createContext("/", new InfoHandler());

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(coreCount * 2);
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("Aegis Control Allocator server started on port " + getPort());
    }

    public void stop(int delaySeconds) {
        logger.info("Stopping server...");
        server.stop(delaySeconds);
        executor.shutdown();
    }

    /**
     * The bound port; differs from the requested one when 0 was requested.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    class AllocateHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!exactPath(exchange, "/allocate") || !requireMethod(exchange, "POST")) {
                return;
            }
            traced(exchange, "http-allocate", span -> {
                AllocationRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, AllocationRequest.class);
                }
                AllocationDecision decision = engine.allocate(request);
                span.setAttribute("requestId", decision.requestId());
                span.setAttribute("loeLevel", decision.result().loeLevel().name());
                span.setAttribute("path", decision.path().name());
                return decision;
            });
        }
    }

    class BatchHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!exactPath(exchange, "/allocate/batch") || !requireMethod(exchange, "POST")) {
                return;
            }
            traced(exchange, "http-allocate-batch", span -> {
                List<AllocationRequest> requests;
                try (InputStream is = exchange.getRequestBody()) {
                    requests = objectMapper.readValue(is, BATCH_TYPE);
                }
                BatchAllocationResult result = engine.allocateBatch(requests);
                span.setAttribute("batchSize", result.decisions().size());
                return result;
            });
        }
    }

    class ExplainHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!exactPath(exchange, "/allocate/explain") || !requireMethod(exchange, "POST")) {
                return;
            }
            traced(exchange, "http-allocate-explain", span -> {
                Map<String, Object> selection;
                try (InputStream is = exchange.getRequestBody()) {
                    selection = objectMapper.readValue(is, SELECTION_TYPE);
                }
                AllocationTrace trace = engine.explain(selection);
                span.setAttribute("matchedRule", trace.matchedRuleCode());
                return trace;
            });
        }
    }

    class RulesHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (requireMethod(exchange, "GET")) {
                traced(exchange, "http-rules", span -> engine.ruleCatalog());
            }
        }
    }

    class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (requireMethod(exchange, "GET")) {
                traced(exchange, "http-metrics", span -> engine.getMetrics().getSnapshot());
            }
        }
    }

    class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            if (engine.isReady()) {
                body.put("status", "UP");
                body.put("fast_track_enabled", engine.getFlags().fastTrackEnabled());
                sendResponse(exchange, 200, objectMapper.writeValueAsString(body));
            } else {
                body.put("status", "DOWN");
                body.put("reason", "Allocation rule chain not loaded");
                sendResponse(exchange, 503, objectMapper.writeValueAsString(body));
            }
        }
    }

    class InfoHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!exactPath(exchange, "/") || !requireMethod(exchange, "GET")) {
                return;
            }
            sendResponse(exchange, 200, objectMapper.writeValueAsString(engine.describe()));
        }
    }

    @FunctionalInterface
    private interface SpanHandler {
        Object handle(Span span) throws IOException;
    }

    /**
     * Runs a handler inside a span and writes its result as JSON. Invalid
     * input maps to 400, anything else to 500.
     */
    private void traced(HttpExchange exchange, String spanName, SpanHandler handler) throws IOException {
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            Object body = handler.handle(span);
            sendResponse(exchange, 200, objectMapper.writeValueAsString(body));
        } catch (InvalidSelectionException e) {
            span.recordException(e);
            sendResponse(exchange, 400, errorBody("Invalid selection", e.getField(), e.getMessage()));
        } catch (JsonProcessingException e) {
            span.recordException(e);
            sendResponse(exchange, 400, errorBody("Invalid request body", null, e.getOriginalMessage()));
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            logger.log(Level.SEVERE, "Error handling " + exchange.getRequestURI(), e);
            sendResponse(exchange, 500, errorBody("Internal Server Error", null, e.getMessage()));
        } finally {
            span.end();
        }
    }

    private String errorBody(String error, String field, String message) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("field", field);
        body.put("message", message);
        return objectMapper.writeValueAsString(body);
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equals(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
        return false;
    }

    // Contexts match by prefix; deeper paths are rejected.
    private boolean exactPath(HttpExchange exchange, String path) throws IOException {
        if (path.equals(exchange.getRequestURI().getPath())) {
            return true;
        }
        sendResponse(exchange, 404, "{\"error\":\"Not Found\"}");
        return false;
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
