/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.service.rest;

import com.aegis.allocation.service.service.AllocationService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Map;

/**
 * JAX-RS resource for monitoring endpoints.
 */
@Path("/monitoring")
@Produces(MediaType.APPLICATION_JSON)
public class MonitoringResource {

    @Inject
    AllocationService allocationService;

    @Inject
    Tracer tracer;

    /**
     * Get allocation counters and latency percentiles.
     *
     * @return metrics snapshot
     */
    @GET
    @Path("/metrics")
    public Response getMetrics() {
        Span span = tracer.spanBuilder("http-get-monitoring-metrics").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Map<String, Object> metrics = allocationService.getMetrics();
            return Response.ok(metrics).build();
        } catch (Exception e) {
            return ErrorResponses.internalError(span, e);
        } finally {
            span.end();
        }
    }
}
