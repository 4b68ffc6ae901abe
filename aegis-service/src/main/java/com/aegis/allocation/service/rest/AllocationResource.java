/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.service.rest;

import com.aegis.allocation.api.exceptions.InvalidSelectionException;
import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationRequest;
import com.aegis.allocation.api.model.AllocationTrace;
import com.aegis.allocation.api.model.BatchAllocationResult;
import com.aegis.allocation.service.service.AllocationService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;

/**
 * JAX-RS resource for control allocation endpoints.
 * Malformed selections are answered with 400 and the offending field.
 */
@Path("/allocate")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AllocationResource {

    @Inject
    AllocationService allocationService;

    @Inject
    Tracer tracer;

    /**
     * Allocate controls for one intake submission.
     *
     * @param request selection plus optional request id and template fields
     * @return the allocation decision, including the path taken
     */
    @POST
    public Response allocate(AllocationRequest request) {
        Span span = tracer.spanBuilder("http-allocate").startSpan();
        try (Scope scope = span.makeCurrent()) {
            AllocationDecision decision = allocationService.allocate(request);
            span.setAttribute("requestId", decision.requestId());
            span.setAttribute("loeLevel", decision.result().loeLevel().name());
            span.setAttribute("path", decision.path().name());
            return Response.ok(decision).build();

        } catch (InvalidSelectionException e) {
            return ErrorResponses.invalidSelection(span, e);
        } catch (Exception e) {
            return ErrorResponses.internalError(span, e);
        } finally {
            span.end();
        }
    }

    /**
     * Allocate several submissions in order with aggregated statistics.
     * One malformed submission rejects the whole batch.
     */
    @POST
    @Path("/batch")
    public Response allocateBatch(List<AllocationRequest> requests) {
        Span span = tracer.spanBuilder("http-allocate-batch").startSpan();
        try (Scope scope = span.makeCurrent()) {
            BatchAllocationResult result = allocationService.allocateBatch(requests);
            span.setAttribute("batchSize", result.decisions().size());
            span.setAttribute("fastTracked", result.stats().fastTracked());
            return Response.ok(result).build();

        } catch (InvalidSelectionException e) {
            return ErrorResponses.invalidSelection(span, e);
        } catch (Exception e) {
            return ErrorResponses.internalError(span, e);
        } finally {
            span.end();
        }
    }

    /**
     * Explain how the rule chain resolves a selection.
     *
     * @param selection the raw selection flags
     * @return every rule in order with MATCHED, NOT_MATCHED or SKIPPED
     */
    @POST
    @Path("/explain")
    public Response explain(Map<String, Object> selection) {
        Span span = tracer.spanBuilder("http-allocate-explain").startSpan();
        try (Scope scope = span.makeCurrent()) {
            AllocationTrace trace = allocationService.explain(selection);
            span.setAttribute("matchedRule", trace.matchedRuleCode());
            return Response.ok(trace).build();

        } catch (InvalidSelectionException e) {
            return ErrorResponses.invalidSelection(span, e);
        } catch (Exception e) {
            return ErrorResponses.internalError(span, e);
        } finally {
            span.end();
        }
    }
}
