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

/**
 * Read-only view of the allocation rules, for intake forms that show the
 * LOE outcome next to each question.
 */
@Path("/rules")
@Produces(MediaType.APPLICATION_JSON)
public class RuleCatalogResource {

    @Inject
    AllocationService allocationService;

    @Inject
    Tracer tracer;

    @GET
    public Response getRules() {
        Span span = tracer.spanBuilder("http-get-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return Response.ok(allocationService.ruleCatalog()).build();
        } catch (Exception e) {
            return ErrorResponses.internalError(span, e);
        } finally {
            span.end();
        }
    }
}
