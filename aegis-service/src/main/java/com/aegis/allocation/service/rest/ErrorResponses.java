package com.aegis.allocation.service.rest;

import com.aegis.allocation.api.exceptions.InvalidSelectionException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import jakarta.ws.rs.core.Response;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies shared by the allocation resources.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static Response invalidSelection(Span span, InvalidSelectionException e) {
        span.recordException(e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Invalid selection");
        body.put("field", e.getField());
        body.put("message", e.getMessage());
        return Response.status(Response.Status.BAD_REQUEST).entity(body).build();
    }

    static Response internalError(Span span, Exception e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Internal Server Error");
        body.put("message", e.getMessage());
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(body).build();
    }
}
