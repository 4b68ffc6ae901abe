package com.aegis.allocation.service.config;

import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;

/**
 * Answers CORS preflight requests for every path. {@link CorsFilter} adds the headers.
 */
@Path("{path:.*}")
public class CorsPreflightHandler {

    @OPTIONS
    public Response handlePreflight() {
        return Response.ok().build();
    }
}
