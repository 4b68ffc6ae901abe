package com.aegis.allocation.service.config;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;

/**
 * Adds CORS headers so browser-based intake forms served from another origin
 * can call the allocator.
 */
@Provider
public class CorsFilter implements ContainerResponseFilter {

    static final String ALLOWED_HEADERS = "origin, content-type, accept, authorization, x-requested-with";
    static final String ALLOWED_METHODS = "GET, POST, OPTIONS, HEAD";
    static final String MAX_AGE_SECONDS = "86400";

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        String origin = requestContext.getHeaderString("Origin");
        responseContext.getHeaders().putSingle("Access-Control-Allow-Origin", origin != null ? origin : "*");
        responseContext.getHeaders().putSingle("Access-Control-Allow-Credentials", "true");
        responseContext.getHeaders().putSingle("Access-Control-Allow-Headers", ALLOWED_HEADERS);
        responseContext.getHeaders().putSingle("Access-Control-Allow-Methods", ALLOWED_METHODS);
        responseContext.getHeaders().putSingle("Access-Control-Max-Age", MAX_AGE_SECONDS);
    }
}
