package com.aegis.allocation.service.rest;

import com.aegis.allocation.service.service.AllocationService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.Map;

@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class InfoResource {

    @Inject
    AllocationService allocationService;

    @GET
    public Map<String, Object> info() {
        return allocationService.describe();
    }
}
