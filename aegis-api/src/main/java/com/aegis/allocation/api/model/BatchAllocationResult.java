package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of batch allocation containing every decision, in request order, and
 * aggregated statistics.
 */
public record BatchAllocationResult(
    @JsonProperty("decisions") List<AllocationDecision> decisions,
    @JsonProperty("stats") BatchStats stats
) {}
