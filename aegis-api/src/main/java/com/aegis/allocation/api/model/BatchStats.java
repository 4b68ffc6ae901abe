package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregated statistics for a batch of allocations.
 */
public record BatchStats(
    @JsonProperty("total_requests") int totalRequests,
    @JsonProperty("fast_tracked") int fastTracked,
    @JsonProperty("count_by_level") Map<LoeLevel, Integer> countByLevel,
    @JsonProperty("total_control_count") long totalControlCount,
    @JsonProperty("avg_processing_time_nanos") long avgProcessingTimeNanos,
    @JsonProperty("min_processing_time_nanos") long minProcessingTimeNanos,
    @JsonProperty("max_processing_time_nanos") long maxProcessingTimeNanos
) {
    /**
     * Creates an empty BatchStats instance for cases with no requests.
     */
    public static BatchStats empty() {
        return new BatchStats(0, 0, Map.of(), 0, 0, 0, 0);
    }
}
