/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Allocation result as handed to downstream approval and record systems,
 * together with how and when it was produced.
 */
public record AllocationDecision(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("result") ControlAllocationResult result,
    @JsonProperty("path") AllocationPath path,
    @JsonProperty("evaluated_at_epoch_millis") long evaluatedAtEpochMillis,
    @JsonProperty("processing_time_nanos") long processingTimeNanos
) implements Serializable {

    public AllocationDecision {
        Objects.requireNonNull(result, "result cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
    }

    /**
     * Returns true if the Fast-Track template baseline was applied.
     */
    public boolean fastTracked() {
        return path == AllocationPath.FAST_TRACK;
    }
}
