/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of a control allocation: how many security controls a system needs,
 * the LOE tier they belong to, and why.
 *
 * <p>The control count is never computed. It must be the fixed count of
 * {@code loeLevel}; any other combination is rejected at construction, so a
 * result can only ever carry one of 20, 38, 56, 70 or 110 controls.
 *
 * <h2>Usage</h2>
 * <pre>
 * ControlAllocationResult result = ControlAllocationResult.of(LoeLevel.B, "LOE B - Public Data");
 * result.controlCount(); // 38
 * </pre>
 */
public record ControlAllocationResult(
    @JsonProperty("control_count") int controlCount,
    @JsonProperty("loe_level") LoeLevel loeLevel,
    @JsonProperty("reason") String reason
) implements Serializable {

    public ControlAllocationResult {
        Objects.requireNonNull(loeLevel, "loeLevel cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        if (controlCount != loeLevel.controlCount()) {
            throw new IllegalArgumentException(String.format(
                "LOE %s requires %d controls, got %d", loeLevel, loeLevel.controlCount(), controlCount));
        }
    }

    /**
     * Creates a result carrying the fixed control count of the given level.
     */
    public static ControlAllocationResult of(LoeLevel loeLevel, String reason) {
        Objects.requireNonNull(loeLevel, "loeLevel cannot be null");
        return new ControlAllocationResult(loeLevel.controlCount(), loeLevel, reason);
    }
}
