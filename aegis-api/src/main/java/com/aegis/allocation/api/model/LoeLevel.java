/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.api.model;

/**
 * Level of Effort tier. Every tier carries the fixed number of security
 * controls it requires.
 */
public enum LoeLevel {
    /**
     * Minimum tier: pilot systems and unclassified defaults.
     */
    A(20),

    /**
     * Public data.
     */
    B(38),

    /**
     * Internal system holding sensitive (non-DFARS) data.
     */
    C(56),

    /**
     * External system holding sensitive (non-DFARS) data.
     */
    D(70),

    /**
     * CUI and DFARS-regulated information. Maximal controls.
     */
    DFARS(110);

    private final int controlCount;

    LoeLevel(int controlCount) {
        this.controlCount = controlCount;
    }

    public int controlCount() {
        return controlCount;
    }
}
