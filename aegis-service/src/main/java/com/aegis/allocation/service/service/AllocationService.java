/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.service.service;

import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationRequest;
import com.aegis.allocation.api.model.AllocationTrace;
import com.aegis.allocation.api.model.BatchAllocationResult;
import com.aegis.allocation.infra.management.AllocationEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Service for control allocation.
 * Delegates to the shared {@link AllocationEngine}; the REST resources never touch it directly.
 */
@ApplicationScoped
public class AllocationService {

    private static final Logger logger = Logger.getLogger(AllocationService.class.getName());

    @Inject
    AllocationEngine engine;

    /**
     * Allocates controls for one intake submission.
     *
     * @throws com.aegis.allocation.api.exceptions.InvalidSelectionException if the selection is malformed
     */
    public AllocationDecision allocate(AllocationRequest request) {
        AllocationDecision decision = engine.allocate(request);
        logger.fine(() -> String.format("Allocated %s: %s via %s",
                decision.requestId(), decision.result().loeLevel(), decision.path()));
        return decision;
    }

    public BatchAllocationResult allocateBatch(List<AllocationRequest> requests) {
        return engine.allocateBatch(requests);
    }

    public AllocationTrace explain(Map<String, Object> selection) {
        return engine.explain(selection);
    }

    public Map<String, Object> ruleCatalog() {
        return engine.ruleCatalog();
    }

    public Map<String, Object> getMetrics() {
        return engine.getMetrics().getSnapshot();
    }

    public Map<String, Object> describe() {
        return engine.describe();
    }
}
