/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.api;

import com.aegis.allocation.api.model.AllocationTrace;
import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.ControlAllocationResult;
import com.aegis.allocation.api.model.RuleDescriptor;

import java.util.List;

/**
 * Contract for resolving a classification selection into a security-control
 * allocation.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IControlAllocator allocator = // obtain from factory or DI
 *
 * ClassificationSelection selection = ClassificationSelection.builder()
 *     .pii(true)
 *     .systemScope(SystemScope.EXTERNAL)
 *     .build();
 *
 * ControlAllocationResult result = allocator.evaluate(selection);
 * // 70 controls, LOE D
 * }</pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Total: every selection maps to exactly one result; there is no error path.</li>
 *   <li>Deterministic: the same selection always yields the same result.</li>
 *   <li>Thread-safe: one instance can serve any number of concurrent callers.</li>
 * </ul>
 */
public interface IControlAllocator {

    /**
     * Resolves a selection to its control allocation.
     *
     * @param selection the classification flags (must not be null)
     * @return the allocation of the highest-priority matching rule
     * @throws NullPointerException if selection is null
     */
    ControlAllocationResult evaluate(ClassificationSelection selection);

    /**
     * Resolves a selection and records which rules were consulted on the way.
     *
     * @param selection the classification flags (must not be null)
     * @return trace ending in the same result {@link #evaluate} returns
     * @throws NullPointerException if selection is null
     */
    default AllocationTrace explain(ClassificationSelection selection) {
        throw new UnsupportedOperationException("explain not implemented");
    }

    /**
     * Resolves several selections.
     *
     * @param selections selections to evaluate
     * @return results in the same order as the input
     * @throws NullPointerException if selections is null
     */
    default List<ControlAllocationResult> evaluateBatch(List<ClassificationSelection> selections) {
        return selections.stream()
            .map(this::evaluate)
            .toList();
    }

    /**
     * Describes the rules this allocator applies, in priority order.
     */
    default List<RuleDescriptor> rules() {
        return List.of();
    }
}
