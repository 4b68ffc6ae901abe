/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.runtime.model;

import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.ControlAllocationResult;
import com.aegis.allocation.api.model.RuleDescriptor;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One entry of the allocation chain: a predicate over the selection and the
 * fixed result returned when it is the first predicate to hold.
 */
public final class AllocationRule {
    private final int order;
    private final String ruleCode;
    private final String description;
    private final Predicate<ClassificationSelection> condition;
    private final ControlAllocationResult outcome;
    private final boolean catchAll;

    private AllocationRule(int order, String ruleCode, String description,
                           Predicate<ClassificationSelection> condition,
                           ControlAllocationResult outcome, boolean catchAll) {
        this.order = order;
        this.ruleCode = Objects.requireNonNull(ruleCode, "ruleCode cannot be null");
        this.description = Objects.requireNonNull(description, "description cannot be null");
        this.condition = Objects.requireNonNull(condition, "condition cannot be null");
        this.outcome = Objects.requireNonNull(outcome, "outcome cannot be null");
        this.catchAll = catchAll;
    }

    public static AllocationRule of(int order, String ruleCode, String description,
                                    Predicate<ClassificationSelection> condition,
                                    ControlAllocationResult outcome) {
        return new AllocationRule(order, ruleCode, description, condition, outcome, false);
    }

    /**
     * A rule that matches every selection. A chain ends with exactly one.
     */
    public static AllocationRule fallback(int order, String ruleCode, String description,
                                          ControlAllocationResult outcome) {
        return new AllocationRule(order, ruleCode, description, selection -> true, outcome, true);
    }

    public boolean matches(ClassificationSelection selection) {
        return condition.test(selection);
    }

    public int getOrder() { return order; }
    public String getRuleCode() { return ruleCode; }
    public String getDescription() { return description; }
    public ControlAllocationResult getOutcome() { return outcome; }
    public boolean isCatchAll() { return catchAll; }

    public RuleDescriptor toDescriptor() {
        return new RuleDescriptor(order, ruleCode, description, catchAll, outcome);
    }

    @Override
    public String toString() {
        return String.format("AllocationRule[order=%d, code=%s, controls=%d, loe=%s]",
                order, ruleCode, outcome.controlCount(), outcome.loeLevel());
    }
}
