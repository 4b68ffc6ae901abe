/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.runtime.evaluation;

import com.aegis.allocation.api.IControlAllocator;
import com.aegis.allocation.api.model.AllocationTrace;
import com.aegis.allocation.api.model.AllocationTrace.RuleCheck;
import com.aegis.allocation.api.model.AllocationTrace.RuleStatus;
import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.ControlAllocationResult;
import com.aegis.allocation.api.model.RuleDescriptor;
import com.aegis.allocation.runtime.model.AllocationRule;
import com.aegis.allocation.runtime.model.AllocationRuleChain;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rule evaluator for control allocation.
 *
 * <p>Walks the {@link AllocationRuleChain} in order and returns the outcome of
 * the first rule that holds. Rules after the match are never consulted. The
 * evaluator holds no mutable state, so a single instance is shared by all
 * request threads.
 */
public final class ControlAllocationEvaluator implements IControlAllocator {

    private final AllocationRuleChain chain;
    private final Tracer tracer;

    public ControlAllocationEvaluator(AllocationRuleChain chain, Tracer tracer) {
        this.chain = Objects.requireNonNull(chain, "chain cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
    }

    /**
     * Evaluator over the standard chain without tracing.
     */
    public static ControlAllocationEvaluator standard() {
        return new ControlAllocationEvaluator(AllocationRuleChain.standard(),
                OpenTelemetry.noop().getTracer("aegis-allocation"));
    }

    @Override
    public ControlAllocationResult evaluate(ClassificationSelection selection) {
        Objects.requireNonNull(selection, "selection cannot be null");

        Span span = tracer.spanBuilder("allocation-evaluate").startSpan();
        try (Scope scope = span.makeCurrent()) {
            AllocationRule rule = chain.firstMatch(selection);
            ControlAllocationResult result = rule.getOutcome();

            span.setAttribute("ruleCode", rule.getRuleCode());
            span.setAttribute("ruleOrder", rule.getOrder());
            span.setAttribute("loeLevel", result.loeLevel().name());
            span.setAttribute("controlCount", result.controlCount());
            return result;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the rule that decides the given selection.
     */
    public AllocationRule matchingRule(ClassificationSelection selection) {
        return chain.firstMatch(selection);
    }

    @Override
    public AllocationTrace explain(ClassificationSelection selection) {
        Objects.requireNonNull(selection, "selection cannot be null");

        Span span = tracer.spanBuilder("allocation-explain").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<RuleCheck> checks = new ArrayList<>(chain.size());
            AllocationRule matched = null;

            for (AllocationRule rule : chain.getRules()) {
                RuleStatus status;
                if (matched != null) {
                    status = RuleStatus.SKIPPED;
                } else if (rule.matches(selection)) {
                    status = RuleStatus.MATCHED;
                    matched = rule;
                } else {
                    status = RuleStatus.NOT_MATCHED;
                }
                checks.add(new RuleCheck(rule.getOrder(), rule.getRuleCode(), rule.getDescription(), status));
            }

            // The chain ends in a catch-all, so something always matched.
            Objects.requireNonNull(matched, "allocation chain produced no match");
            span.setAttribute("ruleCode", matched.getRuleCode());
            AllocationTrace trace = new AllocationTrace(
                    selection, List.copyOf(checks), matched.getRuleCode(), matched.getOutcome());
            span.setAttribute("rulesConsulted", trace.consultedCount());
            return trace;
        } finally {
            span.end();
        }
    }

    @Override
    public List<RuleDescriptor> rules() {
        return chain.describe();
    }

    public AllocationRuleChain getChain() {
        return chain;
    }
}
