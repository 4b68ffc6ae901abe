/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.runtime.evaluation;

import com.aegis.allocation.api.IControlAllocator;
import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationPath;
import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.ControlAllocationResult;
import com.aegis.allocation.api.model.FeatureFlagState;
import com.aegis.allocation.api.model.IntakeSubmission;
import com.aegis.allocation.api.model.TemplateBaseline;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Optional pre-stage in front of the allocation rule chain.
 *
 * <p>A submission takes the Fast-Track path only when all of the following hold:
 * <ol>
 *   <li>the Fast-Track feature flag is on;</li>
 *   <li>the selection carries no high-risk flag (CUI, CDI/DFARS, ITAR, EAR, EAR99+);</li>
 *   <li>every field of the {@link TemplateBaseline} has a non-blank value.</li>
 * </ol>
 * It then receives the template's fixed result and the allocator is not called
 * at all; public, pilot, scope and sensitive-data flags are never looked at.
 * Every other submission is forwarded unchanged to the allocator.
 */
public final class FastTrackGate {
    private static final Logger logger = Logger.getLogger(FastTrackGate.class.getName());

    private final IControlAllocator allocator;
    private final TemplateBaseline baseline;
    private final Tracer tracer;

    public FastTrackGate(IControlAllocator allocator, TemplateBaseline baseline, Tracer tracer) {
        this.allocator = Objects.requireNonNull(allocator, "allocator cannot be null");
        this.baseline = Objects.requireNonNull(baseline, "baseline cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
    }

    /**
     * Returns true if the selection may use the pre-approved template at all.
     */
    public static boolean isEligible(ClassificationSelection selection) {
        return !selection.hasHighRiskFlag();
    }

    /**
     * Returns the path the submission will take under the given flags.
     */
    public AllocationPath pathFor(IntakeSubmission submission, FeatureFlagState flags) {
        Objects.requireNonNull(submission, "submission cannot be null");
        Objects.requireNonNull(flags, "flags cannot be null");

        if (flags.fastTrackEnabled()
                && isEligible(submission.selection())
                && baseline.isSatisfiedBy(submission.templateFields())) {
            return AllocationPath.FAST_TRACK;
        }
        return AllocationPath.RULE_CHAIN;
    }

    public ControlAllocationResult route(IntakeSubmission submission, FeatureFlagState flags) {
        Span span = tracer.spanBuilder("fast-track-route").startSpan();
        try (Scope scope = span.makeCurrent()) {
            AllocationPath path = pathFor(submission, flags);
            span.setAttribute("path", path.name());
            span.setAttribute("fastTrackEnabled", flags.fastTrackEnabled());

            if (path == AllocationPath.FAST_TRACK) {
                logger.fine("Fast-Track template baseline applied");
                return baseline.result();
            }
            if (flags.fastTrackEnabled() && logger.isLoggable(Level.FINE)) {
                logger.fine(isEligible(submission.selection())
                        ? "Fast-Track skipped, missing template fields: " + baseline.missingFields(submission.templateFields())
                        : "Fast-Track skipped, selection carries a high-risk flag");
            }
            return allocator.evaluate(submission.selection());
        } finally {
            span.end();
        }
    }

    /**
     * Routes a selection submitted without template fields. Such a submission
     * can never satisfy the template, so it always reaches the allocator.
     */
    public ControlAllocationResult route(ClassificationSelection selection, FeatureFlagState flags) {
        return route(IntakeSubmission.of(selection), flags);
    }

    /**
     * Routes the submission and wraps the result with its path and timing.
     */
    public AllocationDecision decide(String requestId, IntakeSubmission submission, FeatureFlagState flags) {
        long start = System.nanoTime();
        AllocationPath path = pathFor(submission, flags);
        ControlAllocationResult result = route(submission, flags);
        long elapsed = System.nanoTime() - start;
        return new AllocationDecision(requestId, result, path, System.currentTimeMillis(), elapsed);
    }

    public TemplateBaseline getBaseline() {
        return baseline;
    }
}
