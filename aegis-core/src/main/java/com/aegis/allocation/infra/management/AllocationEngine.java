/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.infra.management;

import com.aegis.allocation.api.exceptions.InvalidSelectionException;
import com.aegis.allocation.api.model.AllocationDecision;
import com.aegis.allocation.api.model.AllocationRequest;
import com.aegis.allocation.api.model.AllocationTrace;
import com.aegis.allocation.api.model.BatchAllocationResult;
import com.aegis.allocation.api.model.BatchStats;
import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.FeatureFlagState;
import com.aegis.allocation.api.model.IntakeSubmission;
import com.aegis.allocation.api.model.LoeLevel;
import com.aegis.allocation.api.model.RuleDescriptor;
import com.aegis.allocation.api.model.TemplateBaseline;
import com.aegis.allocation.infra.config.FeatureFlagLoader;
import com.aegis.allocation.infra.metrics.AllocationMetrics;
import com.aegis.allocation.runtime.context.SelectionParser;
import com.aegis.allocation.runtime.evaluation.ControlAllocationEvaluator;
import com.aegis.allocation.runtime.evaluation.FastTrackGate;
import com.aegis.allocation.runtime.model.AllocationRuleChain;
import io.opentelemetry.api.trace.Tracer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Single entry point for every allocation surface (standalone HTTP server,
 * REST service, embedding applications).
 *
 * <p>Owns the immutable pieces assembled at startup (rule chain, evaluator,
 * Fast-Track gate, template baseline, feature flags) and the shared metrics.
 * Requests are parsed at this boundary; an {@link InvalidSelectionException}
 * never reaches the evaluator.
 */
public class AllocationEngine {
    private static final Logger logger = Logger.getLogger(AllocationEngine.class.getName());

    private final ControlAllocationEvaluator evaluator;
    private final FastTrackGate gate;
    private final FeatureFlagState flags;
    private final SelectionParser parser = new SelectionParser();
    private final AllocationMetrics metrics = new AllocationMetrics();

    public AllocationEngine(AllocationRuleChain chain, FeatureFlagState flags,
                            TemplateBaseline baseline, Tracer tracer) {
        this.flags = Objects.requireNonNull(flags, "flags cannot be null");
        this.evaluator = new ControlAllocationEvaluator(chain, tracer);
        this.gate = new FastTrackGate(evaluator, baseline, tracer);
        logger.info(String.format("Allocation engine ready: %d rules, fast-track=%s, template fields=%s",
                chain.size(), flags.fastTrackEnabled(), baseline.requiredFields()));
    }

    /**
     * Engine over the standard chain, configured from the environment.
     */
    public static AllocationEngine fromEnvironment(Tracer tracer) {
        return new AllocationEngine(AllocationRuleChain.standard(),
                FeatureFlagLoader.loadFlags(), FeatureFlagLoader.loadBaseline(), tracer);
    }

    /**
     * Parses, routes and records one allocation request.
     *
     * @throws InvalidSelectionException if the request or its selection is malformed
     */
    public AllocationDecision allocate(AllocationRequest request) {
        if (request == null) {
            metrics.recordRejectedSelection();
            throw new InvalidSelectionException(null, "Allocation request is required");
        }
        IntakeSubmission submission = new IntakeSubmission(parse(request.selection()), request.templateFields());
        AllocationDecision decision = gate.decide(requestIdOf(request), submission, flags);
        metrics.recordDecision(decision);
        return decision;
    }

    /**
     * Allocates every request in order. The whole batch is rejected if any
     * request is malformed; the message names the offending index.
     */
    public BatchAllocationResult allocateBatch(List<AllocationRequest> requests) {
        if (requests == null) {
            metrics.recordRejectedSelection();
            throw new InvalidSelectionException(null, "Batch request body is required");
        }

        List<IntakeSubmission> submissions = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            AllocationRequest request = requests.get(i);
            try {
                if (request == null) {
                    throw new InvalidSelectionException(null, "Allocation request is required");
                }
                submissions.add(new IntakeSubmission(parser.parse(request.selection()), request.templateFields()));
            } catch (InvalidSelectionException e) {
                metrics.recordRejectedSelection();
                throw new InvalidSelectionException(e.getField(), "requests[" + i + "]: " + e.getMessage(), e);
            }
        }

        List<AllocationDecision> decisions = new ArrayList<>(submissions.size());
        for (int i = 0; i < submissions.size(); i++) {
            AllocationDecision decision = gate.decide(requestIdOf(requests.get(i)), submissions.get(i), flags);
            metrics.recordDecision(decision);
            decisions.add(decision);
        }
        return new BatchAllocationResult(List.copyOf(decisions), statsOf(decisions));
    }

    /**
     * Explains how the full rule chain resolves a selection. The Fast-Track
     * gate is not consulted.
     */
    public AllocationTrace explain(Map<String, ?> selection) {
        return evaluator.explain(parse(selection));
    }

    public List<RuleDescriptor> rules() {
        return evaluator.rules();
    }

    /**
     * The ordered rules together with the Fast-Track template that precedes them.
     */
    public Map<String, Object> ruleCatalog() {
        Map<String, Object> fastTrack = new LinkedHashMap<>();
        fastTrack.put("enabled", flags.fastTrackEnabled());
        fastTrack.put("baseline", getBaseline());

        Map<String, Object> catalog = new LinkedHashMap<>();
        catalog.put("rules", rules());
        catalog.put("fast_track", fastTrack);
        return catalog;
    }

    /**
     * Service description for the root endpoint.
     */
    public Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("message", "Aegis Control Allocator");
        info.put("version", versionOf());
        info.put("fast_track_enabled", flags.fastTrackEnabled());
        info.put("rule_count", evaluator.getChain().size());
        info.put("endpoints", List.of(
                "POST /allocate: allocate security controls for a classification selection",
                "POST /allocate/batch: allocate several selections with aggregated statistics",
                "POST /allocate/explain: rule-by-rule trace for a selection",
                "GET /rules: the ordered allocation rules and the Fast-Track template",
                "GET /monitoring/metrics: allocation metrics"));
        return info;
    }

    public boolean isReady() {
        return evaluator.getChain().size() > 0;
    }

    public ControlAllocationEvaluator getEvaluator() {
        return evaluator;
    }

    public FastTrackGate getGate() {
        return gate;
    }

    public TemplateBaseline getBaseline() {
        return gate.getBaseline();
    }

    public FeatureFlagState getFlags() {
        return flags;
    }

    public AllocationMetrics getMetrics() {
        return metrics;
    }

    private ClassificationSelection parse(Map<String, ?> selection) {
        try {
            return parser.parse(selection);
        } catch (InvalidSelectionException e) {
            metrics.recordRejectedSelection();
            logger.fine(() -> "Rejected selection: " + e.getMessage());
            throw e;
        }
    }

    private static String requestIdOf(AllocationRequest request) {
        String requestId = request.requestId();
        return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }

    private static BatchStats statsOf(List<AllocationDecision> decisions) {
        if (decisions.isEmpty()) {
            return BatchStats.empty();
        }

        Map<LoeLevel, Integer> byLevel = new EnumMap<>(LoeLevel.class);
        int fastTracked = 0;
        long totalControls = 0;
        long totalTime = 0;
        long minTime = Long.MAX_VALUE;
        long maxTime = Long.MIN_VALUE;

        for (AllocationDecision decision : decisions) {
            byLevel.merge(decision.result().loeLevel(), 1, Integer::sum);
            if (decision.fastTracked()) {
                fastTracked++;
            }
            totalControls += decision.result().controlCount();
            long time = decision.processingTimeNanos();
            totalTime += time;
            minTime = Math.min(minTime, time);
            maxTime = Math.max(maxTime, time);
        }

        return new BatchStats(decisions.size(), fastTracked, byLevel, totalControls,
                totalTime / decisions.size(), minTime, maxTime);
    }

    private static String versionOf() {
        String version = AllocationEngine.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
