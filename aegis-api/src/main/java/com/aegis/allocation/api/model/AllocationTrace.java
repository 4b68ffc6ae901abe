/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Rule-by-rule record of how a selection was resolved.
 *
 * <p>Rules are listed in chain order. Exactly one rule is {@link RuleStatus#MATCHED};
 * every rule before it is {@link RuleStatus#NOT_MATCHED} and every rule after it is
 * {@link RuleStatus#SKIPPED}, because a rule is never consulted once an earlier one
 * has matched.
 *
 * <h2>Usage</h2>
 * <pre>
 * AllocationTrace trace = allocator.explain(selection);
 * System.out.println(trace.toDetailedString());
 * </pre>
 */
public record AllocationTrace(
    @JsonProperty("selection") ClassificationSelection selection,
    @JsonProperty("rule_checks") List<RuleCheck> ruleChecks,
    @JsonProperty("matched_rule_code") String matchedRuleCode,
    @JsonProperty("result") ControlAllocationResult result
) implements Serializable {

    public enum RuleStatus {
        MATCHED,
        NOT_MATCHED,
        SKIPPED
    }

    /**
     * Outcome of one rule for this selection.
     */
    public record RuleCheck(
        @JsonProperty("order") int order,
        @JsonProperty("rule_code") String ruleCode,
        @JsonProperty("description") String description,
        @JsonProperty("status") RuleStatus status
    ) implements Serializable {

        /**
         * Returns a human-readable description of this check.
         */
        public String describe() {
            return switch (status) {
                case MATCHED -> String.format("✓ %d. %s - %s", order, ruleCode, description);
                case NOT_MATCHED -> String.format("✗ %d. %s - %s", order, ruleCode, description);
                case SKIPPED -> String.format("- %d. %s (not consulted)", order, ruleCode);
            };
        }
    }

    /**
     * Returns the number of rules actually consulted, including the match.
     */
    public long consultedCount() {
        return ruleChecks.stream()
            .filter(check -> check.status() != RuleStatus.SKIPPED)
            .count();
    }

    /**
     * Returns a detailed text explanation.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Matched rule: %s\n", matchedRuleCode));
        sb.append(String.format("Result: %d controls (LOE %s) - %s\n\n",
            result.controlCount(), result.loeLevel(), result.reason()));
        sb.append(String.format("Rules (%d of %d consulted):\n", consultedCount(), ruleChecks.size()));
        for (RuleCheck check : ruleChecks) {
            sb.append("  ").append(check.describe()).append("\n");
        }
        return sb.toString();
    }
}
