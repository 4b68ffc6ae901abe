/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.runtime.model;

import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.ControlAllocationResult;
import com.aegis.allocation.api.model.LoeLevel;
import com.aegis.allocation.api.model.RuleDescriptor;
import com.aegis.allocation.api.model.SystemScope;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered list of allocation rules. The first rule whose predicate
 * holds decides the result; rule order is the only tie-break.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Orders are strictly increasing and rule codes are unique.</li>
 *   <li>The last rule is a catch-all and no other rule is, so
 *       {@link #firstMatch} always returns a rule.</li>
 * </ul>
 *
 * <h2>Standard chain</h2>
 * <ol>
 *   <li>CUI: 110 controls, LOE DFARS</li>
 *   <li>CDI/DFARS, ITAR, EAR, EAR99+: 110, DFARS</li>
 *   <li>Public data: 38, B</li>
 *   <li>Short-duration pilot: 20, A</li>
 *   <li>Internal system with sensitive data: 56, C</li>
 *   <li>External system with sensitive data: 70, D</li>
 *   <li>Anything else: 20, A</li>
 * </ol>
 */
public final class AllocationRuleChain {

    public static final String CUI_OVERRIDE = "CUI_OVERRIDE";
    public static final String DFARS_COMPLIANCE = "DFARS_COMPLIANCE";
    public static final String PUBLIC_DATA = "PUBLIC_DATA";
    public static final String PILOT_SYSTEM = "PILOT_SYSTEM";
    public static final String INTERNAL_SENSITIVE = "INTERNAL_SENSITIVE";
    public static final String EXTERNAL_SENSITIVE = "EXTERNAL_SENSITIVE";
    public static final String DEFAULT_MINIMUM = "DEFAULT_MINIMUM";

    private static final AllocationRuleChain STANDARD = new AllocationRuleChain(List.of(
        AllocationRule.of(1, CUI_OVERRIDE,
            "CUI is present",
            ClassificationSelection::cui,
            ControlAllocationResult.of(LoeLevel.DFARS, "CUI Override - Highest Security Level")),
        AllocationRule.of(2, DFARS_COMPLIANCE,
            "CDI/DFARS, ITAR, EAR or EAR99+ data is present",
            ClassificationSelection::hasDfarsTrigger,
            ControlAllocationResult.of(LoeLevel.DFARS, "DFARS Compliance Required")),
        AllocationRule.of(3, PUBLIC_DATA,
            "Data is approved for public release",
            ClassificationSelection::publicData,
            ControlAllocationResult.of(LoeLevel.B, "LOE B - Public Data")),
        AllocationRule.of(4, PILOT_SYSTEM,
            "Short-duration pilot system",
            ClassificationSelection::pilotShortDuration,
            ControlAllocationResult.of(LoeLevel.A, "LOE A - ATC (Pilot System)")),
        AllocationRule.of(5, INTERNAL_SENSITIVE,
            "Internal system holding competition-sensitive, proprietary or PII data",
            selection -> selection.systemScope() == SystemScope.INTERNAL && selection.hasSensitiveData(),
            ControlAllocationResult.of(LoeLevel.C, "LOE C - Internal System (RTX Non-DFARS)")),
        AllocationRule.of(6, EXTERNAL_SENSITIVE,
            "External system holding competition-sensitive, proprietary or PII data",
            selection -> selection.systemScope() == SystemScope.EXTERNAL && selection.hasSensitiveData(),
            ControlAllocationResult.of(LoeLevel.D, "LOE D - External System (RTX Non-DFARS)")),
        AllocationRule.fallback(7, DEFAULT_MINIMUM,
            "No other rule applies",
            ControlAllocationResult.of(LoeLevel.A, "Default minimum controls"))
    ));

    private final List<AllocationRule> rules;

    public AllocationRuleChain(List<AllocationRule> rules) {
        Objects.requireNonNull(rules, "rules cannot be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("An allocation chain needs at least one rule");
        }

        Set<String> codes = new HashSet<>();
        int previousOrder = Integer.MIN_VALUE;
        for (int i = 0; i < rules.size(); i++) {
            AllocationRule rule = Objects.requireNonNull(rules.get(i), "rule cannot be null");
            if (rule.getOrder() <= previousOrder) {
                throw new IllegalArgumentException("Rule orders must be strictly increasing at " + rule);
            }
            if (!codes.add(rule.getRuleCode())) {
                throw new IllegalArgumentException("Duplicate rule code: " + rule.getRuleCode());
            }
            boolean last = i == rules.size() - 1;
            if (rule.isCatchAll() != last) {
                throw new IllegalArgumentException(last
                        ? "The last rule must be a catch-all, got " + rule
                        : "Only the last rule may be a catch-all, got " + rule);
            }
            previousOrder = rule.getOrder();
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * The allocation chain in force for classification intake.
     */
    public static AllocationRuleChain standard() {
        return STANDARD;
    }

    /**
     * Returns the first rule whose predicate holds. Never null.
     */
    public AllocationRule firstMatch(ClassificationSelection selection) {
        Objects.requireNonNull(selection, "selection cannot be null");
        for (AllocationRule rule : rules) {
            if (rule.matches(selection)) {
                return rule;
            }
        }
        // Unreachable: the constructor guarantees a trailing catch-all.
        throw new IllegalStateException("No allocation rule matched " + selection);
    }

    public List<AllocationRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public List<RuleDescriptor> describe() {
        return rules.stream()
                .map(AllocationRule::toDescriptor)
                .toList();
    }
}
