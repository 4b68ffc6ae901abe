package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Read-only view of one allocation rule, for intake surfaces that show users
 * how a selection will be resolved.
 */
public record RuleDescriptor(
    @JsonProperty("order") int order,
    @JsonProperty("rule_code") String ruleCode,
    @JsonProperty("description") String description,
    @JsonProperty("catch_all") boolean catchAll,
    @JsonProperty("outcome") ControlAllocationResult outcome
) implements Serializable {
}
