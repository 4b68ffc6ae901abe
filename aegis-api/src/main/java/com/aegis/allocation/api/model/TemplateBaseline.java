/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pre-approved Fast-Track template: the fixed set of intake fields a
 * submission must fill in, and the result it receives when it does.
 *
 * <p>A template always names exactly {@value #REQUIRED_FIELD_COUNT} distinct,
 * non-blank fields. Which fields those are is deployment configuration;
 * {@link #standard()} provides the default set.
 */
public record TemplateBaseline(
    @JsonProperty("required_fields") List<String> requiredFields,
    @JsonProperty("result") ControlAllocationResult result
) implements Serializable {

    public static final int REQUIRED_FIELD_COUNT = 8;

    public static final List<String> STANDARD_FIELDS = List.of(
        "system_name",
        "system_owner",
        "business_unit",
        "program_name",
        "hosting_environment",
        "data_description",
        "user_population",
        "intended_use_duration"
    );

    public static final ControlAllocationResult BASELINE_RESULT = ControlAllocationResult.of(
        LoeLevel.A, "Fast-Track Template Baseline - Pre-approved Minimum Controls");

    public TemplateBaseline {
        Objects.requireNonNull(requiredFields, "requiredFields cannot be null");
        Objects.requireNonNull(result, "result cannot be null");

        Set<String> distinct = new LinkedHashSet<>();
        for (String field : requiredFields) {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("Template field names must not be blank");
            }
            distinct.add(field.trim());
        }
        if (distinct.size() != requiredFields.size()) {
            throw new IllegalArgumentException("Template field names must be distinct: " + requiredFields);
        }
        if (distinct.size() != REQUIRED_FIELD_COUNT) {
            throw new IllegalArgumentException(String.format(
                "A Fast-Track template requires exactly %d fields, got %d",
                REQUIRED_FIELD_COUNT, distinct.size()));
        }
        requiredFields = List.copyOf(distinct);
    }

    /**
     * The default template with the standard field set and the minimum baseline result.
     */
    public static TemplateBaseline standard() {
        return new TemplateBaseline(STANDARD_FIELDS, BASELINE_RESULT);
    }

    /**
     * A template over custom fields with the minimum baseline result.
     */
    public static TemplateBaseline withFields(List<String> requiredFields) {
        return new TemplateBaseline(requiredFields, BASELINE_RESULT);
    }

    /**
     * Returns true if every required field has a non-blank value.
     */
    public boolean isSatisfiedBy(Map<String, String> fieldValues) {
        return missingFields(fieldValues).isEmpty();
    }

    /**
     * Returns the required fields that are absent or blank, in template order.
     */
    public List<String> missingFields(Map<String, String> fieldValues) {
        if (fieldValues == null || fieldValues.isEmpty()) {
            return requiredFields;
        }
        return requiredFields.stream()
            .filter(field -> {
                String value = fieldValues.get(field);
                return value == null || value.isBlank();
            })
            .toList();
    }
}
