package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A classification selection together with the Fast-Track template field
 * values the intake surface collected, if any.
 *
 * @param selection      the classification flags (must not be null)
 * @param templateFields template field name to value; empty when the intake
 *                       did not use the Fast-Track template. Null names and
 *                       null values are dropped, so a null value reads as missing.
 */
public record IntakeSubmission(
    @JsonProperty("selection") ClassificationSelection selection,
    @JsonProperty("template_fields") Map<String, String> templateFields
) implements Serializable {

    public IntakeSubmission {
        Objects.requireNonNull(selection, "selection cannot be null");
        templateFields = templateFields == null ? Map.of() : presentFields(templateFields);
    }

    private static Map<String, String> presentFields(Map<String, String> fields) {
        return fields.entrySet().stream()
            .filter(e -> e.getKey() != null && e.getValue() != null)
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static IntakeSubmission of(ClassificationSelection selection) {
        return new IntakeSubmission(selection, Map.of());
    }
}
