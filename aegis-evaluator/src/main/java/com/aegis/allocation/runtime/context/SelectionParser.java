/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.runtime.context;

import com.aegis.allocation.api.exceptions.InvalidSelectionException;
import com.aegis.allocation.api.model.ClassificationSelection;
import com.aegis.allocation.api.model.SystemScope;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts a loosely typed intake payload (as decoded from JSON or a form)
 * into a {@link ClassificationSelection}.
 *
 * <p>This is the only place malformed input is detected. Field names are
 * matched ignoring case, underscores and hyphens, so {@code cdi_dfars},
 * {@code cdiDfars} and {@code CDI-DFARS} are the same field. Giving one field
 * under two spellings is rejected.
 *
 * <h2>Accepted values</h2>
 * <ul>
 *   <li>Flags: {@link Boolean}, or the strings {@code "true"}/{@code "false"} in any case.
 *       A missing or null flag is false.</li>
 *   <li>{@code system_scope}: {@code INTERNAL}, {@code EXTERNAL} or {@code UNSET} in any case.
 *       Missing or null is UNSET.</li>
 * </ul>
 * Anything else, including unknown field names, raises {@link InvalidSelectionException}.
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless and thread-safe.
 */
public final class SelectionParser {

    private static final String ALLOWED_SCOPES = Arrays.stream(SystemScope.values())
            .map(Enum::name)
            .collect(Collectors.joining(", "));

    public ClassificationSelection parse(Map<String, ?> payload) {
        if (payload == null) {
            throw new InvalidSelectionException(null, "Selection payload is required");
        }

        ClassificationSelection.Builder builder = ClassificationSelection.builder();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            String field = entry.getKey();
            if (field == null) {
                throw new InvalidSelectionException(null, "Selection field names must not be null");
            }
            Object value = entry.getValue();
            String key = normalize(field);
            if (!seen.add(key)) {
                throw new InvalidSelectionException(field, "Duplicate selection field: " + field);
            }

            switch (key) {
                case "cui" -> builder.cui(flag(field, value));
                case "cdidfars" -> builder.cdiDfars(flag(field, value));
                case "itar" -> builder.itar(flag(field, value));
                case "ear" -> builder.ear(flag(field, value));
                case "ear99plus" -> builder.ear99Plus(flag(field, value));
                case "publicdata" -> builder.publicData(flag(field, value));
                case "pilotshortduration" -> builder.pilotShortDuration(flag(field, value));
                case "systemscope" -> builder.systemScope(scope(field, value));
                case "competitionsensitive" -> builder.competitionSensitive(flag(field, value));
                case "proprietary" -> builder.proprietary(flag(field, value));
                case "pii" -> builder.pii(flag(field, value));
                default -> throw new InvalidSelectionException(field, "Unknown selection field: " + field);
            }
        }
        return builder.build();
    }

    private static String normalize(String field) {
        return field.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
    }

    private static boolean flag(String field, Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return true;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return false;
            }
        }
        throw new InvalidSelectionException(field,
                String.format("Field '%s' must be a boolean, got: %s", field, value));
    }

    private static SystemScope scope(String field, Object value) {
        if (value == null) {
            return SystemScope.UNSET;
        }
        if (value instanceof SystemScope s) {
            return s;
        }
        if (value instanceof String s) {
            try {
                return SystemScope.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidSelectionException(field,
                        String.format("Field '%s' must be one of %s, got: %s", field, ALLOWED_SCOPES, s), e);
            }
        }
        throw new InvalidSelectionException(field,
                String.format("Field '%s' must be one of %s, got: %s", field, ALLOWED_SCOPES, value));
    }
}
