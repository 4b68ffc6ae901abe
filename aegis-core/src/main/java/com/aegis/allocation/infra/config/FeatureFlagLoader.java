/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.infra.config;

import com.aegis.allocation.api.model.FeatureFlagState;
import com.aegis.allocation.api.model.TemplateBaseline;

import java.util.List;
import java.util.logging.Logger;

/**
 * Loads the Fast-Track configuration of a standalone deployment.
 *
 * <ul>
 *   <li>{@code AEGIS_FAST_TRACK_ENABLED} / {@code aegis.fast-track.enabled}: toggle (default false)</li>
 *   <li>{@code AEGIS_FAST_TRACK_REQUIRED_FIELDS} / {@code aegis.fast-track.required-fields}:
 *       comma-separated list of the 8 template fields (default {@link TemplateBaseline#STANDARD_FIELDS})</li>
 * </ul>
 *
 * Both values are read once at startup; callers cannot change them afterwards.
 */
public final class FeatureFlagLoader {
    private static final Logger logger = Logger.getLogger(FeatureFlagLoader.class.getName());

    public static final String FAST_TRACK_ENABLED_ENV = "AEGIS_FAST_TRACK_ENABLED";
    public static final String FAST_TRACK_ENABLED_PROPERTY = "aegis.fast-track.enabled";
    public static final String REQUIRED_FIELDS_ENV = "AEGIS_FAST_TRACK_REQUIRED_FIELDS";
    public static final String REQUIRED_FIELDS_PROPERTY = "aegis.fast-track.required-fields";

    private FeatureFlagLoader() {
        throw new AssertionError("No instances");
    }

    public static FeatureFlagState loadFlags() {
        String raw = EnvironmentConfig.get(FAST_TRACK_ENABLED_ENV, FAST_TRACK_ENABLED_PROPERTY, "false");
        FeatureFlagState flags = new FeatureFlagState(parseToggle(raw));
        logger.info("Fast-Track " + (flags.fastTrackEnabled() ? "ENABLED" : "disabled"));
        return flags;
    }

    public static TemplateBaseline loadBaseline() {
        String raw = EnvironmentConfig.get(REQUIRED_FIELDS_ENV, REQUIRED_FIELDS_PROPERTY, null);
        TemplateBaseline baseline = baselineFrom(raw);
        logger.info("Fast-Track template fields: " + baseline.requiredFields());
        return baseline;
    }

    /**
     * Builds a template from a comma-separated field list; blank means the standard fields.
     *
     * @throws IllegalArgumentException if the list does not name exactly 8 distinct fields
     */
    public static TemplateBaseline baselineFrom(String commaSeparatedFields) {
        List<String> fields = EnvironmentConfig.splitList(commaSeparatedFields);
        return fields.isEmpty() ? TemplateBaseline.standard() : TemplateBaseline.withFields(fields);
    }

    /**
     * Accepts true, false (any case) or blank, which means false.
     */
    static boolean parseToggle(String raw) {
        String value = raw == null ? "" : raw.trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || value.isEmpty()) {
            return false;
        }
        throw new IllegalArgumentException(FAST_TRACK_ENABLED_PROPERTY + " must be true or false, got: " + raw);
    }
}
