/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.service.config;

import com.aegis.allocation.api.model.FeatureFlagState;
import com.aegis.allocation.api.model.TemplateBaseline;
import com.aegis.allocation.infra.config.FeatureFlagLoader;
import com.aegis.allocation.infra.management.AllocationEngine;
import com.aegis.allocation.infra.telemetry.TracingService;
import com.aegis.allocation.runtime.model.AllocationRuleChain;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

/**
 * CDI producers for allocation components.
 * Feature flags and the template are read from Quarkus configuration once, at startup.
 */
@ApplicationScoped
public class AllocationProducers {

    @ConfigProperty(name = FeatureFlagLoader.FAST_TRACK_ENABLED_PROPERTY, defaultValue = "false")
    boolean fastTrackEnabled;

    @ConfigProperty(name = FeatureFlagLoader.REQUIRED_FIELDS_PROPERTY)
    Optional<String> requiredFields;

    @Produces
    @Singleton
    public TracingService tracingService() {
        return TracingService.getInstance();
    }

    @Produces
    @ApplicationScoped
    public Tracer tracer(TracingService tracingService) {
        return tracingService.getTracer();
    }

    @Produces
    @Singleton
    public FeatureFlagState featureFlags() {
        return new FeatureFlagState(fastTrackEnabled);
    }

    /**
     * Produces the Fast-Track template.
     * Fails startup if the configured field list does not name exactly 8 distinct fields.
     */
    @Produces
    @Singleton
    public TemplateBaseline templateBaseline() {
        return FeatureFlagLoader.baselineFrom(requiredFields.orElse(null));
    }

    @Produces
    @Singleton
    public AllocationEngine allocationEngine(FeatureFlagState flags, TemplateBaseline baseline, Tracer tracer) {
        return new AllocationEngine(AllocationRuleChain.standard(), flags, baseline, tracer);
    }
}
