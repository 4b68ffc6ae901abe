package com.aegis.allocation.service.health;

import com.aegis.allocation.infra.management.AllocationEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready once the rule chain is loaded.
 */
@Readiness
@ApplicationScoped
public class AllocationHealthCheck implements HealthCheck {

    @Inject
    AllocationEngine engine;

    @Override
    public HealthCheckResponse call() {
        if (!engine.isReady()) {
            return HealthCheckResponse.builder()
                    .name("control-allocator")
                    .down()
                    .withData("reason", "Allocation rule chain not loaded")
                    .build();
        }
        return HealthCheckResponse.builder()
                .name("control-allocator")
                .up()
                .withData("numRules", (long) engine.rules().size())
                .withData("fastTrackEnabled", engine.getFlags().fastTrackEnabled())
                .build();
    }
}
