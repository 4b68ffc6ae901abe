package com.aegis.allocation.service.lifecycle;

import com.aegis.allocation.infra.management.AllocationEngine;
import com.aegis.allocation.infra.telemetry.TracingService;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import java.util.logging.Logger;

/**
 * Startup and shutdown hooks for the allocator.
 */
@ApplicationScoped
public class AllocatorLifecycle {

    private static final Logger logger = Logger.getLogger(AllocatorLifecycle.class.getName());

    @Inject
    AllocationEngine engine;

    @Inject
    TracingService tracingService;

    /**
     * Builds the engine eagerly so a bad template configuration fails startup
     * rather than the first request.
     */
    void onStart(@Observes StartupEvent event) {
        logger.info("Starting Aegis Control Allocator with Quarkus");
        logger.info(String.format("Control allocator is ready: %d rules, fast-track=%s",
                engine.rules().size(), engine.getFlags().fastTrackEnabled()));
    }

    void onStop(@Observes ShutdownEvent event) {
        logger.info("Shutting down control allocator");
        tracingService.shutdown();
        logger.info("Control allocator shutdown complete");
    }
}
