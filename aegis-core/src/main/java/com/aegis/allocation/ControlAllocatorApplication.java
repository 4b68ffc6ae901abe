/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation;

import com.aegis.allocation.infra.config.EnvironmentConfig;
import com.aegis.allocation.infra.management.AllocationEngine;
import com.aegis.allocation.infra.server.HttpServer;
import com.aegis.allocation.infra.telemetry.TracingService;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Standalone entry point: builds the allocation engine from the environment
 * and serves it over {@link HttpServer}.
 *
 * <p>Port: {@code AEGIS_SERVER_PORT} or {@code -Dserver.port} (default 8080).
 */
public class ControlAllocatorApplication {
    private static final Logger logger = Logger.getLogger(ControlAllocatorApplication.class.getName());

    static final int DEFAULT_PORT = 8080;

    private HttpServer httpServer;
    private TracingService tracingService;

    public static void main(String[] args) {
        configureLogging();
        try {
            ControlAllocatorApplication app = new ControlAllocatorApplication();
            app.start();
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "allocator-shutdown-hook"));
            Thread.currentThread().join();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Application failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private void start() throws IOException {
        logger.info("Starting Aegis Control Allocator");
        tracingService = TracingService.getInstance();
        int port = EnvironmentConfig.getInt("AEGIS_SERVER_PORT", "server.port", DEFAULT_PORT);

        AllocationEngine engine = AllocationEngine.fromEnvironment(tracingService.getTracer());
        httpServer = new HttpServer(port, engine, tracingService.getTracer());
        httpServer.start();
        logger.info("Control allocator is ready to serve requests on port " + httpServer.getPort());
    }

    private void shutdown() {
        if (httpServer != null) httpServer.stop(1);
        if (tracingService != null) tracingService.shutdown();
        logger.info("Control allocator shutdown complete");
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream config = ControlAllocatorApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }
}
