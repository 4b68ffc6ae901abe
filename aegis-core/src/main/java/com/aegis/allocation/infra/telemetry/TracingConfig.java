/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.infra.telemetry;

import com.aegis.allocation.infra.config.EnvironmentConfig;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Tracing settings, read once from the environment (or system properties of the same name).
 *
 * <ul>
 *   <li>{@code OTEL_DISABLED}: turn tracing off entirely (default false)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code otlp} or {@code logging} (default logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: collector address (default http://localhost:4317)</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0 to 1.0; defaults to 0.1 in prod, 0.5 in staging, else 1.0</li>
 *   <li>{@code SERVICE_NAME} / {@code OTEL_SERVICE_NAME}, {@code SERVICE_VERSION}, {@code DEPLOYMENT_ENVIRONMENT}</li>
 * </ul>
 */
public record TracingConfig(
    boolean disabled,
    ExporterType exporter,
    String otlpEndpoint,
    double samplingRatio,
    String serviceName,
    String serviceVersion,
    String environment
) {
    private static final Logger logger = Logger.getLogger(TracingConfig.class.getName());

    public static final String DEFAULT_SERVICE_NAME = "aegis-control-allocator";
    public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    public enum ExporterType {
        OTLP,
        LOGGING
    }

    public TracingConfig {
        samplingRatio = Math.max(0.0, Math.min(1.0, samplingRatio));
    }

    public static TracingConfig fromEnvironment() {
        String environment = EnvironmentConfig.get("DEPLOYMENT_ENVIRONMENT", "dev");
        return new TracingConfig(
                EnvironmentConfig.getBoolean("OTEL_DISABLED", false),
                exporterOf(EnvironmentConfig.get("OTEL_EXPORTER_TYPE", "logging")),
                EnvironmentConfig.get("OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_OTLP_ENDPOINT),
                samplingRatioOf(EnvironmentConfig.get("OTEL_TRACE_SAMPLING_RATIO", null), environment),
                EnvironmentConfig.get("SERVICE_NAME", EnvironmentConfig.get("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME)),
                EnvironmentConfig.get("SERVICE_VERSION", EnvironmentConfig.get("OTEL_SERVICE_VERSION", "unknown")),
                environment);
    }

    static ExporterType exporterOf(String value) {
        try {
            return ExporterType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown OTEL_EXPORTER_TYPE '" + value + "', using logging");
            return ExporterType.LOGGING;
        }
    }

    static double samplingRatioOf(String value, String environment) {
        if (value != null && !value.isBlank()) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO '" + value + "', using the environment default");
            }
        }
        return switch (environment.toLowerCase(Locale.ROOT)) {
            case "prod", "production" -> 0.1;
            case "staging" -> 0.5;
            default -> 1.0;
        };
    }
}
