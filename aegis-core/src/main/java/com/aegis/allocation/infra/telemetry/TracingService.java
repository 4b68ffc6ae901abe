/*
 * Copyright (c) 2025 Aegis Control Allocator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.allocation.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the OpenTelemetry SDK for the allocator process.
 *
 * <p>The standalone server and the Quarkus producers share one instance via
 * {@link #getInstance()}. The SDK is built locally and never registered as the
 * global OpenTelemetry, so tests and embedding applications keep their own.
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.aegis.control-allocator";

    private static volatile TracingService instance;

    private final OpenTelemetry openTelemetry;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracerProvider = tracerProvider;
    }

    /**
     * Process-wide service configured from the environment on first use.
     */
    public static TracingService getInstance() {
        TracingService service = instance;
        if (service == null) {
            synchronized (TracingService.class) {
                service = instance;
                if (service == null) {
                    service = create(TracingConfig.fromEnvironment());
                    instance = service;
                }
            }
        }
        return service;
    }

    /**
     * A service that records nothing.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    /**
     * Builds a service from explicit settings. Falls back to {@link #noop()} if
     * tracing is disabled or the exporter cannot be created.
     */
    public static TracingService create(TracingConfig config) {
        if (config.disabled()) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return noop();
        }

        try {
            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(resourceOf(config))
                    .setSampler(Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(config.samplingRatio())).build())
                    .addSpanProcessor(BatchSpanProcessor.builder(exporterOf(config))
                            .setMaxQueueSize(2048)
                            .setMaxExportBatchSize(256)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(provider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s, version=%s, env=%s, exporter=%s, ratio=%.2f",
                    config.serviceName(), config.serviceVersion(), config.environment(),
                    config.exporter(), config.samplingRatio()));

            TracingService service = new TracingService(sdk, provider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "otel-shutdown-hook"));
            return service;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry, falling back to noop", e);
            return noop();
        }
    }

    private static Resource resourceOf(TracingConfig config) {
        return Resource.getDefault().merge(Resource.create(Attributes.of(
                AttributeKey.stringKey("service.name"), config.serviceName(),
                AttributeKey.stringKey("service.version"), config.serviceVersion(),
                AttributeKey.stringKey("deployment.environment"), config.environment())));
    }

    private static SpanExporter exporterOf(TracingConfig config) {
        if (config.exporter() == TracingConfig.ExporterType.OTLP) {
            logger.info("Using OTLP exporter: " + config.otlpEndpoint());
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(config.otlpEndpoint())
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        return LoggingSpanExporter.create();
    }

    /**
     * Flushes buffered spans, waiting up to 30 seconds.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        logger.info("OpenTelemetry shutdown complete");
    }

    public Tracer getTracer() {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }
}
