package com.aegis.allocation.infra.telemetry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @Test
    @DisplayName("Noop service records nothing and shuts down quietly")
    void noopShouldBeDisabled() {
        TracingService service = TracingService.noop();

        assertThat(service.isEnabled()).isFalse();
        assertThat(service.getTracer()).isNotNull();
        service.shutdown();
    }

    @Test
    @DisplayName("OTEL_DISABLED yields the noop singleton")
    void shouldHonourDisabledFlag() {
        // Set by the build for every test run.
        assertThat(System.getProperty("OTEL_DISABLED")).isEqualTo("true");
        assertThat(TracingService.getInstance().isEnabled()).isFalse();
        assertThat(TracingService.getInstance()).isSameAs(TracingService.getInstance());
    }

    @Test
    @DisplayName("Sampling ratio defaults by environment and is clamped")
    void shouldResolveSamplingRatio() {
        assertThat(TracingConfig.samplingRatioOf(null, "prod")).isEqualTo(0.1);
        assertThat(TracingConfig.samplingRatioOf("", "staging")).isEqualTo(0.5);
        assertThat(TracingConfig.samplingRatioOf("abc", "dev")).isEqualTo(1.0);
        assertThat(TracingConfig.samplingRatioOf("0.25", "prod")).isEqualTo(0.25);

        TracingConfig config = new TracingConfig(true, TracingConfig.ExporterType.LOGGING,
                TracingConfig.DEFAULT_OTLP_ENDPOINT, 7.0, "svc", "1", "dev");
        assertThat(config.samplingRatio()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Unknown exporter names fall back to logging")
    void shouldParseExporterType() {
        assertThat(TracingConfig.exporterOf("OTLP")).isEqualTo(TracingConfig.ExporterType.OTLP);
        assertThat(TracingConfig.exporterOf("zipkin")).isEqualTo(TracingConfig.ExporterType.LOGGING);
    }

    @Test
    @DisplayName("Enabled service exports through the SDK and shuts down")
    void shouldCreateEnabledService() {
        TracingService service = TracingService.create(new TracingConfig(false, TracingConfig.ExporterType.LOGGING,
                TracingConfig.DEFAULT_OTLP_ENDPOINT, 1.0, "svc", "1", "dev"));

        assertThat(service.isEnabled()).isTrue();
        service.getTracer().spanBuilder("test-span").startSpan().end();
        service.shutdown();
    }
}
