package com.winmatch.infra.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty("OTEL_TRACE_SAMPLING_RATIO");
        System.clearProperty("OTEL_EXPORTER_TYPE");
    }

    @Test
    void disabledSettingsShouldYieldNoopTracer() {
        TracingService service = TracingService.create(
                new TracingService.Settings(true, "logging", "http://localhost:4317", 1.0, "test"));

        assertThat(service.isEnabled()).isFalse();
        Span span = service.getTracer().spanBuilder("noop").startSpan();
        assertThat(span.getSpanContext().isValid()).isFalse();
        span.end();
        service.shutdown();
    }

    @Test
    void loggingExporterShouldRecordSampledSpans() {
        TracingService service = TracingService.create(
                new TracingService.Settings(false, "logging", "http://localhost:4317", 1.0, "test"));
        try {
            assertThat(service.isEnabled()).isTrue();
            Span span = service.getTracer().spanBuilder("enumerate-windows").startSpan();
            assertThat(span.getSpanContext().isValid()).isTrue();
            assertThat(span.getSpanContext().isSampled()).isTrue();
            span.end();
        } finally {
            service.shutdown();
        }
    }

    @Test
    void settingsShouldClampRatioAndNormaliseExporter() {
        System.setProperty("OTEL_TRACE_SAMPLING_RATIO", "7.5");
        System.setProperty("OTEL_EXPORTER_TYPE", " OTLP ");

        TracingService.Settings settings = TracingService.Settings.fromEnvironment();

        assertThat(settings.samplingRatio()).isEqualTo(1.0);
        assertThat(settings.exporter()).isEqualTo("otlp");
    }

    @Test
    void invalidRatioShouldSampleEverything() {
        System.setProperty("OTEL_TRACE_SAMPLING_RATIO", "often");

        assertThat(TracingService.Settings.fromEnvironment().samplingRatio()).isEqualTo(1.0);
    }
}
