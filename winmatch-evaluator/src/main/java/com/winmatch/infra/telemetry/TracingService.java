package com.winmatch.infra.telemetry;

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
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide OpenTelemetry tracer for window enumeration and definition loading.
 *
 * Configuration via environment variables (or system properties):
 * - OTEL_DISABLED: no-op tracer when true (default: false)
 * - OTEL_EXPORTER_TYPE: logging|otlp (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP gRPC endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0, clamped (default: 1.0)
 * - SERVICE_NAME: service.name resource attribute (default: winmatch)
 *
 * Any failure while building the SDK degrades to the no-op tracer; matching
 * never depends on tracing being available.
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    static final String INSTRUMENTATION_NAME = "com.winmatch";

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final Tracer tracer;
    private final SdkTracerProvider provider;

    private TracingService(Tracer tracer, SdkTracerProvider provider) {
        this.tracer = tracer;
        this.provider = provider;
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = create(Settings.fromEnvironment());
                    if (instance.isEnabled()) {
                        Runtime.getRuntime().addShutdownHook(
                                new Thread(instance::shutdown, "winmatch-tracing-shutdown"));
                    }
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Builds a tracing service from explicit settings. Callers other than
     * {@link #getInstance()} own the result and must {@link #shutdown()} it.
     */
    static TracingService create(Settings settings) {
        if (settings.disabled()) {
            logger.info("Tracing disabled, using no-op tracer");
            return noop();
        }
        try {
            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(Resource.getDefault().merge(Resource.create(Attributes.of(
                            AttributeKey.stringKey("service.name"), settings.serviceName()))))
                    .setSampler(Sampler.parentBasedBuilder(
                            Sampler.traceIdRatioBased(settings.samplingRatio())).build())
                    .addSpanProcessor(BatchSpanProcessor.builder(exporterFor(settings))
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(provider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("Tracing enabled: exporter=%s, samplingRatio=%.2f, service=%s",
                    settings.exporter(), settings.samplingRatio(), settings.serviceName()));
            return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME), provider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Tracing setup failed, using no-op tracer", e);
            return noop();
        }
    }

    private static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    private static SpanExporter exporterFor(Settings settings) {
        if ("otlp".equals(settings.exporter())) {
            logger.info("Exporting spans over OTLP to " + settings.endpoint());
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(settings.endpoint())
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(settings.exporter())) {
            logger.warning("Unknown OTEL_EXPORTER_TYPE '" + settings.exporter() + "', logging spans instead");
        }
        return LoggingSpanExporter.create();
    }

    /**
     * Flushes and stops the span pipeline. Does nothing for the no-op tracer.
     */
    public void shutdown() {
        if (provider == null) {
            return;
        }
        try {
            provider.shutdown().join(30, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Tracing shutdown failed", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return provider != null;
    }

    /**
     * Tracing settings as read from the environment.
     */
    record Settings(boolean disabled, String exporter, String endpoint, double samplingRatio, String serviceName) {

        static Settings fromEnvironment() {
            return new Settings(
                    Boolean.parseBoolean(read("OTEL_DISABLED", "false")),
                    read("OTEL_EXPORTER_TYPE", "logging").trim().toLowerCase(Locale.ROOT),
                    read("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317"),
                    parseRatio(read("OTEL_TRACE_SAMPLING_RATIO", "1.0")),
                    read("SERVICE_NAME", "winmatch"));
        }

        private static double parseRatio(String raw) {
            try {
                return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
            } catch (NumberFormatException e) {
                logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO '" + raw + "', sampling everything");
                return 1.0;
            }
        }

        private static String read(String key, String fallback) {
            String value = System.getenv(key);
            if (value == null || value.isEmpty()) {
                value = System.getProperty(key, fallback);
            }
            return value;
        }
    }
}
