package com.starterkit.generator.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import java.util.Map;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Root spans take their parent from the caller's current context, so a generation started
 * inside a traced request joins that trace. Stage spans name their root explicitly and never
 * touch thread-local context, which keeps the pipe writer thread of a streamed generation in
 * the same trace.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_NAME = "com.starterkit.generator";
    static final String COMPONENT_ATTRIBUTE = "generator.component";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Uses the tracer of the globally registered OpenTelemetry SDK (a no-op tracer when none is registered).
     */
    public static OpenTelemetryTracingService fromGlobal() {
        return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return start(operationName, attributes, Context.current());
    }

    private Span start(String operationName, Map<String, String> attributes, Context parent) {
        SpanBuilder builder = tracer.spanBuilder(operationName)
                .setParent(parent)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(COMPONENT_ATTRIBUTE, stageOf(operationName));
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new GeneratorSpan(builder.startSpan(), parent);
    }

    // "generator.archive" -> "archive"
    private static String stageOf(String operationName) {
        int dot = operationName.lastIndexOf('.');
        return dot >= 0 ? operationName.substring(dot + 1) : operationName;
    }

    private final class GeneratorSpan implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;
        private final Context context;

        GeneratorSpan(io.opentelemetry.api.trace.Span otelSpan, Context parent) {
            this.otelSpan = otelSpan;
            this.context = parent.with(otelSpan);
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public Span startChild(String operationName, Map<String, String> attributes) {
            return start(operationName, attributes, context);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
