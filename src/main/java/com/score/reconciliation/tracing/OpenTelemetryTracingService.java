package com.score.reconciliation.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String SPAN_PREFIX = "reconciliation.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public StageSpan startStage(String stage, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(SPAN_PREFIX + stage);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelStageSpan(builder.startSpan());
    }

    private static final class OTelStageSpan implements StageSpan {

        private final Span span;

        OTelStageSpan(Span span) {
            this.span = span;
        }

        @Override
        public void setAttribute(String key, long value) {
            span.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, String value) {
            span.setAttribute(key, value);
        }

        @Override
        public void fail(Throwable cause) {
            span.recordException(cause);
            span.setStatus(StatusCode.ERROR);
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
