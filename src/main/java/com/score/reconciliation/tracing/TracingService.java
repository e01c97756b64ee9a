package com.score.reconciliation.tracing;

import java.util.Map;

/**
 * Opens trace spans for pipeline stages.
 * {@link NoOpTracingService} is the default; {@link OpenTelemetryTracingService}
 * reports to an OpenTelemetry tracer.
 */
public interface TracingService {

    /**
     * Starts a span named {@code reconciliation.<stage>} carrying the given attributes.
     */
    StageSpan startStage(String stage, Map<String, String> attributes);
}
