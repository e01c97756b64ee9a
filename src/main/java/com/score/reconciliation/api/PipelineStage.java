package com.score.reconciliation.api;

/**
 * Stages of a reconciliation run, used for logging, tracing and metrics.
 */
public enum PipelineStage {
    RESOLVE("resolve"),
    AGGREGATE("aggregate"),
    JOIN("join");

    private final String stageName;

    PipelineStage(String stageName) {
        this.stageName = stageName;
    }

    public String stageName() {
        return stageName;
    }
}
