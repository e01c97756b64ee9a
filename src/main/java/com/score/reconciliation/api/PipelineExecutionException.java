package com.score.reconciliation.api;

/**
 * Runtime exception thrown when a parallel pipeline run fails, times out or
 * is interrupted. Data-quality problems never end up here.
 */
public class PipelineExecutionException extends RuntimeException {

    public PipelineExecutionException(String message) {
        super(message);
    }

    public PipelineExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
