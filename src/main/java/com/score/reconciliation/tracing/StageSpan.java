package com.score.reconciliation.tracing;

/**
 * Trace span around one pipeline stage. Ended by {@link #close()}, so it
 * fits a try-with-resources block.
 */
public interface StageSpan extends AutoCloseable {

    void setAttribute(String key, long value);

    void setAttribute(String key, String value);

    /**
     * Marks the stage as failed and attaches the cause.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
