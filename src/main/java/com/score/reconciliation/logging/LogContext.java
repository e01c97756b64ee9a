package com.score.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for pipeline logging.
 * Keys added through this context are removed again on {@link #close()}.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, "judges-4r")) {
 *     log.info("pipeline.completed canonical={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one pipeline run over one dataset.
     */
    public static LogContext forRun(String runId, String label) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("label", label);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Context for a single stage, optionally scoped to one source.
     */
    public static LogContext forStage(String stage, String source) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage);
        if (source != null) {
            ctx.put("source", source);
        }
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
