package com.score.reconciliation.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent datasets through one {@link ReconciliationPipeline} on a
 * fixed thread pool. Runs share no state, so no coordination is needed
 * beyond waiting for all of them.
 */
public class ParallelReconciliationRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ParallelReconciliationRunner.class);

    private final ReconciliationPipeline pipeline;
    private final ExecutorService executor;
    private final long timeoutMs;

    ParallelReconciliationRunner(ReconciliationPipeline pipeline, PipelineOptions options) {
        this.pipeline = pipeline;
        this.timeoutMs = options.getTimeout().toMillis();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(options.getParallelism(), r -> {
            Thread thread = new Thread(r, "reconcile-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs one dataset asynchronously; the future fails with a
     * {@link TimeoutException} once the configured timeout elapses.
     */
    public CompletableFuture<PipelineResult> runAsync(PipelineInput input) {
        return CompletableFuture.supplyAsync(() -> pipeline.run(input), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs all datasets and returns their results in input order.
     * The first failing run cancels the others.
     *
     * @throws PipelineExecutionException if any run fails or the overall timeout elapses
     */
    public List<PipelineResult> runAll(List<PipelineInput> inputs) {
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        List<CompletableFuture<PipelineResult>> futures = inputs.stream()
                .map(input -> CompletableFuture.supplyAsync(() -> pipeline.run(input), executor))
                .toList();
        futures.forEach(f -> f.whenComplete((result, error) -> {
            if (error != null) {
                firstFailure.completeExceptionally(error);
            }
        }));
        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])), firstFailure)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new PipelineExecutionException("Pipeline runs did not finish within " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            log.warn("pipeline.parallel.failed runs={} error={}", futures.size(), e.getCause().getMessage());
            throw new PipelineExecutionException("Pipeline run failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new PipelineExecutionException("Interrupted while waiting for pipeline runs", e);
        }
        log.info("pipeline.parallel.completed runs={}", futures.size());
        return futures.stream().map(CompletableFuture::join).toList();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void cancelAll(List<CompletableFuture<PipelineResult>> futures) {
        futures.forEach(f -> f.cancel(true));
    }
}
