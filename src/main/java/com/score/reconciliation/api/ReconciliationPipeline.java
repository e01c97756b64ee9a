package com.score.reconciliation.api;

import com.score.reconciliation.aggregate.AggregationResult;
import com.score.reconciliation.aggregate.ExclusionCounts;
import com.score.reconciliation.aggregate.ScoreAggregator;
import com.score.reconciliation.core.model.CanonicalMapping;
import com.score.reconciliation.join.CrossReferenceJoiner;
import com.score.reconciliation.join.JoinResult;
import com.score.reconciliation.logging.LogContext;
import com.score.reconciliation.metrics.MetricsService;
import com.score.reconciliation.metrics.NoOpMetricsService;
import com.score.reconciliation.resolve.EquivalenceResolver;
import com.score.reconciliation.tracing.NoOpTracingService;
import com.score.reconciliation.tracing.StageSpan;
import com.score.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs resolve, aggregate and join over one dataset.
 *
 * <pre>
 * ReconciliationPipeline pipeline = ReconciliationPipeline.builder()
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build();
 * PipelineResult result = pipeline.run(input);
 * </pre>
 *
 * <p>Every call builds its own union-find tables and accumulators, so one
 * pipeline may serve concurrent runs. The combined join tracks missing rows;
 * per-source joins, when enabled, keep counters only.</p>
 */
public class ReconciliationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private final EquivalenceResolver resolver;
    private final ScoreAggregator aggregator;
    private final CrossReferenceJoiner joiner;
    private final PipelineOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private ReconciliationPipeline(Builder builder) {
        this.options = builder.options;
        this.resolver = new EquivalenceResolver();
        this.aggregator = new ScoreAggregator();
        this.joiner = new CrossReferenceJoiner(options.getMissingExampleLimit());
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
    }

    public static Builder builder() {
        return new Builder();
    }

    public PipelineResult run(PipelineInput input) {
        try (LogContext ctx = LogContext.forRun(LogContext.generateRunId(), input.label())) {
            log.info("pipeline.starting label={} records={} auxiliaryRows={} invalid={}",
                    input.label(), input.records().size(), input.auxiliaryRows().size(),
                    input.invalidRaw().size());

            CanonicalMapping mapping = resolve(input);
            AggregationResult aggregation = aggregate(input, mapping);
            JoinResult combinedJoin = join(input, mapping, aggregation, null, aggregation.combined(), true);

            Map<String, JoinResult> perSourceJoins = new LinkedHashMap<>();
            if (options.isPerSourceJoins()) {
                for (String source : aggregation.sources()) {
                    perSourceJoins.put(source, join(input, mapping, aggregation, source,
                            aggregation.forSource(source), false));
                }
            }

            log.info("pipeline.completed label={} groups={} canonicalScored={} dataPoints={} baseline={} missing={}",
                    input.label(), mapping.canonicalIds().size(), aggregation.combined().size(),
                    combinedJoin.dataPoints().size(), combinedJoin.baseline().size(),
                    combinedJoin.diagnostics().missingTotal());
            return new PipelineResult(input.label(), mapping, aggregation, combinedJoin, perSourceJoins);
        }
    }

    /**
     * Returns a runner that processes independent datasets in parallel.
     * The caller owns the runner and must close it.
     */
    public ParallelReconciliationRunner parallel() {
        return new ParallelReconciliationRunner(this, options);
    }

    public PipelineOptions getOptions() {
        return options;
    }

    private CanonicalMapping resolve(PipelineInput input) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forStage(PipelineStage.RESOLVE.stageName(), null);
             StageSpan span = tracingService.startStage(PipelineStage.RESOLVE.stageName(),
                     Map.of("label", input.label()))) {
            try {
                CanonicalMapping mapping = resolver.resolveRecords(input.records());
                int groups = mapping.canonicalIds().size();
                span.setAttribute("identifiers", mapping.size());
                span.setAttribute("groups", groups);
                metricsService.recordGroups(mapping.size(), groups);
                log.debug("resolve.done identifiers={} groups={}", mapping.size(), groups);
                return mapping;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        } finally {
            metricsService.recordStageDuration(PipelineStage.RESOLVE.stageName(), elapsedSince(start));
        }
    }

    private AggregationResult aggregate(PipelineInput input, CanonicalMapping mapping) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forStage(PipelineStage.AGGREGATE.stageName(), null);
             StageSpan span = tracingService.startStage(PipelineStage.AGGREGATE.stageName(),
                     Map.of("label", input.label()))) {
            AggregationResult result = aggregator.aggregate(input.records(), mapping, input.invalidRaw());
            ExclusionCounts counts = result.exclusions();
            span.setAttribute("accepted", counts.accepted());
            span.setAttribute("excluded", counts.excluded());
            metricsService.incrementExcluded("invalid", counts.invalid());
            metricsService.incrementExcluded("merge_vote", counts.mergeVotes());
            metricsService.incrementExcluded("blank_id", counts.blankId());
            metricsService.incrementExcluded("missing_score", counts.missingScore());
            metricsService.incrementExcluded("malformed_score", counts.malformedScore());
            metricsService.incrementExcluded("invalid_group", counts.invalidGroup());
            if (counts.malformedScore() > 0) {
                log.warn("aggregate.malformedScores count={}", counts.malformedScore());
            }
            return result;
        } finally {
            metricsService.recordStageDuration(PipelineStage.AGGREGATE.stageName(), elapsedSince(start));
        }
    }

    private JoinResult join(PipelineInput input, CanonicalMapping mapping, AggregationResult aggregation,
                            String source, Map<String, Double> scores, boolean trackMissing) {
        long start = System.nanoTime();
        String scope = source != null ? source : "combined";
        try (LogContext ctx = LogContext.forStage(PipelineStage.JOIN.stageName(), scope);
             StageSpan span = tracingService.startStage(PipelineStage.JOIN.stageName(),
                     Map.of("label", input.label(), "scope", scope))) {
            JoinResult result = joiner.join(input.auxiliaryRows(), mapping,
                    aggregation.invalidCanonical(), scores, trackMissing);
            span.setAttribute("dataPoints", result.dataPoints().size());
            span.setAttribute("missing", result.diagnostics().missingTotal());
            if (trackMissing) {
                metricsService.incrementMissing(result.diagnostics().missingTotal());
                metricsService.recordDataPoints(result.dataPoints().size());
                if (result.diagnostics().hasMissing()) {
                    log.info("join.missing scope={} total={} examples={}", scope,
                            result.diagnostics().missingTotal(), result.diagnostics().missingExamples());
                }
            }
            return result;
        } finally {
            metricsService.recordStageDuration(PipelineStage.JOIN.stageName(), elapsedSince(start));
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public static class Builder {
        private PipelineOptions options = PipelineOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the tracing service. Defaults to {@link NoOpTracingService}.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public ReconciliationPipeline build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            return new ReconciliationPipeline(this);
        }
    }
}
