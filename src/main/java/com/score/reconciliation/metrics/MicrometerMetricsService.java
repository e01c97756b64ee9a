package com.score.reconciliation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.stage.duration}: Timer (tag: stage)</li>
 *   <li>{@code reconciliation.resolve.identifiers}: DistributionSummary</li>
 *   <li>{@code reconciliation.resolve.groups}: DistributionSummary</li>
 *   <li>{@code reconciliation.records.excluded}: Counter (tag: reason)</li>
 *   <li>{@code reconciliation.join.missing}: Counter</li>
 *   <li>{@code reconciliation.join.datapoints}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary identifierSummary;
    private final DistributionSummary groupSummary;
    private final DistributionSummary dataPointSummary;
    private final Counter missingCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.identifierSummary = DistributionSummary.builder("reconciliation.resolve.identifiers")
                .description("Identifiers registered per resolution")
                .register(registry);
        this.groupSummary = DistributionSummary.builder("reconciliation.resolve.groups")
                .description("Equivalence groups per resolution")
                .register(registry);
        this.dataPointSummary = DistributionSummary.builder("reconciliation.join.datapoints")
                .description("Data points emitted per join")
                .register(registry);
        this.missingCounter = Counter.builder("reconciliation.join.missing")
                .description("Auxiliary rows without an aggregate score")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("reconciliation.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordGroups(int identifiers, int groups) {
        identifierSummary.record(identifiers);
        groupSummary.record(groups);
    }

    @Override
    public void incrementExcluded(String reason, long count) {
        if (count <= 0) {
            return;
        }
        Counter counter = counterCache.computeIfAbsent(reason, k ->
                Counter.builder("reconciliation.records.excluded")
                        .description("Raw records excluded from aggregation")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementMissing(long count) {
        if (count > 0) {
            missingCounter.increment(count);
        }
    }

    @Override
    public void recordDataPoints(int count) {
        dataPointSummary.record(count);
    }
}
