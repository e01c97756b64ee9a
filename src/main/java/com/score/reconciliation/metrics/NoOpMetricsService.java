package com.score.reconciliation.metrics;

import java.time.Duration;

/**
 * Metrics sink that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void recordGroups(int identifiers, int groups) {
    }

    @Override
    public void incrementExcluded(String reason, long count) {
    }

    @Override
    public void incrementMissing(long count) {
    }

    @Override
    public void recordDataPoints(int count) {
    }
}
