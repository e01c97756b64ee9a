package com.score.reconciliation.metrics;

import java.time.Duration;

/**
 * Records pipeline metrics.
 * {@link NoOpMetricsService} is the default; {@link MicrometerMetricsService}
 * publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordStageDuration(String stage, Duration duration);

    void recordGroups(int identifiers, int groups);

    void incrementExcluded(String reason, long count);

    void incrementMissing(long count);

    void recordDataPoints(int count);
}
