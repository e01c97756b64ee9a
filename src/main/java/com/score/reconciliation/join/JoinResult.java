package com.score.reconciliation.join;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of one join pass.
 *
 * @param dataPoints  rows with a dimension value and a score, in input order
 * @param baseline    canonical id to score for rows without a dimension value
 * @param diagnostics match statistics
 */
public record JoinResult(
        List<DataPoint> dataPoints,
        Map<String, Double> baseline,
        JoinDiagnostics diagnostics
) {
    public JoinResult {
        dataPoints = dataPoints != null ? List.copyOf(dataPoints) : List.of();
        baseline = baseline != null ? Collections.unmodifiableMap(new TreeMap<>(baseline)) : Map.of();
    }

    public boolean hasDataPoints() {
        return !dataPoints.isEmpty();
    }
}
