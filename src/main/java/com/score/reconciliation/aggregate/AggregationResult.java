package com.score.reconciliation.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mean scores per canonical identifier, per source and combined.
 *
 * @param perSource        source to (canonical id to mean score), sources in first-seen order
 * @param combined         canonical id to mean of its per-source means
 * @param invalidCanonical canonical ids excluded because a group member is invalid
 * @param exclusions       tally of accepted and excluded records
 */
public record AggregationResult(
        Map<String, Map<String, Double>> perSource,
        Map<String, Double> combined,
        Set<String> invalidCanonical,
        ExclusionCounts exclusions
) {
    public AggregationResult {
        Map<String, Map<String, Double>> sources = new LinkedHashMap<>();
        if (perSource != null) {
            perSource.forEach((source, scores) ->
                    sources.put(source, Collections.unmodifiableMap(new TreeMap<>(scores))));
        }
        perSource = Collections.unmodifiableMap(sources);
        combined = combined != null ? Collections.unmodifiableMap(new TreeMap<>(combined)) : Map.of();
        invalidCanonical = invalidCanonical != null
                ? Collections.unmodifiableSet(new TreeSet<>(invalidCanonical)) : Set.of();
        exclusions = exclusions != null ? exclusions : ExclusionCounts.NONE;
    }

    public List<String> sources() {
        return List.copyOf(perSource.keySet());
    }

    /**
     * Aggregate map of one source; empty if the source contributed nothing.
     */
    public Map<String, Double> forSource(String source) {
        return perSource.getOrDefault(source, Map.of());
    }

    public Optional<Double> combinedScore(String canonicalId) {
        return Optional.ofNullable(combined.get(canonicalId));
    }

    public boolean isEmpty() {
        return combined.isEmpty();
    }
}
