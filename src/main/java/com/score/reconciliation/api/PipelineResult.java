package com.score.reconciliation.api;

import com.score.reconciliation.aggregate.AggregationResult;
import com.score.reconciliation.core.model.CanonicalMapping;
import com.score.reconciliation.join.JoinResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one pipeline run produced. Empty outputs are legitimate values;
 * deciding whether they are fatal is up to the caller.
 *
 * @param label          dataset label
 * @param mapping        canonical mapping of all identifiers
 * @param aggregation    per-source and combined aggregate maps
 * @param combinedJoin   join against the combined aggregate, missing rows tracked
 * @param perSourceJoins join per source, counters only, in source order
 */
public record PipelineResult(
        String label,
        CanonicalMapping mapping,
        AggregationResult aggregation,
        JoinResult combinedJoin,
        Map<String, JoinResult> perSourceJoins
) {
    public PipelineResult {
        perSourceJoins = perSourceJoins != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(perSourceJoins)) : Map.of();
    }

    public Optional<JoinResult> joinForSource(String source) {
        return Optional.ofNullable(perSourceJoins.get(source));
    }
}
