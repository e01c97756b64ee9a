package com.score.reconciliation.join;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters and bounded examples describing how well auxiliary rows matched.
 *
 * @param totalRows          rows with an identifier
 * @param numericRows        rows carrying a dimension value, invalid groups included
 * @param numericCandidates  rows carrying a dimension value outside invalid groups
 * @param numericWithScore   rows carrying a dimension value that matched a score
 * @param missingTotal       rows outside invalid groups that matched no score
 * @param missingExamples    first unmatched rows, capped
 * @param missingByCanonical unmatched row count per canonical id; empty when not tracked
 */
public record JoinDiagnostics(
        long totalRows,
        long numericRows,
        long numericCandidates,
        long numericWithScore,
        long missingTotal,
        List<MissingExample> missingExamples,
        Map<String, Long> missingByCanonical
) {
    public JoinDiagnostics {
        missingExamples = missingExamples != null ? List.copyOf(missingExamples) : List.of();
        missingByCanonical = missingByCanonical != null
                ? Collections.unmodifiableMap(new TreeMap<>(missingByCanonical)) : Map.of();
    }

    public boolean hasMissing() {
        return missingTotal > 0;
    }

    /**
     * Canonical ids with the most unmatched rows, largest first, ties by id.
     */
    public List<Map.Entry<String, Long>> topMissing(int limit) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(missingByCanonical.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        return List.copyOf(entries.subList(0, Math.min(limit, entries.size())));
    }

    /**
     * One-line summary suitable for an error message or a log line.
     */
    public String describe() {
        return "rows=" + totalRows +
                ", numeric rows=" + numericRows +
                ", numeric candidates=" + numericCandidates +
                ", numeric with score=" + numericWithScore +
                ", missing=" + missingTotal;
    }
}
