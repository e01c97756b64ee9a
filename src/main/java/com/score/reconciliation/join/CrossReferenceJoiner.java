package com.score.reconciliation.join;

import com.score.reconciliation.core.model.AuxiliaryRow;
import com.score.reconciliation.core.model.CanonicalMapping;
import com.score.reconciliation.core.model.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Relates auxiliary rows to aggregate scores through the canonical mapping.
 *
 * <p>Rows in an invalid canonical group are skipped. Rows without a dimension
 * value feed the baseline map; the others become {@link DataPoint}s. A row
 * whose canonical id has no score is counted as missing, never raised.</p>
 *
 * <p>With {@code trackMissing} off only the counters are kept, which is the
 * cheap path for secondary per-source passes.</p>
 */
public class CrossReferenceJoiner {
    private static final Logger log = LoggerFactory.getLogger(CrossReferenceJoiner.class);

    public static final int DEFAULT_MISSING_EXAMPLE_LIMIT = 10;

    private final int missingExampleLimit;

    public CrossReferenceJoiner() {
        this(DEFAULT_MISSING_EXAMPLE_LIMIT);
    }

    public CrossReferenceJoiner(int missingExampleLimit) {
        if (missingExampleLimit <= 0) {
            throw new IllegalArgumentException("missingExampleLimit must be > 0");
        }
        this.missingExampleLimit = missingExampleLimit;
    }

    public JoinResult join(List<AuxiliaryRow> rows, CanonicalMapping mapping, Set<String> invalidCanonical,
                           Map<String, Double> aggregate, boolean trackMissing) {
        List<DataPoint> dataPoints = new ArrayList<>();
        Map<String, Double> baseline = new HashMap<>();
        List<MissingExample> missingExamples = new ArrayList<>();
        Map<String, Long> missingByCanonical = new HashMap<>();
        long totalRows = 0;
        long numericRows = 0;
        long numericCandidates = 0;
        long numericWithScore = 0;
        long missingTotal = 0;

        for (AuxiliaryRow row : rows) {
            String identifier = row.identifier();
            if (!Identifiers.isPresent(identifier)) {
                continue;
            }
            totalRows++;
            if (!row.isBaseline()) {
                numericRows++;
            }
            String canonical = mapping.canonicalize(identifier);
            if (invalidCanonical.contains(canonical)) {
                continue;
            }
            if (!row.isBaseline()) {
                numericCandidates++;
            }

            Double score = aggregate.get(canonical);
            if (score == null) {
                missingTotal++;
                if (trackMissing) {
                    missingByCanonical.merge(canonical, 1L, Long::sum);
                    if (missingExamples.size() < missingExampleLimit) {
                        missingExamples.add(new MissingExample(identifier, canonical));
                    }
                }
                continue;
            }

            if (row.isBaseline()) {
                baseline.put(canonical, score);
            } else {
                dataPoints.add(new DataPoint(row.dimensionValue(), score, canonical));
                numericWithScore++;
            }
        }

        JoinDiagnostics diagnostics = new JoinDiagnostics(totalRows, numericRows, numericCandidates,
                numericWithScore, missingTotal, missingExamples, missingByCanonical);
        log.debug("join.completed dataPoints={} baseline={} {}",
                dataPoints.size(), baseline.size(), diagnostics.describe());
        return new JoinResult(dataPoints, baseline, diagnostics);
    }

    public int getMissingExampleLimit() {
        return missingExampleLimit;
    }
}
