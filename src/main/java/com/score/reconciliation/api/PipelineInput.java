package com.score.reconciliation.api;

import com.score.reconciliation.core.model.AuxiliaryRow;
import com.score.reconciliation.core.model.Identifiers;
import com.score.reconciliation.core.model.RawRecord;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One dataset to reconcile: raw scored records from one or more sources, the
 * identifiers flagged invalid and the auxiliary rows to join against.
 *
 * @param label         name used in logs and reports
 * @param records       raw records, merge votes included
 * @param invalidRaw    raw identifiers flagged invalid
 * @param auxiliaryRows rows of the secondary dataset
 */
public record PipelineInput(
        String label,
        List<RawRecord> records,
        Set<String> invalidRaw,
        List<AuxiliaryRow> auxiliaryRows
) {
    public PipelineInput {
        Objects.requireNonNull(label, "label is required");
        records = records != null ? List.copyOf(records) : List.of();
        invalidRaw = normalizeAll(invalidRaw);
        auxiliaryRows = auxiliaryRows != null ? List.copyOf(auxiliaryRows) : List.of();
    }

    /**
     * Builds an input whose invalid set is taken from the records' own invalid flags.
     */
    public static PipelineInput fromRecords(String label, List<RawRecord> records,
                                            List<AuxiliaryRow> auxiliaryRows) {
        Set<String> invalid = new LinkedHashSet<>();
        for (RawRecord record : records) {
            if (record.invalid() && Identifiers.isPresent(record.identifier())) {
                invalid.add(record.identifier());
            }
        }
        return new PipelineInput(label, records, invalid, auxiliaryRows);
    }

    private static Set<String> normalizeAll(Set<String> identifiers) {
        if (identifiers == null) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String id : identifiers) {
            if (Identifiers.isPresent(id)) {
                normalized.add(Identifiers.normalize(id));
            }
        }
        return Set.copyOf(normalized);
    }
}
