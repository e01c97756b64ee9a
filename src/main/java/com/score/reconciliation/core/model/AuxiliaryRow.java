package com.score.reconciliation.core.model;

import java.util.Optional;

/**
 * Row of a secondary dataset keyed by raw identifier, optionally carrying
 * a numeric dimension (for example the number of results shown when the
 * sequence was proposed). Rows without a dimension value are baseline rows.
 *
 * @param identifier     raw identifier
 * @param dimensionValue secondary dimension, or null for a baseline row
 */
public record AuxiliaryRow(String identifier, Integer dimensionValue) {

    public AuxiliaryRow {
        identifier = Identifiers.normalize(identifier);
    }

    public static AuxiliaryRow of(String identifier, int dimensionValue) {
        return new AuxiliaryRow(identifier, dimensionValue);
    }

    public static AuxiliaryRow baseline(String identifier) {
        return new AuxiliaryRow(identifier, null);
    }

    public Optional<Integer> dimension() {
        return Optional.ofNullable(dimensionValue);
    }

    public boolean isBaseline() {
        return dimensionValue == null;
    }
}
