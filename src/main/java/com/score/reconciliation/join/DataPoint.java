package com.score.reconciliation.join;

/**
 * A secondary dimension value paired with the aggregate score of its entity.
 *
 * @param dimensionValue value of the secondary dimension
 * @param score          aggregate score of the canonical identifier
 * @param canonicalId    canonical identifier the row resolved to
 */
public record DataPoint(int dimensionValue, double score, String canonicalId) {
}
