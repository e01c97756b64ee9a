package com.score.reconciliation.join;

/**
 * An auxiliary row that found no aggregate score.
 *
 * @param rawIdentifier       identifier as it appeared in the auxiliary row
 * @param canonicalIdentifier identifier after canonicalization
 */
public record MissingExample(String rawIdentifier, String canonicalIdentifier) {
}
