package com.score.reconciliation.core.model;

/**
 * Key normalization shared by every stage. Identifiers are compared after
 * stripping surrounding whitespace, so {@code "B "} and {@code "B"} are the same entity.
 */
public final class Identifiers {

    private Identifiers() {
    }

    /**
     * Strips surrounding whitespace; null stays null.
     */
    public static String normalize(String identifier) {
        return identifier != null ? identifier.strip() : null;
    }

    /**
     * True for a non-null identifier with at least one non-whitespace character.
     */
    public static boolean isPresent(String identifier) {
        return identifier != null && !identifier.isBlank();
    }
}
