package com.score.reconciliation.core.model;

/**
 * Directed "superseded-by" annotation between two raw identifiers.
 * The record for {@code child} was withdrawn and its votes belong to {@code parent}.
 * Direction only matters when choosing the canonical identifier of a group.
 *
 * @param child  identifier that was withdrawn
 * @param parent identifier that replaces it
 */
public record MergeEdge(String child, String parent) {

    public MergeEdge {
        child = Identifiers.normalize(child);
        parent = Identifiers.normalize(parent);
    }

    public static MergeEdge of(String child, String parent) {
        return new MergeEdge(child, parent);
    }

    /**
     * True if the edge links an identifier to itself.
     */
    public boolean isSelfLoop() {
        return child != null && child.equals(parent);
    }
}
