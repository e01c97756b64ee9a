package com.score.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable mapping from every registered raw identifier to the canonical
 * identifier of its equivalence group.
 *
 * Identifiers the resolver never saw canonicalize to themselves, so the
 * mapping can be applied to any key without a presence check.
 */
public final class CanonicalMapping {

    private static final CanonicalMapping EMPTY = new CanonicalMapping(Map.of());

    private final Map<String, String> canonicalById;

    private CanonicalMapping(Map<String, String> canonicalById) {
        this.canonicalById = Collections.unmodifiableMap(new TreeMap<>(canonicalById));
    }

    /**
     * Wraps a resolved identifier-to-canonical table.
     */
    public static CanonicalMapping of(Map<String, String> canonicalById) {
        Objects.requireNonNull(canonicalById, "canonicalById is required");
        return canonicalById.isEmpty() ? EMPTY : new CanonicalMapping(canonicalById);
    }

    public static CanonicalMapping empty() {
        return EMPTY;
    }

    /**
     * Returns the canonical identifier, or the stripped identifier itself when unregistered.
     */
    public String canonicalize(String identifier) {
        String key = Identifiers.normalize(identifier);
        if (key == null) {
            return null;
        }
        return canonicalById.getOrDefault(key, key);
    }

    /**
     * Canonicalizes every identifier of the collection.
     */
    public Set<String> canonicalizeAll(Collection<String> identifiers) {
        Set<String> result = new TreeSet<>();
        for (String id : identifiers) {
            if (id != null) {
                result.add(canonicalize(id));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public boolean contains(String identifier) {
        String key = Identifiers.normalize(identifier);
        return key != null && canonicalById.containsKey(key);
    }

    public int size() {
        return canonicalById.size();
    }

    /**
     * Groups registered identifiers by canonical identifier, members sorted.
     */
    public Map<String, List<String>> groups() {
        Map<String, List<String>> groups = new TreeMap<>();
        canonicalById.forEach((id, canonical) ->
                groups.computeIfAbsent(canonical, k -> new ArrayList<>()).add(id));
        groups.replaceAll((k, members) -> List.copyOf(members));
        return Collections.unmodifiableMap(groups);
    }

    public Set<String> canonicalIds() {
        return Collections.unmodifiableSet(new TreeSet<>(canonicalById.values()));
    }

    public Map<String, String> asMap() {
        return canonicalById;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalMapping that = (CanonicalMapping) o;
        return canonicalById.equals(that.canonicalById);
    }

    @Override
    public int hashCode() {
        return canonicalById.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalMapping{identifiers=" + canonicalById.size() +
                ", groups=" + canonicalIds().size() + '}';
    }
}
