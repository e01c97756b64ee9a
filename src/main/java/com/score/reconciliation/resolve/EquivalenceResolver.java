package com.score.reconciliation.resolve;

import com.score.reconciliation.core.model.CanonicalMapping;
import com.score.reconciliation.core.model.Identifiers;
import com.score.reconciliation.core.model.MergeEdge;
import com.score.reconciliation.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the canonical identifier of every equivalence group formed by
 * "superseded-by" merge edges.
 *
 * <p>Canonical selection per group:</p>
 * <ol>
 *   <li>the lexicographically smallest member that is never the child of an edge;</li>
 *   <li>if every member is a child (a cycle), the lexicographically smallest member.</li>
 * </ol>
 *
 * <p>The result does not depend on the order of identifiers or edges. Each call
 * builds its own {@link UnionFind}; instances hold no state and may be shared.</p>
 */
public class EquivalenceResolver {
    private static final Logger log = LoggerFactory.getLogger(EquivalenceResolver.class);

    /**
     * Resolves identifiers and merge edges into a canonical mapping.
     * Identifiers mentioned only by edges are registered as singletons first.
     * Identifiers are stripped of surrounding whitespace; null or blank ones are ignored.
     * Self-loops only register their identifier and duplicate edges are no-ops.
     *
     * @param identifiers known raw identifiers
     * @param edges       directed child-to-parent merge edges
     * @return mapping covering every registered identifier
     */
    public CanonicalMapping resolve(Collection<String> identifiers, List<MergeEdge> edges) {
        UnionFind unionFind = new UnionFind();
        if (identifiers != null) {
            for (String id : identifiers) {
                if (Identifiers.isPresent(id)) {
                    unionFind.register(Identifiers.normalize(id));
                }
            }
        }

        Set<String> children = new HashSet<>();
        int applied = 0;
        if (edges != null) {
            for (MergeEdge edge : edges) {
                if (edge == null || !Identifiers.isPresent(edge.child()) || !Identifiers.isPresent(edge.parent())) {
                    continue;
                }
                if (edge.isSelfLoop()) {
                    unionFind.register(edge.child());
                    continue;
                }
                unionFind.union(edge.child(), edge.parent());
                children.add(edge.child());
                applied++;
            }
        }

        if (unionFind.size() == 0) {
            return CanonicalMapping.empty();
        }

        Map<Integer, String> canonicalByRoot = chooseCanonicals(unionFind, children);

        Map<String, String> canonicalById = new HashMap<>(unionFind.size() * 2);
        for (int i = 0; i < unionFind.size(); i++) {
            canonicalById.put(unionFind.identifier(i), canonicalByRoot.get(unionFind.find(i)));
        }

        log.debug("resolve.completed identifiers={} edges={} groups={}",
                canonicalById.size(), applied, canonicalByRoot.size());
        return CanonicalMapping.of(canonicalById);
    }

    /**
     * Resolves the identifiers of raw records, deriving merge edges from merge votes.
     */
    public CanonicalMapping resolveRecords(List<RawRecord> records) {
        Set<String> identifiers = new LinkedHashSet<>();
        List<MergeEdge> edges = new ArrayList<>();
        for (RawRecord record : records) {
            String identifier = record.identifier();
            if (!Identifiers.isPresent(identifier)) {
                continue;
            }
            identifiers.add(identifier);
            record.supersededByOpt().ifPresent(parent -> edges.add(MergeEdge.of(identifier, parent)));
        }
        return resolve(identifiers, edges);
    }

    /**
     * Maps raw invalid identifiers to the canonical identifiers of their groups.
     * One invalid member excludes the whole group.
     */
    public static Set<String> invalidCanonical(CanonicalMapping mapping, Collection<String> invalidRaw) {
        if (invalidRaw == null || invalidRaw.isEmpty()) {
            return Set.of();
        }
        List<String> normalized = new ArrayList<>(invalidRaw.size());
        for (String id : invalidRaw) {
            if (Identifiers.isPresent(id)) {
                normalized.add(Identifiers.normalize(id));
            }
        }
        return mapping.canonicalizeAll(normalized);
    }

    private Map<Integer, String> chooseCanonicals(UnionFind unionFind, Set<String> children) {
        Map<Integer, String> bestNonChild = new HashMap<>();
        Map<Integer, String> bestAny = new HashMap<>();

        for (int i = 0; i < unionFind.size(); i++) {
            int root = unionFind.find(i);
            String id = unionFind.identifier(i);
            bestAny.merge(root, id, EquivalenceResolver::smaller);
            if (!children.contains(id)) {
                bestNonChild.merge(root, id, EquivalenceResolver::smaller);
            }
        }

        Map<Integer, String> canonicalByRoot = new HashMap<>(bestAny.size() * 2);
        for (Map.Entry<Integer, String> entry : bestAny.entrySet()) {
            int root = entry.getKey();
            String canonical = bestNonChild.getOrDefault(root, entry.getValue());
            Integer canonicalIndex = unionFind.indexOf(canonical);
            if (canonicalIndex == null || unionFind.find(canonicalIndex) != root) {
                throw new EquivalenceInvariantException(
                        "Canonical '" + canonical + "' is not a member of its own group");
            }
            canonicalByRoot.put(root, canonical);
        }
        return canonicalByRoot;
    }

    private static String smaller(String a, String b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
