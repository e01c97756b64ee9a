package com.score.reconciliation.resolve;

import com.score.reconciliation.core.model.CanonicalMapping;
import com.score.reconciliation.core.model.MergeEdge;
import com.score.reconciliation.core.model.RawRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EquivalenceResolver Tests")
class EquivalenceResolverTest {

    private EquivalenceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new EquivalenceResolver();
    }

    @Nested
    @DisplayName("Canonical selection")
    class CanonicalSelection {

        @Test
        @DisplayName("Single identifier without edges maps to itself")
        void noEdges() {
            CanonicalMapping mapping = resolver.resolve(Set.of("A"), List.of());
            assertEquals("A", mapping.canonicalize("A"));
            assertEquals(1, mapping.size());
        }

        @Test
        @DisplayName("Superseded child maps to its parent")
        void childMapsToParent() {
            CanonicalMapping mapping = resolver.resolve(Set.of("A", "B"), List.of(MergeEdge.of("B", "A")));
            assertEquals("A", mapping.canonicalize("A"));
            assertEquals("A", mapping.canonicalize("B"));
        }

        @Test
        @DisplayName("Parent wins even when lexicographically larger than the child")
        void parentWinsOverSmallerChild() {
            CanonicalMapping mapping = resolver.resolve(Set.of("AAA", "ZZZ"), List.of(MergeEdge.of("AAA", "ZZZ")));
            assertEquals("ZZZ", mapping.canonicalize("AAA"));
            assertEquals("ZZZ", mapping.canonicalize("ZZZ"));
        }

        @Test
        @DisplayName("Smallest non-child member is chosen among several")
        void smallestNonChild() {
            // C -> B and D -> E leave B and E as non-children; B < E
            CanonicalMapping mapping = resolver.resolve(Set.of("B", "C", "D", "E"),
                    List.of(MergeEdge.of("C", "B"), MergeEdge.of("D", "E"), MergeEdge.of("C", "D")));
            for (String id : List.of("B", "C", "D", "E")) {
                assertEquals("B", mapping.canonicalize(id));
            }
        }

        @Test
        @DisplayName("Cycle falls back to the smallest member overall")
        void cycleFallsBackToSmallest() {
            CanonicalMapping mapping = resolver.resolve(Set.of("X", "Y", "Z"),
                    List.of(MergeEdge.of("Y", "Z"), MergeEdge.of("Z", "X"), MergeEdge.of("X", "Y")));
            assertEquals("X", mapping.canonicalize("X"));
            assertEquals("X", mapping.canonicalize("Y"));
            assertEquals("X", mapping.canonicalize("Z"));
        }

        @Test
        @DisplayName("Comparison is case-sensitive")
        void caseSensitive() {
            CanonicalMapping mapping = resolver.resolve(Set.of("abc", "ABC"), List.of());
            assertEquals("abc", mapping.canonicalize("abc"));
            assertEquals("ABC", mapping.canonicalize("ABC"));
            assertEquals(2, mapping.canonicalIds().size());
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        private final Set<String> ids = Set.of("P1", "P2", "P3", "P4", "P5", "P6", "P7");
        private final List<MergeEdge> edges = List.of(
                MergeEdge.of("P2", "P1"),
                MergeEdge.of("P3", "P2"),
                MergeEdge.of("P5", "P4"),
                MergeEdge.of("P7", "P6"),
                MergeEdge.of("P6", "P7"));

        @Test
        @DisplayName("Resolving the same input twice yields equal mappings")
        void deterministic() {
            assertEquals(resolver.resolve(ids, edges), resolver.resolve(ids, edges));
        }

        @Test
        @DisplayName("Edge order does not change the mapping")
        void orderIndependent() {
            List<MergeEdge> shuffled = new ArrayList<>(edges);
            Collections.reverse(shuffled);
            assertEquals(resolver.resolve(ids, edges), resolver.resolve(ids, shuffled));

            Collections.shuffle(shuffled, new java.util.Random(42));
            assertEquals(resolver.resolve(ids, edges), resolver.resolve(ids, shuffled));
        }

        @Test
        @DisplayName("Connected identifiers share one canonical")
        void groupConsistency() {
            CanonicalMapping mapping = resolver.resolve(ids, edges);
            assertEquals(mapping.canonicalize("P1"), mapping.canonicalize("P3"));
            assertEquals(mapping.canonicalize("P4"), mapping.canonicalize("P5"));
            assertEquals(mapping.canonicalize("P6"), mapping.canonicalize("P7"));
            assertNotEquals(mapping.canonicalize("P1"), mapping.canonicalize("P4"));
        }

        @Test
        @DisplayName("Every canonical is a fixed point and a member of its group")
        void fixedPoint() {
            CanonicalMapping mapping = resolver.resolve(ids, edges);
            for (String canonical : mapping.canonicalIds()) {
                assertEquals(canonical, mapping.canonicalize(canonical));
                assertTrue(mapping.groups().get(canonical).contains(canonical));
            }
        }

        @Test
        @DisplayName("Canonicalization is idempotent")
        void idempotent() {
            CanonicalMapping mapping = resolver.resolve(ids, edges);
            for (String id : ids) {
                String once = mapping.canonicalize(id);
                assertEquals(once, mapping.canonicalize(once));
            }
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("Identifiers only mentioned by edges are registered")
        void autoRegistersEdgeIdentifiers() {
            CanonicalMapping mapping = resolver.resolve(Set.of("A"), List.of(MergeEdge.of("A", "NEW")));
            assertTrue(mapping.contains("NEW"));
            assertEquals("NEW", mapping.canonicalize("A"));
        }

        @Test
        @DisplayName("Self-loops and duplicate edges are harmless")
        void selfLoopsAndDuplicates() {
            CanonicalMapping mapping = resolver.resolve(Set.of("A", "B"), List.of(
                    MergeEdge.of("A", "A"),
                    MergeEdge.of("B", "A"),
                    MergeEdge.of("B", "A")));
            assertEquals("A", mapping.canonicalize("B"));
            assertEquals(2, mapping.size());
        }

        @Test
        @DisplayName("A self-loop alone registers its identifier as a singleton")
        void selfLoopAlone() {
            CanonicalMapping mapping = resolver.resolve(Set.of(), List.of(MergeEdge.of("A", "A")));
            assertEquals("A", mapping.canonicalize("A"));
            assertEquals(1, mapping.size());
        }

        @Test
        @DisplayName("A self-loop does not turn its identifier into a child")
        void selfLoopKeepsCanonical() {
            CanonicalMapping mapping = resolver.resolve(Set.of("A", "B", "C"), List.of(
                    MergeEdge.of("A", "A"),
                    MergeEdge.of("C", "A"),
                    MergeEdge.of("C", "B")));
            assertEquals("A", mapping.canonicalize("B"));
            assertEquals("A", mapping.canonicalize("C"));
        }

        @Test
        @DisplayName("Padded identifiers resolve to the same group as their stripped form")
        void paddedIdentifiers() {
            CanonicalMapping mapping = resolver.resolve(List.of("A", " B"), List.of(MergeEdge.of("B ", "A")));
            assertEquals(2, mapping.size());
            assertEquals("A", mapping.canonicalize("B"));
            assertEquals(Set.of("A"), EquivalenceResolver.invalidCanonical(mapping, List.of(" B ")));
        }

        @Test
        @DisplayName("Null and blank identifiers are ignored")
        void nullAndBlankIgnored() {
            List<String> ids = new ArrayList<>();
            ids.add("A");
            ids.add(null);
            ids.add("  ");
            List<MergeEdge> edges = new ArrayList<>();
            edges.add(null);
            edges.add(new MergeEdge(null, "A"));
            edges.add(new MergeEdge("A", ""));

            CanonicalMapping mapping = assertDoesNotThrow(() -> resolver.resolve(ids, edges));
            assertEquals(1, mapping.size());
            assertEquals("A", mapping.canonicalize("A"));
        }

        @Test
        @DisplayName("Empty input yields an empty mapping")
        void emptyInput() {
            CanonicalMapping mapping = resolver.resolve(Set.of(), List.of());
            assertEquals(0, mapping.size());
            assertEquals("unseen", mapping.canonicalize("unseen"));
        }
    }

    @Nested
    @DisplayName("Record-based resolution")
    class RecordResolution {

        @Test
        @DisplayName("Merge votes become edges")
        void mergeVotesBecomeEdges() {
            List<RawRecord> records = List.of(
                    RawRecord.scored("GLFD", "judge-a", 1200),
                    RawRecord.mergeVote("GLFDX", "judge-a", "GLFD"),
                    RawRecord.scored("KKLL", "judge-b", 1100));

            CanonicalMapping mapping = resolver.resolveRecords(records);

            assertEquals("GLFD", mapping.canonicalize("GLFDX"));
            assertEquals("KKLL", mapping.canonicalize("KKLL"));
            assertEquals(3, mapping.size());
        }

        @Test
        @DisplayName("Invalid raw identifiers propagate to their canonical")
        void invalidCanonical() {
            CanonicalMapping mapping = resolver.resolve(Set.of("A", "B", "C"), List.of(MergeEdge.of("B", "A")));
            Set<String> invalid = EquivalenceResolver.invalidCanonical(mapping, Set.of("B", "UNSEEN"));
            assertEquals(Set.of("A", "UNSEEN"), invalid);
            assertTrue(EquivalenceResolver.invalidCanonical(mapping, Set.of()).isEmpty());
        }
    }
}
