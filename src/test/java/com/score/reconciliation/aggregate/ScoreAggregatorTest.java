package com.score.reconciliation.aggregate;

import com.score.reconciliation.core.model.CanonicalMapping;
import com.score.reconciliation.core.model.MergeEdge;
import com.score.reconciliation.core.model.RawRecord;
import com.score.reconciliation.resolve.EquivalenceResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScoreAggregator Tests")
class ScoreAggregatorTest {

    private EquivalenceResolver resolver;
    private ScoreAggregator aggregator;

    @BeforeEach
    void setUp() {
        resolver = new EquivalenceResolver();
        aggregator = new ScoreAggregator();
    }

    @Test
    @DisplayName("Merge votes never contribute a score")
    void mergeVoteExcluded() {
        List<RawRecord> records = List.of(
                RawRecord.scored("A", "source1", 1000),
                new RawRecord("B", "1100", "source1", false, "A"));
        CanonicalMapping mapping = resolver.resolve(Set.of("A", "B"), List.of(MergeEdge.of("B", "A")));

        AggregationResult result = aggregator.aggregate(records, mapping, Set.of());

        assertEquals(1000.0, result.combined().get("A"));
        assertEquals(1, result.combined().size());
        assertEquals(1, result.exclusions().mergeVotes());
    }

    @Test
    @DisplayName("Combined score weighs every source equally")
    void equalWeightPerSource() {
        List<RawRecord> records = List.of(
                RawRecord.scored("X", "source1", 1400),
                RawRecord.scored("X", "source1", 1500),
                RawRecord.scored("X", "source1", 1600),
                RawRecord.scored("X", "source2", 1600));
        CanonicalMapping mapping = resolver.resolveRecords(records);

        AggregationResult result = aggregator.aggregate(records, mapping, Set.of());

        assertEquals(1500.0, result.forSource("source1").get("X"));
        assertEquals(1600.0, result.forSource("source2").get("X"));
        assertEquals(1550.0, result.combined().get("X"));
    }

    @Test
    @DisplayName("Scores of group members are averaged under the canonical")
    void groupMembersAveraged() {
        List<RawRecord> records = List.of(
                RawRecord.scored("A", "s", 1000),
                RawRecord.scored("A2", "s", 1200),
                RawRecord.mergeVote("A2", "other", "A"));
        CanonicalMapping mapping = resolver.resolveRecords(records);

        AggregationResult result = aggregator.aggregate(records, mapping, Set.of());

        assertEquals(Map.of("A", 1100.0), result.combined());
        assertEquals(List.of("s"), result.sources());
    }

    @Test
    @DisplayName("One invalid member removes the whole group from every map")
    void invalidPropagation() {
        List<RawRecord> records = List.of(
                RawRecord.scored("A", "s1", 1000),
                RawRecord.scored("B", "s2", 1300),
                RawRecord.mergeVote("B", "s2", "A"),
                RawRecord.scored("C", "s1", 900));
        CanonicalMapping mapping = resolver.resolveRecords(records);

        AggregationResult result = aggregator.aggregate(records, mapping, Set.of("B"));

        assertFalse(result.combined().containsKey("A"));
        assertFalse(result.forSource("s1").containsKey("A"));
        assertFalse(result.forSource("s2").containsKey("A"));
        assertEquals(900.0, result.combined().get("C"));
        assertEquals(Set.of("A"), result.invalidCanonical());
        assertEquals(2, result.exclusions().invalidGroup());
    }

    @Test
    @DisplayName("Records flagged invalid are dropped themselves")
    void invalidRecordDropped() {
        List<RawRecord> records = List.of(
                RawRecord.builder().identifier("A").score(1000).source("s").invalid(true).build(),
                RawRecord.scored("B", "s", 1200));
        CanonicalMapping mapping = resolver.resolveRecords(records);

        AggregationResult result = aggregator.aggregate(records, mapping, Set.of());

        assertFalse(result.combined().containsKey("A"));
        assertEquals(1, result.exclusions().invalid());
        assertEquals(1, result.exclusions().accepted());
    }

    @Test
    @DisplayName("Missing and malformed scores are excluded without raising")
    void badScoresExcluded() {
        List<RawRecord> records = List.of(
                new RawRecord("A", "", "s", false, null),
                new RawRecord("A", "n/a", "s", false, null),
                new RawRecord("  ", "1000", "s", false, null),
                new RawRecord("A", "1010", "s", false, null));
        CanonicalMapping mapping = resolver.resolveRecords(records);

        AggregationResult result = assertDoesNotThrow(() -> aggregator.aggregate(records, mapping, Set.of()));

        assertEquals(1010.0, result.combined().get("A"));
        ExclusionCounts counts = result.exclusions();
        assertEquals(1, counts.missingScore());
        assertEquals(1, counts.malformedScore());
        assertEquals(1, counts.blankId());
        assertEquals(1, counts.accepted());
        assertEquals(4, counts.total());
    }

    @Test
    @DisplayName("Identifiers unseen by the resolver aggregate under themselves")
    void unseenIdentifierIsIdentity() {
        List<RawRecord> records = List.of(RawRecord.scored("NEW", "s", 5));

        AggregationResult result = aggregator.aggregate(records, CanonicalMapping.empty(), Set.of());

        assertEquals(5.0, result.combined().get("NEW"));
    }

    @Test
    @DisplayName("A canonical absent from one source is simply missing there")
    void absentFromSource() {
        List<RawRecord> records = List.of(
                RawRecord.scored("A", "s1", 10),
                RawRecord.scored("B", "s2", 20));
        CanonicalMapping mapping = resolver.resolveRecords(records);

        AggregationResult result = aggregator.aggregate(records, mapping, Set.of());

        assertFalse(result.forSource("s1").containsKey("B"));
        assertFalse(result.forSource("s2").containsKey("A"));
        assertEquals(10.0, result.combined().get("A"));
        assertEquals(20.0, result.combined().get("B"));
        assertTrue(result.forSource("unknown").isEmpty());
    }

    @Test
    @DisplayName("No records yields empty maps")
    void emptyInput() {
        AggregationResult result = aggregator.aggregate(List.of(), CanonicalMapping.empty(), Set.of());
        assertTrue(result.isEmpty());
        assertTrue(result.perSource().isEmpty());
        assertEquals(0, result.exclusions().total());
    }
}
