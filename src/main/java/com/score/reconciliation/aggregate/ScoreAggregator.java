package com.score.reconciliation.aggregate;

import com.score.reconciliation.core.model.CanonicalMapping;
import com.score.reconciliation.core.model.Identifiers;
import com.score.reconciliation.core.model.RawRecord;
import com.score.reconciliation.resolve.EquivalenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Averages scores per canonical identifier.
 *
 * <p>A record is dropped when it is flagged invalid, is a merge vote, has no
 * identifier, has a missing or malformed score, or resolves into a group with
 * an invalid member. Surviving scores are averaged per (source, canonical id);
 * the combined score is the mean of the per-source means, so every source
 * weighs the same regardless of how many votes it cast.</p>
 *
 * <p>Data-quality problems never raise; they only show up in {@link ExclusionCounts}.</p>
 */
public class ScoreAggregator {
    private static final Logger log = LoggerFactory.getLogger(ScoreAggregator.class);

    public AggregationResult aggregate(List<RawRecord> records, CanonicalMapping mapping,
                                       Collection<String> invalidRaw) {
        Set<String> invalidCanonical = EquivalenceResolver.invalidCanonical(mapping, invalidRaw);

        Map<String, Map<String, MeanAccumulator>> bySource = new LinkedHashMap<>();
        long accepted = 0;
        long invalid = 0;
        long mergeVotes = 0;
        long blankId = 0;
        long missingScore = 0;
        long malformedScore = 0;
        long invalidGroup = 0;

        for (RawRecord record : records) {
            if (record.invalid()) {
                invalid++;
                continue;
            }
            if (record.isMergeVote()) {
                mergeVotes++;
                continue;
            }
            String identifier = record.identifier();
            if (!Identifiers.isPresent(identifier)) {
                blankId++;
                continue;
            }
            ScoreParseResult score = ScoreValues.parseScore(record.score());
            if (score.status() == ScoreParseResult.Status.MISSING) {
                missingScore++;
                continue;
            }
            if (score.status() == ScoreParseResult.Status.MALFORMED) {
                log.debug("aggregate.malformedScore identifier={} source={} score='{}'",
                        identifier, record.source(), score.raw());
                malformedScore++;
                continue;
            }
            String canonical = mapping.canonicalize(identifier);
            if (invalidCanonical.contains(canonical)) {
                invalidGroup++;
                continue;
            }
            bySource.computeIfAbsent(record.source(), k -> new HashMap<>())
                    .computeIfAbsent(canonical, k -> new MeanAccumulator())
                    .add(score.value());
            accepted++;
        }

        Map<String, Map<String, Double>> perSource = new LinkedHashMap<>();
        Map<String, MeanAccumulator> combinedAcc = new HashMap<>();
        bySource.forEach((source, accumulators) -> {
            Map<String, Double> means = new HashMap<>();
            accumulators.forEach((canonical, acc) -> {
                double mean = acc.mean();
                means.put(canonical, mean);
                combinedAcc.computeIfAbsent(canonical, k -> new MeanAccumulator()).add(mean);
            });
            perSource.put(source, means);
        });

        Map<String, Double> combined = new HashMap<>();
        combinedAcc.forEach((canonical, acc) -> combined.put(canonical, acc.mean()));

        ExclusionCounts exclusions = new ExclusionCounts(accepted, invalid, mergeVotes, blankId,
                missingScore, malformedScore, invalidGroup);
        log.debug("aggregate.completed sources={} canonical={} {}",
                perSource.size(), combined.size(), exclusions);
        return new AggregationResult(perSource, combined, invalidCanonical, exclusions);
    }

    private static final class MeanAccumulator {
        private double sum;
        private long count;

        void add(double value) {
            sum += value;
            count++;
        }

        double mean() {
            return sum / count;
        }
    }
}
