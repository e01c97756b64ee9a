package com.score.reconciliation.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One raw row of a judging or ranking run.
 * The score is kept as the text the producer supplied; parsing happens during aggregation.
 * A record with {@code supersededBy} set is a merge vote and never contributes a score.
 * Both identifiers are stored stripped of surrounding whitespace.
 *
 * @param identifier   raw identifier of the entity
 * @param score        raw score text, may be null or blank
 * @param source       originator of the score (one judge or ranking run)
 * @param invalid      whether the entity was flagged invalid by this source
 * @param supersededBy identifier that replaces this one, or null
 */
public record RawRecord(
        String identifier,
        String score,
        String source,
        boolean invalid,
        String supersededBy
) {
    public RawRecord {
        Objects.requireNonNull(source, "source is required");
        identifier = Identifiers.normalize(identifier);
        supersededBy = Identifiers.isPresent(supersededBy) ? Identifiers.normalize(supersededBy) : null;
    }

    /**
     * Creates a plain scored observation.
     */
    public static RawRecord scored(String identifier, String source, double score) {
        return new RawRecord(identifier, Double.toString(score), source, false, null);
    }

    /**
     * Creates a merge vote: the identifier's votes belong to {@code parent}.
     */
    public static RawRecord mergeVote(String identifier, String source, String parent) {
        return new RawRecord(identifier, null, source, false, parent);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isMergeVote() {
        return supersededBy != null;
    }

    public Optional<String> supersededByOpt() {
        return Optional.ofNullable(supersededBy);
    }

    public static class Builder {
        private String identifier;
        private String score;
        private String source;
        private boolean invalid;
        private String supersededBy;

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder score(String score) {
            this.score = score;
            return this;
        }

        public Builder score(double score) {
            this.score = Double.toString(score);
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder invalid(boolean invalid) {
            this.invalid = invalid;
            return this;
        }

        public Builder supersededBy(String supersededBy) {
            this.supersededBy = supersededBy;
            return this;
        }

        public RawRecord build() {
            return new RawRecord(identifier, score, source, invalid, supersededBy);
        }
    }
}
