package com.score.reconciliation.api;

import java.time.Duration;

/**
 * Options for reconciliation pipeline runs.
 */
public class PipelineOptions {

    private static final int DEFAULT_MISSING_EXAMPLE_LIMIT = 10;
    private static final int DEFAULT_PARALLELISM = 4;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final int missingExampleLimit;
    private final boolean perSourceJoins;
    private final int parallelism;
    private final Duration timeout;

    private PipelineOptions(Builder builder) {
        this.missingExampleLimit = builder.missingExampleLimit;
        this.perSourceJoins = builder.perSourceJoins;
        this.parallelism = builder.parallelism;
        this.timeout = builder.timeout;
    }

    /**
     * Maximum number of unmatched rows kept as examples in join diagnostics.
     */
    public int getMissingExampleLimit() {
        return missingExampleLimit;
    }

    /**
     * Whether each source also gets its own join pass next to the combined one.
     */
    public boolean isPerSourceJoins() {
        return perSourceJoins;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    /**
     * Combined join only, no per-source passes.
     */
    public static PipelineOptions combinedOnly() {
        return builder().perSourceJoins(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int missingExampleLimit = DEFAULT_MISSING_EXAMPLE_LIMIT;
        private boolean perSourceJoins = true;
        private int parallelism = DEFAULT_PARALLELISM;
        private Duration timeout = DEFAULT_TIMEOUT;

        public Builder missingExampleLimit(int missingExampleLimit) {
            if (missingExampleLimit <= 0) {
                throw new IllegalArgumentException("missingExampleLimit must be positive");
            }
            this.missingExampleLimit = missingExampleLimit;
            return this;
        }

        public Builder perSourceJoins(boolean perSourceJoins) {
            this.perSourceJoins = perSourceJoins;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "missingExampleLimit=" + missingExampleLimit +
                ", perSourceJoins=" + perSourceJoins +
                ", parallelism=" + parallelism +
                ", timeout=" + timeout +
                '}';
    }
}
