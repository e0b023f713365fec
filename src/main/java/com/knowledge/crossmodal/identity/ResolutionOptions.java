package com.knowledge.crossmodal.identity;

/**
 * Thresholds for identity resolution.
 */
public class ResolutionOptions {

    private static final double DEFAULT_MATCH_THRESHOLD = 0.80;
    private static final double DEFAULT_AMBIGUITY_EPSILON = 0.02;
    private static final double DEFAULT_AMBIGUITY_PENALTY = 0.15;
    private static final double DEFAULT_STABLE_THRESHOLD = 0.80;

    private final double matchThreshold;
    private final double ambiguityEpsilon;
    private final double ambiguityPenalty;
    private final double stableThreshold;

    private ResolutionOptions(Builder builder) {
        this.matchThreshold = builder.matchThreshold;
        this.ambiguityEpsilon = builder.ambiguityEpsilon;
        this.ambiguityPenalty = builder.ambiguityPenalty;
        this.stableThreshold = builder.stableThreshold;
    }

    /**
     * Minimum similarity for a mention to attach to an existing entity.
     */
    public double getMatchThreshold() {
        return matchThreshold;
    }

    /**
     * Candidates scoring within this distance of the best are treated as tied.
     */
    public double getAmbiguityEpsilon() {
        return ambiguityEpsilon;
    }

    /**
     * Multiplicative penalty per ambiguous link: confidence is scaled by (1 - penalty) for each.
     */
    public double getAmbiguityPenalty() {
        return ambiguityPenalty;
    }

    public double getStableThreshold() {
        return stableThreshold;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double matchThreshold = DEFAULT_MATCH_THRESHOLD;
        private double ambiguityEpsilon = DEFAULT_AMBIGUITY_EPSILON;
        private double ambiguityPenalty = DEFAULT_AMBIGUITY_PENALTY;
        private double stableThreshold = DEFAULT_STABLE_THRESHOLD;

        public Builder matchThreshold(double matchThreshold) {
            validateUnit(matchThreshold, "matchThreshold");
            if (matchThreshold == 0.0) {
                throw new IllegalArgumentException("matchThreshold must be > 0.0");
            }
            this.matchThreshold = matchThreshold;
            return this;
        }

        public Builder ambiguityEpsilon(double ambiguityEpsilon) {
            if (ambiguityEpsilon < 0.0 || ambiguityEpsilon > 0.2) {
                throw new IllegalArgumentException("ambiguityEpsilon must be between 0.0 and 0.2");
            }
            this.ambiguityEpsilon = ambiguityEpsilon;
            return this;
        }

        public Builder ambiguityPenalty(double ambiguityPenalty) {
            if (ambiguityPenalty < 0.0 || ambiguityPenalty >= 1.0) {
                throw new IllegalArgumentException("ambiguityPenalty must be in [0.0, 1.0)");
            }
            this.ambiguityPenalty = ambiguityPenalty;
            return this;
        }

        public Builder stableThreshold(double stableThreshold) {
            validateUnit(stableThreshold, "stableThreshold");
            this.stableThreshold = stableThreshold;
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }

        private void validateUnit(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "matchThreshold=" + matchThreshold +
                ", ambiguityEpsilon=" + ambiguityEpsilon +
                ", ambiguityPenalty=" + ambiguityPenalty +
                ", stableThreshold=" + stableThreshold +
                '}';
    }
}
