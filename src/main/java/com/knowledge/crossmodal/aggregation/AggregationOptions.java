package com.knowledge.crossmodal.aggregation;

import java.time.Duration;

/**
 * Parameters of the Bayesian evidence combination and the default dependency heuristics.
 */
public class AggregationOptions {

    private static final double DEFAULT_PRIOR = 0.5;
    private static final double DEFAULT_CLAMP_MIN = 0.001;
    private static final double DEFAULT_CLAMP_MAX = 0.999;
    private static final int DEFAULT_CLOSED_FORM_MAX_ITEMS = 3;
    private static final double DEFAULT_CITATION_OVERLAP_THRESHOLD = 0.3;
    private static final Duration DEFAULT_CASCADE_WINDOW = Duration.ofHours(6);
    private static final double DEFAULT_CASCADE_STRENGTH = 0.75;

    private final double prior;
    private final double clampMin;
    private final double clampMax;
    private final int closedFormMaxItems;
    private final double citationOverlapThreshold;
    private final Duration cascadeWindow;
    private final double cascadeStrength;

    private AggregationOptions(Builder builder) {
        this.prior = builder.prior;
        this.clampMin = builder.clampMin;
        this.clampMax = builder.clampMax;
        this.closedFormMaxItems = builder.closedFormMaxItems;
        this.citationOverlapThreshold = builder.citationOverlapThreshold;
        this.cascadeWindow = builder.cascadeWindow;
        this.cascadeStrength = builder.cascadeStrength;
    }

    public double getPrior() {
        return prior;
    }

    public double getClampMin() {
        return clampMin;
    }

    public double getClampMax() {
        return clampMax;
    }

    /**
     * Largest evidence set combined in closed form when no dependence is suspected.
     */
    public int getClosedFormMaxItems() {
        return closedFormMaxItems;
    }

    public double getCitationOverlapThreshold() {
        return citationOverlapThreshold;
    }

    public Duration getCascadeWindow() {
        return cascadeWindow;
    }

    public double getCascadeStrength() {
        return cascadeStrength;
    }

    public static AggregationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double prior = DEFAULT_PRIOR;
        private double clampMin = DEFAULT_CLAMP_MIN;
        private double clampMax = DEFAULT_CLAMP_MAX;
        private int closedFormMaxItems = DEFAULT_CLOSED_FORM_MAX_ITEMS;
        private double citationOverlapThreshold = DEFAULT_CITATION_OVERLAP_THRESHOLD;
        private Duration cascadeWindow = DEFAULT_CASCADE_WINDOW;
        private double cascadeStrength = DEFAULT_CASCADE_STRENGTH;

        public Builder prior(double prior) {
            if (!(prior > 0.0 && prior < 1.0)) {
                throw new IllegalArgumentException("prior must be strictly between 0.0 and 1.0");
            }
            this.prior = prior;
            return this;
        }

        public Builder clamp(double min, double max) {
            if (!(min > 0.0 && min < max && max < 1.0)) {
                throw new IllegalArgumentException("clamp bounds must satisfy 0 < min < max < 1");
            }
            this.clampMin = min;
            this.clampMax = max;
            return this;
        }

        public Builder closedFormMaxItems(int closedFormMaxItems) {
            if (closedFormMaxItems < 0) {
                throw new IllegalArgumentException("closedFormMaxItems must not be negative");
            }
            this.closedFormMaxItems = closedFormMaxItems;
            return this;
        }

        public Builder citationOverlapThreshold(double citationOverlapThreshold) {
            validateUnit(citationOverlapThreshold, "citationOverlapThreshold");
            this.citationOverlapThreshold = citationOverlapThreshold;
            return this;
        }

        public Builder cascadeWindow(Duration cascadeWindow) {
            if (cascadeWindow == null || cascadeWindow.isNegative()) {
                throw new IllegalArgumentException("cascadeWindow must not be negative");
            }
            this.cascadeWindow = cascadeWindow;
            return this;
        }

        public Builder cascadeStrength(double cascadeStrength) {
            if (!(cascadeStrength > 0.0 && cascadeStrength <= 1.0)) {
                throw new IllegalArgumentException("cascadeStrength must be in (0, 1]");
            }
            this.cascadeStrength = cascadeStrength;
            return this;
        }

        public AggregationOptions build() {
            return new AggregationOptions(this);
        }

        private void validateUnit(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "AggregationOptions{" +
                "prior=" + prior +
                ", clamp=[" + clampMin + ", " + clampMax + ']' +
                ", closedFormMaxItems=" + closedFormMaxItems +
                ", citationOverlapThreshold=" + citationOverlapThreshold +
                ", cascadeWindow=" + cascadeWindow +
                ", cascadeStrength=" + cascadeStrength +
                '}';
    }
}
