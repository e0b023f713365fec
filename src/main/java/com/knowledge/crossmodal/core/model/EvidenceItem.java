package com.knowledge.crossmodal.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One piece of evidence about a claim. Retained verbatim for audit; never overwritten.
 *
 * @param evidenceId    stable identifier, used to deduplicate retried submissions
 * @param sourceId      document or extractor run the evidence came from
 * @param confidence    extractor-reported confidence
 * @param stance        whether the evidence supports or contradicts the claim
 * @param dependencyTag upstream origin shared by dependent items (e.g. a wire report id), may be null
 * @param citations     sources this evidence cites
 * @param observedAt    publication/observation time, may be null
 */
public record EvidenceItem(
        String evidenceId,
        String sourceId,
        double confidence,
        Stance stance,
        String dependencyTag,
        Set<String> citations,
        Instant observedAt
) {
    public EvidenceItem {
        Objects.requireNonNull(evidenceId, "evidenceId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        stance = stance != null ? stance : Stance.SUPPORTS;
        citations = citations != null ? Set.copyOf(citations) : Set.of();
    }

    public static EvidenceItem supporting(String sourceId, double confidence) {
        return builder().sourceId(sourceId).confidence(confidence).build();
    }

    public static EvidenceItem contradicting(String sourceId, double confidence) {
        return builder().sourceId(sourceId).confidence(confidence).stance(Stance.CONTRADICTS).build();
    }

    public boolean supports() {
        return stance == Stance.SUPPORTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String evidenceId;
        private String sourceId;
        private double confidence;
        private Stance stance = Stance.SUPPORTS;
        private String dependencyTag;
        private Set<String> citations = Set.of();
        private Instant observedAt;

        public Builder evidenceId(String evidenceId) {
            this.evidenceId = evidenceId;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder stance(Stance stance) {
            this.stance = stance;
            return this;
        }

        public Builder dependencyTag(String dependencyTag) {
            this.dependencyTag = dependencyTag;
            return this;
        }

        public Builder citations(Set<String> citations) {
            this.citations = citations;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        /**
         * Builds the item. Without an explicit identifier one is derived from the source,
         * stance and confidence, so the same submission always maps to the same item.
         */
        public EvidenceItem build() {
            Objects.requireNonNull(sourceId, "sourceId is required");
            String id = evidenceId;
            if (id == null) {
                String key = sourceId + '\u0000' + stance + '\u0000' + confidence;
                id = "ev-" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
            }
            return new EvidenceItem(id, sourceId, confidence, stance, dependencyTag, citations, observedAt);
        }
    }
}
