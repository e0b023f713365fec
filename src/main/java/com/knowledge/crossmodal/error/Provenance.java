package com.knowledge.crossmodal.error;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Trace back from an error to the raw text that produced it.
 * Carries the record identifiers involved plus the source documents, mentions and
 * evidence items that contributed to them.
 */
public record Provenance(
        Set<String> recordIds,
        Set<String> sourceIds,
        Set<String> mentionIds,
        Set<String> evidenceIds
) {
    public Provenance {
        recordIds = recordIds != null ? Set.copyOf(recordIds) : Set.of();
        sourceIds = sourceIds != null ? Set.copyOf(sourceIds) : Set.of();
        mentionIds = mentionIds != null ? Set.copyOf(mentionIds) : Set.of();
        evidenceIds = evidenceIds != null ? Set.copyOf(evidenceIds) : Set.of();
    }

    public static Provenance empty() {
        return new Provenance(Set.of(), Set.of(), Set.of(), Set.of());
    }

    public static Provenance ofRecord(String recordId) {
        return builder().record(recordId).build();
    }

    public boolean isEmpty() {
        return recordIds.isEmpty() && sourceIds.isEmpty() && mentionIds.isEmpty() && evidenceIds.isEmpty();
    }

    @Override
    public String toString() {
        return "records=" + recordIds + " sources=" + sourceIds
                + " mentions=" + mentionIds + " evidence=" + evidenceIds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<String> recordIds = new LinkedHashSet<>();
        private final Set<String> sourceIds = new LinkedHashSet<>();
        private final Set<String> mentionIds = new LinkedHashSet<>();
        private final Set<String> evidenceIds = new LinkedHashSet<>();

        public Builder record(String recordId) {
            if (recordId != null) {
                recordIds.add(recordId);
            }
            return this;
        }

        public Builder records(Collection<String> ids) {
            ids.forEach(this::record);
            return this;
        }

        public Builder source(String sourceId) {
            if (sourceId != null) {
                sourceIds.add(sourceId);
            }
            return this;
        }

        public Builder sources(Collection<String> ids) {
            ids.forEach(this::source);
            return this;
        }

        public Builder mention(String mentionId) {
            if (mentionId != null) {
                mentionIds.add(mentionId);
            }
            return this;
        }

        public Builder mentions(Collection<String> ids) {
            ids.forEach(this::mention);
            return this;
        }

        public Builder evidence(String evidenceId) {
            if (evidenceId != null) {
                evidenceIds.add(evidenceId);
            }
            return this;
        }

        public Builder evidence(Collection<String> ids) {
            ids.forEach(this::evidence);
            return this;
        }

        public Provenance build() {
            return new Provenance(recordIds, sourceIds, mentionIds, evidenceIds);
        }
    }
}
