package com.knowledge.crossmodal.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Ledger row for one identity operation.
 * For a merge, {@code sourceEntityId} is retired into {@code targetEntityId}.
 * For a split, {@code mentionIds} moved from {@code sourceEntityId} to the new {@code targetEntityId}.
 * The confidences are the identity confidences of both entities right after the operation,
 * except for a retired entity, which keeps its last live value.
 */
public record MergeRecord(
        String id,
        IdentityOperation operation,
        String sourceEntityId,
        String targetEntityId,
        Set<String> mentionIds,
        double sourceConfidence,
        double targetConfidence,
        String triggeredBy,
        String reasoning,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(sourceEntityId, "sourceEntityId is required");
        Objects.requireNonNull(targetEntityId, "targetEntityId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (sourceEntityId.equals(targetEntityId)) {
            throw new IllegalArgumentException("Identity operation needs two distinct entities: " + sourceEntityId);
        }
        mentionIds = mentionIds != null ? Set.copyOf(mentionIds) : Set.of();
    }

    public static MergeRecord merge(Entity retired, Entity survivor, String triggeredBy, String reasoning,
                                    Instant at) {
        return new MergeRecord(UUID.randomUUID().toString(), IdentityOperation.MERGE,
                retired.getId(), survivor.getId(), retired.getMentionIds(),
                retired.getIdentityConfidence(), survivor.getIdentityConfidence(),
                triggeredBy, reasoning, at);
    }

    public static MergeRecord split(Entity remaining, Entity created, Set<String> movedMentionIds,
                                    String triggeredBy, String reasoning, Instant at) {
        return new MergeRecord(UUID.randomUUID().toString(), IdentityOperation.SPLIT,
                remaining.getId(), created.getId(), movedMentionIds,
                remaining.getIdentityConfidence(), created.getIdentityConfidence(),
                triggeredBy, reasoning, at);
    }

    public boolean isMerge() {
        return operation == IdentityOperation.MERGE;
    }

    public boolean involves(String entityId) {
        return sourceEntityId.equals(entityId) || targetEntityId.equals(entityId);
    }
}
