package com.knowledge.crossmodal.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Logical identity of a claim: (subject, predicate, object).
 * Raw claims about the same triple are merged into one claim record.
 */
public record ClaimKey(String subjectId, String predicate, ClaimObject object) {
    public ClaimKey {
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(predicate, "predicate is required");
        Objects.requireNonNull(object, "object is required");
        predicate = predicate.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
        if (predicate.isEmpty()) {
            throw new IllegalArgumentException("predicate must not be blank");
        }
    }

    public boolean references(String entityId) {
        return subjectId.equals(entityId) || (object.isEntity() && object.entityId().equals(entityId));
    }

    /**
     * Returns this key with every reference to {@code from} replaced by {@code to}.
     */
    public ClaimKey repoint(String from, String to) {
        String subject = subjectId.equals(from) ? to : subjectId;
        ClaimObject obj = object.isEntity() && object.entityId().equals(from) ? ClaimObject.entity(to) : object;
        return new ClaimKey(subject, predicate, obj);
    }
}
