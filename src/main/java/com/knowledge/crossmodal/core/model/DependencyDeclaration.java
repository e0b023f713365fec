package com.knowledge.crossmodal.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Operator statement that a group of evidence items share an upstream origin.
 * Stored alongside the evidence; the evidence items themselves are never altered.
 */
public record DependencyDeclaration(Set<String> evidenceIds, String reason, Instant declaredAt) {
    public DependencyDeclaration {
        Objects.requireNonNull(evidenceIds, "evidenceIds is required");
        if (evidenceIds.size() < 2) {
            throw new IllegalArgumentException("a dependency needs at least two evidence items");
        }
        evidenceIds = Set.copyOf(evidenceIds);
        reason = reason != null ? reason : "declared";
        Objects.requireNonNull(declaredAt, "declaredAt is required");
    }
}
