package com.knowledge.crossmodal.aggregation;

import java.util.Objects;

/**
 * Undirected dependency between two evidence items. The ids are stored in ascending order.
 *
 * @param strength dependency strength in (0, 1]; 1 means the items are fully redundant
 */
public record DependencyLink(String firstEvidenceId, String secondEvidenceId, DependencyKind kind, double strength) {

    public DependencyLink {
        Objects.requireNonNull(firstEvidenceId, "firstEvidenceId is required");
        Objects.requireNonNull(secondEvidenceId, "secondEvidenceId is required");
        Objects.requireNonNull(kind, "kind is required");
        if (firstEvidenceId.equals(secondEvidenceId)) {
            throw new IllegalArgumentException("an evidence item cannot depend on itself");
        }
        if (!(strength > 0.0 && strength <= 1.0)) {
            throw new IllegalArgumentException("strength must be in (0, 1]");
        }
        if (firstEvidenceId.compareTo(secondEvidenceId) > 0) {
            String tmp = firstEvidenceId;
            firstEvidenceId = secondEvidenceId;
            secondEvidenceId = tmp;
        }
    }

    public static DependencyLink of(String a, String b, DependencyKind kind, double strength) {
        return new DependencyLink(a, b, kind, strength);
    }
}
