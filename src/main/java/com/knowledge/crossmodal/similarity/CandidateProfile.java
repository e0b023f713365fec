package com.knowledge.crossmodal.similarity;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What a similarity function may know about a candidate entity:
 * its type and every normalized surface form and context its mentions carried.
 */
public record CandidateProfile(
        String entityId,
        String typeLabel,
        Set<String> surfaceForms,
        List<String> contexts
) {
    public CandidateProfile {
        Objects.requireNonNull(entityId, "entityId is required");
        surfaceForms = surfaceForms != null ? Set.copyOf(surfaceForms) : Set.of();
        contexts = contexts != null ? List.copyOf(contexts) : List.of();
    }
}
