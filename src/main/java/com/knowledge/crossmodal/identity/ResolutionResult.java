package com.knowledge.crossmodal.identity;

import com.knowledge.crossmodal.core.model.EntityStatus;

import java.util.List;

/**
 * Outcome of resolving one mention.
 *
 * @param mentionId          the resolved mention
 * @param entityId           entity that now owns the mention
 * @param identityConfidence the entity's identity confidence after the attachment
 * @param status             the entity's lifecycle status after the attachment
 * @param decision           how the mention was resolved
 * @param bestScore          similarity of the chosen candidate, 0 for a newly created entity
 * @param candidates         scored candidates considered, best first
 */
public record ResolutionResult(
        String mentionId,
        String entityId,
        double identityConfidence,
        EntityStatus status,
        ResolutionDecision decision,
        double bestScore,
        List<ScoredCandidate> candidates
) {
    public ResolutionResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public boolean isNewEntity() {
        return decision == ResolutionDecision.CREATED;
    }

    public boolean isAmbiguous() {
        return decision == ResolutionDecision.AMBIGUOUS;
    }
}
