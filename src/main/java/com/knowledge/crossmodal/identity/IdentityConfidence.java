package com.knowledge.crossmodal.identity;

import com.knowledge.crossmodal.core.model.EntityStatus;
import com.knowledge.crossmodal.core.model.MentionLink;

import java.util.Collection;

/**
 * Identity confidence of an entity from its mention links:
 * the similarity-weighted mean of mention confidences, scaled by
 * (1 - ambiguityPenalty) for every ambiguous link.
 */
final class IdentityConfidence {

    private IdentityConfidence() {
    }

    static double compute(Collection<MentionLink> links, double ambiguityPenalty) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        int ambiguous = 0;
        for (MentionLink link : links) {
            weighted += link.weight() * link.confidence();
            totalWeight += link.weight();
            if (link.ambiguous()) {
                ambiguous++;
            }
        }
        if (totalWeight == 0.0) {
            return 0.0;
        }
        double confidence = weighted / totalWeight * Math.pow(1.0 - ambiguityPenalty, ambiguous);
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    /**
     * PROVISIONAL/STABLE transition. RETIRED is terminal.
     */
    static EntityStatus status(EntityStatus current, double confidence, int conflictChecksPassed,
                               double stableThreshold) {
        if (current == EntityStatus.RETIRED) {
            return EntityStatus.RETIRED;
        }
        return confidence >= stableThreshold && conflictChecksPassed >= 1
                ? EntityStatus.STABLE
                : EntityStatus.PROVISIONAL;
    }
}
