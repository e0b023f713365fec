package com.knowledge.crossmodal.identity;

/**
 * How a mention was resolved.
 */
public enum ResolutionDecision {
    /**
     * No candidate reached the match threshold; a provisional entity was created.
     */
    CREATED,

    /**
     * A single best candidate reached the threshold.
     */
    MATCHED,

    /**
     * Several candidates tied within the ambiguity band; attached with a penalty.
     */
    AMBIGUOUS,

    /**
     * The mention was already owned by an entity (retried submission).
     */
    ALREADY_RESOLVED
}
