package com.knowledge.crossmodal.core.model;

/**
 * Lifecycle of a claim record.
 */
public enum ClaimStatus {
    ACTIVE,
    /**
     * Folded into another claim after an entity merge made both refer to the same triple.
     */
    RETIRED
}
