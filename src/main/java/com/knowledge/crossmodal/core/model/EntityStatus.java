package com.knowledge.crossmodal.core.model;

/**
 * Lifecycle of a canonical entity. Entities are never physically deleted.
 */
public enum EntityStatus {
    /**
     * Newly created; identity not yet confirmed.
     */
    PROVISIONAL,

    /**
     * Identity confidence above the stability threshold and survived a merge-conflict check.
     */
    STABLE,

    /**
     * Kept for audit and referential integrity; excluded from new resolutions.
     */
    RETIRED
}
