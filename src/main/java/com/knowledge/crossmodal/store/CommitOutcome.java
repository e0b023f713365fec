package com.knowledge.crossmodal.store;

/**
 * Result of one commit attempt, as recorded in the commit log.
 */
public enum CommitOutcome {
    /**
     * A new version became visible in all three modalities.
     */
    APPLIED,

    /**
     * The derived projections equal the current version; nothing was written.
     */
    UNCHANGED,

    /**
     * Nothing became visible: staging failed, the record is quarantined or the lock timed out.
     */
    REJECTED
}
