package com.knowledge.crossmodal.core.model;

/**
 * Operator-level identity changes recorded in the merge ledger.
 */
public enum IdentityOperation {
    MERGE,
    SPLIT
}
