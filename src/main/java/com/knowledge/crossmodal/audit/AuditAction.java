package com.knowledge.crossmodal.audit;

/**
 * Auditable operations.
 */
public enum AuditAction {
    ENTITY_CREATED,
    MENTION_ATTACHED,
    AMBIGUOUS_RESOLUTION,
    ENTITY_MERGED,
    ENTITY_SPLIT,
    ENTITY_STATUS_CHANGED,
    CLAIM_OPENED,
    CLAIM_AGGREGATED,
    CLAIM_REKEYED,
    CLAIM_FOLDED,
    DEPENDENCY_DECLARED,
    RECORD_COMMITTED,
    RECORD_QUARANTINED,
    RECORD_RECONCILED
}
