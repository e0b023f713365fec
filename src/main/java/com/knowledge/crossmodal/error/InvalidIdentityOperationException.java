package com.knowledge.crossmodal.error;

/**
 * A merge or split was requested that would violate identity invariants
 * (retired participants, mentions not owned by the entity, emptying an entity).
 */
public class InvalidIdentityOperationException extends KnowledgeException {

    public InvalidIdentityOperationException(String message, Provenance provenance) {
        super(message, provenance);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
