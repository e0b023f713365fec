package com.knowledge.crossmodal.error;

/**
 * Dependency detection could not partition an evidence set.
 * Aggregation degrades to the independence assumption and flags the result as lower-trust.
 */
public class DependencyDetectionException extends KnowledgeException {

    public DependencyDetectionException(String message, Provenance provenance) {
        super(message, provenance);
    }

    public DependencyDetectionException(String message, Provenance provenance, Throwable cause) {
        super(message, provenance, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
