package com.knowledge.crossmodal.error;

/**
 * Root of the typed error hierarchy. Every error carries the provenance chain
 * so an operator can trace it back to the raw text.
 */
public abstract class KnowledgeException extends RuntimeException {

    private final Provenance provenance;

    protected KnowledgeException(String message, Provenance provenance) {
        super(message);
        this.provenance = provenance != null ? provenance : Provenance.empty();
    }

    protected KnowledgeException(String message, Provenance provenance, Throwable cause) {
        super(message, cause);
        this.provenance = provenance != null ? provenance : Provenance.empty();
    }

    public Provenance getProvenance() {
        return provenance;
    }

    /**
     * Whether the caller can expect a retry of the same identifier-scoped operation to succeed.
     */
    public abstract boolean isRetryable();
}
