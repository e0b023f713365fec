package com.knowledge.crossmodal.error;

/**
 * A raw claim names a subject by surface text that does not resolve to any known entity.
 */
public class UnresolvedReferenceException extends KnowledgeException {

    private final String surfaceText;

    public UnresolvedReferenceException(String surfaceText, Provenance provenance) {
        super("No entity resolves from reference '" + surfaceText + "'", provenance);
        this.surfaceText = surfaceText;
    }

    public String getSurfaceText() {
        return surfaceText;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
