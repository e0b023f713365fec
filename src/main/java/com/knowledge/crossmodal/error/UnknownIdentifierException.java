package com.knowledge.crossmodal.error;

/**
 * No entity, claim or record exists for the given identifier.
 */
public class UnknownIdentifierException extends KnowledgeException {

    private final String identifier;

    public UnknownIdentifierException(String kind, String identifier) {
        super(kind + " not found: " + identifier, Provenance.ofRecord(identifier));
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
