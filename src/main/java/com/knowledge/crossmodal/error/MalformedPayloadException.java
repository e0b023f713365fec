package com.knowledge.crossmodal.error;

/**
 * An extractor payload failed validation at the ingestion boundary.
 */
public class MalformedPayloadException extends KnowledgeException {

    public MalformedPayloadException(String message, Provenance provenance) {
        super(message, provenance);
    }

    public MalformedPayloadException(String message, Provenance provenance, Throwable cause) {
        super(message, provenance, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
