package com.knowledge.crossmodal.error;

/**
 * An identifier-scoped operation could not acquire its lock within the configured bound.
 * Safe to retry: operations are keyed by stable identifiers.
 */
public class OperationTimeoutException extends KnowledgeException {

    private final String key;

    public OperationTimeoutException(String key, String message) {
        super(message, Provenance.ofRecord(key));
        this.key = key;
    }

    public OperationTimeoutException(String key, String message, Throwable cause) {
        super(message, Provenance.ofRecord(key), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
