package com.knowledge.crossmodal.error;

/**
 * Caller error: a confidence was requested for a claim that has no evidence.
 * The claim is rejected rather than given a fabricated confidence.
 */
public class InsufficientEvidenceException extends KnowledgeException {

    private final String claimId;

    public InsufficientEvidenceException(String claimId, String message) {
        super(message, Provenance.ofRecord(claimId));
        this.claimId = claimId;
    }

    public String getClaimId() {
        return claimId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
