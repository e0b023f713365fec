package com.knowledge.crossmodal.error;

import com.knowledge.crossmodal.store.Modality;

import java.util.Locale;

/**
 * A projection write could not be completed and the commit was rolled back.
 * {@link #isFatal()} is true once retries were exhausted and the record has been
 * quarantined for manual reconciliation.
 */
public class ProjectionSyncException extends KnowledgeException {

    private final String recordId;
    private final Modality modality;
    private final int attempts;
    private final boolean fatal;

    public ProjectionSyncException(String recordId, Modality modality, int attempts, boolean fatal,
                                   Provenance provenance, Throwable cause) {
        super("Projection sync failed for record " + recordId
                + (modality != null ? " (" + modality.name().toLowerCase(Locale.ROOT) + ")" : "")
                + " after " + attempts + " attempt(s)" + (fatal ? "; record quarantined" : ""),
                provenance, cause);
        this.recordId = recordId;
        this.modality = modality;
        this.attempts = attempts;
        this.fatal = fatal;
    }

    public static ProjectionSyncException quarantined(String recordId, Provenance provenance) {
        return new ProjectionSyncException(recordId, null, 0, true, provenance, null);
    }

    public String getRecordId() {
        return recordId;
    }

    public Modality getModality() {
        return modality;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isFatal() {
        return fatal;
    }

    @Override
    public boolean isRetryable() {
        return !fatal;
    }
}
