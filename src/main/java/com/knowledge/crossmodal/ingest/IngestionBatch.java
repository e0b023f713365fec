package com.knowledge.crossmodal.ingest;

import com.knowledge.crossmodal.core.model.Mention;

import java.util.List;

/**
 * Validated output of one extraction, or the reason it was rejected. A rejected batch
 * carries no mentions and no claims.
 *
 * @param failure cause of the rejection, may be null
 */
public record IngestionBatch(String sourceId, List<Mention> mentions, List<RawClaimPayload> claims,
                             String rejectionReason, Throwable failure) {

    public IngestionBatch {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        claims = claims != null ? List.copyOf(claims) : List.of();
    }

    public static IngestionBatch accepted(String sourceId, List<Mention> mentions, List<RawClaimPayload> claims) {
        return new IngestionBatch(sourceId, mentions, claims, null, null);
    }

    public static IngestionBatch rejected(String sourceId, String reason, Throwable failure) {
        return new IngestionBatch(sourceId, List.of(), List.of(), reason, failure);
    }

    public boolean isAccepted() {
        return rejectionReason == null;
    }
}
