package com.knowledge.crossmodal.ingest;

/**
 * One candidate produced by an extractor: either a {@link MentionPayload} or a
 * {@link RawClaimPayload}.
 */
public interface EvidencePayload {

    String KIND_MENTION = "mention";
    String KIND_CLAIM = "claim";

    String kind();

    String sourceId();

    /**
     * Checks required fields and value ranges.
     *
     * @throws com.knowledge.crossmodal.error.MalformedPayloadException if the payload is unusable
     */
    void validate();
}
