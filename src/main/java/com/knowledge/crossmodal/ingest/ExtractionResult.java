package com.knowledge.crossmodal.ingest;

import java.util.List;
import java.util.Objects;

/**
 * Everything an extractor produced for one source document.
 *
 * @param complete false when the extractor stopped early; incomplete results are never ingested
 */
public record ExtractionResult(String sourceId, List<EvidencePayload> payloads, boolean complete) {

    public ExtractionResult {
        Objects.requireNonNull(sourceId, "sourceId is required");
        payloads = payloads != null ? List.copyOf(payloads) : List.of();
    }

    public static ExtractionResult complete(String sourceId, List<EvidencePayload> payloads) {
        return new ExtractionResult(sourceId, payloads, true);
    }

    public static ExtractionResult partial(String sourceId, List<EvidencePayload> payloads) {
        return new ExtractionResult(sourceId, payloads, false);
    }
}
