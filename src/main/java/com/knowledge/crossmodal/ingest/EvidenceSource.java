package com.knowledge.crossmodal.ingest;

import java.util.concurrent.CompletableFuture;

/**
 * External extractor for one source document. Extraction runs asynchronously; the
 * returned future may fail or be cancelled.
 */
public interface EvidenceSource {

    String sourceId();

    CompletableFuture<ExtractionResult> extract();
}
