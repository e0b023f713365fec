package com.knowledge.crossmodal.ingest;

import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.error.MalformedPayloadException;
import com.knowledge.crossmodal.error.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Boundary between extractors and the knowledge base. An extraction is forwarded whole or
 * not at all: cancelled, failed, timed-out or incomplete extractions and extractions with
 * a malformed payload produce a rejected batch.
 */
public class IngestionGateway {
    private static final Logger log = LoggerFactory.getLogger(IngestionGateway.class);

    private final Duration timeout;

    public IngestionGateway() {
        this(Duration.ofMinutes(1));
    }

    public IngestionGateway(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Starts the source's extraction and collects it. An extractor that throws instead of
     * returning a failed future is rejected like one that failed asynchronously.
     */
    public IngestionBatch collect(EvidenceSource source) {
        String sourceId = source.sourceId();
        Future<ExtractionResult> extraction;
        try {
            extraction = source.extract();
        } catch (RuntimeException e) {
            return reject(sourceId, "extraction failed: " + e.getMessage(), e);
        }
        if (extraction == null) {
            return reject(sourceId, "extraction returned no result", null);
        }
        return collect(sourceId, extraction);
    }

    /**
     * Waits for the extraction and validates it.
     */
    public IngestionBatch collect(String sourceId, Future<ExtractionResult> extraction) {
        ExtractionResult result;
        try {
            result = extraction.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (CancellationException e) {
            return reject(sourceId, "extraction cancelled", e);
        } catch (ExecutionException e) {
            return reject(sourceId, "extraction failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            extraction.cancel(true);
            return reject(sourceId, "extraction timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            extraction.cancel(true);
            return reject(sourceId, "interrupted while waiting for extraction", e);
        }
        return validate(result);
    }

    /**
     * Validates a finished extraction.
     */
    public IngestionBatch validate(ExtractionResult result) {
        if (result == null) {
            return reject("unknown", "extraction returned no result", null);
        }
        if (!result.complete()) {
            return reject(result.sourceId(), "extraction incomplete (" + result.payloads().size() + " payloads)", null);
        }
        List<Mention> mentions = new ArrayList<>();
        List<RawClaimPayload> claims = new ArrayList<>();
        try {
            for (EvidencePayload payload : result.payloads()) {
                if (payload instanceof MentionPayload mention) {
                    mentions.add(mention.toMention());
                } else if (payload instanceof RawClaimPayload claim) {
                    claim.validate();
                    claims.add(claim);
                } else {
                    throw new MalformedPayloadException("unsupported payload " + payload.getClass().getSimpleName(),
                            Provenance.builder().source(result.sourceId()).build());
                }
            }
        } catch (MalformedPayloadException e) {
            return reject(result.sourceId(), e.getMessage(), e);
        }
        log.info("extraction.accepted sourceId={} mentions={} claims={}", result.sourceId(), mentions.size(), claims.size());
        return IngestionBatch.accepted(result.sourceId(), mentions, claims);
    }

    private static IngestionBatch reject(String sourceId, String reason, Throwable cause) {
        log.warn("extraction.rejected sourceId={} reason='{}'", sourceId, reason, cause);
        return IngestionBatch.rejected(sourceId, reason, cause);
    }
}
