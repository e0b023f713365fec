package com.knowledge.crossmodal.ingest;

import com.knowledge.crossmodal.error.MalformedPayloadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IngestionGateway Tests")
class IngestionGatewayTest {

    private final IngestionGateway gateway = new IngestionGateway(Duration.ofMillis(200));

    private static MentionPayload mention(String text, int start) {
        return new MentionPayload("doc-1", new MentionPayload.Span(start, start + text.length()), text, "PERSON",
                0.9, null);
    }

    private static RawClaimPayload claim(Double confidence) {
        return new RawClaimPayload("Tim Cook", "PERSON", "ceo_of", "Apple", "ORG", null, confidence,
                "doc-1", null, null, null, null, null);
    }

    private static EvidenceSource source(CompletableFuture<ExtractionResult> future) {
        return new EvidenceSource() {
            @Override
            public String sourceId() {
                return "doc-1";
            }

            @Override
            public CompletableFuture<ExtractionResult> extract() {
                return future;
            }
        };
    }

    @Test
    @DisplayName("A complete extraction is forwarded whole")
    void acceptsCompleteExtraction() {
        ExtractionResult result = ExtractionResult.complete("doc-1",
                List.of(mention("Tim Cook", 0), mention("Apple", 20), claim(0.8)));

        IngestionBatch batch = gateway.collect(source(CompletableFuture.completedFuture(result)));

        assertTrue(batch.isAccepted());
        assertEquals(2, batch.mentions().size());
        assertEquals(1, batch.claims().size());
        assertNull(batch.failure());
    }

    @Test
    @DisplayName("An extractor that throws is rejected with its cause")
    void rejectsThrowingExtractor() {
        IllegalStateException crash = new IllegalStateException("model not loaded");
        EvidenceSource throwing = new EvidenceSource() {
            @Override
            public String sourceId() {
                return "doc-1";
            }

            @Override
            public CompletableFuture<ExtractionResult> extract() {
                throw crash;
            }
        };

        IngestionBatch batch = gateway.collect(throwing);

        assertFalse(batch.isAccepted());
        assertEquals("doc-1", batch.sourceId());
        assertTrue(batch.rejectionReason().contains("model not loaded"));
        assertSame(crash, batch.failure());
    }

    @Test
    @DisplayName("An incomplete extraction is rejected")
    void rejectsPartialExtraction() {
        IngestionBatch batch = gateway.validate(ExtractionResult.partial("doc-1", List.of(mention("Tim Cook", 0))));

        assertFalse(batch.isAccepted());
        assertTrue(batch.mentions().isEmpty());
        assertTrue(batch.rejectionReason().contains("incomplete"));
    }

    @Test
    @DisplayName("One malformed payload rejects the whole extraction")
    void rejectsOnMalformedPayload() {
        ExtractionResult result = ExtractionResult.complete("doc-1", List.of(mention("Tim Cook", 0), claim(null)));

        IngestionBatch batch = gateway.validate(result);

        assertFalse(batch.isAccepted());
        assertTrue(batch.mentions().isEmpty());
        assertTrue(batch.claims().isEmpty());
        assertInstanceOf(MalformedPayloadException.class, batch.failure());
    }

    @Test
    @DisplayName("A failed extraction is rejected with its cause")
    void rejectsFailedExtraction() {
        IngestionBatch batch = gateway.collect(
                source(CompletableFuture.failedFuture(new IllegalStateException("extractor crashed"))));

        assertFalse(batch.isAccepted());
        assertTrue(batch.rejectionReason().contains("extractor crashed"));
        assertInstanceOf(IllegalStateException.class, batch.failure());
    }

    @Test
    @DisplayName("A cancelled extraction is rejected")
    void rejectsCancelledExtraction() {
        CompletableFuture<ExtractionResult> future = new CompletableFuture<>();
        future.cancel(true);

        IngestionBatch batch = gateway.collect(source(future));

        assertFalse(batch.isAccepted());
        assertEquals("extraction cancelled", batch.rejectionReason());
    }

    @Test
    @DisplayName("A slow extraction times out and is cancelled")
    void rejectsSlowExtraction() {
        CompletableFuture<ExtractionResult> future = new CompletableFuture<>();

        IngestionBatch batch = gateway.collect(source(future));

        assertFalse(batch.isAccepted());
        assertTrue(batch.rejectionReason().contains("timed out"));
        assertTrue(future.isCancelled());
    }

    @Test
    @DisplayName("A missing result is rejected")
    void rejectsNullResult() {
        assertFalse(gateway.validate(null).isAccepted());
    }
}
