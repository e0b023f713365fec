package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.ingest.EvidencePayload;
import com.knowledge.crossmodal.ingest.EvidenceSource;
import com.knowledge.crossmodal.ingest.ExtractionResult;
import com.knowledge.crossmodal.ingest.IngestionGateway;
import com.knowledge.crossmodal.ingest.MentionPayload;
import com.knowledge.crossmodal.ingest.RawClaimPayload;
import com.knowledge.crossmodal.store.CrossModalRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KnowledgePipeline Tests")
class KnowledgePipelineTest {

    private CrossModalKnowledgeBase kb;
    private KnowledgePipeline pipeline;

    @BeforeEach
    void setUp() {
        kb = CrossModalKnowledgeBase.builder().build();
        pipeline = new KnowledgePipeline(kb, new IngestionGateway(Duration.ofSeconds(2)), 4);
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
        kb.close();
    }

    private static MentionPayload mention(String source, String text, String type, int start) {
        return new MentionPayload(source, new MentionPayload.Span(start, start + text.length()), text, type, 0.9, null);
    }

    private static RawClaimPayload worksFor(String source, double confidence) {
        return new RawClaimPayload("Tim Cook", "PERSON", "works_for", "Apple", "ORG", "entity", confidence,
                source, null, null, null, null, null);
    }

    private static EvidenceSource source(String sourceId, CompletableFuture<ExtractionResult> extraction) {
        return new EvidenceSource() {
            @Override
            public String sourceId() {
                return sourceId;
            }

            @Override
            public CompletableFuture<ExtractionResult> extract() {
                return extraction;
            }
        };
    }

    private static EvidenceSource completed(String sourceId, EvidencePayload... payloads) {
        return source(sourceId, CompletableFuture.completedFuture(ExtractionResult.complete(sourceId, List.of(payloads))));
    }

    @Test
    @DisplayName("Claims may reference entities first mentioned in another document")
    void crossDocumentReferences() {
        List<IngestionOutcome> outcomes = pipeline.run(List.of(
                completed("doc-claims", worksFor("doc-claims", 0.8)),
                completed("doc-people", mention("doc-people", "Tim Cook", "PERSON", 0)),
                completed("doc-orgs", mention("doc-orgs", "Apple", "ORG", 0))));

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.stream().noneMatch(IngestionOutcome::hasFailures));
        assertEquals(1, outcomes.get(0).claims().size());
        Claim claim = kb.getClaim(outcomes.get(0).claims().get(0).claimId()).orElseThrow();
        assertEquals(0.8, claim.getPosterior().getAsDouble(), 1e-9);
        assertEquals("Tim Cook works_for Apple", kb.getVector(claim.getId()).orElseThrow().label());
    }

    @Test
    @DisplayName("A failed or partial extraction is rejected without affecting the others")
    void failedSourceIsRejected() {
        List<IngestionOutcome> outcomes = pipeline.run(List.of(
                completed("doc-a", mention("doc-a", "Tim Cook", "PERSON", 0)),
                source("doc-broken", CompletableFuture.failedFuture(new IllegalStateException("extractor crashed"))),
                source("doc-partial", CompletableFuture.completedFuture(
                        ExtractionResult.partial("doc-partial", List.of(mention("doc-partial", "Apple", "ORG", 0)))))));

        assertTrue(outcomes.get(0).accepted());
        assertFalse(outcomes.get(1).accepted());
        assertEquals("doc-broken", outcomes.get(1).sourceId());
        assertFalse(outcomes.get(2).accepted());
        assertEquals(1, kb.listEntities().size());
        assertTrue(kb.lookup("Apple", "ORG").isEmpty());
    }

    @Test
    @DisplayName("An extractor that throws does not abort the other sources")
    void throwingExtractorIsIsolated() {
        EvidenceSource throwing = new EvidenceSource() {
            @Override
            public String sourceId() {
                return "doc-throws";
            }

            @Override
            public CompletableFuture<ExtractionResult> extract() {
                throw new IllegalStateException("extractor misconfigured");
            }
        };

        List<IngestionOutcome> outcomes = pipeline.run(List.of(
                throwing,
                completed("doc-a", mention("doc-a", "Tim Cook", "PERSON", 0), mention("doc-a", "Apple", "ORG", 20),
                        worksFor("doc-a", 0.8))));

        assertEquals(2, outcomes.size());
        assertFalse(outcomes.get(0).accepted());
        assertEquals("doc-throws", outcomes.get(0).sourceId());
        assertTrue(outcomes.get(1).accepted());
        assertFalse(outcomes.get(1).hasFailures());
        assertEquals(2, kb.listEntities().size());
        assertEquals(1, kb.listClaims().size());
    }

    @Test
    @DisplayName("Outcomes keep source order and the store ends consistent")
    void manySourcesInParallel() {
        List<EvidenceSource> sources = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String sourceId = "doc-" + i;
            sources.add(completed(sourceId,
                    mention(sourceId, "Tim Cook", "PERSON", 0),
                    mention(sourceId, "Apple", "ORG", 20),
                    worksFor(sourceId, 0.6)));
        }

        List<IngestionOutcome> outcomes = pipeline.run(sources);

        for (int i = 0; i < outcomes.size(); i++) {
            assertEquals("doc-" + i, outcomes.get(i).sourceId());
            assertTrue(outcomes.get(i).accepted());
            assertFalse(outcomes.get(i).hasFailures());
        }
        assertEquals(2, kb.listEntities().size());
        assertEquals(1, kb.listClaims().size());
        Claim claim = kb.listClaims().get(0);
        assertEquals(12, claim.getEvidence().size());
        assertTrue(claim.getPosterior().getAsDouble() > 0.6);
        for (CrossModalRecord record : kb.getStore().snapshot()) {
            assertTrue(record.isConsistent(kb.getStore().getEmbeddingFunction()));
        }
    }

    @Test
    @DisplayName("Parallelism must be positive")
    void invalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new KnowledgePipeline(kb, 0));
    }
}
