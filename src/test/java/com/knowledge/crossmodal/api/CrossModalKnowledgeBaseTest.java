package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.aggregation.AuditTrail;
import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.ClaimKey;
import com.knowledge.crossmodal.core.model.ClaimObject;
import com.knowledge.crossmodal.core.model.ClaimStatus;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.EntityStatus;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.core.model.TextSpan;
import com.knowledge.crossmodal.embedding.CacheConfig;
import com.knowledge.crossmodal.error.AmbiguousResolutionException;
import com.knowledge.crossmodal.error.UnresolvedReferenceException;
import com.knowledge.crossmodal.identity.ResolutionResult;
import com.knowledge.crossmodal.ingest.IngestionBatch;
import com.knowledge.crossmodal.ingest.RawClaimPayload;
import com.knowledge.crossmodal.metrics.MicrometerMetricsService;
import com.knowledge.crossmodal.projection.GraphEdge;
import com.knowledge.crossmodal.projection.TableRow;
import com.knowledge.crossmodal.store.CrossModalRecord;
import com.knowledge.crossmodal.store.Modality;
import com.knowledge.crossmodal.store.RecordKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossModalKnowledgeBase Tests")
class CrossModalKnowledgeBaseTest {

    private static final double NAIVE_POSTERIOR = 108.0 / 109.0;

    private SimpleMeterRegistry registry;
    private CrossModalKnowledgeBase kb;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        kb = CrossModalKnowledgeBase.builder()
                .context(KnowledgeContext.builder()
                        .metricsService(new MicrometerMetricsService(registry))
                        .build())
                .cacheConfig(CacheConfig.defaults())
                .build();
    }

    @AfterEach
    void tearDown() {
        kb.close();
    }

    private static Mention mention(String source, int start, String text, String type, double confidence) {
        return Mention.of(source, new TextSpan(start, start + text.length()), text, type, confidence);
    }

    private static RawClaimPayload worksFor(String source, String evidenceId, double confidence) {
        return new RawClaimPayload("Tim Cook", "PERSON", "works_for", "Apple", "ORG", "entity", confidence,
                source, evidenceId, null, null, null, null);
    }

    private void assertStoreConsistent() {
        for (CrossModalRecord record : kb.getStore().snapshot()) {
            assertTrue(record.isConsistent(kb.getStore().getEmbeddingFunction()),
                    () -> "inconsistent record " + record.id());
        }
        for (Entity entity : kb.listEntities()) {
            TableRow row = kb.getTable(entity.getId()).orElseThrow();
            assertEquals(entity.getCanonicalName(), row.column("canonical_name"));
            assertEquals(entity.getIdentityConfidence(), row.confidence("identity_confidence"), 1e-12);
            assertEquals(entity.getStatus().name(), row.column("status"));
        }
        for (Claim claim : kb.listClaims()) {
            TableRow row = kb.getTable(claim.getId()).orElseThrow();
            assertEquals(claim.getStatus().name(), row.column("status"));
            assertEquals(claim.getKey().subjectId(), row.column("subject_id"));
            if (claim.getPosterior().isPresent()) {
                assertEquals(claim.getPosterior().getAsDouble(), row.confidence("posterior_confidence"), 1e-12);
            }
        }
    }

    @Nested
    @DisplayName("Tim Cook works for Apple")
    class ScenarioTests {

        @Test
        @DisplayName("Mentions across documents converge on one entity with rising confidence")
        void mentionsConverge() {
            ResolutionResult tim = kb.resolve(mention("doc-a", 0, "Tim Cook", "PERSON", 0.9));
            ResolutionResult cook = kb.resolve(mention("doc-a", 40, "T. Cook, CEO", "PERSON", 0.85));

            assertEquals(tim.entityId(), cook.entityId());
            double afterDocA = kb.getEntity(tim.entityId()).orElseThrow().getIdentityConfidence();
            assertTrue(afterDocA >= 0.85, "confidence " + afterDocA);
            assertStoreConsistent();

            ResolutionResult docB = kb.resolve(mention("doc-b", 3, "Tim Cook", "PERSON", 0.95));

            assertEquals(tim.entityId(), docB.entityId());
            Entity entity = kb.getEntity(tim.entityId()).orElseThrow();
            assertTrue(entity.getIdentityConfidence() > afterDocA);
            assertEquals(3, entity.getMentionLinks().size());
            assertEquals(1, kb.listEntities().size());
            assertEquals(3, kb.getTable(entity.getId()).orElseThrow().column("mention_count"));
            assertStoreConsistent();
        }

        @Test
        @DisplayName("Independent evidence compounds and declared dependence lowers the posterior")
        void evidenceCompoundsThenDiscounts() {
            String cook = kb.resolve(mention("doc-a", 0, "Tim Cook", "PERSON", 0.9)).entityId();
            String apple = kb.resolve(mention("doc-a", 20, "Apple", "ORG", 0.95)).entityId();

            kb.ingestClaim(worksFor("reuters", "e1", 0.8));
            kb.ingestClaim(worksFor("bloomberg", "e2", 0.75));
            ClaimResult third = kb.ingestClaim(worksFor("ft", "e3", 0.9));

            assertEquals(NAIVE_POSTERIOR, third.posterior(), 1e-9);
            assertTrue(third.posterior() > 0.9);
            Claim claim = kb.getClaim(third.claimId()).orElseThrow();
            assertEquals(new ClaimKey(cook, "works_for", ClaimObject.entity(apple)), claim.getKey());
            assertEquals(3, claim.getEvidence().size());
            assertStoreConsistent();

            CrossModalRecord claimRecord = kb.getRecord(third.claimId()).orElseThrow();
            assertEquals(RecordKind.CLAIM, claimRecord.kind());
            assertEquals("Tim Cook works_for Apple", claimRecord.vector().label());
            GraphEdge edge = kb.getGraph(cook).orElseThrow().edges().get(0);
            assertEquals("works_for", edge.predicate());
            assertEquals(apple, edge.targetId());
            assertEquals(NAIVE_POSTERIOR, edge.confidence(), 1e-9);
            long versionBefore = claimRecord.version();

            double discounted = kb.declareDependency(third.claimId(), Set.of("e1", "e2"), "same wire report");

            assertTrue(discounted < NAIVE_POSTERIOR);
            assertTrue(discounted > 0.9);
            assertEquals(36.0 / 37.0, discounted, 1e-9);
            AuditTrail trail = kb.explain(third.claimId());
            assertTrue(trail.isClustered());
            assertEquals(discounted, trail.posterior(), 1e-12);
            assertEquals(2, trail.clusters().size());
            assertTrue(kb.getRecord(third.claimId()).orElseThrow().version() > versionBefore);
            assertEquals(discounted, kb.getGraph(cook).orElseThrow().edges().get(0).confidence(), 1e-12);
            assertStoreConsistent();
        }

        @Test
        @DisplayName("Resubmitting the same raw claim does not change the posterior")
        void resubmissionIsIdempotent() {
            kb.resolve(mention("doc-a", 0, "Tim Cook", "PERSON", 0.9));
            kb.resolve(mention("doc-a", 20, "Apple", "ORG", 0.95));

            ClaimResult first = kb.ingestClaim(worksFor("reuters", null, 0.8));
            ClaimResult again = kb.ingestClaim(worksFor("reuters", null, 0.8));

            assertEquals(first.evidenceId(), again.evidenceId());
            assertEquals(first.posterior(), again.posterior(), 0.0);
            assertEquals(1, kb.getClaim(first.claimId()).orElseThrow().getEvidence().size());
        }
    }

    @Nested
    @DisplayName("Raw claim references")
    class ReferenceTests {

        @Test
        @DisplayName("An unknown subject is an unresolved reference")
        void unknownSubject() {
            UnresolvedReferenceException ex = assertThrows(UnresolvedReferenceException.class,
                    () -> kb.ingestClaim(worksFor("reuters", "e1", 0.8)));

            assertTrue(ex.getProvenance().evidenceIds().contains("e1"));
            assertTrue(kb.listClaims().isEmpty());
        }

        @Test
        @DisplayName("An unmatched object falls back to a literal unless declared an entity")
        void literalFallback() {
            kb.resolve(mention("doc-a", 0, "Tim Cook", "PERSON", 0.9));

            ClaimResult born = kb.ingestClaim(new RawClaimPayload("Tim Cook", "PERSON", "born_in", "Mobile, Alabama",
                    "GPE", null, 0.7, "wiki", "e9", null, null, null, null));

            Claim claim = kb.getClaim(born.claimId()).orElseThrow();
            assertFalse(claim.getKey().object().isEntity());
            assertEquals("Mobile, Alabama", claim.getKey().object().literal());
            assertThrows(UnresolvedReferenceException.class, () -> kb.ingestClaim(worksFor("reuters", "e1", 0.8)));
            assertStoreConsistent();
        }
    }

    @Nested
    @DisplayName("Identity operations reach every modality")
    class IdentityOperationTests {

        @Test
        @DisplayName("A merge folds duplicate claims and retires the absorbed records")
        void mergeFoldsClaims() {
            String tim = kb.resolve(mention("doc-a", 0, "Tim Cook", "PERSON", 0.9)).entityId();
            String ceo = kb.resolve(mention("doc-b", 0, "Apple CEO", "PERSON", 0.9)).entityId();
            String apple = kb.resolve(mention("doc-a", 20, "Apple", "ORG", 0.95)).entityId();
            assertNotEquals(tim, ceo);

            String timClaim = kb.openClaim(new ClaimKey(tim, "works_for", ClaimObject.entity(apple)));
            kb.aggregate(timClaim, List.of(EvidenceItem.builder().evidenceId("e1").sourceId("reuters")
                    .confidence(0.8).build()));
            String ceoClaim = kb.openClaim(new ClaimKey(ceo, "works_for", ClaimObject.entity(apple)));
            kb.aggregate(ceoClaim, List.of(EvidenceItem.builder().evidenceId("e2").sourceId("ft")
                    .confidence(0.9).build()));

            String survivor = kb.merge(tim, ceo);
            String retired = survivor.equals(tim) ? ceo : tim;
            String survivingClaim = survivor.equals(tim) ? timClaim : ceoClaim;
            String foldedClaim = survivor.equals(tim) ? ceoClaim : timClaim;

            assertEquals(EntityStatus.RETIRED, kb.getEntity(retired).orElseThrow().getStatus());
            assertEquals(survivor, kb.getTable(retired).orElseThrow().column("merged_into"));
            assertEquals(ClaimStatus.RETIRED, kb.getClaim(foldedClaim).orElseThrow().getStatus());
            assertEquals("RETIRED", kb.getGraph(foldedClaim).orElseThrow().property("status"));

            Claim holder = kb.getClaim(survivingClaim).orElseThrow();
            assertEquals(2, holder.getEvidence().size());
            assertEquals(36.0 / 37.0, holder.getPosterior().getAsDouble(), 1e-9);
            assertTrue(kb.getGraph(retired).orElseThrow().edges().isEmpty());
            assertEquals(1, kb.getGraph(survivor).orElseThrow().edges().size());
            assertStoreConsistent();
        }

        @Test
        @DisplayName("A split creates a new entity record and updates the source")
        void splitReachesStore() {
            Mention first = mention("doc-a", 0, "Tim Cook", "PERSON", 0.9);
            Mention second = mention("doc-b", 0, "Tim Cook", "PERSON", 0.9);
            String id = kb.resolve(first).entityId();
            kb.resolve(second);

            String detached = kb.split(id, List.of(second.id()));

            assertEquals(1, kb.getTable(id).orElseThrow().column("mention_count"));
            assertEquals(1, kb.getTable(detached).orElseThrow().column("mention_count"));
            assertEquals(2, kb.tableView().entities().size());
            assertStoreConsistent();
        }
    }

    @Nested
    @DisplayName("Batches, views and export")
    class BatchTests {

        @Test
        @DisplayName("A batch reports resolutions, claims and per-item failures")
        void ingestBatch() {
            IngestionBatch batch = IngestionBatch.accepted("doc-a",
                    List.of(mention("doc-a", 0, "Tim Cook", "PERSON", 0.9),
                            mention("doc-a", 20, "Apple", "ORG", 0.95)),
                    List.of(worksFor("doc-a", "e1", 0.8),
                            new RawClaimPayload("Satya Nadella", "PERSON", "works_for", "Microsoft", "ORG", null,
                                    0.8, "doc-a", "e2", null, null, null, null)));

            IngestionOutcome outcome = kb.ingest(batch);

            assertTrue(outcome.accepted());
            assertEquals(2, outcome.resolutions().size());
            assertEquals(1, outcome.claims().size());
            assertEquals(1, outcome.failures().size());
            assertInstanceOf(UnresolvedReferenceException.class, outcome.failures().get(0));
        }

        @Test
        @DisplayName("A rejected batch contributes nothing")
        void rejectedBatch() {
            IngestionOutcome outcome = kb.ingest(IngestionBatch.rejected("doc-x", "extraction incomplete", null));

            assertFalse(outcome.accepted());
            assertEquals("extraction incomplete", outcome.rejectionReason());
            assertTrue(kb.listEntities().isEmpty());
        }

        @Test
        @DisplayName("An ambiguous mention is attached and reported")
        void ambiguousMentionIsReported() {
            Mention a = mention("doc-a", 0, "John Smith", "PERSON", 0.9);
            Mention b = mention("doc-b", 0, "John Smith", "PERSON", 0.9);
            String first = kb.resolve(a).entityId();
            kb.resolve(b);
            kb.split(first, List.of(b.id()));

            StageResult<ResolutionResult> stage = kb.resolveMentions(IngestionBatch.accepted("doc-c",
                    List.of(mention("doc-c", 0, "J. Smith", "PERSON", 0.9)), List.of()));

            assertEquals(1, stage.results().size());
            assertTrue(stage.results().get(0).isAmbiguous());
            assertInstanceOf(AmbiguousResolutionException.class, stage.failures().get(0));
            assertStoreConsistent();
        }

        @Test
        @DisplayName("Views, reads by modality and export reflect the same state")
        void viewsAndExport() {
            String cook = kb.resolve(mention("doc-a", 0, "Tim Cook", "PERSON", 0.9)).entityId();
            kb.resolve(mention("doc-a", 20, "Apple", "ORG", 0.95));
            ClaimResult claim = kb.ingestClaim(worksFor("reuters", "e1", 0.8));

            assertEquals(3, kb.graphView().size());
            assertEquals(1, kb.tableView().claims().size());
            assertEquals(cook, kb.vectorView().nearest(
                    kb.getStore().getEmbeddingFunction().embed("Tim Cook"), 1).get(0).id());
            assertTrue(kb.get(claim.claimId(), Modality.VECTOR).isPresent());
            assertTrue(registry.find("knowledge.store.commit").tag("outcome", "APPLIED").counter().count() >= 3);

            var export = kb.export();
            assertEquals(2, export.get("entities").size());
            assertEquals(1, export.get("claims").size());
            assertEquals(kb.getCommitLog().size(), export.get("commit_log").size());
        }
    }
}
