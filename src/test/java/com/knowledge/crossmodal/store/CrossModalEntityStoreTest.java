package com.knowledge.crossmodal.store;

import com.knowledge.crossmodal.audit.AuditAction;
import com.knowledge.crossmodal.audit.AuditService;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.MentionLink;
import com.knowledge.crossmodal.embedding.HashingEmbeddingFunction;
import com.knowledge.crossmodal.error.OperationTimeoutException;
import com.knowledge.crossmodal.error.ProjectionSyncException;
import com.knowledge.crossmodal.error.UnknownIdentifierException;
import com.knowledge.crossmodal.lock.IdentifierLock;
import com.knowledge.crossmodal.lock.LockConfig;
import com.knowledge.crossmodal.metrics.MicrometerMetricsService;
import com.knowledge.crossmodal.projection.CanonicalEntity;
import com.knowledge.crossmodal.projection.GraphProjection;
import com.knowledge.crossmodal.projection.TableRow;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("CrossModalEntityStore Tests")
class CrossModalEntityStoreTest {

    private static final Instant CREATED = Instant.parse("2026-01-15T09:00:00Z");

    private static CanonicalEntity entity(String id, String name, double confidence) {
        Entity entity = Entity.builder()
                .id(id)
                .canonicalName(name)
                .typeLabel("PERSON")
                .link("m-" + id, MentionLink.founding(confidence))
                .identityConfidence(confidence)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build();
        return new CanonicalEntity(entity, List.of(), List.of());
    }

    @Nested
    @DisplayName("Committing")
    class CommitTests {

        private SimpleMeterRegistry registry;
        private AuditService auditService;
        private CrossModalEntityStore store;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            auditService = new AuditService();
            store = CrossModalEntityStore.builder()
                    .auditService(auditService)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();
        }

        @Test
        @DisplayName("First commit publishes version 1 in all three modalities")
        void firstCommitPublishesVersionOne() {
            CommitResult result = store.commit(entity("ent-cook", "Tim Cook", 0.9));

            assertTrue(result.applied());
            assertEquals(1, result.version());

            CrossModalRecord record = store.getRecord("ent-cook").orElseThrow();
            assertEquals(RecordKind.ENTITY, record.kind());
            assertEquals("Tim Cook", record.graph().property("canonical_name"));
            assertEquals("Tim Cook", record.table().column("canonical_name"));
            assertEquals("Tim Cook", record.vector().label());
            assertEquals(0.9, record.table().confidence("identity_confidence"), 1e-9);
            assertTrue(record.isConsistent(store.getEmbeddingFunction()));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RECORD_COMMITTED).size());
        }

        @Test
        @DisplayName("Recommitting identical data is UNCHANGED and keeps the version")
        void recommitIsUnchanged() {
            store.commit(entity("ent-cook", "Tim Cook", 0.9));
            CommitResult again = store.commit(entity("ent-cook", "Tim Cook", 0.9));

            assertEquals(CommitOutcome.UNCHANGED, again.outcome());
            assertEquals(1, again.version());
            assertEquals(1, store.getCommitLog().count(CommitOutcome.APPLIED));
            assertEquals(1, store.getCommitLog().count(CommitOutcome.UNCHANGED));
            assertEquals(1.0, registry.find("knowledge.store.commit").tag("outcome", "UNCHANGED")
                    .counter().count());
        }

        @Test
        @DisplayName("A changed record moves every modality to the next version together")
        void changedRecordBumpsVersion() {
            store.commit(entity("ent-cook", "Tim Cook", 0.9));
            CommitResult result = store.commit(entity("ent-cook", "Timothy Cook", 0.95));

            assertEquals(2, result.version());
            CrossModalRecord record = store.getRecord("ent-cook").orElseThrow();
            assertEquals(2, record.version());
            assertEquals("Timothy Cook", record.graph().property("canonical_name"));
            assertEquals("Timothy Cook", record.vector().label());
            assertTrue(record.isConsistent(store.getEmbeddingFunction()));
            assertEquals(2.0, registry.find("knowledge.store.commit").tag("outcome", "APPLIED")
                    .counter().count());
        }

        @Test
        @DisplayName("Older versions are pruned from the sinks after publication")
        void olderVersionsArePruned() {
            InMemoryProjectionSink<GraphProjection> graphSink = new InMemoryProjectionSink<>(Modality.GRAPH);
            CrossModalEntityStore pruning = CrossModalEntityStore.builder().graphSink(graphSink).build();

            pruning.commit(entity("ent-cook", "Tim Cook", 0.9));
            pruning.commit(entity("ent-cook", "Timothy Cook", 0.9));

            assertEquals(1, graphSink.versionCount("ent-cook"));
            assertTrue(graphSink.read("ent-cook", 2).isPresent());
            assertTrue(graphSink.read("ent-cook", 1).isEmpty());
        }

        @Test
        @DisplayName("Reads by modality return the projection of the current snapshot")
        void readsByModality() {
            store.commit(entity("ent-cook", "Tim Cook", 0.9));

            assertEquals(Optional.of(store.getGraph("ent-cook").orElseThrow()), store.get("ent-cook", Modality.GRAPH));
            assertEquals("entities", store.getTable("ent-cook").orElseThrow().table());
            assertEquals(HashingEmbeddingFunction.DEFAULT_DIMENSION,
                    store.getVector("ent-cook").orElseThrow().embedding().length);
            assertTrue(store.getRecord("ent-unknown").isEmpty());
        }

        @Test
        @DisplayName("Snapshots are ordered by id")
        void snapshotIsOrdered() {
            store.commit(entity("ent-b", "Bob", 0.9));
            store.commit(entity("ent-a", "Alice", 0.9));

            assertEquals(List.of("ent-a", "ent-b"), store.snapshot().stream().map(CrossModalRecord::id).toList());
            assertEquals(2, store.snapshot(RecordKind.ENTITY).size());
            assertTrue(store.snapshot(RecordKind.CLAIM).isEmpty());
        }
    }

    @Nested
    @DisplayName("Reindexing")
    class ReindexTests {

        @Test
        @DisplayName("Reindex rebuilds the record from the canonical provider")
        void reindexUsesProvider() {
            Map<String, CanonicalRecord> canonical = new HashMap<>();
            canonical.put("ent-cook", entity("ent-cook", "Tim Cook", 0.9));
            CrossModalEntityStore store = CrossModalEntityStore.builder()
                    .recordProvider(id -> Optional.ofNullable(canonical.get(id)))
                    .build();

            assertEquals(1, store.reindex("ent-cook").version());

            canonical.put("ent-cook", entity("ent-cook", "Tim Cook", 0.97));
            CommitResult result = store.reindex("ent-cook");

            assertEquals(2, result.version());
            assertEquals(0.97, store.getTable("ent-cook").orElseThrow().confidence("identity_confidence"), 1e-9);
            assertEquals(CommitOutcome.UNCHANGED, store.reindex("ent-cook").outcome());
        }

        @Test
        @DisplayName("Reindexing an unknown record fails")
        void reindexUnknown() {
            CrossModalEntityStore store = CrossModalEntityStore.builder()
                    .recordProvider(id -> Optional.empty())
                    .build();

            assertThrows(UnknownIdentifierException.class, () -> store.reindex("ent-missing"));
        }

        @Test
        @DisplayName("Reindexing without a provider is a configuration error")
        void reindexWithoutProvider() {
            CrossModalEntityStore store = CrossModalEntityStore.builder().build();

            assertThrows(IllegalStateException.class, () -> store.reindex("ent-cook"));
        }
    }

    @Nested
    @DisplayName("Projection failures")
    @ExtendWith(MockitoExtension.class)
    class FailureTests {

        @Mock
        ProjectionSink<TableRow> tableSink;

        private InMemoryProjectionSink<GraphProjection> graphSink;
        private AuditService auditService;
        private SimpleMeterRegistry registry;
        private CrossModalEntityStore store;

        @BeforeEach
        void setUp() {
            when(tableSink.modality()).thenReturn(Modality.TABLE);
            graphSink = new InMemoryProjectionSink<>(Modality.GRAPH);
            auditService = new AuditService();
            registry = new SimpleMeterRegistry();
            Map<String, CanonicalRecord> canonical = Map.of("ent-cook", entity("ent-cook", "Tim Cook", 0.9));
            store = CrossModalEntityStore.builder()
                    .graphSink(graphSink)
                    .tableSink(tableSink)
                    .recordProvider(id -> Optional.ofNullable(canonical.get(id)))
                    .auditService(auditService)
                    .metricsService(new MicrometerMetricsService(registry))
                    .options(StoreOptions.builder().retryPolicy(RetryPolicy.immediate(3)).build())
                    .build();
        }

        @Test
        @DisplayName("A transient failure is retried and the commit succeeds")
        void transientFailureIsRetried() {
            doThrow(new IllegalStateException("table offline"))
                    .doNothing()
                    .when(tableSink).stage(eq("ent-cook"), eq(1L), any());

            CommitResult result = store.commit(entity("ent-cook", "Tim Cook", 0.9));

            assertTrue(result.applied());
            verify(tableSink, times(2)).stage(eq("ent-cook"), eq(1L), any());
            assertEquals(1.0, registry.find("knowledge.projection.retry").tag("modality", "TABLE")
                    .counter().count());
            assertFalse(store.isQuarantined("ent-cook"));
        }

        @Test
        @DisplayName("Exhausted retries roll back staged modalities and quarantine the record")
        void exhaustedRetriesQuarantine() {
            doThrow(new IllegalStateException("table offline"))
                    .when(tableSink).stage(eq("ent-cook"), anyLong(), any());

            ProjectionSyncException error = assertThrows(ProjectionSyncException.class,
                    () -> store.commit(entity("ent-cook", "Tim Cook", 0.9)));

            assertTrue(error.isFatal());
            assertEquals(Modality.TABLE, error.getModality());
            assertEquals(3, error.getAttempts());
            assertTrue(store.isQuarantined("ent-cook"));
            assertTrue(store.getRecord("ent-cook").isEmpty());
            assertEquals(0, graphSink.versionCount("ent-cook"));
            verify(tableSink).discard("ent-cook", 1L);
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RECORD_QUARANTINED).size());
            assertEquals(1, store.getCommitLog().count(CommitOutcome.REJECTED));
            assertEquals(1.0, registry.find("knowledge.projection.failure").tag("modality", "TABLE")
                    .counter().count());
        }

        @Test
        @DisplayName("A quarantined record rejects commits until reconciled")
        void quarantineRejectsThenReconciles() {
            doThrow(new IllegalStateException("table offline"))
                    .doThrow(new IllegalStateException("table offline"))
                    .doThrow(new IllegalStateException("table offline"))
                    .doNothing()
                    .when(tableSink).stage(eq("ent-cook"), anyLong(), any());

            assertThrows(ProjectionSyncException.class, () -> store.commit(entity("ent-cook", "Tim Cook", 0.9)));

            ProjectionSyncException rejected = assertThrows(ProjectionSyncException.class,
                    () -> store.commit(entity("ent-cook", "Tim Cook", 0.9)));
            assertTrue(rejected.isFatal());
            assertEquals(2, store.getCommitLog().count(CommitOutcome.REJECTED));

            CommitResult reconciled = store.reconcile("ent-cook");

            assertTrue(reconciled.applied());
            assertFalse(store.isQuarantined("ent-cook"));
            assertTrue(store.getRecord("ent-cook").orElseThrow().isConsistent(store.getEmbeddingFunction()));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RECORD_RECONCILED).size());
        }
    }

    @Nested
    @DisplayName("Locking")
    @ExtendWith(MockitoExtension.class)
    class LockTests {

        @Mock
        IdentifierLock lock;

        @Test
        @DisplayName("A lock timeout rejects the commit without writing anything")
        void lockTimeoutRejects() {
            doThrow(new OperationTimeoutException("record:ent-cook", "timed out"))
                    .when(lock).lock("record:ent-cook");
            CrossModalEntityStore store = CrossModalEntityStore.builder().lock(lock).build();

            assertThrows(OperationTimeoutException.class, () -> store.commit(entity("ent-cook", "Tim Cook", 0.9)));

            assertTrue(store.getRecord("ent-cook").isEmpty());
            assertEquals(1, store.getCommitLog().count(CommitOutcome.REJECTED));
            verify(lock, never()).unlock("record:ent-cook");
        }

        @Test
        @DisplayName("The record lock is released after a successful commit")
        void lockIsReleased() {
            doNothing().when(lock).lock("record:ent-cook");
            CrossModalEntityStore store = CrossModalEntityStore.builder().lock(lock).build();

            store.commit(entity("ent-cook", "Tim Cook", 0.9));

            verify(lock).unlock("record:ent-cook");
        }
    }

    @Nested
    @DisplayName("Concurrent access")
    class ConcurrencyTests {

        private static final int WRITERS = 4;
        private static final int COMMITS_PER_WRITER = 50;
        private static final int READERS = 4;

        @Test
        @DisplayName("Readers only ever see whole snapshots while commits race")
        void readersSeeWholeSnapshots() throws Exception {
            CrossModalEntityStore store = CrossModalEntityStore.builder()
                    .options(StoreOptions.builder().lockConfig(LockConfig.of(Duration.ofSeconds(30))).build())
                    .build();
            store.commit(entity("ent-cook", "Cook 0", confidenceFor(0)));
            AtomicBoolean writing = new AtomicBoolean(true);
            AtomicInteger torn = new AtomicInteger();
            AtomicInteger reads = new AtomicInteger();

            ExecutorService executor = Executors.newFixedThreadPool(WRITERS + READERS);
            try {
                List<Future<?>> readers = new ArrayList<>();
                for (int r = 0; r < READERS; r++) {
                    readers.add(executor.submit(() -> {
                        long lastVersion = 0;
                        while (writing.get()) {
                            CrossModalRecord record = store.getRecord("ent-cook").orElseThrow();
                            reads.incrementAndGet();
                            int n = Integer.parseInt(record.vector().label().substring("Cook ".length()));
                            boolean whole = record.isConsistent(store.getEmbeddingFunction())
                                    && Math.abs(record.table().confidence("identity_confidence")
                                    - confidenceFor(n)) < 1e-12
                                    && record.version() >= lastVersion;
                            if (!whole) {
                                torn.incrementAndGet();
                            }
                            lastVersion = record.version();
                        }
                        return null;
                    }));
                }

                List<Future<?>> writers = new ArrayList<>();
                for (int w = 0; w < WRITERS; w++) {
                    final int writerId = w;
                    writers.add(executor.submit(() -> {
                        for (int i = 1; i <= COMMITS_PER_WRITER; i++) {
                            int n = writerId * COMMITS_PER_WRITER + i;
                            store.commit(entity("ent-cook", "Cook " + n, confidenceFor(n)));
                        }
                        return null;
                    }));
                }
                for (Future<?> f : writers) {
                    f.get(60, TimeUnit.SECONDS);
                }
                writing.set(false);
                for (Future<?> f : readers) {
                    f.get(60, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(0, torn.get(), "torn or regressing snapshots out of " + reads.get() + " reads");
            assertEquals(1 + WRITERS * COMMITS_PER_WRITER, store.getRecord("ent-cook").orElseThrow().version());
            assertEquals(WRITERS * COMMITS_PER_WRITER + 1, store.getCommitLog().count(CommitOutcome.APPLIED));
        }

        private double confidenceFor(int n) {
            return 0.5 + n / 1000.0;
        }
    }
}
