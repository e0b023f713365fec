package com.knowledge.crossmodal.store;

import com.knowledge.crossmodal.audit.AuditAction;
import com.knowledge.crossmodal.audit.AuditService;
import com.knowledge.crossmodal.embedding.EmbeddingFunction;
import com.knowledge.crossmodal.embedding.HashingEmbeddingFunction;
import com.knowledge.crossmodal.error.OperationTimeoutException;
import com.knowledge.crossmodal.error.ProjectionSyncException;
import com.knowledge.crossmodal.error.Provenance;
import com.knowledge.crossmodal.error.UnknownIdentifierException;
import com.knowledge.crossmodal.lock.IdentifierLock;
import com.knowledge.crossmodal.lock.LocalIdentifierLock;
import com.knowledge.crossmodal.logging.LogContext;
import com.knowledge.crossmodal.metrics.MetricsService;
import com.knowledge.crossmodal.metrics.NoOpMetricsService;
import com.knowledge.crossmodal.projection.GraphProjection;
import com.knowledge.crossmodal.projection.GraphProjector;
import com.knowledge.crossmodal.projection.GraphView;
import com.knowledge.crossmodal.projection.Projector;
import com.knowledge.crossmodal.projection.TableProjector;
import com.knowledge.crossmodal.projection.TableRow;
import com.knowledge.crossmodal.projection.TableView;
import com.knowledge.crossmodal.projection.VectorProjection;
import com.knowledge.crossmodal.projection.VectorProjector;
import com.knowledge.crossmodal.projection.VectorView;
import com.knowledge.crossmodal.tracing.NoOpTracingService;
import com.knowledge.crossmodal.tracing.Span;
import com.knowledge.crossmodal.tracing.TraceOperation;
import com.knowledge.crossmodal.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds every committed record in graph, table and vector form.
 *
 * <p>A commit stages the three projections into their sinks and then replaces the record's
 * snapshot in one map write. Readers only ever see whole snapshots, so they need no lock and
 * can never observe a modality that is ahead of the others. Commits to one record are
 * serialised on that record's lock; different records commit in parallel.</p>
 */
public class CrossModalEntityStore {
    private static final Logger log = LoggerFactory.getLogger(CrossModalEntityStore.class);

    private static final String RECORD_LOCK_PREFIX = "record:";

    private final Projector<GraphProjection> graphProjector;
    private final Projector<TableRow> tableProjector;
    private final Projector<VectorProjection> vectorProjector;
    private final ProjectionSink<GraphProjection> graphSink;
    private final ProjectionSink<TableRow> tableSink;
    private final ProjectionSink<VectorProjection> vectorSink;
    private final CanonicalRecordProvider recordProvider;
    private final IdentifierLock lock;
    private final StoreOptions options;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final CommitLog commitLog;
    private final Clock clock;

    private final Map<String, CrossModalRecord> records = new ConcurrentHashMap<>();
    private final Set<String> quarantined = ConcurrentHashMap.newKeySet();

    private CrossModalEntityStore(Builder builder) {
        this.options = builder.options != null ? builder.options : StoreOptions.defaults();
        EmbeddingFunction embeddings = builder.embeddingFunction != null
                ? builder.embeddingFunction : new HashingEmbeddingFunction();
        this.graphProjector = builder.graphProjector != null ? builder.graphProjector : new GraphProjector();
        this.tableProjector = builder.tableProjector != null ? builder.tableProjector : new TableProjector();
        this.vectorProjector = builder.vectorProjector != null
                ? builder.vectorProjector : new VectorProjector(embeddings);
        this.graphSink = builder.graphSink != null ? builder.graphSink : new InMemoryProjectionSink<>(Modality.GRAPH);
        this.tableSink = builder.tableSink != null ? builder.tableSink : new InMemoryProjectionSink<>(Modality.TABLE);
        this.vectorSink = builder.vectorSink != null
                ? builder.vectorSink : new InMemoryProjectionSink<>(Modality.VECTOR);
        this.recordProvider = builder.recordProvider;
        this.lock = builder.lock != null ? builder.lock : new LocalIdentifierLock(options.getLockConfig());
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.commitLog = builder.commitLog != null ? builder.commitLog : new CommitLog(clock);
    }

    /**
     * Projects the record into all three modalities and publishes them as the next version.
     * Recommitting identical canonical data is a no-op that reports {@link CommitOutcome#UNCHANGED}.
     *
     * @throws OperationTimeoutException if the record lock could not be acquired in time
     * @throws ProjectionSyncException   if a projection could not be written; fatal once retries
     *                                   are exhausted, in which case the record is quarantined
     */
    public CommitResult commit(CanonicalRecord record) {
        String recordId = record.id();
        try (LogContext ignored = LogContext.forCommit(recordId);
             Span span = tracingService.startSpan(TraceOperation.COMMIT,
                     Map.of("recordId", recordId, "kind", record.kind().name()))) {
            String lockKey = RECORD_LOCK_PREFIX + recordId;
            try {
                lock.lock(lockKey);
            } catch (OperationTimeoutException e) {
                reject(recordId, "lock timeout");
                span.fail(e);
                throw e;
            }
            try {
                CommitResult result = commitLocked(record);
                span.setAttribute("version", result.version());
                span.setAttribute("outcome", result.outcome().name());
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            } finally {
                lock.unlock(lockKey);
            }
        }
    }

    private CommitResult commitLocked(CanonicalRecord record) {
        String recordId = record.id();
        if (quarantined.contains(recordId)) {
            reject(recordId, "record quarantined");
            throw ProjectionSyncException.quarantined(recordId, Provenance.ofRecord(recordId));
        }

        GraphProjection graph = graphProjector.project(record);
        TableRow table = tableProjector.project(record);
        VectorProjection vector = vectorProjector.project(record);

        CrossModalRecord current = records.get(recordId);
        if (current != null && current.hasProjections(graph, table, vector)) {
            commitLog.append(recordId, current.version(), CommitOutcome.UNCHANGED, null);
            metricsService.incrementCommit(CommitOutcome.UNCHANGED);
            log.debug("record.unchanged recordId={} version={}", recordId, current.version());
            return new CommitResult(recordId, current.version(), CommitOutcome.UNCHANGED);
        }

        long version = current != null ? current.version() + 1 : 1;
        CrossModalRecord next = new CrossModalRecord(recordId, record.kind(), version, graph, table, vector,
                clock.instant());

        ProjectionTransaction tx = new ProjectionTransaction(recordId, version);
        try (tx) {
            stage(tx, graphSink, recordId, version, graph);
            stage(tx, tableSink, recordId, version, table);
            stage(tx, vectorSink, recordId, version, vector);
            tx.executeNoCompensation("publish version", () -> records.put(recordId, next));
            tx.markSuccess();
        } catch (StageExhaustedException e) {
            throw quarantine(recordId, version, e, tx.getCompensationFailures());
        } catch (StageInterruptedException e) {
            commitLog.append(recordId, current != null ? current.version() : 0, CommitOutcome.REJECTED,
                    "interrupted while staging " + e.modality);
            metricsService.incrementCommit(CommitOutcome.REJECTED);
            log.warn("record.rejected recordId={} version={} reason=interrupted modality={}",
                    recordId, version, e.modality);
            throw new ProjectionSyncException(recordId, e.modality, e.attempts, false,
                    Provenance.ofRecord(recordId), e.getCause());
        }

        pruneOlderVersions(recordId, version);
        commitLog.append(recordId, version, CommitOutcome.APPLIED, null);
        metricsService.incrementCommit(CommitOutcome.APPLIED);
        auditService.record(AuditAction.RECORD_COMMITTED, recordId,
                Map.of("version", version, "kind", record.kind().name()));
        log.info("record.committed recordId={} kind={} version={}", recordId, record.kind(), version);
        return new CommitResult(recordId, version, CommitOutcome.APPLIED);
    }

    private <P> void stage(ProjectionTransaction tx, ProjectionSink<P> sink, String recordId, long version,
                           P projection) {
        tx.execute("stage " + sink.modality().name().toLowerCase(Locale.ROOT),
                () -> stageWithRetry(sink, recordId, version, projection),
                () -> sink.discard(recordId, version));
    }

    private <P> void stageWithRetry(ProjectionSink<P> sink, String recordId, long version, P projection) {
        RetryPolicy policy = options.getRetryPolicy();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                sink.stage(recordId, version, projection);
                return;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("projection.stage.failed recordId={} version={} modality={} attempt={} error={}",
                        recordId, version, sink.modality(), attempt, e.getMessage());
                if (attempt < policy.maxAttempts()) {
                    metricsService.incrementProjectionRetry(sink.modality());
                    sleep(policy.backoff(attempt), sink.modality(), attempt, e);
                }
            }
        }
        // The failed stage may have left a partial write behind; its compensation is not registered yet.
        sink.discard(recordId, version);
        throw new StageExhaustedException(sink.modality(), policy.maxAttempts(), lastFailure);
    }

    private static void sleep(Duration backoff, Modality modality, int attempt, RuntimeException failure) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            StageInterruptedException interrupted = new StageInterruptedException(modality, attempt, failure);
            interrupted.addSuppressed(e);
            throw interrupted;
        }
    }

    private ProjectionSyncException quarantine(String recordId, long version, StageExhaustedException failure,
                                               List<RuntimeException> compensationFailures) {
        quarantined.add(recordId);
        metricsService.incrementProjectionFailure(failure.modality);
        metricsService.incrementCommit(CommitOutcome.REJECTED);
        CrossModalRecord current = records.get(recordId);
        commitLog.append(recordId, current != null ? current.version() : 0, CommitOutcome.REJECTED,
                failure.modality + " failed after " + failure.attempts + " attempt(s)");
        auditService.record(AuditAction.RECORD_QUARANTINED, recordId,
                Map.of("version", version, "modality", failure.modality.name(), "attempts", failure.attempts));

        ProjectionSyncException error = new ProjectionSyncException(recordId, failure.modality, failure.attempts,
                true, Provenance.ofRecord(recordId), failure.getCause());
        compensationFailures.forEach(error::addSuppressed);
        log.error("record.quarantined recordId={} version={} modality={} attempts={} provenance=[{}]",
                recordId, version, failure.modality, failure.attempts, error.getProvenance(), error);
        return error;
    }

    private void pruneOlderVersions(String recordId, long version) {
        for (ProjectionSink<?> sink : List.of(graphSink, tableSink, vectorSink)) {
            try {
                sink.prune(recordId, version);
            } catch (RuntimeException e) {
                // Stale versions are unreachable once the pointer moved; the next commit prunes again.
                log.warn("projection.prune.failed recordId={} version={} modality={}",
                        recordId, version, sink.modality(), e);
            }
        }
    }

    private void reject(String recordId, String reason) {
        CrossModalRecord current = records.get(recordId);
        commitLog.append(recordId, current != null ? current.version() : 0, CommitOutcome.REJECTED, reason);
        metricsService.incrementCommit(CommitOutcome.REJECTED);
        log.warn("record.rejected recordId={} reason='{}'", recordId, reason);
    }

    /**
     * Rebuilds the record from the canonical data and commits it.
     *
     * @throws UnknownIdentifierException if the provider does not know the record
     */
    public CommitResult reindex(String recordId) {
        if (recordProvider == null) {
            throw new IllegalStateException("No CanonicalRecordProvider configured");
        }
        String lockKey = RECORD_LOCK_PREFIX + recordId;
        lock.lock(lockKey);
        try {
            // Fetched under the record lock so a concurrent reindex cannot publish older data after us.
            CanonicalRecord record = recordProvider.fetch(recordId)
                    .orElseThrow(() -> new UnknownIdentifierException("record", recordId));
            return commit(record);
        } finally {
            lock.unlock(lockKey);
        }
    }

    /**
     * Clears the quarantine on a record and reindexes it from the canonical data.
     */
    public CommitResult reconcile(String recordId) {
        return reconcile(recordId, AuditService.SYSTEM_ACTOR);
    }

    public CommitResult reconcile(String recordId, String actorId) {
        boolean wasQuarantined = quarantined.remove(recordId);
        auditService.record(AuditAction.RECORD_RECONCILED, recordId, actorId,
                Map.of("wasQuarantined", wasQuarantined));
        log.info("record.reconciled recordId={} wasQuarantined={} actor={}", recordId, wasQuarantined, actorId);
        return reindex(recordId);
    }

    public boolean isQuarantined(String recordId) {
        return quarantined.contains(recordId);
    }

    public Set<String> getQuarantined() {
        return Set.copyOf(quarantined);
    }

    // ── Reads (lock-free) ─────────────────────────────────────────

    public Optional<CrossModalRecord> getRecord(String recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    public Optional<Object> get(String recordId, Modality modality) {
        return getRecord(recordId).map(r -> r.projection(modality));
    }

    public Optional<GraphProjection> getGraph(String recordId) {
        return getRecord(recordId).map(CrossModalRecord::graph);
    }

    public Optional<TableRow> getTable(String recordId) {
        return getRecord(recordId).map(CrossModalRecord::table);
    }

    public Optional<VectorProjection> getVector(String recordId) {
        return getRecord(recordId).map(CrossModalRecord::vector);
    }

    /**
     * Current snapshots, ordered by id.
     */
    public List<CrossModalRecord> snapshot() {
        List<CrossModalRecord> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(CrossModalRecord::id));
        return all;
    }

    public List<CrossModalRecord> snapshot(RecordKind kind) {
        return snapshot().stream().filter(r -> r.kind() == kind).toList();
    }

    public GraphView graphView() {
        return GraphView.of(snapshot());
    }

    public TableView tableView() {
        return TableView.of(snapshot());
    }

    public VectorView vectorView() {
        return VectorView.of(snapshot());
    }

    public Collection<String> recordIds() {
        return Set.copyOf(records.keySet());
    }

    public CommitLog getCommitLog() {
        return commitLog;
    }

    public EmbeddingFunction getEmbeddingFunction() {
        return vectorProjector instanceof VectorProjector vp ? vp.getEmbeddingFunction() : null;
    }

    private static final class StageExhaustedException extends RuntimeException {
        private final Modality modality;
        private final int attempts;

        StageExhaustedException(Modality modality, int attempts, Throwable cause) {
            super(modality + " stage failed after " + attempts + " attempt(s)", cause);
            this.modality = modality;
            this.attempts = attempts;
        }
    }

    private static final class StageInterruptedException extends RuntimeException {
        private final Modality modality;
        private final int attempts;

        StageInterruptedException(Modality modality, int attempts, Throwable cause) {
            super(modality + " stage interrupted after " + attempts + " attempt(s)", cause);
            this.modality = modality;
            this.attempts = attempts;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Projector<GraphProjection> graphProjector;
        private Projector<TableRow> tableProjector;
        private Projector<VectorProjection> vectorProjector;
        private EmbeddingFunction embeddingFunction;
        private ProjectionSink<GraphProjection> graphSink;
        private ProjectionSink<TableRow> tableSink;
        private ProjectionSink<VectorProjection> vectorSink;
        private CanonicalRecordProvider recordProvider;
        private IdentifierLock lock;
        private StoreOptions options;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private CommitLog commitLog;
        private Clock clock;

        public Builder graphProjector(Projector<GraphProjection> graphProjector) {
            this.graphProjector = graphProjector;
            return this;
        }

        public Builder tableProjector(Projector<TableRow> tableProjector) {
            this.tableProjector = tableProjector;
            return this;
        }

        public Builder vectorProjector(Projector<VectorProjection> vectorProjector) {
            this.vectorProjector = vectorProjector;
            return this;
        }

        /**
         * Embedding used by the default vector projector. Ignored when a vector projector is set.
         */
        public Builder embeddingFunction(EmbeddingFunction embeddingFunction) {
            this.embeddingFunction = embeddingFunction;
            return this;
        }

        public Builder graphSink(ProjectionSink<GraphProjection> graphSink) {
            this.graphSink = graphSink;
            return this;
        }

        public Builder tableSink(ProjectionSink<TableRow> tableSink) {
            this.tableSink = tableSink;
            return this;
        }

        public Builder vectorSink(ProjectionSink<VectorProjection> vectorSink) {
            this.vectorSink = vectorSink;
            return this;
        }

        public Builder recordProvider(CanonicalRecordProvider recordProvider) {
            this.recordProvider = recordProvider;
            return this;
        }

        public Builder lock(IdentifierLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder options(StoreOptions options) {
            this.options = options;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder commitLog(CommitLog commitLog) {
            this.commitLog = commitLog;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CrossModalEntityStore build() {
            return new CrossModalEntityStore(this);
        }
    }
}
