package com.knowledge.crossmodal.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledge.crossmodal.aggregation.AggregationOptions;
import com.knowledge.crossmodal.aggregation.AuditTrail;
import com.knowledge.crossmodal.aggregation.BayesianAggregator;
import com.knowledge.crossmodal.aggregation.ClaimAggregationService;
import com.knowledge.crossmodal.aggregation.DependencyDetector;
import com.knowledge.crossmodal.aggregation.HeuristicDependencyDetector;
import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.ClaimKey;
import com.knowledge.crossmodal.core.model.ClaimObject;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.embedding.CacheConfig;
import com.knowledge.crossmodal.embedding.CachingEmbeddingFunction;
import com.knowledge.crossmodal.embedding.EmbeddingFunction;
import com.knowledge.crossmodal.embedding.HashingEmbeddingFunction;
import com.knowledge.crossmodal.error.AmbiguousResolutionException;
import com.knowledge.crossmodal.error.KnowledgeException;
import com.knowledge.crossmodal.error.Provenance;
import com.knowledge.crossmodal.error.UnresolvedReferenceException;
import com.knowledge.crossmodal.export.StateExporter;
import com.knowledge.crossmodal.identity.IdentityResolutionService;
import com.knowledge.crossmodal.identity.ResolutionOptions;
import com.knowledge.crossmodal.identity.ResolutionResult;
import com.knowledge.crossmodal.ingest.IngestionBatch;
import com.knowledge.crossmodal.ingest.RawClaimPayload;
import com.knowledge.crossmodal.projection.GraphProjection;
import com.knowledge.crossmodal.projection.GraphView;
import com.knowledge.crossmodal.projection.TableRow;
import com.knowledge.crossmodal.projection.TableView;
import com.knowledge.crossmodal.projection.VectorProjection;
import com.knowledge.crossmodal.projection.VectorView;
import com.knowledge.crossmodal.rules.NormalizationEngine;
import com.knowledge.crossmodal.similarity.BlockingKeyStrategy;
import com.knowledge.crossmodal.similarity.MentionSimilarity;
import com.knowledge.crossmodal.store.CommitLog;
import com.knowledge.crossmodal.store.CommitResult;
import com.knowledge.crossmodal.store.CrossModalEntityStore;
import com.knowledge.crossmodal.store.CrossModalRecord;
import com.knowledge.crossmodal.store.Modality;
import com.knowledge.crossmodal.store.ProjectionSink;
import com.knowledge.crossmodal.store.StoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point: identity resolution, claim aggregation and the cross-modal store wired
 * around one shared {@link KnowledgeContext}.
 *
 * <p>Every identity or claim change is pushed to the store before the call returns, so the
 * graph, table and vector views always reflect the canonical data once an operation completes.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CrossModalKnowledgeBase kb = CrossModalKnowledgeBase.builder().build();
 *
 * kb.resolve(Mention.of("doc-1", new TextSpan(0, 9), "Tim Cook", "PERSON", 0.95));
 * kb.resolve(Mention.of("doc-1", new TextSpan(20, 25), "Apple", "ORG", 0.9));
 *
 * ClaimResult result = kb.ingestClaim(rawClaim);
 * AuditTrail trail = kb.explain(result.claimId());
 * </pre>
 */
public class CrossModalKnowledgeBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CrossModalKnowledgeBase.class);

    private final KnowledgeContext context;
    private final IdentityResolutionService identityService;
    private final ClaimAggregationService claimService;
    private final CrossModalEntityStore store;
    private final CrossModalSynchronizer synchronizer;
    private final StateExporter exporter;

    private CrossModalKnowledgeBase(Builder builder) {
        this.context = builder.context != null ? builder.context : KnowledgeContext.defaults();

        this.identityService = IdentityResolutionService.builder()
                .normalizationEngine(builder.normalizationEngine)
                .similarity(builder.similarity)
                .blockingKeyStrategy(builder.blockingKeyStrategy)
                .options(builder.resolutionOptions)
                .lock(context.getLock())
                .auditService(context.getAuditService())
                .mergeLedger(context.getMergeLedger())
                .metricsService(context.getMetricsService())
                .tracingService(context.getTracingService())
                .clock(context.getClock())
                .build();

        AggregationOptions aggregationOptions = builder.aggregationOptions != null
                ? builder.aggregationOptions : AggregationOptions.defaults();
        DependencyDetector detector = builder.dependencyDetector != null
                ? builder.dependencyDetector : new HeuristicDependencyDetector(aggregationOptions);
        this.claimService = ClaimAggregationService.builder()
                .aggregator(new BayesianAggregator(aggregationOptions, detector))
                .lock(context.getLock())
                .auditService(context.getAuditService())
                .metricsService(context.getMetricsService())
                .tracingService(context.getTracingService())
                .clock(context.getClock())
                .build();

        EmbeddingFunction embeddings = builder.embeddingFunction != null
                ? builder.embeddingFunction : new HashingEmbeddingFunction();
        if (builder.cacheConfig != null) {
            embeddings = CachingEmbeddingFunction.wrap(embeddings, builder.cacheConfig, context.getMetricsService());
        }
        this.store = CrossModalEntityStore.builder()
                .embeddingFunction(embeddings)
                .graphSink(builder.graphSink)
                .tableSink(builder.tableSink)
                .vectorSink(builder.vectorSink)
                .recordProvider(new KnowledgeRecordProvider(identityService, claimService))
                .options(builder.storeOptions)
                .lock(context.getLock())
                .auditService(context.getAuditService())
                .metricsService(context.getMetricsService())
                .tracingService(context.getTracingService())
                .clock(context.getClock())
                .build();

        // Claims are re-keyed before the store refreshes the merged entities.
        this.synchronizer = new CrossModalSynchronizer(store, identityService, claimService);
        identityService.addListener(claimService);
        identityService.addListener(synchronizer);
        claimService.addListener(synchronizer);

        this.exporter = new StateExporter(identityService, claimService, store.getCommitLog());
        log.info("knowledge.base.initialized embeddingModel={} resolution={}",
                embeddings.modelId(), identityService.getOptions());
    }

    // ── Identity ─────────────────────────────────────────────────

    /**
     * @throws AmbiguousResolutionException when candidates tie; the mention is still attached
     */
    public ResolutionResult resolve(Mention mention) {
        return identityService.resolve(mention);
    }

    public String merge(String entityIdA, String entityIdB) {
        return identityService.merge(entityIdA, entityIdB);
    }

    public String merge(String entityIdA, String entityIdB, String triggeredBy, String reasoning) {
        return identityService.merge(entityIdA, entityIdB, triggeredBy, reasoning);
    }

    public String split(String entityId, Collection<String> mentionIds) {
        return identityService.split(entityId, mentionIds);
    }

    public String split(String entityId, Collection<String> mentionIds, String triggeredBy, String reasoning) {
        return identityService.split(entityId, mentionIds, triggeredBy, reasoning);
    }

    public Optional<Entity> lookup(String surfaceText, String typeLabel) {
        return identityService.lookup(surfaceText, typeLabel);
    }

    public Optional<Entity> getEntity(String entityId) {
        return identityService.getEntity(entityId);
    }

    public List<Entity> listEntities() {
        return identityService.listEntities();
    }

    // ── Claims ───────────────────────────────────────────────────

    public String openClaim(ClaimKey key) {
        return claimService.openClaim(key);
    }

    public double aggregate(String claimId, List<EvidenceItem> evidence) {
        return claimService.aggregate(claimId, evidence);
    }

    public double recompute(String claimId) {
        return claimService.recompute(claimId);
    }

    public AuditTrail explain(String claimId) {
        return claimService.explain(claimId);
    }

    public double declareDependency(String claimId, Collection<String> evidenceIds, String reason) {
        return claimService.declareDependency(claimId, evidenceIds, reason);
    }

    public Optional<Claim> getClaim(String claimId) {
        return claimService.getClaim(claimId);
    }

    public Optional<Claim> findClaim(ClaimKey key) {
        return claimService.findClaim(key);
    }

    public List<Claim> listClaims() {
        return claimService.listClaims();
    }

    /**
     * Resolves the raw claim's references against known entities, opens (or finds) the claim
     * for the resulting triple and aggregates the payload's evidence into it.
     *
     * @throws UnresolvedReferenceException if the subject, or an object declared as an entity,
     *                                      matches no known entity
     */
    public ClaimResult ingestClaim(RawClaimPayload payload) {
        EvidenceItem evidence = payload.toEvidence();
        Provenance provenance = Provenance.builder()
                .source(payload.sourceId())
                .evidence(evidence.evidenceId())
                .build();

        Entity subject = identityService.lookup(payload.subjectRef(), payload.subjectType())
                .orElseThrow(() -> new UnresolvedReferenceException(payload.subjectRef(), provenance));

        ClaimObject object;
        if (payload.objectIsLiteral()) {
            object = ClaimObject.literal(payload.objectRef().strip());
        } else {
            Optional<Entity> target = identityService.lookup(payload.objectRef(), payload.objectType());
            if (target.isPresent()) {
                object = ClaimObject.entity(target.get().getId());
            } else if (payload.objectIsEntity()) {
                throw new UnresolvedReferenceException(payload.objectRef(), provenance);
            } else {
                object = ClaimObject.literal(payload.objectRef().strip());
            }
        }

        String claimId = claimService.openClaim(new ClaimKey(subject.getId(), payload.predicate(), object));
        double posterior = claimService.aggregate(claimId, List.of(evidence));
        String holder = claimService.canonicalClaimId(claimId);
        log.debug("claim.ingested claimId={} evidenceId={} posterior={}", holder, evidence.evidenceId(), posterior);
        return new ClaimResult(holder, evidence.evidenceId(), posterior);
    }

    // ── Ingestion ────────────────────────────────────────────────

    /**
     * Resolves the batch's mentions, then ingests its claims. A rejected batch contributes nothing.
     */
    public IngestionOutcome ingest(IngestionBatch batch) {
        if (!batch.isAccepted()) {
            return IngestionOutcome.rejected(batch.sourceId(), batch.rejectionReason());
        }
        return IngestionOutcome.of(batch.sourceId(), resolveMentions(batch), ingestClaims(batch));
    }

    /**
     * Resolves every mention of the batch. An ambiguous mention is still attached: its
     * result is kept and the exception is reported alongside it.
     */
    public StageResult<ResolutionResult> resolveMentions(IngestionBatch batch) {
        List<ResolutionResult> results = new ArrayList<>();
        List<KnowledgeException> failures = new ArrayList<>();
        for (Mention mention : batch.mentions()) {
            try {
                results.add(identityService.resolve(mention));
            } catch (AmbiguousResolutionException e) {
                results.add(e.getResult());
                failures.add(e);
                log.warn("ingest.mention.ambiguous sourceId={} mentionId={} candidates={}",
                        batch.sourceId(), mention.id(), e.getTiedCandidateIds());
            } catch (KnowledgeException e) {
                failures.add(e);
                log.warn("ingest.mention.failed sourceId={} mentionId={} error={}",
                        batch.sourceId(), mention.id(), e.getMessage());
            }
        }
        return new StageResult<>(results, failures);
    }

    public StageResult<ClaimResult> ingestClaims(IngestionBatch batch) {
        List<ClaimResult> results = new ArrayList<>();
        List<KnowledgeException> failures = new ArrayList<>();
        for (RawClaimPayload payload : batch.claims()) {
            try {
                results.add(ingestClaim(payload));
            } catch (KnowledgeException e) {
                failures.add(e);
                log.warn("ingest.claim.failed sourceId={} subject='{}' predicate={} error={}",
                        batch.sourceId(), payload.subjectRef(), payload.predicate(), e.getMessage());
            }
        }
        return new StageResult<>(results, failures);
    }

    // ── Store ────────────────────────────────────────────────────

    public Optional<Object> get(String recordId, Modality modality) {
        return store.get(recordId, modality);
    }

    public Optional<CrossModalRecord> getRecord(String recordId) {
        return store.getRecord(recordId);
    }

    public Optional<GraphProjection> getGraph(String recordId) {
        return store.getGraph(recordId);
    }

    public Optional<TableRow> getTable(String recordId) {
        return store.getTable(recordId);
    }

    public Optional<VectorProjection> getVector(String recordId) {
        return store.getVector(recordId);
    }

    public CommitResult reindex(String recordId) {
        return store.reindex(recordId);
    }

    public CommitResult reconcile(String recordId) {
        return store.reconcile(recordId);
    }

    public GraphView graphView() {
        return store.graphView();
    }

    public TableView tableView() {
        return store.tableView();
    }

    public VectorView vectorView() {
        return store.vectorView();
    }

    public CommitLog getCommitLog() {
        return store.getCommitLog();
    }

    public ObjectNode export() {
        return exporter.export();
    }

    // ── Accessors ────────────────────────────────────────────────

    public KnowledgeContext getContext() {
        return context;
    }

    public IdentityResolutionService getIdentityService() {
        return identityService;
    }

    public ClaimAggregationService getClaimService() {
        return claimService;
    }

    public CrossModalEntityStore getStore() {
        return store;
    }

    public StateExporter getExporter() {
        return exporter;
    }

    @Override
    public void close() {
        identityService.removeListener(synchronizer);
        identityService.removeListener(claimService);
        claimService.removeListener(synchronizer);
        log.info("knowledge.base.closed entities={} claims={}",
                identityService.getRegistry().entityCount(), claimService.getRegistry().size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private KnowledgeContext context;
        private ResolutionOptions resolutionOptions;
        private NormalizationEngine normalizationEngine;
        private MentionSimilarity similarity;
        private BlockingKeyStrategy blockingKeyStrategy;
        private AggregationOptions aggregationOptions;
        private DependencyDetector dependencyDetector;
        private StoreOptions storeOptions;
        private EmbeddingFunction embeddingFunction;
        private CacheConfig cacheConfig;
        private ProjectionSink<GraphProjection> graphSink;
        private ProjectionSink<TableRow> tableSink;
        private ProjectionSink<VectorProjection> vectorSink;

        public Builder context(KnowledgeContext context) {
            this.context = context;
            return this;
        }

        public Builder resolutionOptions(ResolutionOptions resolutionOptions) {
            this.resolutionOptions = resolutionOptions;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder similarity(MentionSimilarity similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder aggregationOptions(AggregationOptions aggregationOptions) {
            this.aggregationOptions = aggregationOptions;
            return this;
        }

        public Builder dependencyDetector(DependencyDetector dependencyDetector) {
            this.dependencyDetector = dependencyDetector;
            return this;
        }

        public Builder storeOptions(StoreOptions storeOptions) {
            this.storeOptions = storeOptions;
            return this;
        }

        public Builder embeddingFunction(EmbeddingFunction embeddingFunction) {
            this.embeddingFunction = embeddingFunction;
            return this;
        }

        /**
         * Caches embeddings with Caffeine. No caching when unset.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
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

        public CrossModalKnowledgeBase build() {
            return new CrossModalKnowledgeBase(this);
        }
    }
}
