package com.knowledge.crossmodal.identity;

import com.knowledge.crossmodal.audit.AuditAction;
import com.knowledge.crossmodal.audit.AuditService;
import com.knowledge.crossmodal.audit.MergeLedger;
import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.EntityStatus;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.core.model.MentionLink;
import com.knowledge.crossmodal.core.model.MergeRecord;
import com.knowledge.crossmodal.error.AmbiguousResolutionException;
import com.knowledge.crossmodal.error.InvalidIdentityOperationException;
import com.knowledge.crossmodal.error.Provenance;
import com.knowledge.crossmodal.error.UnknownIdentifierException;
import com.knowledge.crossmodal.lock.IdentifierLock;
import com.knowledge.crossmodal.lock.LocalIdentifierLock;
import com.knowledge.crossmodal.logging.LogContext;
import com.knowledge.crossmodal.metrics.MetricsService;
import com.knowledge.crossmodal.metrics.NoOpMetricsService;
import com.knowledge.crossmodal.rules.DefaultNormalizationRules;
import com.knowledge.crossmodal.rules.NormalizationEngine;
import com.knowledge.crossmodal.similarity.BlockingKeyStrategy;
import com.knowledge.crossmodal.similarity.CompositeMentionSimilarity;
import com.knowledge.crossmodal.similarity.DefaultBlockingKeyStrategy;
import com.knowledge.crossmodal.similarity.MentionSimilarity;
import com.knowledge.crossmodal.tracing.NoOpTracingService;
import com.knowledge.crossmodal.tracing.Span;
import com.knowledge.crossmodal.tracing.TraceOperation;
import com.knowledge.crossmodal.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Resolves mentions into canonical entities and applies operator merges and splits.
 *
 * <p>Resolution serialises on the mention's blocking keys, so two concurrent mentions that
 * could refer to the same entity are resolved one after the other and cannot both create an
 * entity. Entity updates additionally hold the entity's own lock; merges and splits lock only
 * entity ids, in sorted order. Reads never lock.</p>
 */
public class IdentityResolutionService {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolutionService.class);

    private static final String BLOCK_LOCK_PREFIX = "block:";
    private static final String ENTITY_LOCK_PREFIX = "entity:";

    private final EntityRegistry registry;
    private final NormalizationEngine normalizationEngine;
    private final MentionSimilarity similarity;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final IdentifierLock lock;
    private final ResolutionOptions options;
    private final AuditService auditService;
    private final MergeLedger mergeLedger;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private final List<IdentityChangeListener> listeners = new CopyOnWriteArrayList<>();

    private IdentityResolutionService(Builder builder) {
        this.registry = builder.registry != null ? builder.registry : new EntityRegistry();
        this.normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        this.similarity = builder.similarity != null ? builder.similarity : new CompositeMentionSimilarity();
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy();
        this.lock = builder.lock != null ? builder.lock : new LocalIdentifierLock();
        this.options = builder.options != null ? builder.options : ResolutionOptions.defaults();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.mergeLedger = builder.mergeLedger != null ? builder.mergeLedger : new MergeLedger();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public void addListener(IdentityChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(IdentityChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Assigns the mention to an existing entity or creates a new provisional one.
     * Resubmitting an already-owned mention returns its current assignment.
     *
     * @throws AmbiguousResolutionException when candidates tie; the mention is still attached
     *                                      and the attached result is carried by the exception
     */
    public ResolutionResult resolve(Mention mention) {
        long start = System.nanoTime();
        String correlationId = LogContext.currentOrNewCorrelationId();
        try (LogContext ignored = LogContext.forResolution(correlationId, mention.sourceId(), mention.typeLabel());
             Span span = tracingService.startSpan(TraceOperation.RESOLVE,
                     Map.of("mentionId", mention.id(), "sourceId", mention.sourceId()))) {
            Outcome outcome;
            try {
                outcome = resolveLocked(mention);
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
            ResolutionResult result = outcome.result();
            span.setAttribute("entityId", result.entityId());
            span.setAttribute("decision", result.decision().name());
            span.setStatus(Span.SpanStatus.OK);
            metricsService.recordResolutionDuration(mention.typeLabel(), result.decision(),
                    Duration.ofNanos(System.nanoTime() - start));
            log.info("mention.resolved mentionId={} entityId={} decision={} score={} identityConfidence={}",
                    mention.id(), result.entityId(), result.decision(), result.bestScore(),
                    result.identityConfidence());

            notifyListeners(l -> l.onEntityChanged(result.entityId()));

            if (result.isAmbiguous()) {
                throw new AmbiguousResolutionException(result, outcome.tiedCandidateIds(),
                        Provenance.builder()
                                .mention(mention.id())
                                .source(mention.sourceId())
                                .records(outcome.tiedCandidateIds())
                                .build());
            }
            return result;
        }
    }

    private Outcome resolveLocked(Mention mention) {
        Optional<ResolutionResult> existing = existingAssignment(mention.id());
        if (existing.isPresent()) {
            return new Outcome(existing.get(), List.of());
        }

        String normalized = normalize(mention);
        Set<String> blockingKeys = blockingKeyStrategy.generateKeys(normalized, mention.typeLabel());
        List<String> lockKeys = blockingKeys.stream().map(k -> BLOCK_LOCK_PREFIX + k).collect(Collectors.toList());

        try (IdentifierLock.LockHandle ignored = lock.lockAll(lockKeys)) {
            existing = existingAssignment(mention.id());
            if (existing.isPresent()) {
                return new Outcome(existing.get(), List.of());
            }
            registry.putMention(mention, normalized);

            List<ScoredCandidate> scored = scoreCandidates(normalized, mention, blockingKeys);
            if (scored.isEmpty() || scored.get(0).score() < options.getMatchThreshold()) {
                Entity created = createEntity(mention, normalized, blockingKeys);
                ResolutionResult result = new ResolutionResult(mention.id(), created.getId(),
                        created.getIdentityConfidence(), created.getStatus(), ResolutionDecision.CREATED,
                        0.0, scored);
                return new Outcome(result, List.of());
            }

            double best = scored.get(0).score();
            metricsService.recordSimilarityScore(best);
            List<ScoredCandidate> tied = scored.stream()
                    .filter(c -> c.score() >= options.getMatchThreshold())
                    .filter(c -> best - c.score() <= options.getAmbiguityEpsilon())
                    .collect(Collectors.toList());
            boolean ambiguous = tied.size() > 1;
            ScoredCandidate chosen = ambiguous ? preferredAmongTied(tied) : tied.get(0);

            Entity attached = attach(chosen, mention, blockingKeys, ambiguous);
            if (ambiguous) {
                metricsService.incrementAmbiguousResolution(mention.typeLabel());
                auditService.record(AuditAction.AMBIGUOUS_RESOLUTION, attached.getId(), Map.of(
                        "mentionId", mention.id(),
                        "tiedCandidates", tied.stream().map(ScoredCandidate::entityId).collect(Collectors.toList()),
                        "score", chosen.score()));
                log.warn("mention.ambiguous mentionId={} tied={} chosen={}",
                        mention.id(), tied, attached.getId());
            }
            ResolutionResult result = new ResolutionResult(mention.id(), attached.getId(),
                    attached.getIdentityConfidence(), attached.getStatus(),
                    ambiguous ? ResolutionDecision.AMBIGUOUS : ResolutionDecision.MATCHED,
                    chosen.score(), scored);
            List<String> tiedIds = tied.stream().map(ScoredCandidate::entityId).collect(Collectors.toList());
            return new Outcome(result, tiedIds);
        }
    }

    private Optional<ResolutionResult> existingAssignment(String mentionId) {
        return registry.findOwner(mentionId)
                .map(this::canonicalId)
                .flatMap(registry::findEntity)
                .map(owner -> {
                    MentionLink link = owner.getMentionLinks().get(mentionId);
                    return new ResolutionResult(mentionId, owner.getId(), owner.getIdentityConfidence(),
                            owner.getStatus(), ResolutionDecision.ALREADY_RESOLVED,
                            link != null ? link.weight() : 0.0, List.of());
                });
    }

    private List<ScoredCandidate> scoreCandidates(String normalized, Mention mention, Set<String> blockingKeys) {
        List<Entity> candidates = registry.blockCandidates(blockingKeys);
        if (candidates.isEmpty()) {
            candidates = registry.typeCandidates(mention.typeLabel());
            log.debug("resolve.fullScan mentionId={} candidates={}", mention.id(), candidates.size());
        }
        List<ScoredCandidate> scored = new ArrayList<>();
        for (Entity candidate : candidates) {
            double score = similarity.score(normalized, mention.typeLabel(), mention.context(),
                    registry.profile(candidate));
            if (score > 0.0) {
                scored.add(new ScoredCandidate(candidate.getId(), Math.min(1.0, score)));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed()
                .thenComparing(ScoredCandidate::entityId));
        return scored;
    }

    /**
     * Among tied candidates prefer the highest identity confidence, then the older entity,
     * then the smaller id.
     */
    private ScoredCandidate preferredAmongTied(List<ScoredCandidate> tied) {
        Comparator<ScoredCandidate> preference = Comparator
                .comparingDouble((ScoredCandidate c) -> entityOrThrow(c.entityId()).getIdentityConfidence())
                .reversed()
                .thenComparing((a, b) -> Entity.compareByAge(entityOrThrow(a.entityId()), entityOrThrow(b.entityId())));
        return tied.stream().sorted(preference).findFirst().orElseThrow();
    }

    private Entity createEntity(Mention mention, String normalized, Set<String> blockingKeys) {
        Instant now = clock.instant();
        MentionLink founding = MentionLink.founding(mention.confidence());
        Entity entity = Entity.builder()
                .canonicalName(mention.text().strip())
                .normalizedName(normalized)
                .typeLabel(typeOf(mention))
                .link(mention.id(), founding)
                .identityConfidence(IdentityConfidence.compute(List.of(founding), options.getAmbiguityPenalty()))
                .status(EntityStatus.PROVISIONAL)
                .createdAt(now)
                .updatedAt(now)
                .build();
        registry.putEntity(entity);
        registry.index(entity.getId(), blockingKeys);
        metricsService.incrementEntityCreated(entity.getTypeLabel());
        auditService.record(AuditAction.ENTITY_CREATED, entity.getId(), Map.of(
                "mentionId", mention.id(),
                "canonicalName", entity.getCanonicalName(),
                "typeLabel", entity.getTypeLabel()));
        log.info("entity.created entityId={} canonicalName='{}' type={}",
                entity.getId(), entity.getCanonicalName(), entity.getTypeLabel());
        return entity;
    }

    private Entity attach(ScoredCandidate chosen, Mention mention, Set<String> blockingKeys, boolean ambiguous) {
        String targetId = chosen.entityId();
        while (true) {
            String lockKey = ENTITY_LOCK_PREFIX + targetId;
            lock.lock(lockKey);
            try {
                Entity target = entityOrThrow(targetId);
                if (target.isRetired()) {
                    // merged away since scoring; follow to the survivor
                    targetId = canonicalId(target.getId());
                    continue;
                }
                Map<String, MentionLink> links = new LinkedHashMap<>(target.getMentionLinks());
                links.put(mention.id(), new MentionLink(mention.confidence(), chosen.score(), ambiguous));
                int checks = target.getConflictChecksPassed() + (ambiguous ? 0 : 1);
                Entity updated = withLinks(target, links, checks);
                registry.putEntity(updated);
                registry.index(updated.getId(), blockingKeys);
                auditService.record(AuditAction.MENTION_ATTACHED, updated.getId(), Map.of(
                        "mentionId", mention.id(),
                        "score", chosen.score(),
                        "ambiguous", ambiguous,
                        "identityConfidence", updated.getIdentityConfidence()));
                recordStatusChange(target, updated);
                return updated;
            } finally {
                lock.unlock(lockKey);
            }
        }
    }

    /**
     * Merges two entities. The older entity survives (ties broken by the smaller id) and absorbs
     * every mention link of the other, which is retired. Merging a pair that is already merged
     * returns the survivor.
     *
     * @return the surviving entity id
     */
    public String merge(String entityIdA, String entityIdB) {
        return merge(entityIdA, entityIdB, AuditService.SYSTEM_ACTOR, null);
    }

    public String merge(String entityIdA, String entityIdB, String triggeredBy, String reasoning) {
        if (entityIdA.equals(entityIdB)) {
            throw new InvalidIdentityOperationException("Cannot merge an entity with itself: " + entityIdA,
                    Provenance.ofRecord(entityIdA));
        }
        String correlationId = LogContext.currentOrNewCorrelationId();
        MergeRecord ledgerEntry;
        try (LogContext ignored = LogContext.forMerge(correlationId, entityIdA, entityIdB);
             Span span = tracingService.startSpan(TraceOperation.MERGE,
                     Map.of("entityA", entityIdA, "entityB", entityIdB));
             IdentifierLock.LockHandle handle = lock.lockAll(
                     List.of(ENTITY_LOCK_PREFIX + entityIdA, ENTITY_LOCK_PREFIX + entityIdB))) {
            Entity a = entityOrThrow(entityIdA);
            Entity b = entityOrThrow(entityIdB);

            String canonicalA = canonicalId(a.getId());
            if (canonicalA.equals(canonicalId(b.getId())) && (a.isRetired() || b.isRetired())) {
                log.info("merge.alreadyApplied entityA={} entityB={} survivor={}", entityIdA, entityIdB, canonicalA);
                span.setStatus(Span.SpanStatus.OK);
                return canonicalA;
            }
            if (a.isRetired() || b.isRetired()) {
                span.setStatus(Span.SpanStatus.ERROR);
                throw new InvalidIdentityOperationException(
                        "Cannot merge retired entity " + (a.isRetired() ? a.getId() : b.getId()),
                        Provenance.builder().record(entityIdA).record(entityIdB).build());
            }

            Entity survivor = Entity.compareByAge(a, b) <= 0 ? a : b;
            Entity loser = survivor == a ? b : a;

            Map<String, MentionLink> links = new LinkedHashMap<>(survivor.getMentionLinks());
            links.putAll(loser.getMentionLinks());
            Entity mergedSurvivor = withLinks(survivor, links, survivor.getConflictChecksPassed() + 1);
            Entity retired = Entity.builder(loser)
                    .mentionLinks(Map.of())
                    .status(EntityStatus.RETIRED)
                    .mergedInto(survivor.getId())
                    .updatedAt(clock.instant())
                    .build();

            registry.putEntity(retired);
            registry.putEntity(mergedSurvivor);
            registry.index(mergedSurvivor.getId(), blockingKeysOf(mergedSurvivor));

            ledgerEntry = mergeLedger.record(
                    MergeRecord.merge(loser, mergedSurvivor, triggeredBy, reasoning, clock.instant()));
            auditService.record(AuditAction.ENTITY_MERGED, survivor.getId(), triggeredBy, Map.of(
                    "retiredEntityId", loser.getId(),
                    "movedMentions", loser.getMentionIds().size(),
                    "identityConfidence", mergedSurvivor.getIdentityConfidence()));
            recordStatusChange(survivor, mergedSurvivor);
            metricsService.incrementEntityMerged(survivor.getTypeLabel());
            span.setAttribute("survivorId", survivor.getId());
            span.setStatus(Span.SpanStatus.OK);
            log.info("merge.completed sourceEntityId={} targetEntityId={} mentions={} identityConfidence={}",
                    loser.getId(), survivor.getId(), mergedSurvivor.getMentionLinks().size(),
                    mergedSurvivor.getIdentityConfidence());
        }
        notifyListeners(l -> l.onMerge(ledgerEntry.sourceEntityId(), ledgerEntry.targetEntityId()));
        return ledgerEntry.targetEntityId();
    }

    /**
     * Detaches the given mentions into a new entity. Both entities' confidences are recomputed
     * from the links they retain.
     *
     * @return the new entity id
     */
    public String split(String entityId, Collection<String> mentionIds) {
        return split(entityId, mentionIds, AuditService.SYSTEM_ACTOR, null);
    }

    public String split(String entityId, Collection<String> mentionIds, String triggeredBy, String reasoning) {
        Set<String> moving = new LinkedHashSet<>(mentionIds);
        Provenance provenance = Provenance.builder().record(entityId).mentions(moving).build();
        if (moving.isEmpty()) {
            throw new InvalidIdentityOperationException("Split requires at least one mention", provenance);
        }
        String correlationId = LogContext.currentOrNewCorrelationId();
        MergeRecord ledgerEntry;
        try (LogContext ignored = LogContext.forSplit(correlationId, entityId);
             Span span = tracingService.startSpan(TraceOperation.SPLIT, Map.of("entityId", entityId))) {
            lock.lock(ENTITY_LOCK_PREFIX + entityId);
            try {
                Entity source = entityOrThrow(entityId);
                if (source.isRetired()) {
                    throw new InvalidIdentityOperationException("Cannot split retired entity " + entityId, provenance);
                }
                List<String> notOwned = moving.stream().filter(m -> !source.ownsMention(m)).collect(Collectors.toList());
                if (!notOwned.isEmpty()) {
                    throw new InvalidIdentityOperationException(
                            "Mentions " + notOwned + " are not owned by entity " + entityId, provenance);
                }
                if (moving.size() == source.getMentionLinks().size()) {
                    throw new InvalidIdentityOperationException(
                            "Split would leave entity " + entityId + " without mentions", provenance);
                }

                Map<String, MentionLink> retained = new LinkedHashMap<>();
                Map<String, MentionLink> detached = new LinkedHashMap<>();
                source.getMentionLinks().forEach((id, link) -> (moving.contains(id) ? detached : retained).put(id, link));

                // the first detached mention founds the new entity
                String foundingId = detached.keySet().iterator().next();
                MentionLink foundingLink = detached.get(foundingId);
                detached.put(foundingId, new MentionLink(foundingLink.confidence(), 1.0, foundingLink.ambiguous()));
                Mention foundingMention = registry.findMention(foundingId)
                        .orElseThrow(() -> new UnknownIdentifierException("Mention", foundingId));

                Instant now = clock.instant();
                double newConfidence = IdentityConfidence.compute(detached.values(), options.getAmbiguityPenalty());
                Entity created = Entity.builder()
                        .canonicalName(foundingMention.text().strip())
                        .normalizedName(registry.normalizedForm(foundingId).orElse(normalize(foundingMention)))
                        .typeLabel(source.getTypeLabel())
                        .mentionLinks(detached)
                        .identityConfidence(newConfidence)
                        .status(EntityStatus.PROVISIONAL)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                Entity remaining = withLinks(source, retained, source.getConflictChecksPassed());

                registry.putEntity(remaining);
                registry.putEntity(created);
                registry.index(created.getId(), blockingKeysOf(created));

                ledgerEntry = mergeLedger.record(
                        MergeRecord.split(remaining, created, moving, triggeredBy, reasoning, now));
                auditService.record(AuditAction.ENTITY_SPLIT, source.getId(), triggeredBy, Map.of(
                        "newEntityId", created.getId(),
                        "movedMentions", List.copyOf(moving),
                        "identityConfidence", remaining.getIdentityConfidence()));
                recordStatusChange(source, remaining);
                metricsService.incrementEntitySplit(source.getTypeLabel());
                span.setAttribute("newEntityId", created.getId());
                span.setStatus(Span.SpanStatus.OK);
                log.info("split.completed entityId={} newEntityId={} moved={} remainingConfidence={}",
                        source.getId(), created.getId(), moving.size(), remaining.getIdentityConfidence());
            } finally {
                lock.unlock(ENTITY_LOCK_PREFIX + entityId);
            }
        }
        notifyListeners(l -> l.onSplit(ledgerEntry.sourceEntityId(), ledgerEntry.targetEntityId()));
        return ledgerEntry.targetEntityId();
    }

    /**
     * Read-only best match for a surface form, without creating or attaching anything.
     */
    public Optional<Entity> lookup(String surfaceText, String typeLabel) {
        if (surfaceText == null || surfaceText.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(surfaceText, typeLabel);
        Set<String> keys = blockingKeyStrategy.generateKeys(normalized, typeLabel);
        List<Entity> candidates = registry.blockCandidates(keys);
        if (candidates.isEmpty()) {
            candidates = registry.typeCandidates(typeLabel);
        }
        Entity best = null;
        double bestScore = 0.0;
        for (Entity candidate : candidates) {
            double score = similarity.score(normalized, typeLabel, "", registry.profile(candidate));
            if (score < options.getMatchThreshold()) {
                continue;
            }
            if (best == null || score > bestScore + options.getAmbiguityEpsilon()
                    || (Math.abs(score - bestScore) <= options.getAmbiguityEpsilon()
                    && prefer(candidate, best))) {
                best = candidate;
                bestScore = Math.max(bestScore, score);
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean prefer(Entity candidate, Entity current) {
        if (candidate.getIdentityConfidence() != current.getIdentityConfidence()) {
            return candidate.getIdentityConfidence() > current.getIdentityConfidence();
        }
        return Entity.compareByAge(candidate, current) < 0;
    }

    public Optional<Entity> getEntity(String entityId) {
        return registry.findEntity(entityId);
    }

    public Entity requireEntity(String entityId) {
        return entityOrThrow(entityId);
    }

    public Optional<Mention> getMention(String mentionId) {
        return registry.findMention(mentionId);
    }

    public Optional<Entity> findEntityForMention(String mentionId) {
        return registry.findOwner(mentionId).flatMap(registry::findEntity);
    }

    /**
     * Follows merge pointers to the entity that currently stands for the given id.
     */
    public String canonicalId(String entityId) {
        String current = entityId;
        Set<String> seen = new LinkedHashSet<>();
        while (seen.add(current)) {
            Entity entity = registry.findEntity(current).orElse(null);
            if (entity == null || entity.getMergedInto() == null) {
                return current;
            }
            current = entity.getMergedInto();
        }
        throw new IllegalStateException("Merge cycle detected: " + seen);
    }

    public List<Entity> listEntities() {
        return registry.allEntities();
    }

    public List<Mention> mentionsOf(String entityId) {
        return registry.mentionsOf(entityOrThrow(entityId));
    }

    public EntityRegistry getRegistry() {
        return registry;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public String normalize(String surfaceText, String typeLabel) {
        String normalized = normalizationEngine.normalize(surfaceText, typeLabel);
        if (normalized.isEmpty()) {
            // every character was stripped by a rule; fall back to the plain form
            return surfaceText.toLowerCase(Locale.ROOT).strip().replaceAll("\\s+", " ");
        }
        return normalized;
    }

    private String normalize(Mention mention) {
        return normalize(mention.text(), mention.typeLabel());
    }

    private Entity withLinks(Entity entity, Map<String, MentionLink> links, int conflictChecks) {
        double confidence = IdentityConfidence.compute(links.values(), options.getAmbiguityPenalty());
        EntityStatus status = IdentityConfidence.status(entity.getStatus(), confidence, conflictChecks,
                options.getStableThreshold());
        return Entity.builder(entity)
                .mentionLinks(links)
                .identityConfidence(confidence)
                .conflictChecksPassed(conflictChecks)
                .status(status)
                .updatedAt(clock.instant())
                .build();
    }

    private Set<String> blockingKeysOf(Entity entity) {
        Set<String> keys = new LinkedHashSet<>();
        for (String mentionId : entity.getMentionIds()) {
            registry.normalizedForm(mentionId)
                    .ifPresent(form -> keys.addAll(blockingKeyStrategy.generateKeys(form, entity.getTypeLabel())));
        }
        return keys;
    }

    private void recordStatusChange(Entity before, Entity after) {
        if (before.getStatus() != after.getStatus()) {
            auditService.record(AuditAction.ENTITY_STATUS_CHANGED, after.getId(), Map.of(
                    "from", before.getStatus().name(),
                    "to", after.getStatus().name(),
                    "identityConfidence", after.getIdentityConfidence()));
            log.info("entity.status.changed entityId={} from={} to={}",
                    after.getId(), before.getStatus(), after.getStatus());
        }
    }

    private Entity entityOrThrow(String entityId) {
        return registry.findEntity(entityId)
                .orElseThrow(() -> new UnknownIdentifierException("Entity", entityId));
    }

    private static String typeOf(Mention mention) {
        return mention.typeLabel() == null || mention.typeLabel().isBlank()
                ? "UNKNOWN" : mention.typeLabel().trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Every listener is called; the first failure is rethrown after the rest have run,
     * with later failures attached as suppressed.
     */
    private void notifyListeners(Consumer<IdentityChangeListener> event) {
        RuntimeException failure = null;
        for (IdentityChangeListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("identity.listener.failed listener={} error={}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private record Outcome(ResolutionResult result, List<String> tiedCandidateIds) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityRegistry registry;
        private NormalizationEngine normalizationEngine;
        private MentionSimilarity similarity;
        private BlockingKeyStrategy blockingKeyStrategy;
        private IdentifierLock lock;
        private ResolutionOptions options;
        private AuditService auditService;
        private MergeLedger mergeLedger;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;

        public Builder registry(EntityRegistry registry) {
            this.registry = registry;
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

        public Builder lock(IdentifierLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder mergeLedger(MergeLedger mergeLedger) {
            this.mergeLedger = mergeLedger;
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

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public IdentityResolutionService build() {
            return new IdentityResolutionService(this);
        }
    }
}
