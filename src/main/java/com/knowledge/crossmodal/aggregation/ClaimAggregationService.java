package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.audit.AuditAction;
import com.knowledge.crossmodal.audit.AuditService;
import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.ClaimKey;
import com.knowledge.crossmodal.core.model.ClaimStatus;
import com.knowledge.crossmodal.core.model.DependencyDeclaration;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.error.InsufficientEvidenceException;
import com.knowledge.crossmodal.error.UnknownIdentifierException;
import com.knowledge.crossmodal.identity.IdentityChangeListener;
import com.knowledge.crossmodal.lock.IdentifierLock;
import com.knowledge.crossmodal.lock.LocalIdentifierLock;
import com.knowledge.crossmodal.logging.LogContext;
import com.knowledge.crossmodal.metrics.MetricsService;
import com.knowledge.crossmodal.metrics.NoOpMetricsService;
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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Owns claims and their evidence, and keeps each claim's posterior equal to the aggregation
 * of its current evidence list.
 *
 * <p>Every write to a claim holds that claim's lock. Finding or creating the claim for a
 * triple additionally holds the triple's lock, so two raw claims about the same triple
 * always land on one claim record. As an {@link IdentityChangeListener} the service moves
 * claims off entities retired by a merge.</p>
 */
public class ClaimAggregationService implements IdentityChangeListener {
    private static final Logger log = LoggerFactory.getLogger(ClaimAggregationService.class);

    private static final String CLAIM_LOCK_PREFIX = "claim:";
    private static final String TRIPLE_LOCK_PREFIX = "triple:";
    private static final int MAX_REDIRECTS = 16;

    private final ClaimRegistry registry;
    private final BayesianAggregator aggregator;
    private final IdentifierLock lock;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private final List<ClaimChangeListener> listeners = new CopyOnWriteArrayList<>();

    private ClaimAggregationService(Builder builder) {
        this.registry = builder.registry != null ? builder.registry : new ClaimRegistry();
        this.aggregator = builder.aggregator != null ? builder.aggregator : new BayesianAggregator();
        this.lock = builder.lock != null ? builder.lock : new LocalIdentifierLock();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public void addListener(ClaimChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ClaimChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns the active claim for the triple, creating it without evidence if none exists.
     */
    public String openClaim(ClaimKey key) {
        String tripleLock = tripleLock(key);
        Claim created;
        lock.lock(tripleLock);
        try {
            Optional<Claim> existing = registry.findActive(key);
            if (existing.isPresent()) {
                return existing.get().getId();
            }
            Instant now = clock.instant();
            created = Claim.builder().key(key).createdAt(now).updatedAt(now).build();
            registry.put(created);
            auditService.record(AuditAction.CLAIM_OPENED, created.getId(), Map.of(
                    "subjectId", key.subjectId(),
                    "predicate", key.predicate(),
                    "object", key.object().value()));
            log.info("claim.opened claimId={} subjectId={} predicate={} object={}",
                    created.getId(), key.subjectId(), key.predicate(), key.object().value());
        } finally {
            lock.unlock(tripleLock);
        }
        notifyListeners(List.of(new Change(created.getId(), List.of(key.subjectId()))));
        return created.getId();
    }

    /**
     * Appends the evidence items not yet recorded (by evidence id) and recomputes the posterior.
     * Resubmitting evidence that is already recorded leaves the claim unchanged.
     *
     * @throws InsufficientEvidenceException if {@code evidence} is empty
     * @throws UnknownIdentifierException    if the claim does not exist
     */
    public double aggregate(String claimId, List<EvidenceItem> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            throw new InsufficientEvidenceException(claimId, "Cannot aggregate an empty evidence list for claim " + claimId);
        }
        try (LogContext ignored = LogContext.forAggregation(claimId);
             Span span = tracingService.startSpan(TraceOperation.AGGREGATE,
                     Map.of("claimId", claimId, "evidence", String.valueOf(evidence.size())))) {
            Update update;
            try {
                update = underClaimLock(claimId, claim -> {
                    Map<String, EvidenceItem> fresh = new LinkedHashMap<>();
                    for (EvidenceItem item : evidence) {
                        if (!claim.hasEvidence(item.evidenceId())) {
                            fresh.putIfAbsent(item.evidenceId(), item);
                        }
                    }
                    if (fresh.isEmpty() && claim.getAuditTrail().isPresent()) {
                        log.debug("claim.evidence.duplicate claimId={} submitted={}", claim.getId(), evidence.size());
                        return new Update(claim, false);
                    }
                    List<EvidenceItem> all = new ArrayList<>(claim.getEvidence());
                    all.addAll(fresh.values());
                    return new Update(reaggregate(claim, all, claim.getDependencyDeclarations(),
                            Map.of("added", fresh.size())), true);
                });
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
            double posterior = update.claim().getPosterior().getAsDouble();
            span.setAttribute("posterior", posterior);
            span.setStatus(Span.SpanStatus.OK);
            if (update.changed()) {
                notifyListeners(List.of(changeOf(update.claim())));
            }
            return posterior;
        }
    }

    /**
     * Re-runs the aggregation over the current evidence. Deterministic: an unchanged claim
     * yields a bit-identical posterior and the stored trail is kept.
     *
     * @throws InsufficientEvidenceException if the claim has no evidence
     */
    public double recompute(String claimId) {
        try (LogContext ignored = LogContext.forAggregation(claimId)) {
            Update update = underClaimLock(claimId, claim -> {
                if (claim.getEvidence().isEmpty()) {
                    throw new InsufficientEvidenceException(claim.getId(), "Claim " + claim.getId() + " has no evidence");
                }
                AuditTrail trail = aggregator.aggregate(claim.getId(), claim.getEvidence(),
                        claim.getDependencyDeclarations(), clock.instant());
                if (trail.sameResult(claim.getAuditTrail().orElse(null))) {
                    return new Update(claim, false);
                }
                return new Update(store(claim, claim.getEvidence(), claim.getDependencyDeclarations(), trail,
                        Map.of("recomputed", true)), true);
            });
            if (update.changed()) {
                notifyListeners(List.of(changeOf(update.claim())));
            }
            return update.claim().getPosterior().getAsDouble();
        }
    }

    /**
     * Derivation of the claim's current posterior.
     *
     * @throws InsufficientEvidenceException if the claim was never aggregated
     */
    public AuditTrail explain(String claimId) {
        Claim claim = claimOrThrow(claimId);
        return claim.getAuditTrail().orElseThrow(() -> new InsufficientEvidenceException(claimId,
                "Claim " + claimId + " has not been aggregated"));
    }

    /**
     * Records that the given evidence items share an upstream origin and re-aggregates.
     * The evidence items themselves are left as submitted.
     *
     * @return the re-aggregated posterior
     */
    public double declareDependency(String claimId, Collection<String> evidenceIds, String reason) {
        Set<String> ids = new TreeSet<>(evidenceIds);
        if (ids.size() < 2) {
            throw new IllegalArgumentException("A dependency needs at least two distinct evidence ids");
        }
        try (LogContext ignored = LogContext.forAggregation(claimId)) {
            Update update = underClaimLock(claimId, claim -> {
                for (String id : ids) {
                    if (!claim.hasEvidence(id)) {
                        throw new UnknownIdentifierException("Evidence", id);
                    }
                }
                List<DependencyDeclaration> declarations = new ArrayList<>(claim.getDependencyDeclarations());
                boolean alreadyDeclared = declarations.stream().anyMatch(d -> d.evidenceIds().equals(ids));
                if (!alreadyDeclared) {
                    declarations.add(new DependencyDeclaration(ids, reason, clock.instant()));
                    auditService.record(AuditAction.DEPENDENCY_DECLARED, claim.getId(), Map.of(
                            "evidenceIds", List.copyOf(ids),
                            "reason", reason != null ? reason : "declared"));
                    log.info("claim.dependency.declared claimId={} evidenceIds={} reason='{}'",
                            claim.getId(), ids, reason);
                }
                return new Update(reaggregate(claim, claim.getEvidence(), declarations,
                        Map.of("declaredDependency", List.copyOf(ids))), true);
            });
            if (update.changed()) {
                notifyListeners(List.of(changeOf(update.claim())));
            }
            return update.claim().getPosterior().getAsDouble();
        }
    }

    // ── Identity changes ───────────────────────────────────────────

    /**
     * Re-keys the claims naming the retired entity onto the survivor. A claim whose re-keyed
     * triple already exists is folded into that claim and retired.
     */
    @Override
    public void onMerge(String retiredEntityId, String survivorId) {
        List<Change> changes = new ArrayList<>();
        for (Claim claim : registry.activeReferencing(retiredEntityId)) {
            changes.addAll(rekey(claim.getId(), retiredEntityId, survivorId));
        }
        if (!changes.isEmpty()) {
            log.info("claims.rekeyed retiredEntityId={} survivorId={} claims={}",
                    retiredEntityId, survivorId, changes.size());
        }
        notifyListeners(changes);
    }

    private List<Change> rekey(String claimId, String from, String to) {
        for (int attempt = 0; attempt < MAX_REDIRECTS; attempt++) {
            Claim peek = registry.find(claimId).orElse(null);
            if (peek == null || !peek.isActive() || !peek.getKey().references(from)) {
                return List.of();
            }
            ClaimKey newKey = peek.getKey().repoint(from, to);
            Optional<Claim> peekTarget = registry.findActive(newKey);
            List<String> keys = new ArrayList<>(List.of(CLAIM_LOCK_PREFIX + claimId, tripleLock(newKey)));
            peekTarget.ifPresent(t -> keys.add(CLAIM_LOCK_PREFIX + t.getId()));

            try (IdentifierLock.LockHandle handle = lock.lockAll(keys)) {
                Claim current = registry.find(claimId).orElseThrow();
                if (!current.isActive() || !current.getKey().references(from)) {
                    return List.of();
                }
                Optional<Claim> target = registry.findActive(newKey);
                if (target.isPresent() && !target.get().getId().equals(claimId)
                        && !target.map(Claim::getId).equals(peekTarget.map(Claim::getId))) {
                    // a claim appeared at the new triple after we looked; take its lock too
                    continue;
                }
                if (target.isEmpty() || target.get().getId().equals(claimId)) {
                    Claim rekeyed = Claim.builder(current).key(newKey).updatedAt(clock.instant()).build();
                    registry.put(rekeyed);
                    auditService.record(AuditAction.CLAIM_REKEYED, claimId, Map.of(
                            "fromEntityId", from,
                            "toEntityId", to,
                            "subjectId", newKey.subjectId()));
                    return List.of(new Change(claimId, List.of(current.getKey().subjectId(), newKey.subjectId())));
                }
                return fold(current, target.get(), newKey);
            }
        }
        throw new IllegalStateException("Claim " + claimId + " kept moving while being re-keyed");
    }

    private List<Change> fold(Claim duplicate, Claim survivor, ClaimKey newKey) {
        Map<String, EvidenceItem> evidence = new LinkedHashMap<>();
        survivor.getEvidence().forEach(e -> evidence.put(e.evidenceId(), e));
        duplicate.getEvidence().forEach(e -> evidence.putIfAbsent(e.evidenceId(), e));
        List<DependencyDeclaration> declarations = new ArrayList<>(survivor.getDependencyDeclarations());
        for (DependencyDeclaration declaration : duplicate.getDependencyDeclarations()) {
            if (declarations.stream().noneMatch(d -> d.evidenceIds().equals(declaration.evidenceIds()))) {
                declarations.add(declaration);
            }
        }

        Instant now = clock.instant();
        Claim retired = Claim.builder(duplicate)
                .status(ClaimStatus.RETIRED)
                .mergedInto(survivor.getId())
                .updatedAt(now)
                .build();
        registry.put(retired);

        List<EvidenceItem> all = new ArrayList<>(evidence.values());
        Claim folded = all.isEmpty()
                ? survivor
                : reaggregate(survivor, all, declarations, Map.of("foldedClaimId", duplicate.getId()));
        auditService.record(AuditAction.CLAIM_FOLDED, survivor.getId(), Map.of(
                "retiredClaimId", duplicate.getId(),
                "evidenceCount", all.size()));
        log.info("claim.folded retiredClaimId={} survivorClaimId={} evidence={}",
                duplicate.getId(), survivor.getId(), all.size());
        return List.of(
                new Change(duplicate.getId(), List.of(duplicate.getKey().subjectId(), newKey.subjectId())),
                changeOf(folded));
    }

    // ── Reads ─────────────────────────────────────────────────────

    public Optional<Claim> getClaim(String claimId) {
        return registry.find(claimId);
    }

    public Optional<Claim> findClaim(ClaimKey key) {
        return registry.findActive(key);
    }

    public List<Claim> listClaims() {
        return registry.all();
    }

    /**
     * Active claims with the entity as subject.
     */
    public List<Claim> claimsAbout(String entityId) {
        return registry.activeWithSubject(entityId);
    }

    /**
     * Follows fold redirects to the claim that now holds the evidence.
     */
    public String canonicalClaimId(String claimId) {
        String current = claimId;
        Set<String> seen = new HashSet<>();
        while (true) {
            Claim claim = claimOrThrow(current);
            if (claim.getMergedInto() == null) {
                return current;
            }
            if (!seen.add(current)) {
                throw new IllegalStateException("Claim redirect cycle at " + current);
            }
            current = claim.getMergedInto();
        }
    }

    public ClaimRegistry getRegistry() {
        return registry;
    }

    public BayesianAggregator getAggregator() {
        return aggregator;
    }

    // ── Internals ─────────────────────────────────────────────────

    /**
     * Runs the action on the active claim the id currently resolves to, holding its lock.
     */
    private Update underClaimLock(String claimId, Function<Claim, Update> action) {
        for (int hop = 0; hop < MAX_REDIRECTS; hop++) {
            String target = canonicalClaimId(claimId);
            String key = CLAIM_LOCK_PREFIX + target;
            lock.lock(key);
            try {
                Claim claim = claimOrThrow(target);
                if (claim.isActive()) {
                    return action.apply(claim);
                }
            } finally {
                lock.unlock(key);
            }
        }
        throw new IllegalStateException("Claim " + claimId + " kept moving while being updated");
    }

    private Claim reaggregate(Claim claim, List<EvidenceItem> evidence, List<DependencyDeclaration> declarations,
                              Map<String, Object> details) {
        long start = System.nanoTime();
        AuditTrail trail = aggregator.aggregate(claim.getId(), evidence, declarations, clock.instant());
        metricsService.recordAggregationDuration(trail.isClustered(), Duration.ofNanos(System.nanoTime() - start));
        return store(claim, evidence, declarations, trail, details);
    }

    private Claim store(Claim claim, List<EvidenceItem> evidence, List<DependencyDeclaration> declarations,
                        AuditTrail trail, Map<String, Object> details) {
        Claim updated = Claim.builder(claim)
                .evidence(evidence)
                .dependencyDeclarations(declarations)
                .auditTrail(trail)
                .updatedAt(trail.computedAt())
                .build();
        registry.put(updated);

        metricsService.recordPosterior(trail.posterior());
        if (trail.lowerTrust()) {
            metricsService.incrementDependencyDetectionDegraded();
        }
        Map<String, Object> auditDetails = new LinkedHashMap<>(details);
        auditDetails.put("posterior", trail.posterior());
        auditDetails.put("evidenceCount", evidence.size());
        auditDetails.put("method", trail.method());
        auditDetails.put("lowerTrust", trail.lowerTrust());
        auditService.record(AuditAction.CLAIM_AGGREGATED, claim.getId(), auditDetails);
        log.info("claim.aggregated claimId={} evidence={} clusters={} method={} posterior={} lowerTrust={}",
                claim.getId(), evidence.size(), trail.clusters().size(), trail.method(), trail.posterior(),
                trail.lowerTrust());
        return updated;
    }

    private Claim claimOrThrow(String claimId) {
        return registry.find(claimId).orElseThrow(() -> new UnknownIdentifierException("Claim", claimId));
    }

    private static String tripleLock(ClaimKey key) {
        return TRIPLE_LOCK_PREFIX + key.subjectId() + '|' + key.predicate() + '|'
                + (key.object().isEntity() ? "e:" : "l:") + key.object().value();
    }

    private static Change changeOf(Claim claim) {
        return new Change(claim.getId(), List.of(claim.getKey().subjectId()));
    }

    /**
     * Every listener sees every change; the first failure is rethrown at the end with later
     * failures attached as suppressed.
     */
    private void notifyListeners(List<Change> changes) {
        RuntimeException failure = null;
        for (Change change : changes) {
            for (ClaimChangeListener listener : listeners) {
                try {
                    listener.onClaimChanged(change.claimId(), change.affectedEntityIds());
                } catch (RuntimeException e) {
                    log.error("claim.listener.failed claimId={} listener={} error={}",
                            change.claimId(), listener.getClass().getSimpleName(), e.getMessage(), e);
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private record Update(Claim claim, boolean changed) {
    }

    private record Change(String claimId, Set<String> affectedEntityIds) {
        Change(String claimId, List<String> affectedEntityIds) {
            this(claimId, Set.copyOf(new LinkedHashSet<>(affectedEntityIds)));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ClaimRegistry registry;
        private BayesianAggregator aggregator;
        private IdentifierLock lock;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;

        public Builder registry(ClaimRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder aggregator(BayesianAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder lock(IdentifierLock lock) {
            this.lock = lock;
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

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ClaimAggregationService build() {
            return new ClaimAggregationService(this);
        }
    }
}
