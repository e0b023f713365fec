package com.knowledge.crossmodal.metrics;

import com.knowledge.crossmodal.identity.ResolutionDecision;
import com.knowledge.crossmodal.store.CommitOutcome;
import com.knowledge.crossmodal.store.Modality;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code knowledge.resolution.duration} Timer (tags: type, decision)</li>
 *   <li>{@code knowledge.entity.created|merged|split} Counters (tag: type)</li>
 *   <li>{@code knowledge.resolution.ambiguous} Counter (tag: type)</li>
 *   <li>{@code knowledge.similarity.score} DistributionSummary</li>
 *   <li>{@code knowledge.store.commit} Counter (tag: outcome)</li>
 *   <li>{@code knowledge.projection.retry|failure} Counters (tag: modality)</li>
 *   <li>{@code knowledge.aggregation.duration} Timer (tag: method)</li>
 *   <li>{@code knowledge.claim.posterior} DistributionSummary</li>
 *   <li>{@code knowledge.aggregation.degraded} Counter</li>
 *   <li>{@code knowledge.embedding.cache.hit|miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary posteriorSummary;
    private final Counter degradedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("knowledge.similarity.score")
                .description("Best candidate similarity per resolved mention")
                .register(registry);
        this.posteriorSummary = DistributionSummary.builder("knowledge.claim.posterior")
                .description("Distribution of aggregated claim posteriors")
                .register(registry);
        this.degradedCounter = Counter.builder("knowledge.aggregation.degraded")
                .description("Aggregations that fell back to the independence assumption")
                .register(registry);
        this.cacheHitCounter = Counter.builder("knowledge.embedding.cache.hit")
                .description("Embedding cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("knowledge.embedding.cache.miss")
                .description("Embedding cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(String typeLabel, ResolutionDecision decision, Duration duration) {
        String type = label(typeLabel);
        Timer timer = timerCache.computeIfAbsent("resolve:" + type + ":" + decision.name(), k ->
                Timer.builder("knowledge.resolution.duration")
                        .description("Duration of mention resolution")
                        .tag("type", type)
                        .tag("decision", decision.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementEntityCreated(String typeLabel) {
        typedCounter("knowledge.entity.created", "Entities created", typeLabel).increment();
    }

    @Override
    public void incrementEntityMerged(String typeLabel) {
        typedCounter("knowledge.entity.merged", "Entities retired by merge", typeLabel).increment();
    }

    @Override
    public void incrementEntitySplit(String typeLabel) {
        typedCounter("knowledge.entity.split", "Entities split", typeLabel).increment();
    }

    @Override
    public void incrementAmbiguousResolution(String typeLabel) {
        typedCounter("knowledge.resolution.ambiguous", "Resolutions with tied candidates", typeLabel).increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void incrementCommit(CommitOutcome outcome) {
        counterCache.computeIfAbsent("commit:" + outcome.name(), k ->
                Counter.builder("knowledge.store.commit")
                        .description("Commit attempts by outcome")
                        .tag("outcome", outcome.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementProjectionRetry(Modality modality) {
        modalityCounter("knowledge.projection.retry", "Retried projection stages", modality).increment();
    }

    @Override
    public void incrementProjectionFailure(Modality modality) {
        modalityCounter("knowledge.projection.failure", "Projection stages that exhausted retries", modality)
                .increment();
    }

    @Override
    public void recordAggregationDuration(boolean clustered, Duration duration) {
        String method = clustered ? "clustered" : "closed_form";
        timerCache.computeIfAbsent("aggregate:" + method, k ->
                Timer.builder("knowledge.aggregation.duration")
                        .description("Duration of claim aggregation")
                        .tag("method", method)
                        .register(registry)).record(duration);
    }

    @Override
    public void recordPosterior(double posterior) {
        posteriorSummary.record(posterior);
    }

    @Override
    public void incrementDependencyDetectionDegraded() {
        degradedCounter.increment();
    }

    @Override
    public void recordEmbeddingCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordEmbeddingCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter typedCounter(String name, String description, String typeLabel) {
        String type = label(typeLabel);
        return counterCache.computeIfAbsent(name + ":" + type, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("type", type)
                        .register(registry));
    }

    private Counter modalityCounter(String name, String description, Modality modality) {
        return counterCache.computeIfAbsent(name + ":" + modality.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("modality", modality.name())
                        .register(registry));
    }

    private static String label(String typeLabel) {
        return typeLabel == null || typeLabel.isBlank() ? "UNKNOWN" : typeLabel.toUpperCase(Locale.ROOT);
    }
}
