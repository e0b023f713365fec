package com.knowledge.crossmodal.cdi;

import com.knowledge.crossmodal.aggregation.AggregationOptions;
import com.knowledge.crossmodal.api.CrossModalKnowledgeBase;
import com.knowledge.crossmodal.api.KnowledgeContext;
import com.knowledge.crossmodal.api.KnowledgePipeline;
import com.knowledge.crossmodal.embedding.CacheConfig;
import com.knowledge.crossmodal.embedding.HashingEmbeddingFunction;
import com.knowledge.crossmodal.identity.ResolutionOptions;
import com.knowledge.crossmodal.ingest.IngestionGateway;
import com.knowledge.crossmodal.lock.LockConfig;
import com.knowledge.crossmodal.metrics.MicrometerMetricsService;
import com.knowledge.crossmodal.store.RetryPolicy;
import com.knowledge.crossmodal.store.StoreOptions;
import com.knowledge.crossmodal.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires the knowledge base from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus), it reads the
 * {@code crossmodal.*} properties and produces a {@link CrossModalKnowledgeBase} and a
 * {@link KnowledgePipeline}. A {@link MeterRegistry} or {@link OpenTelemetry} bean, when
 * present, switches on metrics or tracing.</p>
 *
 * <pre>
 * crossmodal:
 *   resolution:
 *     match-threshold: 0.80
 *   aggregation:
 *     prior: 0.5
 *   store:
 *     max-attempts: 3
 * </pre>
 */
@ApplicationScoped
public class KnowledgeBaseProducer {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseProducer.class);

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "crossmodal.resolution.match-threshold", defaultValue = "0.80")
    double matchThreshold;

    @Inject
    @ConfigProperty(name = "crossmodal.resolution.ambiguity-epsilon", defaultValue = "0.02")
    double ambiguityEpsilon;

    @Inject
    @ConfigProperty(name = "crossmodal.resolution.ambiguity-penalty", defaultValue = "0.15")
    double ambiguityPenalty;

    @Inject
    @ConfigProperty(name = "crossmodal.resolution.stable-threshold", defaultValue = "0.80")
    double stableThreshold;

    // ── Aggregation ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "crossmodal.aggregation.prior", defaultValue = "0.5")
    double prior;

    @Inject
    @ConfigProperty(name = "crossmodal.aggregation.clamp-min", defaultValue = "0.001")
    double clampMin;

    @Inject
    @ConfigProperty(name = "crossmodal.aggregation.clamp-max", defaultValue = "0.999")
    double clampMax;

    @Inject
    @ConfigProperty(name = "crossmodal.aggregation.closed-form-max-items", defaultValue = "3")
    int closedFormMaxItems;

    @Inject
    @ConfigProperty(name = "crossmodal.aggregation.citation-overlap-threshold", defaultValue = "0.3")
    double citationOverlapThreshold;

    @Inject
    @ConfigProperty(name = "crossmodal.aggregation.cascade-window-minutes", defaultValue = "360")
    long cascadeWindowMinutes;

    @Inject
    @ConfigProperty(name = "crossmodal.aggregation.cascade-strength", defaultValue = "0.75")
    double cascadeStrength;

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "crossmodal.store.max-attempts", defaultValue = "3")
    int maxAttempts;

    @Inject
    @ConfigProperty(name = "crossmodal.store.initial-backoff-millis", defaultValue = "50")
    long initialBackoffMillis;

    @Inject
    @ConfigProperty(name = "crossmodal.store.backoff-multiplier", defaultValue = "2.0")
    double backoffMultiplier;

    @Inject
    @ConfigProperty(name = "crossmodal.store.max-backoff-millis", defaultValue = "1000")
    long maxBackoffMillis;

    @Inject
    @ConfigProperty(name = "crossmodal.lock.timeout-millis", defaultValue = "5000")
    long lockTimeoutMillis;

    // ── Embeddings ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "crossmodal.embedding.dimension", defaultValue = "64")
    int embeddingDimension;

    @Inject
    @ConfigProperty(name = "crossmodal.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "crossmodal.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "crossmodal.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Ingestion ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "crossmodal.ingest.extraction-timeout-seconds", defaultValue = "60")
    long extractionTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "crossmodal.ingest.parallelism", defaultValue = "4")
    int parallelism;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<OpenTelemetry> openTelemetry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public CrossModalKnowledgeBase knowledgeBase() {
        LockConfig lockConfig = LockConfig.of(Duration.ofMillis(lockTimeoutMillis));

        KnowledgeContext.Builder context = KnowledgeContext.builder().lockConfig(lockConfig);
        if (meterRegistry.isResolvable()) {
            context.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Metrics enabled");
        }
        if (openTelemetry.isResolvable()) {
            context.tracingService(new OpenTelemetryTracingService(openTelemetry.get()));
            log.info("Tracing enabled");
        }

        ResolutionOptions resolutionOptions = ResolutionOptions.builder()
                .matchThreshold(matchThreshold)
                .ambiguityEpsilon(ambiguityEpsilon)
                .ambiguityPenalty(ambiguityPenalty)
                .stableThreshold(stableThreshold)
                .build();

        AggregationOptions aggregationOptions = AggregationOptions.builder()
                .prior(prior)
                .clamp(clampMin, clampMax)
                .closedFormMaxItems(closedFormMaxItems)
                .citationOverlapThreshold(citationOverlapThreshold)
                .cascadeWindow(Duration.ofMinutes(cascadeWindowMinutes))
                .cascadeStrength(cascadeStrength)
                .build();

        StoreOptions storeOptions = StoreOptions.builder()
                .lockConfig(lockConfig)
                .retryPolicy(new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMillis),
                        backoffMultiplier, Duration.ofMillis(maxBackoffMillis)))
                .build();

        log.info("Producing CrossModalKnowledgeBase: resolution={} aggregation={} store={}",
                resolutionOptions, aggregationOptions, storeOptions);

        return CrossModalKnowledgeBase.builder()
                .context(context.build())
                .resolutionOptions(resolutionOptions)
                .aggregationOptions(aggregationOptions)
                .storeOptions(storeOptions)
                .embeddingFunction(new HashingEmbeddingFunction(embeddingDimension))
                .cacheConfig(cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : null)
                .build();
    }

    public void closeKnowledgeBase(@Disposes CrossModalKnowledgeBase knowledgeBase) {
        log.info("Closing CrossModalKnowledgeBase");
        knowledgeBase.close();
    }

    @Produces
    @ApplicationScoped
    public KnowledgePipeline knowledgePipeline(CrossModalKnowledgeBase knowledgeBase) {
        log.info("Producing KnowledgePipeline: parallelism={} extractionTimeout={}s",
                parallelism, extractionTimeoutSeconds);
        return new KnowledgePipeline(knowledgeBase,
                new IngestionGateway(Duration.ofSeconds(extractionTimeoutSeconds)), parallelism);
    }

    public void closePipeline(@Disposes KnowledgePipeline pipeline) {
        log.info("Closing KnowledgePipeline");
        pipeline.close();
    }
}
