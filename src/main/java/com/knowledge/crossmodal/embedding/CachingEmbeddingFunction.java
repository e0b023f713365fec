package com.knowledge.crossmodal.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.knowledge.crossmodal.metrics.MetricsService;
import com.knowledge.crossmodal.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Caffeine-backed cache in front of another {@link EmbeddingFunction}, keyed by input text.
 * Callers receive a copy of the cached vector, so cached and uncached results are
 * interchangeable.
 */
public class CachingEmbeddingFunction implements EmbeddingFunction {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingFunction.class);

    private final EmbeddingFunction delegate;
    private final Cache<String, double[]> cache;
    private final MetricsService metrics;

    public CachingEmbeddingFunction(EmbeddingFunction delegate, CacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingEmbeddingFunction(EmbeddingFunction delegate, CacheConfig config, MetricsService metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("embedding.cache.initialized model={} maxSize={} ttl={}s",
                delegate.modelId(), config.maxSize(), config.ttlSeconds());
    }

    /**
     * Wraps the delegate when the config enables caching, otherwise returns it unchanged.
     */
    public static EmbeddingFunction wrap(EmbeddingFunction delegate, CacheConfig config, MetricsService metrics) {
        return config.enabled() ? new CachingEmbeddingFunction(delegate, config, metrics) : delegate;
    }

    @Override
    public double[] embed(String text) {
        String key = text != null ? text : "";
        double[] cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordEmbeddingCacheHit();
            return cached.clone();
        }
        metrics.recordEmbeddingCacheMiss();
        double[] computed = cache.get(key, delegate::embed);
        return computed.clone();
    }

    @Override
    public int dimension() {
        return delegate.dimension();
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
