package com.knowledge.crossmodal.embedding;

import com.knowledge.crossmodal.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Embedding Tests")
class EmbeddingFunctionTest {

    @Nested
    @DisplayName("HashingEmbeddingFunction")
    class HashingTests {

        private final HashingEmbeddingFunction embeddings = new HashingEmbeddingFunction();

        @Test
        @DisplayName("Same text yields a bit-identical unit vector")
        void deterministic() {
            double[] first = embeddings.embed("Tim Cook");
            double[] second = new HashingEmbeddingFunction().embed("Tim Cook");

            assertArrayEquals(first, second);
            assertEquals(1.0, EmbeddingFunction.cosine(first, first), 1e-9);
            double norm = 0.0;
            for (double v : first) {
                norm += v * v;
            }
            assertEquals(1.0, Math.sqrt(norm), 1e-9);
        }

        @Test
        @DisplayName("Case and surrounding whitespace do not change the vector")
        void caseInsensitive() {
            assertArrayEquals(embeddings.embed("Tim Cook"), embeddings.embed("  tim cook "));
        }

        @Test
        @DisplayName("Similar text is closer than unrelated text")
        void similarityOrdering() {
            double[] query = embeddings.embed("tim cook");
            double close = EmbeddingFunction.cosine(query, embeddings.embed("tim cooke"));
            double far = EmbeddingFunction.cosine(query, embeddings.embed("quarterly revenue"));

            assertTrue(close > far);
        }

        @Test
        @DisplayName("Blank text embeds to the zero vector")
        void blankText() {
            double[] zero = embeddings.embed(" ");
            assertEquals(HashingEmbeddingFunction.DEFAULT_DIMENSION, zero.length);
            assertEquals(0.0, EmbeddingFunction.cosine(zero, embeddings.embed("x")));
        }

        @Test
        @DisplayName("Model id names the dimension")
        void modelId() {
            assertEquals("hashing-trigram-32", new HashingEmbeddingFunction(32).modelId());
            assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingFunction(4));
            assertThrows(IllegalArgumentException.class,
                    () -> EmbeddingFunction.cosine(new double[2], new double[3]));
        }
    }

    @Nested
    @DisplayName("CachingEmbeddingFunction")
    @ExtendWith(MockitoExtension.class)
    class CachingTests {

        @Mock
        EmbeddingFunction delegate;

        @Test
        @DisplayName("Repeated text is served from the cache")
        void cachesVectors() {
            when(delegate.embed("tim cook")).thenReturn(new double[]{0.6, 0.8});
            when(delegate.modelId()).thenReturn("mock-2");
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            CachingEmbeddingFunction cached = new CachingEmbeddingFunction(delegate, CacheConfig.defaults(),
                    new MicrometerMetricsService(registry));

            double[] first = cached.embed("tim cook");
            double[] second = cached.embed("tim cook");

            assertArrayEquals(first, second);
            verify(delegate, times(1)).embed("tim cook");
            assertEquals(1, cached.hitCount());
            assertEquals(1.0, registry.find("knowledge.embedding.cache.hit").counter().count());
            assertEquals(1.0, registry.find("knowledge.embedding.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Callers get copies they cannot use to corrupt the cache")
        void returnsCopies() {
            when(delegate.embed("apple")).thenReturn(new double[]{1.0, 0.0});
            when(delegate.modelId()).thenReturn("mock-2");
            CachingEmbeddingFunction cached = new CachingEmbeddingFunction(delegate, CacheConfig.defaults());

            cached.embed("apple")[0] = 42.0;

            assertEquals(1.0, cached.embed("apple")[0]);
        }

        @Test
        @DisplayName("A disabled config leaves the delegate unwrapped")
        void disabledConfig() {
            assertSame(delegate, CachingEmbeddingFunction.wrap(delegate, CacheConfig.disabled(), null));
        }

        @Test
        @DisplayName("Invalidation forces recomputation")
        void invalidateAll() {
            when(delegate.embed("apple")).thenReturn(new double[]{1.0, 0.0});
            when(delegate.modelId()).thenReturn("mock-2");
            CachingEmbeddingFunction cached = new CachingEmbeddingFunction(delegate, CacheConfig.defaults());

            cached.embed("apple");
            cached.invalidateAll();
            cached.embed("apple");

            verify(delegate, times(2)).embed("apple");
        }

        @Test
        @DisplayName("Cache config is validated")
        void configValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }
    }
}
