package com.knowledge.crossmodal.metrics;

import com.knowledge.crossmodal.identity.ResolutionDecision;
import com.knowledge.crossmodal.store.CommitOutcome;
import com.knowledge.crossmodal.store.Modality;

import java.time.Duration;

/**
 * Records engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend on the classpath.
 */
public interface MetricsService {

    void recordResolutionDuration(String typeLabel, ResolutionDecision decision, Duration duration);

    void incrementEntityCreated(String typeLabel);

    void incrementEntityMerged(String typeLabel);

    void incrementEntitySplit(String typeLabel);

    void incrementAmbiguousResolution(String typeLabel);

    void recordSimilarityScore(double score);

    void incrementCommit(CommitOutcome outcome);

    void incrementProjectionRetry(Modality modality);

    void incrementProjectionFailure(Modality modality);

    void recordAggregationDuration(boolean clustered, Duration duration);

    void recordPosterior(double posterior);

    void incrementDependencyDetectionDegraded();

    void recordEmbeddingCacheHit();

    void recordEmbeddingCacheMiss();
}
