package com.knowledge.crossmodal.metrics;

import com.knowledge.crossmodal.identity.ResolutionDecision;
import com.knowledge.crossmodal.store.CommitOutcome;
import com.knowledge.crossmodal.store.Modality;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(String typeLabel, ResolutionDecision decision, Duration duration) {
    }

    @Override
    public void incrementEntityCreated(String typeLabel) {
    }

    @Override
    public void incrementEntityMerged(String typeLabel) {
    }

    @Override
    public void incrementEntitySplit(String typeLabel) {
    }

    @Override
    public void incrementAmbiguousResolution(String typeLabel) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementCommit(CommitOutcome outcome) {
    }

    @Override
    public void incrementProjectionRetry(Modality modality) {
    }

    @Override
    public void incrementProjectionFailure(Modality modality) {
    }

    @Override
    public void recordAggregationDuration(boolean clustered, Duration duration) {
    }

    @Override
    public void recordPosterior(double posterior) {
    }

    @Override
    public void incrementDependencyDetectionDegraded() {
    }

    @Override
    public void recordEmbeddingCacheHit() {
    }

    @Override
    public void recordEmbeddingCacheMiss() {
    }
}
