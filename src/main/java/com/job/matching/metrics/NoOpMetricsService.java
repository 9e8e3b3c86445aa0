package com.job.matching.metrics;

import com.job.matching.core.model.DuplicateMatchType;
import com.job.matching.core.model.Recommendation;

import java.time.Duration;

/**
 * No-op implementation used when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(Recommendation recommendation, Duration duration) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void incrementDedupChecked() {
    }

    @Override
    public void incrementDuplicateDetected(DuplicateMatchType type) {
    }

    @Override
    public void incrementApplicationRecorded() {
    }

    @Override
    public void incrementSimilarityFallback() {
    }

    @Override
    public void recordEmbeddingCacheHit() {
    }

    @Override
    public void recordEmbeddingCacheMiss() {
    }
}
