package com.job.matching.metrics;

import com.job.matching.core.model.DuplicateMatchType;
import com.job.matching.core.model.Recommendation;

import java.time.Duration;

/**
 * Interface for recording matching and deduplication metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordMatchDuration(Recommendation recommendation, Duration duration);

    void recordMatchScore(double score);

    void incrementDedupChecked();

    void incrementDuplicateDetected(DuplicateMatchType type);

    void incrementApplicationRecorded();

    /**
     * Called each time a similarity falls back to the lexical score alone.
     */
    void incrementSimilarityFallback();

    void recordEmbeddingCacheHit();

    void recordEmbeddingCacheMiss();
}
