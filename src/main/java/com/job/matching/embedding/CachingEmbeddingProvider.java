package com.job.matching.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.job.matching.metrics.MetricsService;
import com.job.matching.metrics.NoOpMetricsService;

import java.time.Duration;

/**
 * Caffeine-backed decorator that memoizes vectors by input text.
 * Failures are not cached, so a backend that comes back is used again.
 */
public class CachingEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProvider delegate;
    private final Cache<String, float[]> cache;
    private final MetricsService metricsService;

    public CachingEmbeddingProvider(EmbeddingProvider delegate, long maxSize, Duration ttl) {
        this(delegate, maxSize, ttl, new NoOpMetricsService());
    }

    public CachingEmbeddingProvider(EmbeddingProvider delegate, long maxSize, Duration ttl,
                                    MetricsService metricsService) {
        this.delegate = delegate;
        this.metricsService = metricsService;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .build();
    }

    @Override
    public float[] embed(String text) {
        String key = text == null ? "" : text;
        float[] cached = cache.getIfPresent(key);
        if (cached != null) {
            metricsService.recordEmbeddingCacheHit();
            return cached.clone();
        }
        metricsService.recordEmbeddingCacheMiss();
        float[] vector = delegate.embed(key);
        cache.put(key, vector.clone());
        return vector;
    }

    @Override
    public String getProviderName() {
        return delegate.getProviderName() + "+cache";
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
