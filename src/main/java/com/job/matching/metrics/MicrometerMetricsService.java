package com.job.matching.metrics;

import com.job.matching.core.model.DuplicateMatchType;
import com.job.matching.core.model.Recommendation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code job.match.duration} (timer, tag: recommendation)</li>
 *   <li>{@code job.match.score} (distribution summary)</li>
 *   <li>{@code job.dedup.checked}, {@code job.dedup.inserted} (counters)</li>
 *   <li>{@code job.dedup.duplicate} (counter, tag: matchType)</li>
 *   <li>{@code job.similarity.fallback} (counter)</li>
 *   <li>{@code job.embedding.cache.hit}, {@code job.embedding.cache.miss} (counters)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<Recommendation, Timer> matchTimers = new ConcurrentHashMap<>();
    private final Map<DuplicateMatchType, Counter> duplicateCounters = new ConcurrentHashMap<>();
    private final DistributionSummary matchScoreSummary;
    private final Counter dedupCheckedCounter;
    private final Counter insertedCounter;
    private final Counter fallbackCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchScoreSummary = DistributionSummary.builder("job.match.score")
                .description("Distribution of overall match scores")
                .register(registry);
        this.dedupCheckedCounter = Counter.builder("job.dedup.checked")
                .description("Number of postings checked against the duplicate index")
                .register(registry);
        this.insertedCounter = Counter.builder("job.dedup.inserted")
                .description("Number of applications recorded in the duplicate index")
                .register(registry);
        this.fallbackCounter = Counter.builder("job.similarity.fallback")
                .description("Number of similarity computations that fell back to lexical only")
                .register(registry);
        this.cacheHitCounter = Counter.builder("job.embedding.cache.hit")
                .description("Number of embedding cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("job.embedding.cache.miss")
                .description("Number of embedding cache misses")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(Recommendation recommendation, Duration duration) {
        Timer timer = matchTimers.computeIfAbsent(recommendation, r ->
                Timer.builder("job.match.duration")
                        .description("Duration of a single resume-to-posting match")
                        .tag("recommendation", r.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordMatchScore(double score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void incrementDedupChecked() {
        dedupCheckedCounter.increment();
    }

    @Override
    public void incrementDuplicateDetected(DuplicateMatchType type) {
        Counter counter = duplicateCounters.computeIfAbsent(type, t ->
                Counter.builder("job.dedup.duplicate")
                        .description("Number of duplicate postings detected")
                        .tag("matchType", t.tag())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementApplicationRecorded() {
        insertedCounter.increment();
    }

    @Override
    public void incrementSimilarityFallback() {
        fallbackCounter.increment();
    }

    @Override
    public void recordEmbeddingCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordEmbeddingCacheMiss() {
        cacheMissCounter.increment();
    }
}
