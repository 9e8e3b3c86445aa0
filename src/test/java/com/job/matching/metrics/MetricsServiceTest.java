package com.job.matching.metrics;

import com.job.matching.core.model.DuplicateMatchType;
import com.job.matching.core.model.Recommendation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    @Nested
    @DisplayName("Micrometer")
    class Micrometer {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Match timers are tagged by recommendation")
        void testMatchDuration() {
            metrics.recordMatchDuration(Recommendation.RECOMMENDED, Duration.ofMillis(5));
            metrics.recordMatchDuration(Recommendation.RECOMMENDED, Duration.ofMillis(7));
            metrics.recordMatchDuration(Recommendation.CONSIDER, Duration.ofMillis(1));

            assertEquals(2, registry.get("job.match.duration").tag("recommendation", "RECOMMENDED").timer().count());
            assertEquals(1, registry.get("job.match.duration").tag("recommendation", "CONSIDER").timer().count());
        }

        @Test
        @DisplayName("Scores are summarized")
        void testScoreSummary() {
            metrics.recordMatchScore(0.4);
            metrics.recordMatchScore(0.8);

            assertEquals(2, registry.get("job.match.score").summary().count());
            assertEquals(1.2, registry.get("job.match.score").summary().totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Duplicates are counted per match type")
        void testDuplicateCounters() {
            metrics.incrementDuplicateDetected(DuplicateMatchType.EXACT);
            metrics.incrementDuplicateDetected(DuplicateMatchType.HIGH_SIMILARITY);
            metrics.incrementDuplicateDetected(DuplicateMatchType.HIGH_SIMILARITY);

            assertEquals(1.0, registry.get("job.dedup.duplicate").tag("matchType", "exact").counter().count());
            assertEquals(2.0, registry.get("job.dedup.duplicate").tag("matchType", "high_similarity").counter().count());
        }

        @Test
        @DisplayName("Plain counters")
        void testCounters() {
            metrics.incrementDedupChecked();
            metrics.incrementApplicationRecorded();
            metrics.incrementSimilarityFallback();
            metrics.incrementSimilarityFallback();

            assertEquals(1.0, registry.get("job.dedup.checked").counter().count());
            assertEquals(1.0, registry.get("job.dedup.inserted").counter().count());
            assertEquals(2.0, registry.get("job.similarity.fallback").counter().count());
        }
    }

    @Test
    @DisplayName("No-op service accepts every call")
    void testNoOp() {
        MetricsService metrics = new NoOpMetricsService();
        assertDoesNotThrow(() -> {
            metrics.recordMatchDuration(Recommendation.NOT_RECOMMENDED, Duration.ZERO);
            metrics.recordMatchScore(0.1);
            metrics.incrementDedupChecked();
            metrics.incrementDuplicateDetected(DuplicateMatchType.POTENTIAL);
            metrics.incrementApplicationRecorded();
            metrics.incrementSimilarityFallback();
            metrics.recordEmbeddingCacheHit();
            metrics.recordEmbeddingCacheMiss();
        });
    }
}
