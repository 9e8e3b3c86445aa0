package com.job.matching.matching;

import com.job.matching.core.model.MatchDimension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchingOptionsTest {

    @Nested
    @DisplayName("Weights")
    class Weights {

        @Test
        @DisplayName("Defaults sum to 1")
        void testDefaults() {
            MatchingWeights weights = MatchingWeights.defaults();
            double sum = 0;
            for (MatchDimension dimension : MatchDimension.values()) {
                sum += weights.weightFor(dimension);
            }
            assertEquals(1.0, sum, 1e-9);
            assertEquals(0.35, weights.weightFor(MatchDimension.SKILLS));
            assertEquals(0.05, weights.weightFor(MatchDimension.SALARY));
        }

        @Test
        @DisplayName("Weights that do not sum to 1 are rejected")
        void testSum() {
            InvalidWeightsException e = assertThrows(InvalidWeightsException.class,
                    () -> new MatchingWeights(0.5, 0.5, 0.5, 0, 0, 0));
            assertTrue(e.getMessage().contains("1.0"));
        }

        @Test
        @DisplayName("Negative weights are rejected")
        void testNegative() {
            assertThrows(InvalidWeightsException.class, () -> new MatchingWeights(1.2, -0.2, 0, 0, 0, 0));
        }

        @Test
        @DisplayName("Invalid weights are an IllegalArgumentException")
        void testHierarchy() {
            assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().weights(null));
        }
    }

    @Nested
    @DisplayName("Thresholds")
    class Thresholds {

        @Test
        @DisplayName("Defaults")
        void testDefaults() {
            MatchingOptions options = MatchingOptions.defaults();
            assertEquals(0.8, options.getHighlyRecommendedThreshold());
            assertEquals(0.6, options.getRecommendedThreshold());
            assertEquals(0.4, options.getConsiderThreshold());
            assertEquals(0.85, options.getSkillMatchThreshold());
            assertEquals(4, options.getBatchWorkers());
            assertEquals(20, options.getTopN());
            assertEquals(0.6, options.getMinApplicationScore());
            assertEquals(0.8, options.getAutoApplyScore());
        }

        @Test
        @DisplayName("Out-of-range threshold is rejected")
        void testRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> MatchingOptions.builder().highlyRecommendedThreshold(1.5));
            assertThrows(IllegalArgumentException.class,
                    () -> MatchingOptions.builder().minApplicationScore(-0.1));
        }

        @Test
        @DisplayName("Thresholds must be ordered")
        void testOrdering() {
            assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder()
                    .highlyRecommendedThreshold(0.5)
                    .recommendedThreshold(0.6)
                    .build());
            assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder()
                    .considerThreshold(0.7)
                    .build());
        }

        @Test
        @DisplayName("Batch settings must be positive")
        void testBatchSettings() {
            assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().batchWorkers(0));
            assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().topN(0));
        }
    }
}
