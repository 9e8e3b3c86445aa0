package com.job.matching.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilarityTest {

    @Test
    @DisplayName("Parallel vectors score 1, orthogonal 0")
    void testBasicAngles() {
        assertEquals(1.0, CosineSimilarity.compute(new float[]{1, 2, 3}, new float[]{2, 4, 6}), 1e-6);
        assertEquals(0.0, CosineSimilarity.compute(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
    }

    @Test
    @DisplayName("Negative cosine is clamped to 0")
    void testClamped() {
        assertEquals(0.0, CosineSimilarity.compute(new float[]{1, 0}, new float[]{-1, 0}));
    }

    @Test
    @DisplayName("Zero vector scores 0")
    void testZeroVector() {
        assertEquals(0.0, CosineSimilarity.compute(new float[]{0, 0}, new float[]{1, 1}));
    }

    @Test
    @DisplayName("Dimension mismatch is rejected")
    void testMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> CosineSimilarity.compute(new float[]{1, 0}, new float[]{1, 0, 0}));
    }
}
