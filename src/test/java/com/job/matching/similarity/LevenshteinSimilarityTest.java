package com.job.matching.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinSimilarityTest {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @ParameterizedTest
    @DisplayName("Edit distance")
    @CsvSource({
            "kitten,sitting,3",
            "flaw,lawn,2",
            "abc,abc,0",
            "a,abc,2"
    })
    void testDistance(String a, String b, int expected) {
        assertEquals(expected, LevenshteinSimilarity.distance(a, b));
        assertEquals(expected, LevenshteinSimilarity.distance(b, a));
    }

    @Test
    @DisplayName("Ratio is 1 - distance / longer length")
    void testRatio() {
        assertEquals(1.0 - 3.0 / 7.0, similarity.compute("kitten", "sitting"), 1e-9);
    }

    @Test
    @DisplayName("Should be symmetric and case-insensitive")
    void testSymmetricAndCaseInsensitive() {
        assertEquals(similarity.compute("python", "pythons"), similarity.compute("pythons", "python"), 1e-12);
        assertEquals(1.0, similarity.compute("Java", "JAVA"));
    }

    @Test
    @DisplayName("Empty or null input scores 0")
    void testEmpty() {
        assertEquals(0.0, similarity.compute("", "java"));
        assertEquals(0.0, similarity.compute("java", null));
        assertEquals(0.0, similarity.compute("", ""));
    }
}
