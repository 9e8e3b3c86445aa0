package com.job.matching.similarity;

/**
 * Character-level similarity between two strings.
 * Implementations return a score between 0.0 (nothing in common) and 1.0 (identical)
 * and must be symmetric.
 */
@FunctionalInterface
public interface LexicalSimilarity {

    double compute(String s1, String s2);

    default String getName() {
        return getClass().getSimpleName();
    }
}
