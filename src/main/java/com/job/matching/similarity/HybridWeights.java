package com.job.matching.similarity;

/**
 * Weights for combining the lexical and semantic scores when both are available.
 */
public record HybridWeights(double lexicalWeight, double semanticWeight) {

    public HybridWeights {
        if (lexicalWeight < 0 || semanticWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = lexicalWeight + semanticWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Arithmetic mean of both scores.
     */
    public static HybridWeights defaults() {
        return new HybridWeights(0.5, 0.5);
    }
}
