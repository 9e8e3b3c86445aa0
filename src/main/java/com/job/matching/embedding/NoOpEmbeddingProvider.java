package com.job.matching.embedding;

/**
 * Provider used when no semantic model is configured. Always unavailable,
 * so similarity is computed from the lexical score alone.
 */
public class NoOpEmbeddingProvider implements EmbeddingProvider {

    @Override
    public float[] embed(String text) {
        throw new EmbeddingUnavailableException("No embedding provider configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
