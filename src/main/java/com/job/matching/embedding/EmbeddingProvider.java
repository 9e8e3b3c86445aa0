package com.job.matching.embedding;

/**
 * Semantic embedding backend. Implementations turn text into a fixed-length vector
 * used for meaning-aware similarity. Callers must tolerate
 * {@link EmbeddingUnavailableException} and fall back to lexical comparison.
 */
public interface EmbeddingProvider {

    /**
     * Embeds the given text.
     *
     * @throws EmbeddingUnavailableException if no vector can be produced
     */
    float[] embed(String text) throws EmbeddingUnavailableException;

    String getProviderName();

    boolean isAvailable();
}
