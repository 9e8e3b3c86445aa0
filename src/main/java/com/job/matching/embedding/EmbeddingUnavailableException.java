package com.job.matching.embedding;

/**
 * Thrown when an embedding backend cannot produce a vector: not configured,
 * unreachable, slow, or returning an unusable response.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
