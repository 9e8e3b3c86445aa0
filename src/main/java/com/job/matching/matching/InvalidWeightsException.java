package com.job.matching.matching;

/**
 * Thrown when aggregation weights are negative or do not sum to 1.0.
 * Raised at construction time so a bad configuration fails fast.
 */
public class InvalidWeightsException extends IllegalArgumentException {

    public InvalidWeightsException(String message) {
        super(message);
    }
}
