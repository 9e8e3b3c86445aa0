package com.job.matching.core.model;

/**
 * How much trust to place in an overall match score.
 */
public enum ConfidenceLevel {
    /**
     * Score above 0.8 with at most one listed weakness.
     */
    HIGH,

    /**
     * Score above 0.6 with at most two listed weaknesses.
     */
    MEDIUM,

    LOW;

    public static ConfidenceLevel of(double overallScore, int weaknessCount) {
        if (overallScore > 0.8 && weaknessCount <= 1) {
            return HIGH;
        }
        if (overallScore > 0.6 && weaknessCount <= 2) {
            return MEDIUM;
        }
        return LOW;
    }
}
