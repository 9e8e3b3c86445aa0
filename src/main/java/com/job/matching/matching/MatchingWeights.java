package com.job.matching.matching;

import com.job.matching.core.model.MatchDimension;

/**
 * Per-dimension weights for the overall match score. Must be non-negative and sum to 1.0.
 */
public record MatchingWeights(
        double skills,
        double experience,
        double education,
        double location,
        double culture,
        double salary
) {
    private static final double TOLERANCE = 0.001;

    public MatchingWeights {
        if (skills < 0 || experience < 0 || education < 0 || location < 0 || culture < 0 || salary < 0) {
            throw new InvalidWeightsException("Weights must be non-negative");
        }
        double sum = skills + experience + education + location + culture + salary;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new InvalidWeightsException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Skills 0.35, experience 0.25, education 0.10, location 0.15, culture 0.10, salary 0.05.
     */
    public static MatchingWeights defaults() {
        return new MatchingWeights(0.35, 0.25, 0.10, 0.15, 0.10, 0.05);
    }

    public double weightFor(MatchDimension dimension) {
        return switch (dimension) {
            case SKILLS -> skills;
            case EXPERIENCE -> experience;
            case EDUCATION -> education;
            case LOCATION -> location;
            case CULTURE -> culture;
            case SALARY -> salary;
        };
    }
}
