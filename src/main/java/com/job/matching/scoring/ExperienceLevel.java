package com.job.matching.scoring;

import java.util.Locale;
import java.util.Optional;

/**
 * Experience-level labels used in postings and the year range each one expects.
 */
public enum ExperienceLevel {
    JUNIOR(0, 2),
    MID(2, 5),
    SENIOR(5, 10),
    LEAD(8, 15);

    private final double minYears;
    private final double maxYears;

    ExperienceLevel(double minYears, double maxYears) {
        this.minYears = minYears;
        this.maxYears = maxYears;
    }

    public double getMinYears() {
        return minYears;
    }

    public double getMaxYears() {
        return maxYears;
    }

    /**
     * Parses a posting label such as {@code "Senior"}; empty for unknown labels.
     */
    public static Optional<ExperienceLevel> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.trim().toUpperCase(Locale.ROOT);
        for (ExperienceLevel level : values()) {
            if (level.name().equals(key)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
