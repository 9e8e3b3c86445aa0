package com.job.matching.core.model;

/**
 * Annual salary band advertised by a posting.
 */
public record SalaryRange(long min, long max) {
    public SalaryRange {
        if (min < 0 || max < 0) {
            throw new IllegalArgumentException("Salary bounds must not be negative");
        }
        if (min > max) {
            throw new IllegalArgumentException("Salary min must be <= max, got " + min + " > " + max);
        }
    }

    public static SalaryRange of(long min, long max) {
        return new SalaryRange(min, max);
    }

    @Override
    public String toString() {
        return min + "-" + max;
    }
}
