package com.job.matching.core.model;

import java.util.List;

/**
 * Candidate-side preferences consulted by the location and salary dimensions.
 *
 * @param minSalary minimum acceptable annual salary, null when unspecified
 */
public record UserPreferences(
        List<String> preferredLocations,
        Long minSalary,
        List<String> jobTypes,
        List<String> industries,
        List<String> companySizes
) {
    public static final long FALLBACK_MIN_SALARY = 50_000L;

    public UserPreferences {
        preferredLocations = preferredLocations != null ? List.copyOf(preferredLocations) : List.of();
        jobTypes = jobTypes != null ? List.copyOf(jobTypes) : List.of();
        industries = industries != null ? List.copyOf(industries) : List.of();
        companySizes = companySizes != null ? List.copyOf(companySizes) : List.of();
        if (minSalary != null && minSalary < 0) {
            throw new IllegalArgumentException("minSalary must not be negative");
        }
    }

    /**
     * Preferences applied when the caller supplies none.
     */
    public static UserPreferences defaults() {
        return new UserPreferences(
                List.of("Remote", "Berlin", "Munich"),
                70_000L,
                List.of("full-time"),
                List.of("Technology", "Financial Services"),
                List.of("Startup", "Medium", "Large")
        );
    }

    /**
     * Minimum salary expectation, falling back to {@link #FALLBACK_MIN_SALARY}.
     */
    public long effectiveMinSalary() {
        return minSalary != null ? minSalary : FALLBACK_MIN_SALARY;
    }

    public UserPreferences withMinSalary(Long salary) {
        return new UserPreferences(preferredLocations, salary, jobTypes, industries, companySizes);
    }
}
