package com.job.matching.core.model;

import java.util.List;

/**
 * A single role from the candidate's work history.
 *
 * @param endDate null while the role is current
 */
public record WorkExperience(
        String title,
        String company,
        String location,
        String startDate,
        String endDate,
        int durationMonths,
        List<String> responsibilities,
        List<String> achievements,
        List<String> skillsUsed
) {
    public WorkExperience {
        if (durationMonths < 0) {
            throw new IllegalArgumentException("durationMonths must not be negative");
        }
        responsibilities = responsibilities != null ? List.copyOf(responsibilities) : List.of();
        achievements = achievements != null ? List.copyOf(achievements) : List.of();
        skillsUsed = skillsUsed != null ? List.copyOf(skillsUsed) : List.of();
    }

    public static WorkExperience of(String title, String company, int durationMonths) {
        return new WorkExperience(title, company, null, null, null, durationMonths,
                List.of(), List.of(), List.of());
    }

    public boolean isCurrent() {
        return endDate == null || endDate.isBlank();
    }
}
