package com.job.matching.core.model;

import java.util.List;

/**
 * Narrative breakdown of a match: what speaks for and against the candidate.
 */
public record MatchAnalysis(
        List<String> strengths,
        List<String> weaknesses,
        List<String> recommendations,
        List<String> skillGaps,
        String experienceAssessment,
        String educationAssessment,
        String locationNotes,
        String overallAssessment
) {
    public MatchAnalysis {
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        weaknesses = weaknesses != null ? List.copyOf(weaknesses) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        skillGaps = skillGaps != null ? List.copyOf(skillGaps) : List.of();
        experienceAssessment = experienceAssessment != null ? experienceAssessment : "";
        educationAssessment = educationAssessment != null ? educationAssessment : "";
        locationNotes = locationNotes != null ? locationNotes : "";
        overallAssessment = overallAssessment != null ? overallAssessment : "";
    }
}
