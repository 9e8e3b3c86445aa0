package com.job.matching.recommendation;

import java.util.List;

/**
 * Application-strategy advice derived from a match result.
 */
public record ApplicationInsights(
        String jobId,
        List<String> resumeOptimization,
        List<String> coverLetterPoints,
        List<String> interviewPreparation,
        List<String> skillsToHighlight,
        List<String> skillsToDevelop,
        String domainNote,
        String applicationStrategy
) {
    public ApplicationInsights {
        resumeOptimization = List.copyOf(resumeOptimization);
        coverLetterPoints = List.copyOf(coverLetterPoints);
        interviewPreparation = List.copyOf(interviewPreparation);
        skillsToHighlight = List.copyOf(skillsToHighlight);
        skillsToDevelop = List.copyOf(skillsToDevelop);
        domainNote = domainNote != null ? domainNote : "";
        applicationStrategy = applicationStrategy != null ? applicationStrategy : "";
    }
}
