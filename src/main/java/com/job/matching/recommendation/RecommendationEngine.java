package com.job.matching.recommendation;

import com.job.matching.core.model.MatchResult;
import com.job.matching.core.model.ParsedResume;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Produces application advice from a match result and the candidate's profile.
 * Pure: no state beyond its thresholds.
 */
public class RecommendationEngine {

    private static final int MAX_INTERVIEW_SKILLS = 3;
    private static final int MAX_SKILLS_TO_DEVELOP = 5;

    private final double confidentThreshold;
    private final double customizeThreshold;
    private final double autoApplyThreshold;

    public RecommendationEngine() {
        this(0.8, 0.6, 0.8);
    }

    /**
     * @param confidentThreshold score from which the standard approach is advised
     * @param customizeThreshold score from which a customized application is advised
     * @param autoApplyThreshold score from which {@link #shouldAutoApply} holds
     */
    public RecommendationEngine(double confidentThreshold, double customizeThreshold, double autoApplyThreshold) {
        if (customizeThreshold > confidentThreshold) {
            throw new IllegalArgumentException("customizeThreshold must be <= confidentThreshold");
        }
        this.confidentThreshold = confidentThreshold;
        this.customizeThreshold = customizeThreshold;
        this.autoApplyThreshold = autoApplyThreshold;
    }

    public ApplicationInsights insights(MatchResult match, ParsedResume resume) {
        List<String> resumeOptimization = new ArrayList<>();
        if (match.skillScore() < 0.7) {
            resumeOptimization.add("Emphasize relevant technical skills more prominently");
        }
        if (match.experienceScore() < 0.7) {
            resumeOptimization.add("Quantify achievements with specific metrics");
        }

        List<String> coverLetterPoints = new ArrayList<>();
        for (String strength : match.analysis().strengths()) {
            coverLetterPoints.add("Highlight: " + strength);
        }

        List<String> interviewPreparation = new ArrayList<>();
        if (!match.missingSkills().isEmpty()) {
            List<String> toLearn = match.missingSkills().subList(0,
                    Math.min(MAX_INTERVIEW_SKILLS, match.missingSkills().size()));
            interviewPreparation.add("Prepare to discuss how you would quickly learn: " + String.join(", ", toLearn));
        }

        List<String> skillsToHighlight = new ArrayList<>(match.matchingSkills());
        skillsToHighlight.sort(Comparator.<String>comparingDouble(resume::skillConfidence).reversed());

        List<String> skillsToDevelop = match.missingSkills().subList(0,
                Math.min(MAX_SKILLS_TO_DEVELOP, match.missingSkills().size()));

        String domainNote = "";
        if (resume.getPrimaryDomain() != null && !resume.getPrimaryDomain().isBlank()) {
            domainNote = "Frame your experience around your " + resume.getPrimaryDomain().replace('_', ' ') + " background";
        }

        return new ApplicationInsights(
                match.jobId(),
                resumeOptimization,
                coverLetterPoints,
                interviewPreparation,
                skillsToHighlight,
                skillsToDevelop,
                domainNote,
                strategyFor(match.overallScore())
        );
    }

    public String strategyFor(double overallScore) {
        if (overallScore >= confidentThreshold) {
            return "Apply with confidence using standard approach";
        } else if (overallScore >= customizeThreshold) {
            return "Customize application to emphasize matching qualifications";
        }
        return "Consider reaching out to hiring manager or employee referral";
    }

    /**
     * Whether the application collaborator may apply without manual review.
     */
    public boolean shouldAutoApply(MatchResult match) {
        return match.overallScore() >= autoApplyThreshold;
    }
}
