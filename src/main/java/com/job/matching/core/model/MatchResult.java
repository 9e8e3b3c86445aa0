package com.job.matching.core.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of scoring one candidate against one posting.
 * Created fresh per match call and never mutated.
 */
public record MatchResult(
        String jobId,
        double overallScore,
        double skillScore,
        double experienceScore,
        double educationScore,
        double locationScore,
        double cultureScore,
        double salaryScore,
        MatchAnalysis analysis,
        Recommendation recommendation,
        List<String> matchingSkills,
        List<String> missingSkills,
        ConfidenceLevel confidence
) {
    public MatchResult {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(analysis, "analysis is required");
        Objects.requireNonNull(recommendation, "recommendation is required");
        Objects.requireNonNull(confidence, "confidence is required");
        checkUnit(overallScore, "overallScore");
        checkUnit(skillScore, "skillScore");
        checkUnit(experienceScore, "experienceScore");
        checkUnit(educationScore, "educationScore");
        checkUnit(locationScore, "locationScore");
        checkUnit(cultureScore, "cultureScore");
        checkUnit(salaryScore, "salaryScore");
        matchingSkills = matchingSkills != null ? List.copyOf(matchingSkills) : List.of();
        missingSkills = missingSkills != null ? List.copyOf(missingSkills) : List.of();
    }

    public double scoreFor(MatchDimension dimension) {
        return switch (dimension) {
            case SKILLS -> skillScore;
            case EXPERIENCE -> experienceScore;
            case EDUCATION -> educationScore;
            case LOCATION -> locationScore;
            case CULTURE -> cultureScore;
            case SALARY -> salaryScore;
        };
    }

    public Map<MatchDimension, Double> dimensionScores() {
        Map<MatchDimension, Double> scores = new EnumMap<>(MatchDimension.class);
        for (MatchDimension dimension : MatchDimension.values()) {
            scores.put(dimension, scoreFor(dimension));
        }
        return scores;
    }

    private static void checkUnit(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }
}
