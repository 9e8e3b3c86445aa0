package com.job.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Pairwise comparison between a candidate posting and a stored record.
 * Confidence equals the similarity score.
 */
public record DuplicateMatch(
        String candidateId,
        String existingId,
        double similarityScore,
        DuplicateMatchType matchType,
        List<String> matchingFactors
) {
    public static final String IDENTICAL_URL = "identical_url";
    public static final String IDENTICAL_ID = "identical_id";
    public static final String TITLE_MATCH = "title_match";
    public static final String COMPANY_MATCH = "company_match";
    public static final String DESCRIPTION_MATCH = "description_match";
    public static final String SIMILAR_TITLE = "similar_title";
    public static final String SIMILAR_COMPANY = "similar_company";

    public DuplicateMatch {
        Objects.requireNonNull(candidateId, "candidateId is required");
        Objects.requireNonNull(existingId, "existingId is required");
        Objects.requireNonNull(matchType, "matchType is required");
        if (similarityScore < 0.0 || similarityScore > 1.0) {
            throw new IllegalArgumentException("similarityScore must be between 0.0 and 1.0");
        }
        matchingFactors = matchingFactors != null ? List.copyOf(matchingFactors) : List.of();
    }

    public double confidence() {
        return similarityScore;
    }

    public boolean isExact() {
        return matchType == DuplicateMatchType.EXACT;
    }
}
