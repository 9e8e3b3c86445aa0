package com.job.matching.dedup;

import com.job.matching.core.model.DuplicateMatch;
import com.job.matching.core.model.DuplicateMatchType;
import com.job.matching.core.model.JobApplicationRecord;
import com.job.matching.similarity.HybridSimilarityScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies a pair of records as exact, high-similarity or potential duplicates.
 *
 * <ul>
 *   <li>exact: same id or same URL, score 1.0</li>
 *   <li>high_similarity: title and company above their thresholds; score is their mean,
 *       averaged again with the description score when that exceeds its threshold</li>
 *   <li>potential: title and company both at least the potential threshold</li>
 * </ul>
 *
 * Both records must carry normalized title and company.
 */
public class DuplicateClassifier {

    private final HybridSimilarityScorer similarity;
    private final DuplicateOptions options;

    public DuplicateClassifier(HybridSimilarityScorer similarity, DuplicateOptions options) {
        this.similarity = similarity;
        this.options = options;
    }

    public Optional<DuplicateMatch> classify(JobApplicationRecord candidate, JobApplicationRecord existing) {
        if (candidate.id().equals(existing.id())) {
            return Optional.of(exact(candidate, existing, DuplicateMatch.IDENTICAL_ID));
        }
        if (!candidate.jobUrl().isBlank() && candidate.jobUrl().trim().equals(existing.jobUrl().trim())) {
            return Optional.of(exact(candidate, existing, DuplicateMatch.IDENTICAL_URL));
        }

        double titleScore = similarity.compute(candidate.normalizedTitle(), existing.normalizedTitle());
        double companyScore = similarity.compute(candidate.normalizedCompany(), existing.normalizedCompany());

        List<String> factors = new ArrayList<>();
        DuplicateMatchType type;
        double score;
        if (titleScore >= options.getTitleThreshold() && companyScore >= options.getCompanyThreshold()) {
            type = DuplicateMatchType.HIGH_SIMILARITY;
            score = (titleScore + companyScore) / 2;
            factors.add(DuplicateMatch.TITLE_MATCH);
            factors.add(DuplicateMatch.COMPANY_MATCH);

            double descriptionScore = descriptionSimilarity(candidate, existing);
            if (descriptionScore > options.getDescriptionThreshold()) {
                factors.add(DuplicateMatch.DESCRIPTION_MATCH);
                score = (score + descriptionScore) / 2;
            }
        } else if (titleScore >= options.getPotentialThreshold() && companyScore >= options.getPotentialThreshold()) {
            type = DuplicateMatchType.POTENTIAL;
            score = (titleScore + companyScore) / 2;
            factors.add(DuplicateMatch.SIMILAR_TITLE);
            factors.add(DuplicateMatch.SIMILAR_COMPANY);
        } else {
            return Optional.empty();
        }

        if (score < options.getPotentialThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new DuplicateMatch(candidate.id(), existing.id(),
                Math.min(1.0, score), type, factors));
    }

    /**
     * Whether a match blocks insertion: exact, or scoring at least the high-similarity threshold.
     */
    public boolean isDefinitive(DuplicateMatch match) {
        return match.isExact() || match.similarityScore() >= options.getHighSimilarityThreshold();
    }

    private double descriptionSimilarity(JobApplicationRecord a, JobApplicationRecord b) {
        if (a.jobDescription().isBlank() || b.jobDescription().isBlank()) {
            return 0.0;
        }
        return similarity.compute(prefix(a.jobDescription()), prefix(b.jobDescription()));
    }

    private String prefix(String text) {
        int length = options.getDescriptionPrefixLength();
        return text.length() <= length ? text : text.substring(0, length);
    }

    private static DuplicateMatch exact(JobApplicationRecord candidate, JobApplicationRecord existing, String factor) {
        return new DuplicateMatch(candidate.id(), existing.id(), 1.0, DuplicateMatchType.EXACT, List.of(factor));
    }
}
