package com.job.matching.scoring;

import com.job.matching.core.model.Education;
import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;

/**
 * Compares the candidate's highest degree with the posting's requirement.
 * Meets or exceeds: 1.0, one level short: 0.8, further short: 0.5.
 * No requirement: 1.0. No education on the resume: 0.3.
 */
public class EducationScorer implements DimensionScorer {

    static final double NO_EDUCATION_SCORE = 0.3;

    @Override
    public MatchDimension dimension() {
        return MatchDimension.EDUCATION;
    }

    @Override
    public double score(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        String required = job.getEducationRequired();
        if (required == null || required.isBlank() || required.trim().equalsIgnoreCase("none")) {
            return 1.0;
        }
        if (!resume.hasEducation()) {
            return NO_EDUCATION_SCORE;
        }

        int requiredRank = DegreeLevel.lowestIn(required).map(DegreeLevel::getRank).orElse(0);
        int candidateRank = 0;
        for (Education education : resume.getEducation()) {
            candidateRank = Math.max(candidateRank,
                    DegreeLevel.highestIn(education.degree()).map(DegreeLevel::getRank).orElse(0));
        }

        if (candidateRank >= requiredRank) {
            return 1.0;
        }
        if (candidateRank >= requiredRank - 1) {
            return 0.8;
        }
        return 0.5;
    }
}
