package com.job.matching.scoring;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;

/**
 * Inside the level's year range scores 1.0. Above it decays by 0.05 per extra year
 * down to 0.7; below it scores {@code years / minYears * 0.8}. Unknown levels score 0.5.
 */
public class ExperienceScorer implements DimensionScorer {

    static final double UNKNOWN_LEVEL_SCORE = 0.5;
    static final double OVER_QUALIFIED_FLOOR = 0.7;
    static final double DECAY_PER_YEAR = 0.05;
    static final double UNDER_QUALIFIED_FACTOR = 0.8;

    @Override
    public MatchDimension dimension() {
        return MatchDimension.EXPERIENCE;
    }

    @Override
    public double score(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        return ExperienceLevel.fromLabel(job.getExperienceLevel())
                .map(level -> scoreFor(resume.getTotalExperienceYears(), level))
                .orElse(UNKNOWN_LEVEL_SCORE);
    }

    static double scoreFor(double years, ExperienceLevel level) {
        double min = level.getMinYears();
        double max = level.getMaxYears();
        if (years >= min && years <= max) {
            return 1.0;
        }
        if (years > max) {
            return Math.max(OVER_QUALIFIED_FLOOR, 1.0 - (years - max) * DECAY_PER_YEAR);
        }
        if (min <= 0) {
            return 1.0;
        }
        return Math.max(0.0, years / min * UNDER_QUALIFIED_FACTOR);
    }
}
