package com.job.matching.scoring;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;

import java.util.List;

/**
 * Formula: score = 0.8*required + 0.2*preferred, where each part is the
 * {@link SkillMatcher#listScore} of that list. A posting listing only one kind of
 * skill gives that list the full weight.
 */
public class SkillScorer implements DimensionScorer {

    public static final double REQUIRED_WEIGHT = 0.8;
    public static final double PREFERRED_WEIGHT = 0.2;

    private final SkillMatcher skillMatcher;

    public SkillScorer(SkillMatcher skillMatcher) {
        this.skillMatcher = skillMatcher;
    }

    @Override
    public MatchDimension dimension() {
        return MatchDimension.SKILLS;
    }

    @Override
    public double score(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        boolean hasRequired = hasAny(job.getRequiredSkills());
        boolean hasPreferred = hasAny(job.getPreferredSkills());
        if (!hasRequired && !hasPreferred) {
            return 0.0;
        }

        double required = hasRequired ? skillMatcher.listScore(resume.getAllSkills(), job.getRequiredSkills()) : 0.0;
        double preferred = hasPreferred ? skillMatcher.listScore(resume.getAllSkills(), job.getPreferredSkills()) : 0.0;

        if (!hasPreferred) {
            return required;
        }
        if (!hasRequired) {
            return preferred;
        }
        return Math.min(1.0, REQUIRED_WEIGHT * required + PREFERRED_WEIGHT * preferred);
    }

    private static boolean hasAny(List<String> skills) {
        return skills.stream().anyMatch(s -> s != null && !s.isBlank());
    }
}
