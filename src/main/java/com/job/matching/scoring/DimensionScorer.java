package com.job.matching.scoring;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;

/**
 * Scores one aspect of how well a candidate fits a posting.
 * Implementations are pure functions returning a value between 0.0 and 1.0;
 * missing optional data lowers the score instead of raising an error.
 */
public interface DimensionScorer {

    MatchDimension dimension();

    /**
     * @param preferences never null; callers substitute {@link UserPreferences#defaults()}
     */
    double score(ParsedResume resume, JobRequirement job, UserPreferences preferences);
}
