package com.job.matching.scoring;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.SalaryRange;
import com.job.matching.core.model.UserPreferences;

import java.util.Optional;

/**
 * No posted range: 0.7. Range reaching the expectation: 1.0. Range starting at
 * 80% of the expectation or more: 0.8. Otherwise 0.3.
 */
public class SalaryScorer implements DimensionScorer {

    static final double UNKNOWN_SALARY_SCORE = 0.7;

    @Override
    public MatchDimension dimension() {
        return MatchDimension.SALARY;
    }

    @Override
    public double score(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        Optional<SalaryRange> range = job.getSalaryRange();
        if (range.isEmpty()) {
            return UNKNOWN_SALARY_SCORE;
        }
        long expectation = preferences.effectiveMinSalary();
        if (range.get().max() >= expectation) {
            return 1.0;
        }
        if (range.get().min() >= expectation * 0.8) {
            return 0.8;
        }
        return 0.3;
    }
}
