package com.job.matching.scoring;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;

import java.util.Locale;

/**
 * Remote-friendly postings score 1.0. Otherwise a posting location overlapping a
 * preferred location scores 0.9, one overlapping the candidate's own location 0.8,
 * anything else 0.3. Overlap is case-insensitive containment in either direction.
 */
public class LocationScorer implements DimensionScorer {

    static final double REMOTE_SCORE = 1.0;
    static final double PREFERRED_SCORE = 0.9;
    static final double CANDIDATE_LOCATION_SCORE = 0.8;
    static final double MISMATCH_SCORE = 0.3;

    @Override
    public MatchDimension dimension() {
        return MatchDimension.LOCATION;
    }

    @Override
    public double score(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        if (job.isRemoteFriendly()) {
            return REMOTE_SCORE;
        }
        String jobLocation = job.getLocation();
        if (jobLocation == null || jobLocation.isBlank()) {
            return MISMATCH_SCORE;
        }

        for (String preferred : preferences.preferredLocations()) {
            if (overlaps(preferred, jobLocation)) {
                return PREFERRED_SCORE;
            }
        }
        if (resume.getContactInfo().hasLocation() && overlaps(resume.getContactInfo().location(), jobLocation)) {
            return CANDIDATE_LOCATION_SCORE;
        }
        return MISMATCH_SCORE;
    }

    private static boolean overlaps(String a, String b) {
        if (a == null || a.isBlank()) {
            return false;
        }
        String left = a.trim().toLowerCase(Locale.ROOT);
        String right = b.trim().toLowerCase(Locale.ROOT);
        return left.contains(right) || right.contains(left);
    }
}
