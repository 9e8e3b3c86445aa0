package com.job.matching.dedup;

import com.job.matching.core.model.DuplicateMatch;
import com.job.matching.core.model.JobApplicationRecord;

import java.util.Optional;

/**
 * Outcome of {@link DuplicateIndex#add}. When {@code inserted} is false,
 * {@code record} is the existing record the posting duplicates.
 */
public record AddResult(boolean inserted, JobApplicationRecord record, DuplicateMatch match) {

    public Optional<DuplicateMatch> duplicateMatch() {
        return Optional.ofNullable(match);
    }
}
