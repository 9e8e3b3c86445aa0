package com.job.matching.api;

import com.job.matching.core.model.DuplicateMatch;
import com.job.matching.core.model.JobApplicationRecord;
import com.job.matching.core.model.MatchResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of screening one posting.
 *
 * @param jobId          id of the posting as supplied by the caller
 * @param outcome        what happened to the posting
 * @param match          the score, absent when the posting was rejected as a duplicate before scoring
 * @param record         the inserted record for {@code RECORDED}, the stored one for {@code DUPLICATE}
 * @param duplicateMatch the best duplicate match found, if any
 * @param autoApply      recorded and scored at or above the auto-apply score
 */
public record ScreeningResult(
        String jobId,
        ScreeningOutcome outcome,
        MatchResult match,
        JobApplicationRecord record,
        DuplicateMatch duplicateMatch,
        boolean autoApply
) {
    public ScreeningResult {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(outcome, "outcome is required");
        if (autoApply && outcome != ScreeningOutcome.RECORDED) {
            throw new IllegalArgumentException("autoApply requires a recorded posting");
        }
    }

    static ScreeningResult duplicate(String jobId, MatchResult match, JobApplicationRecord existing,
                                     DuplicateMatch duplicateMatch) {
        return new ScreeningResult(jobId, ScreeningOutcome.DUPLICATE, match, existing, duplicateMatch, false);
    }

    static ScreeningResult belowThreshold(MatchResult match) {
        return new ScreeningResult(match.jobId(), ScreeningOutcome.BELOW_THRESHOLD, match, null, null, false);
    }

    static ScreeningResult recorded(MatchResult match, JobApplicationRecord record, DuplicateMatch potential,
                                    boolean autoApply) {
        return new ScreeningResult(match.jobId(), ScreeningOutcome.RECORDED, match, record, potential, autoApply);
    }

    public Optional<MatchResult> matchResult() {
        return Optional.ofNullable(match);
    }

    public Optional<JobApplicationRecord> applicationRecord() {
        return Optional.ofNullable(record);
    }

    public Optional<DuplicateMatch> bestDuplicateMatch() {
        return Optional.ofNullable(duplicateMatch);
    }

    public boolean isRecorded() {
        return outcome == ScreeningOutcome.RECORDED;
    }

    public boolean isDuplicate() {
        return outcome == ScreeningOutcome.DUPLICATE;
    }
}
