package com.job.matching.dedup;

import com.job.matching.core.model.DuplicateMatch;

import java.util.Optional;

/**
 * Verdict of a duplicate check. {@code bestMatch} is null when nothing similar is stored;
 * it may be present with {@code duplicate == false} for a {@code potential} match.
 */
public record DuplicateCheck(String candidateId, boolean duplicate, DuplicateMatch bestMatch) {

    public Optional<DuplicateMatch> match() {
        return Optional.ofNullable(bestMatch);
    }
}
