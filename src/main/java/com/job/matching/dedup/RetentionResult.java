package com.job.matching.dedup;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a cleanup run: which records were removed and the cutoff applied.
 */
public record RetentionResult(List<String> removedIds, Instant cutoff) {

    public RetentionResult {
        removedIds = List.copyOf(removedIds);
    }

    public int removedCount() {
        return removedIds.size();
    }
}
