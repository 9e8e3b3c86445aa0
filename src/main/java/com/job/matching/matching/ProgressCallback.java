package com.job.matching.matching;

/**
 * Callback for tracking progress of batch operations.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed number of postings handled so far
     * @param total     total number of postings in the batch
     * @param message   short progress note
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
