package com.job.matching.api;

/**
 * What happened to a posting passed through {@link MatchEngine#screen}.
 */
public enum ScreeningOutcome {
    /** Already in the index; not scored, or lost the insert to an earlier posting. */
    DUPLICATE,
    /** Scored at or above the application threshold and added to the index. */
    RECORDED,
    /** Scored below the application threshold; the index is untouched. */
    BELOW_THRESHOLD
}
