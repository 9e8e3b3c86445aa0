package com.job.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tiered verdict on how likely two postings are the same job.
 */
public enum DuplicateMatchType {
    /**
     * Same source URL or same derived identity.
     */
    EXACT("exact"),

    /**
     * Title and company both highly similar after normalization.
     */
    HIGH_SIMILARITY("high_similarity"),

    /**
     * Related posting; recorded for audit but never blocks insertion.
     */
    POTENTIAL("potential");

    private final String tag;

    DuplicateMatchType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
