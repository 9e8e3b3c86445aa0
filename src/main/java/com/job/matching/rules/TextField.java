package com.job.matching.rules;

/**
 * The kind of text a normalization rule is written for.
 */
public enum TextField {
    TITLE,
    COMPANY,
    GENERIC
}
