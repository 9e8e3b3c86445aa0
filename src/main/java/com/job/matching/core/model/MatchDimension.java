package com.job.matching.core.model;

/**
 * Independent axes along which a candidate is scored against a posting.
 */
public enum MatchDimension {
    SKILLS,
    EXPERIENCE,
    EDUCATION,
    LOCATION,
    CULTURE,
    SALARY
}
