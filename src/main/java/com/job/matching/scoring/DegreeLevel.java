package com.job.matching.scoring;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordinal education hierarchy. Degree strings are matched on word boundaries,
 * so "Mathematics" is not read as an MA.
 */
public enum DegreeLevel {
    HIGH_SCHOOL(1, "\\bhigh[\\s-]?school\\b|\\bdiploma\\b|\\bged\\b"),
    ASSOCIATE(2, "\\bassociate"),
    BACHELOR(3, "\\bbachelor|\\bb\\.?sc?\\b|\\bb\\.?a\\b|\\bb\\.?eng\\b|\\bundergraduate\\b"),
    MASTER(4, "\\bmaster|\\bm\\.?sc?\\b|\\bm\\.?a\\b|\\bmba\\b|\\bm\\.?eng\\b"),
    DOCTORATE(5, "\\bph\\.?\\s?d\\b|\\bdoctor");

    private final int rank;
    private final Pattern pattern;

    DegreeLevel(int rank, String regex) {
        this.rank = rank;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public int getRank() {
        return rank;
    }

    /**
     * Highest level mentioned in the text.
     */
    public static Optional<DegreeLevel> highestIn(String text) {
        DegreeLevel found = null;
        if (text != null) {
            for (DegreeLevel level : values()) {
                if (level.pattern.matcher(text).find()) {
                    found = level;
                }
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Lowest level mentioned in the text; "Bachelor's or Master's" requires a bachelor.
     */
    public static Optional<DegreeLevel> lowestIn(String text) {
        if (text != null) {
            for (DegreeLevel level : values()) {
                if (level.pattern.matcher(text).find()) {
                    return Optional.of(level);
                }
            }
        }
        return Optional.empty();
    }
}
