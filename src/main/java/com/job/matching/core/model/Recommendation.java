package com.job.matching.core.model;

/**
 * Discrete application recommendation derived from the overall match score.
 */
public enum Recommendation {
    HIGHLY_RECOMMENDED("HIGHLY RECOMMENDED", "Apply immediately with standard application"),
    RECOMMENDED("RECOMMENDED", "Apply with tailored resume and cover letter"),
    CONSIDER("CONSIDER", "Apply only if genuinely interested and willing to learn"),
    NOT_RECOMMENDED("NOT RECOMMENDED", "Focus on better-matching opportunities");

    private final String label;
    private final String advice;

    Recommendation(String label, String advice) {
        this.label = label;
        this.advice = advice;
    }

    public String getLabel() {
        return label;
    }

    public String getAdvice() {
        return advice;
    }

    /**
     * Label and advice as a single line, e.g. {@code "RECOMMENDED: Apply with tailored resume and cover letter"}.
     */
    public String describe() {
        return label + ": " + advice;
    }

    /**
     * Maps a score onto a recommendation using inclusive lower bounds.
     */
    public static Recommendation forScore(double score, double highlyRecommended,
                                          double recommended, double consider) {
        if (score >= highlyRecommended) {
            return HIGHLY_RECOMMENDED;
        } else if (score >= recommended) {
            return RECOMMENDED;
        } else if (score >= consider) {
            return CONSIDER;
        }
        return NOT_RECOMMENDED;
    }
}
