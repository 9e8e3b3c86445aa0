package com.job.matching.dedup;

/**
 * Thresholds for duplicate classification.
 */
public class DuplicateOptions {

    private static final double DEFAULT_HIGH_SIMILARITY_THRESHOLD = 0.85;
    private static final double DEFAULT_POTENTIAL_THRESHOLD = 0.70;
    private static final double DEFAULT_TITLE_THRESHOLD = 0.8;
    private static final double DEFAULT_COMPANY_THRESHOLD = 0.9;
    private static final double DEFAULT_DESCRIPTION_THRESHOLD = 0.7;
    private static final int DEFAULT_DESCRIPTION_PREFIX_LENGTH = 500;

    private final double highSimilarityThreshold;
    private final double potentialThreshold;
    private final double titleThreshold;
    private final double companyThreshold;
    private final double descriptionThreshold;
    private final int descriptionPrefixLength;

    private DuplicateOptions(Builder builder) {
        this.highSimilarityThreshold = builder.highSimilarityThreshold;
        this.potentialThreshold = builder.potentialThreshold;
        this.titleThreshold = builder.titleThreshold;
        this.companyThreshold = builder.companyThreshold;
        this.descriptionThreshold = builder.descriptionThreshold;
        this.descriptionPrefixLength = builder.descriptionPrefixLength;
    }

    /**
     * Best-match score at or above which a posting counts as a definitive duplicate.
     */
    public double getHighSimilarityThreshold() {
        return highSimilarityThreshold;
    }

    /**
     * Minimum title and company similarity for a {@code potential} match.
     */
    public double getPotentialThreshold() {
        return potentialThreshold;
    }

    public double getTitleThreshold() {
        return titleThreshold;
    }

    public double getCompanyThreshold() {
        return companyThreshold;
    }

    /**
     * Description similarity must exceed this to boost a high-similarity match.
     */
    public double getDescriptionThreshold() {
        return descriptionThreshold;
    }

    public int getDescriptionPrefixLength() {
        return descriptionPrefixLength;
    }

    public static DuplicateOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double highSimilarityThreshold = DEFAULT_HIGH_SIMILARITY_THRESHOLD;
        private double potentialThreshold = DEFAULT_POTENTIAL_THRESHOLD;
        private double titleThreshold = DEFAULT_TITLE_THRESHOLD;
        private double companyThreshold = DEFAULT_COMPANY_THRESHOLD;
        private double descriptionThreshold = DEFAULT_DESCRIPTION_THRESHOLD;
        private int descriptionPrefixLength = DEFAULT_DESCRIPTION_PREFIX_LENGTH;

        public Builder highSimilarityThreshold(double threshold) {
            validateThreshold(threshold, "highSimilarityThreshold");
            this.highSimilarityThreshold = threshold;
            return this;
        }

        public Builder potentialThreshold(double threshold) {
            validateThreshold(threshold, "potentialThreshold");
            this.potentialThreshold = threshold;
            return this;
        }

        public Builder titleThreshold(double threshold) {
            validateThreshold(threshold, "titleThreshold");
            this.titleThreshold = threshold;
            return this;
        }

        public Builder companyThreshold(double threshold) {
            validateThreshold(threshold, "companyThreshold");
            this.companyThreshold = threshold;
            return this;
        }

        public Builder descriptionThreshold(double threshold) {
            validateThreshold(threshold, "descriptionThreshold");
            this.descriptionThreshold = threshold;
            return this;
        }

        public Builder descriptionPrefixLength(int length) {
            if (length <= 0) {
                throw new IllegalArgumentException("descriptionPrefixLength must be positive");
            }
            this.descriptionPrefixLength = length;
            return this;
        }

        public DuplicateOptions build() {
            if (highSimilarityThreshold < potentialThreshold) {
                throw new IllegalArgumentException(
                        "highSimilarityThreshold must be >= potentialThreshold");
            }
            return new DuplicateOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
