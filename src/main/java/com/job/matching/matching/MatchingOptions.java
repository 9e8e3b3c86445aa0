package com.job.matching.matching;

/**
 * Options for scoring and ranking: weights, recommendation thresholds,
 * the skill-match threshold, batch settings and application gates.
 */
public class MatchingOptions {

    private static final double DEFAULT_HIGHLY_RECOMMENDED_THRESHOLD = 0.8;
    private static final double DEFAULT_RECOMMENDED_THRESHOLD = 0.6;
    private static final double DEFAULT_CONSIDER_THRESHOLD = 0.4;
    private static final double DEFAULT_SKILL_MATCH_THRESHOLD = 0.85;
    private static final int DEFAULT_BATCH_WORKERS = 4;
    private static final int DEFAULT_TOP_N = 20;
    private static final double DEFAULT_MIN_APPLICATION_SCORE = 0.6;
    private static final double DEFAULT_AUTO_APPLY_SCORE = 0.8;

    private final MatchingWeights weights;
    private final double highlyRecommendedThreshold;
    private final double recommendedThreshold;
    private final double considerThreshold;
    private final double skillMatchThreshold;
    private final int batchWorkers;
    private final int topN;
    private final double minApplicationScore;
    private final double autoApplyScore;

    private MatchingOptions(Builder builder) {
        this.weights = builder.weights;
        this.highlyRecommendedThreshold = builder.highlyRecommendedThreshold;
        this.recommendedThreshold = builder.recommendedThreshold;
        this.considerThreshold = builder.considerThreshold;
        this.skillMatchThreshold = builder.skillMatchThreshold;
        this.batchWorkers = builder.batchWorkers;
        this.topN = builder.topN;
        this.minApplicationScore = builder.minApplicationScore;
        this.autoApplyScore = builder.autoApplyScore;
    }

    public MatchingWeights getWeights() {
        return weights;
    }

    public double getHighlyRecommendedThreshold() {
        return highlyRecommendedThreshold;
    }

    public double getRecommendedThreshold() {
        return recommendedThreshold;
    }

    public double getConsiderThreshold() {
        return considerThreshold;
    }

    public double getSkillMatchThreshold() {
        return skillMatchThreshold;
    }

    public int getBatchWorkers() {
        return batchWorkers;
    }

    public int getTopN() {
        return topN;
    }

    /**
     * Minimum overall score for a posting to be recorded as applied.
     */
    public double getMinApplicationScore() {
        return minApplicationScore;
    }

    public double getAutoApplyScore() {
        return autoApplyScore;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingWeights weights = MatchingWeights.defaults();
        private double highlyRecommendedThreshold = DEFAULT_HIGHLY_RECOMMENDED_THRESHOLD;
        private double recommendedThreshold = DEFAULT_RECOMMENDED_THRESHOLD;
        private double considerThreshold = DEFAULT_CONSIDER_THRESHOLD;
        private double skillMatchThreshold = DEFAULT_SKILL_MATCH_THRESHOLD;
        private int batchWorkers = DEFAULT_BATCH_WORKERS;
        private int topN = DEFAULT_TOP_N;
        private double minApplicationScore = DEFAULT_MIN_APPLICATION_SCORE;
        private double autoApplyScore = DEFAULT_AUTO_APPLY_SCORE;

        public Builder weights(MatchingWeights weights) {
            if (weights == null) {
                throw new InvalidWeightsException("weights are required");
            }
            this.weights = weights;
            return this;
        }

        public Builder highlyRecommendedThreshold(double threshold) {
            validateThreshold(threshold, "highlyRecommendedThreshold");
            this.highlyRecommendedThreshold = threshold;
            return this;
        }

        public Builder recommendedThreshold(double threshold) {
            validateThreshold(threshold, "recommendedThreshold");
            this.recommendedThreshold = threshold;
            return this;
        }

        public Builder considerThreshold(double threshold) {
            validateThreshold(threshold, "considerThreshold");
            this.considerThreshold = threshold;
            return this;
        }

        public Builder skillMatchThreshold(double threshold) {
            validateThreshold(threshold, "skillMatchThreshold");
            this.skillMatchThreshold = threshold;
            return this;
        }

        public Builder batchWorkers(int batchWorkers) {
            if (batchWorkers <= 0) {
                throw new IllegalArgumentException("batchWorkers must be positive");
            }
            this.batchWorkers = batchWorkers;
            return this;
        }

        public Builder topN(int topN) {
            if (topN <= 0) {
                throw new IllegalArgumentException("topN must be positive");
            }
            this.topN = topN;
            return this;
        }

        public Builder minApplicationScore(double score) {
            validateThreshold(score, "minApplicationScore");
            this.minApplicationScore = score;
            return this;
        }

        public Builder autoApplyScore(double score) {
            validateThreshold(score, "autoApplyScore");
            this.autoApplyScore = score;
            return this;
        }

        public MatchingOptions build() {
            if (highlyRecommendedThreshold < recommendedThreshold) {
                throw new IllegalArgumentException(
                        "highlyRecommendedThreshold must be >= recommendedThreshold");
            }
            if (recommendedThreshold < considerThreshold) {
                throw new IllegalArgumentException(
                        "recommendedThreshold must be >= considerThreshold");
            }
            return new MatchingOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
