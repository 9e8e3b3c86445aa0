package com.job.matching.matching;

import com.job.matching.core.model.ConfidenceLevel;
import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchAnalysis;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.MatchResult;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.Recommendation;
import com.job.matching.core.model.UserPreferences;
import com.job.matching.logging.LogContext;
import com.job.matching.metrics.MetricsService;
import com.job.matching.metrics.NoOpMetricsService;
import com.job.matching.rules.TextNormalizer;
import com.job.matching.scoring.CultureFitScorer;
import com.job.matching.scoring.DimensionScorer;
import com.job.matching.scoring.EducationScorer;
import com.job.matching.scoring.ExperienceScorer;
import com.job.matching.scoring.LocationScorer;
import com.job.matching.scoring.SalaryScorer;
import com.job.matching.scoring.SkillMatcher;
import com.job.matching.scoring.SkillScorer;
import com.job.matching.similarity.HybridSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Scores a resume against a posting on every {@link MatchDimension} and combines
 * the results with {@link MatchingWeights}.
 * Formula: overall = sum(weight[d] * score[d]), clamped to [0, 1].
 *
 * <p>A scorer that throws contributes 0.0 for its dimension; the match itself
 * never fails because of missing optional data.</p>
 */
public class CompositeMatcher {
    private static final Logger log = LoggerFactory.getLogger(CompositeMatcher.class);

    private final Map<MatchDimension, DimensionScorer> scorers;
    private final SkillMatcher skillMatcher;
    private final MatchAnalyzer analyzer;
    private final MatchingOptions options;
    private final MetricsService metricsService;

    public CompositeMatcher(List<DimensionScorer> scorers, SkillMatcher skillMatcher,
                            MatchingOptions options, MetricsService metricsService) {
        this.scorers = new EnumMap<>(MatchDimension.class);
        for (DimensionScorer scorer : scorers) {
            this.scorers.put(scorer.dimension(), scorer);
        }
        for (MatchDimension dimension : MatchDimension.values()) {
            if (!this.scorers.containsKey(dimension)) {
                throw new IllegalArgumentException("No scorer registered for dimension " + dimension);
            }
        }
        this.skillMatcher = skillMatcher;
        this.analyzer = new MatchAnalyzer();
        this.options = options;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Matcher with the built-in scorers.
     */
    public static CompositeMatcher create(TextNormalizer normalizer, HybridSimilarityScorer similarity,
                                          MatchingOptions options, MetricsService metricsService) {
        SkillMatcher skillMatcher = new SkillMatcher(similarity, options.getSkillMatchThreshold());
        List<DimensionScorer> scorers = List.of(
                new SkillScorer(skillMatcher),
                new ExperienceScorer(),
                new EducationScorer(),
                new LocationScorer(),
                new CultureFitScorer(normalizer),
                new SalaryScorer()
        );
        return new CompositeMatcher(scorers, skillMatcher, options, metricsService);
    }

    /**
     * Lexical-only matcher with default rules and options.
     */
    public static CompositeMatcher createDefault() {
        return create(TextNormalizer.createDefault(), new HybridSimilarityScorer(),
                MatchingOptions.defaults(), new NoOpMetricsService());
    }

    /**
     * Scores a resume against a posting.
     *
     * @param preferences may be null, in which case {@link UserPreferences#defaults()} apply
     */
    public MatchResult match(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        UserPreferences prefs = preferences != null ? preferences : UserPreferences.defaults();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forMatch(job.getId())) {
            Map<MatchDimension, Double> scores = new EnumMap<>(MatchDimension.class);
            double overall = 0.0;
            for (MatchDimension dimension : MatchDimension.values()) {
                double score = scoreDimension(dimension, resume, job, prefs);
                scores.put(dimension, score);
                overall += options.getWeights().weightFor(dimension) * score;
            }
            overall = clamp(overall);

            List<String> matchingSkills = skillList(() -> skillMatcher.matchingSkills(resume, job), "matching");
            List<String> missingSkills = skillList(() -> skillMatcher.missingSkills(resume, job), "missing");

            MatchAnalysis analysis = analyzer.analyze(resume, job, scores, missingSkills);
            Recommendation recommendation = Recommendation.forScore(overall,
                    options.getHighlyRecommendedThreshold(),
                    options.getRecommendedThreshold(),
                    options.getConsiderThreshold());
            ConfidenceLevel confidence = ConfidenceLevel.of(overall, analysis.weaknesses().size());

            MatchResult result = new MatchResult(
                    job.getId(),
                    overall,
                    scores.get(MatchDimension.SKILLS),
                    scores.get(MatchDimension.EXPERIENCE),
                    scores.get(MatchDimension.EDUCATION),
                    scores.get(MatchDimension.LOCATION),
                    scores.get(MatchDimension.CULTURE),
                    scores.get(MatchDimension.SALARY),
                    analysis,
                    recommendation,
                    matchingSkills,
                    missingSkills,
                    confidence
            );

            metricsService.recordMatchDuration(recommendation, Duration.ofNanos(System.nanoTime() - start));
            metricsService.recordMatchScore(overall);
            log.debug("match.scored title='{}' company='{}' score={} recommendation={} confidence={}",
                    job.getTitle(), job.getCompany(), overall, recommendation, confidence);
            return result;
        }
    }

    private double scoreDimension(MatchDimension dimension, ParsedResume resume,
                                  JobRequirement job, UserPreferences prefs) {
        try {
            return clamp(scorers.get(dimension).score(resume, job, prefs));
        } catch (RuntimeException e) {
            log.warn("match.dimension.failed dimension={} reason={}", dimension, e.getMessage());
            log.debug("match.dimension.failed detail", e);
            return 0.0;
        }
    }

    private static List<String> skillList(Supplier<List<String>> supplier, String kind) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            log.warn("match.skills.failed kind={} reason={}", kind, e.getMessage());
            return List.of();
        }
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public SkillMatcher getSkillMatcher() {
        return skillMatcher;
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
