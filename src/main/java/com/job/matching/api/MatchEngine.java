package com.job.matching.api;

import com.job.matching.config.EngineConfig;
import com.job.matching.core.model.DuplicateMatch;
import com.job.matching.core.model.JobApplicationRecord;
import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchResult;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;
import com.job.matching.dedup.AddResult;
import com.job.matching.dedup.ApplicationRequest;
import com.job.matching.dedup.DuplicateCheck;
import com.job.matching.dedup.DuplicateIndex;
import com.job.matching.dedup.DuplicateOptions;
import com.job.matching.embedding.EmbeddingProvider;
import com.job.matching.logging.LogContext;
import com.job.matching.matching.BatchMatcher;
import com.job.matching.matching.CompositeMatcher;
import com.job.matching.matching.MatchingOptions;
import com.job.matching.matching.ProgressCallback;
import com.job.matching.metrics.MetricsService;
import com.job.matching.metrics.NoOpMetricsService;
import com.job.matching.recommendation.ApplicationInsights;
import com.job.matching.recommendation.RecommendationEngine;
import com.job.matching.rules.TextNormalizer;
import com.job.matching.similarity.HybridSimilarityScorer;
import com.job.matching.similarity.HybridWeights;
import com.job.matching.similarity.LevenshteinSimilarity;
import com.job.matching.store.ApplicationStore;
import com.job.matching.store.InMemoryApplicationStore;
import com.job.matching.store.StorageCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Main entry point: scores postings for a candidate and keeps the index of postings
 * already applied to.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (MatchEngine engine = MatchEngine.builder()
 *         .store(new JsonlApplicationStore(Path.of("data")))
 *         .build()) {
 *
 *     ScreeningResult result = engine.screen(resume, job, preferences);
 *     if (result.isRecorded()) {
 *         ApplicationInsights tips = engine.insights(result.match(), resume);
 *     }
 *
 *     List&lt;ScreeningResult&gt; all = engine.screenAll(resume, jobs, preferences);
 * }
 * </pre>
 *
 * A posting is checked against the index before it is scored. Postings that score at
 * least {@link MatchingOptions#getMinApplicationScore()} are recorded.
 */
public class MatchEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final TextNormalizer normalizer;
    private final HybridSimilarityScorer similarity;
    private final boolean ownsSimilarity;
    private final MatchingOptions options;
    private final CompositeMatcher matcher;
    private final BatchMatcher batchMatcher;
    private final DuplicateIndex index;
    private final RecommendationEngine recommendationEngine;
    private final ExecutorService screeningExecutor;

    private MatchEngine(Builder builder) {
        this.normalizer = builder.normalizer != null ? builder.normalizer : TextNormalizer.createDefault();
        this.options = builder.options;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.similarity != null) {
            this.similarity = builder.similarity;
            this.ownsSimilarity = false;
        } else {
            this.similarity = new HybridSimilarityScorer(new LevenshteinSimilarity(), builder.embeddingProvider,
                    HybridWeights.defaults(), HybridSimilarityScorer.DEFAULT_TIMEOUT, metricsService);
            this.ownsSimilarity = true;
        }

        ApplicationStore store = builder.store != null ? builder.store : new InMemoryApplicationStore();
        try {
            this.index = new DuplicateIndex(store, normalizer, similarity, builder.duplicateOptions,
                    metricsService, builder.clock);
        } catch (RuntimeException e) {
            store.close();
            if (ownsSimilarity) {
                similarity.close();
            }
            throw e;
        }

        this.matcher = CompositeMatcher.create(normalizer, similarity, options, metricsService);
        this.batchMatcher = new BatchMatcher(matcher, options.getBatchWorkers());
        this.recommendationEngine = new RecommendationEngine(
                options.getHighlyRecommendedThreshold(),
                options.getRecommendedThreshold(),
                options.getAutoApplyScore());
        this.screeningExecutor = Executors.newFixedThreadPool(options.getBatchWorkers());

        log.info("MatchEngine initialized records={} semanticEnabled={} minApplicationScore={}",
                index.size(), similarity.isSemanticEnabled(), options.getMinApplicationScore());
    }

    /**
     * Engine wired from configuration, persisting to the configured store directory.
     */
    public static MatchEngine fromConfig(EngineConfig config, MetricsService metricsService) {
        return builder()
                .options(config.getMatchingOptions())
                .duplicateOptions(config.getDuplicateOptions())
                .store(config.createStore())
                .embeddingProvider(config.createEmbeddingProvider(metricsService))
                .metricsService(metricsService)
                .build();
    }

    // ========== Matching API ==========

    public MatchResult match(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        return matcher.match(resume, job, preferences);
    }

    /**
     * Scores every posting and returns the best {@link MatchingOptions#getTopN()}, ranked.
     * Does not touch the index.
     */
    public List<MatchResult> rank(ParsedResume resume, List<JobRequirement> jobs, UserPreferences preferences) {
        return batchMatcher.matchAll(resume, jobs, preferences);
    }

    public ApplicationInsights insights(MatchResult match, ParsedResume resume) {
        return recommendationEngine.insights(match, resume);
    }

    // ========== Screening API ==========

    /**
     * Checks the posting against the index, scores it if new and records it when the
     * score clears the application threshold.
     */
    public ScreeningResult screen(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        try (LogContext ctx = LogContext.forMatch(job.getId())) {
            Prescreen prescreen = prescreen(resume, job, preferences);
            return ingest(job, prescreen);
        }
    }

    public List<ScreeningResult> screenAll(ParsedResume resume, List<JobRequirement> jobs,
                                           UserPreferences preferences) {
        return screenAll(resume, jobs, preferences, () -> false, ProgressCallback.NOOP);
    }

    /**
     * Screens many postings. Duplicate checks and scoring run in parallel; recording runs
     * on the calling thread in input order, so the first of two duplicate postings in the
     * batch becomes the stored record. Once {@code stopSignal} reports true no further
     * posting is recorded. Postings whose scoring fails are logged and left out.
     *
     * @return one result per screened posting, in input order
     */
    public List<ScreeningResult> screenAll(ParsedResume resume, List<JobRequirement> jobs,
                                           UserPreferences preferences, BooleanSupplier stopSignal,
                                           ProgressCallback progress) {
        Objects.requireNonNull(stopSignal, "stopSignal is required");
        Objects.requireNonNull(progress, "progress is required");
        String batchId = LogContext.generateBatchId();
        long total = jobs.size();

        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("screen.batch.start jobs={}", total);

            List<Future<Prescreen>> futures = new ArrayList<>(jobs.size());
            for (JobRequirement job : jobs) {
                futures.add(screeningExecutor.submit(() -> {
                    if (stopSignal.getAsBoolean()) {
                        return null;
                    }
                    try (LogContext jobCtx = LogContext.forBatch(batchId)) {
                        return prescreen(resume, job, preferences);
                    }
                }));
            }

            List<ScreeningResult> results = new ArrayList<>(jobs.size());
            int recorded = 0;
            for (int i = 0; i < futures.size(); i++) {
                if (stopSignal.getAsBoolean()) {
                    log.info("screen.batch.stopped processed={} remaining={}", i, total - i);
                    futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                    break;
                }
                JobRequirement job = jobs.get(i);
                Prescreen prescreen = await(futures.get(i), job);
                if (prescreen == null) {
                    continue;
                }
                ScreeningResult result = ingest(job, prescreen);
                if (result.isRecorded()) {
                    recorded++;
                }
                results.add(result);
                progress.onProgress(i + 1, total, job.getId());
            }

            log.info("screen.batch.complete screened={} recorded={}", results.size(), recorded);
            return results;
        }
    }

    // ========== Index API ==========

    public DuplicateIndex getIndex() {
        return index;
    }

    public TextNormalizer getNormalizer() {
        return normalizer;
    }

    public MatchingOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        screeningExecutor.shutdown();
        try {
            if (!screeningExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                screeningExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            screeningExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        batchMatcher.close();
        if (ownsSimilarity) {
            similarity.close();
        }
        index.close();
        log.info("MatchEngine closed");
    }

    private Prescreen prescreen(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        ApplicationRequest request = ApplicationRequest.from(job);
        DuplicateCheck check = index.isDuplicate(request);
        if (check.duplicate()) {
            return new Prescreen(request, check, null);
        }
        return new Prescreen(request, check, matcher.match(resume, job, preferences));
    }

    private ScreeningResult ingest(JobRequirement job, Prescreen prescreen) {
        if (prescreen.check().duplicate()) {
            DuplicateMatch best = prescreen.check().bestMatch();
            JobApplicationRecord existing = index.get(best.existingId()).orElse(null);
            log.info("screen.duplicate jobId={} existingId={} type={}",
                    job.getId(), best.existingId(), best.matchType().tag());
            return ScreeningResult.duplicate(job.getId(), null, existing, best);
        }

        MatchResult match = prescreen.match();
        if (match.overallScore() < options.getMinApplicationScore()) {
            log.debug("screen.below_threshold jobId={} score={}", job.getId(), match.overallScore());
            return ScreeningResult.belowThreshold(match);
        }

        AddResult added = index.add(prescreen.request());
        if (!added.inserted()) {
            log.info("screen.duplicate jobId={} existingId={} reason=concurrent_insert",
                    job.getId(), added.record().id());
            return ScreeningResult.duplicate(job.getId(), match, added.record(), added.match());
        }
        boolean autoApply = recommendationEngine.shouldAutoApply(match);
        log.info("screen.recorded jobId={} recordId={} score={} autoApply={}",
                job.getId(), added.record().id(), match.overallScore(), autoApply);
        return ScreeningResult.recorded(match, added.record(), added.match(), autoApply);
    }

    private Prescreen await(Future<Prescreen> future, JobRequirement job) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("screen.failed jobId={} reason={}", job.getId(), cause.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("screen.interrupted jobId={}", job.getId());
            return null;
        }
    }

    private record Prescreen(ApplicationRequest request, DuplicateCheck check, MatchResult match) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TextNormalizer normalizer;
        private EmbeddingProvider embeddingProvider;
        private HybridSimilarityScorer similarity;
        private MatchingOptions options = MatchingOptions.defaults();
        private DuplicateOptions duplicateOptions = DuplicateOptions.defaults();
        private ApplicationStore store;
        private MetricsService metricsService;
        private Clock clock = Clock.systemUTC();

        public Builder normalizer(TextNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Embedding backend for the engine's own similarity scorer.
         * Ignored when {@link #similarity} is set.
         */
        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        /**
         * Shared similarity scorer. The caller keeps ownership and closes it.
         */
        public Builder similarity(HybridSimilarityScorer similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder options(MatchingOptions options) {
            this.options = Objects.requireNonNull(options);
            return this;
        }

        public Builder duplicateOptions(DuplicateOptions duplicateOptions) {
            this.duplicateOptions = Objects.requireNonNull(duplicateOptions);
            return this;
        }

        /**
         * Defaults to an {@link InMemoryApplicationStore}.
         */
        public Builder store(ApplicationStore store) {
            this.store = store;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * @throws StorageCorruptionException if the store cannot be read; the store is closed
         */
        public MatchEngine build() {
            return new MatchEngine(this);
        }
    }
}
