package com.job.matching.similarity;

import com.job.matching.embedding.EmbeddingProvider;
import com.job.matching.embedding.EmbeddingUnavailableException;
import com.job.matching.metrics.MetricsService;
import com.job.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lexical plus semantic similarity.
 * Formula: score = wl*lexical + ws*cosine(embed(a), embed(b)), or the lexical score alone
 * when the embedding backend is missing, fails, or exceeds the timeout.
 *
 * <p>Either argument empty scores 0.0; equal strings score 1.0. Never throws.</p>
 */
public class HybridSimilarityScorer implements LexicalSimilarity, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HybridSimilarityScorer.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    private final LexicalSimilarity lexical;
    private final EmbeddingProvider embeddingProvider;
    private final HybridWeights weights;
    private final Duration timeout;
    private final MetricsService metricsService;
    private ExecutorService executor;
    private boolean closed;
    private volatile Boolean semanticEnabled;

    /**
     * Lexical-only scorer using {@link LevenshteinSimilarity}.
     */
    public HybridSimilarityScorer() {
        this(new LevenshteinSimilarity(), null, HybridWeights.defaults(), DEFAULT_TIMEOUT, new NoOpMetricsService());
    }

    public HybridSimilarityScorer(LexicalSimilarity lexical, EmbeddingProvider embeddingProvider) {
        this(lexical, embeddingProvider, HybridWeights.defaults(), DEFAULT_TIMEOUT, new NoOpMetricsService());
    }

    /**
     * @param embeddingProvider may be null for lexical-only scoring
     */
    public HybridSimilarityScorer(LexicalSimilarity lexical, EmbeddingProvider embeddingProvider,
                                  HybridWeights weights, Duration timeout, MetricsService metricsService) {
        this.lexical = lexical != null ? lexical : new LevenshteinSimilarity();
        this.embeddingProvider = embeddingProvider;
        this.weights = weights;
        this.timeout = timeout;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        if (embeddingProvider == null) {
            this.semanticEnabled = Boolean.FALSE;
        }
    }

    @Override
    public double compute(String s1, String s2) {
        return computeWithBreakdown(s1, s2).score();
    }

    @Override
    public String getName() {
        return embeddingProvider != null ? "Hybrid(" + embeddingProvider.getProviderName() + ")" : "Lexical";
    }

    /**
     * Whether an embedding backend is configured and reports itself available.
     * Checked once, on first call. A backend whose availability check throws is treated
     * as unavailable.
     */
    public boolean isSemanticEnabled() {
        Boolean enabled = semanticEnabled;
        if (enabled == null) {
            enabled = checkBackendAvailable();
            semanticEnabled = enabled;
            log.info("similarity.backend provider={} available={}", embeddingProvider.getProviderName(), enabled);
        }
        return enabled;
    }

    private boolean checkBackendAvailable() {
        try {
            return embeddingProvider.isAvailable();
        } catch (RuntimeException e) {
            metricsService.incrementSimilarityFallback();
            log.warn("similarity.backend.check.failed provider={} reason={}",
                    embeddingProvider.getProviderName(), e.getMessage());
            log.debug("similarity.backend.check.failed detail", e);
            return false;
        }
    }

    /**
     * Computes the score along with the parts it was built from.
     */
    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return new SimilarityBreakdown(0.0, Double.NaN, 0.0, false);
        }
        if (s1.equals(s2)) {
            return new SimilarityBreakdown(1.0, Double.NaN, 1.0, false);
        }

        double lexicalScore = clamp(lexical.compute(s1, s2));
        if (embeddingProvider == null || !isSemanticEnabled()) {
            return new SimilarityBreakdown(lexicalScore, Double.NaN, lexicalScore, false);
        }

        double semanticScore;
        try {
            semanticScore = semantic(s1, s2);
        } catch (EmbeddingUnavailableException e) {
            metricsService.incrementSimilarityFallback();
            log.warn("similarity.fallback provider={} reason={}", embeddingProvider.getProviderName(), e.getMessage());
            log.debug("similarity.fallback detail", e);
            return new SimilarityBreakdown(lexicalScore, Double.NaN, lexicalScore, false);
        }

        double combined = clamp(weights.lexicalWeight() * lexicalScore + weights.semanticWeight() * semanticScore);
        log.debug("similarity.hybrid a='{}' b='{}' lexical={} semantic={} combined={}",
                s1, s2, lexicalScore, semanticScore, combined);
        return new SimilarityBreakdown(lexicalScore, semanticScore, combined, true);
    }

    private double semantic(String s1, String s2) {
        Future<Double> future;
        try {
            future = executor().submit(() ->
                    CosineSimilarity.compute(embeddingProvider.embed(s1), embeddingProvider.embed(s2)));
        } catch (RejectedExecutionException e) {
            throw new EmbeddingUnavailableException("Similarity scorer is closed", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingUnavailableException("Embedding timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EmbeddingUnavailableException("Embedding failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while waiting for embedding", e);
        }
    }

    /**
     * Worker pool for embedding calls, created on first semantic comparison.
     */
    private synchronized ExecutorService executor() {
        if (closed) {
            throw new RejectedExecutionException("closed");
        }
        if (executor == null) {
            executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()),
                    daemonThreads());
        }
        return executor;
    }

    synchronized boolean workerPoolStarted() {
        return executor != null;
    }

    public HybridWeights getWeights() {
        return weights;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "embedding-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        ExecutorService pool;
        synchronized (this) {
            closed = true;
            pool = executor;
        }
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Parts of a hybrid score. {@code semanticScore} is NaN when no embedding was used.
     */
    public record SimilarityBreakdown(
            double lexicalScore,
            double semanticScore,
            double score,
            boolean semanticUsed
    ) {
        @Override
        public String toString() {
            return String.format("SimilarityBreakdown{lexical=%.4f, semantic=%s, score=%.4f}",
                    lexicalScore, semanticUsed ? String.format("%.4f", semanticScore) : "n/a", score);
        }
    }
}
