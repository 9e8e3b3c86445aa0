package com.job.matching.matching;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchResult;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;
import com.job.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Matches one resume against many postings on a fixed worker pool and ranks the results.
 */
public class BatchMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchMatcher.class);

    /**
     * Overall score descending, then job id ascending.
     */
    public static final Comparator<MatchResult> RANKING =
            Comparator.comparingDouble(MatchResult::overallScore).reversed()
                    .thenComparing(MatchResult::jobId);

    private final CompositeMatcher matcher;
    private final ExecutorService executor;

    public BatchMatcher(CompositeMatcher matcher) {
        this(matcher, matcher.getOptions().getBatchWorkers());
    }

    public BatchMatcher(CompositeMatcher matcher, int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        this.matcher = matcher;
        this.executor = Executors.newFixedThreadPool(workers);
    }

    public List<MatchResult> matchAll(ParsedResume resume, List<JobRequirement> jobs, UserPreferences preferences) {
        return matchAll(resume, jobs, preferences, matcher.getOptions().getTopN(), () -> false, ProgressCallback.NOOP);
    }

    /**
     * Scores every posting and returns the best {@code topN}.
     * Postings that fail are logged and skipped. Once {@code stopSignal} reports true,
     * postings not yet started are skipped as well.
     */
    public List<MatchResult> matchAll(ParsedResume resume, List<JobRequirement> jobs, UserPreferences preferences,
                                      int topN, BooleanSupplier stopSignal, ProgressCallback progress) {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN must be positive");
        }
        String batchId = LogContext.generateBatchId();
        long total = jobs.size();
        AtomicLong processed = new AtomicLong();

        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.match.start jobs={} topN={}", total, topN);

            List<Future<MatchResult>> futures = new ArrayList<>(jobs.size());
            for (JobRequirement job : jobs) {
                futures.add(executor.submit(() -> {
                    if (stopSignal.getAsBoolean()) {
                        return null;
                    }
                    try (LogContext jobCtx = LogContext.forBatch(batchId)) {
                        MatchResult result = matcher.match(resume, job, preferences);
                        progress.onProgress(processed.incrementAndGet(), total, job.getId());
                        return result;
                    }
                }));
            }

            List<MatchResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                MatchResult result = await(futures.get(i), jobs.get(i));
                if (result != null) {
                    results.add(result);
                }
            }

            results.sort(RANKING);
            List<MatchResult> top = results.size() > topN ? List.copyOf(results.subList(0, topN)) : List.copyOf(results);
            log.info("batch.match.complete scored={} skipped={} returned={}",
                    results.size(), total - results.size(), top.size());
            return top;
        }
    }

    private MatchResult await(Future<MatchResult> future, JobRequirement job) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("batch.match.failed jobId={} reason={}", job.getId(), cause.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("batch.match.interrupted jobId={}", job.getId());
            return null;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
