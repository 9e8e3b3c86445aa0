package com.job.matching.dedup;

import com.job.matching.core.model.ApplicationStatus;
import com.job.matching.core.model.DuplicateMatch;
import com.job.matching.core.model.JobApplicationRecord;
import com.job.matching.logging.LogContext;
import com.job.matching.metrics.MetricsService;
import com.job.matching.metrics.NoOpMetricsService;
import com.job.matching.rules.TextNormalizer;
import com.job.matching.similarity.HybridSimilarityScorer;
import com.job.matching.store.ApplicationStore;
import com.job.matching.store.StorageCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Persistent index of postings already applied to.
 *
 * <p>Reads (duplicate checks, stats) may run concurrently. Writes are serialized
 * under a write lock and re-check for duplicates before inserting, so the first
 * writer of a posting becomes the canonical record. Every accepted record is
 * persisted individually before {@link #add} returns.</p>
 */
public class DuplicateIndex implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DuplicateIndex.class);

    private static final Duration RECENT_WINDOW = Duration.ofDays(7);
    private static final Comparator<DuplicateMatch> BY_SCORE_DESC =
            Comparator.comparingDouble(DuplicateMatch::similarityScore).reversed();

    private final ApplicationStore store;
    private final TextNormalizer normalizer;
    private final JobIdGenerator idGenerator;
    private final DuplicateClassifier classifier;
    private final DuplicateOptions options;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Map<String, JobApplicationRecord> records;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Loads all stored records.
     *
     * @throws StorageCorruptionException if the store cannot be read
     */
    public DuplicateIndex(ApplicationStore store, TextNormalizer normalizer, HybridSimilarityScorer similarity,
                          DuplicateOptions options, MetricsService metricsService, Clock clock) {
        this.store = store;
        this.normalizer = normalizer;
        this.idGenerator = new JobIdGenerator(normalizer);
        this.classifier = new DuplicateClassifier(similarity, options);
        this.options = options;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.clock = clock;
        this.records = new LinkedHashMap<>();
        for (JobApplicationRecord record : store.loadAll().values()) {
            records.put(record.id(), withNormalizedFields(record));
        }
        log.info("dedup.index.loaded records={}", records.size());
    }

    public DuplicateIndex(ApplicationStore store, TextNormalizer normalizer, HybridSimilarityScorer similarity) {
        this(store, normalizer, similarity, DuplicateOptions.defaults(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public String generateId(String title, String company, String url) {
        return idGenerator.generate(title, company, url);
    }

    /**
     * Every stored record similar to {@code candidate}, best first.
     */
    public List<DuplicateMatch> findDuplicates(JobApplicationRecord candidate) {
        JobApplicationRecord normalized = withNormalizedFields(candidate);
        lock.readLock().lock();
        try {
            return findDuplicatesLocked(normalized);
        } finally {
            lock.readLock().unlock();
        }
    }

    public DuplicateCheck isDuplicate(String title, String company, String url, String description) {
        return isDuplicate(ApplicationRequest.of(title, company, url, description));
    }

    /**
     * Duplicate when the best match is exact or scores at least the high-similarity threshold.
     * A weaker {@code potential} match is reported but does not make the posting a duplicate.
     */
    public DuplicateCheck isDuplicate(ApplicationRequest request) {
        JobApplicationRecord candidate = toCandidate(request);
        try (LogContext ctx = LogContext.forDedup(candidate.id())) {
            lock.readLock().lock();
            try {
                return check(candidate);
            } finally {
                lock.readLock().unlock();
            }
        }
    }

    /**
     * Records the posting unless it duplicates a stored one, in which case the stored
     * record is returned with {@code inserted == false}. A new record is stamped with the
     * id and score of any potential match.
     *
     * @throws UncheckedIOException if the record could not be persisted; the index is left unchanged
     */
    public AddResult add(ApplicationRequest request) {
        JobApplicationRecord candidate = toCandidate(request);
        try (LogContext ctx = LogContext.forDedup(candidate.id())) {
            lock.writeLock().lock();
            try {
                DuplicateCheck check = check(candidate);
                if (check.duplicate()) {
                    DuplicateMatch match = check.bestMatch();
                    log.info("dedup.rejected title='{}' company='{}' existingId={} score={}",
                            request.title(), request.company(), match.existingId(), match.similarityScore());
                    return new AddResult(false, records.get(match.existingId()), match);
                }

                JobApplicationRecord record = candidate;
                DuplicateMatch potential = check.bestMatch();
                if (potential != null && potential.similarityScore() >= options.getPotentialThreshold()) {
                    record = stampDuplicateOf(candidate, potential);
                }

                records.put(record.id(), record);
                try {
                    store.append(record);
                } catch (UncheckedIOException e) {
                    records.remove(record.id());
                    throw e;
                }
                metricsService.incrementApplicationRecorded();
                log.info("dedup.inserted id={} title='{}' company='{}' duplicateOf={}",
                        record.id(), record.jobTitle(), record.company(), record.duplicateOf());

                compactIfNeeded();
                return new AddResult(true, record, potential);
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    /**
     * Changes the status of a stored record; false when the id is unknown.
     */
    public boolean updateStatus(String id, ApplicationStatus status) {
        lock.writeLock().lock();
        try {
            JobApplicationRecord existing = records.get(id);
            if (existing == null) {
                log.debug("dedup.status.unknown id={}", id);
                return false;
            }
            JobApplicationRecord updated = existing.withStatus(status.value());
            store.append(updated);
            records.put(id, updated);
            log.info("dedup.status.updated id={} status={}", id, status.value());
            compactIfNeeded();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<JobApplicationRecord> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All records in insertion order.
     */
    public List<JobApplicationRecord> records() {
        lock.readLock().lock();
        try {
            return List.copyOf(records.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Similar pairs across the whole index, each unordered pair once, best first.
     */
    public List<DuplicateMatch> findAllPotentialDuplicates() {
        lock.readLock().lock();
        try {
            List<DuplicateMatch> all = new ArrayList<>();
            Set<String> seenPairs = new HashSet<>();
            for (JobApplicationRecord record : records.values()) {
                for (DuplicateMatch match : findDuplicatesLocked(record)) {
                    String a = match.candidateId();
                    String b = match.existingId();
                    String pairKey = a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
                    if (seenPairs.add(pairKey)) {
                        all.add(match);
                    }
                }
            }
            all.sort(BY_SCORE_DESC);
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ApplicationStats stats() {
        lock.readLock().lock();
        try {
            if (records.isEmpty()) {
                return ApplicationStats.empty();
            }
            Map<String, Integer> byStatus = new TreeMap<>();
            Map<String, Integer> byCompany = new TreeMap<>();
            Map<String, Integer> bySource = new TreeMap<>();
            int duplicates = 0;
            int recent = 0;
            Instant recentCutoff = clock.instant().minus(RECENT_WINDOW);

            for (JobApplicationRecord record : records.values()) {
                byStatus.merge(record.status(), 1, Integer::sum);
                byCompany.merge(record.company(), 1, Integer::sum);
                bySource.merge(record.jobSource().isBlank() ? "unknown" : record.jobSource(), 1, Integer::sum);
                if (record.duplicateOfId().isPresent()) {
                    duplicates++;
                }
                Optional<Instant> appliedAt = record.appliedAt();
                if (appliedAt.isPresent() && !appliedAt.get().isBefore(recentCutoff)) {
                    recent++;
                }
            }
            return new ApplicationStats(records.size(), byStatus, byCompany, bySource, duplicates, recent);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes rejected and unanswered applications older than {@code age}, then compacts the store.
     * Records with an unreadable date are kept.
     */
    public RetentionResult cleanupOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        lock.writeLock().lock();
        try {
            List<String> removed = new ArrayList<>();
            Iterator<JobApplicationRecord> iterator = records.values().iterator();
            while (iterator.hasNext()) {
                JobApplicationRecord record = iterator.next();
                boolean closed = record.hasStatus(ApplicationStatus.REJECTED)
                        || record.hasStatus(ApplicationStatus.NO_RESPONSE);
                Optional<Instant> appliedAt = record.appliedAt();
                if (closed && appliedAt.isPresent() && appliedAt.get().isBefore(cutoff)) {
                    iterator.remove();
                    removed.add(record.id());
                }
            }
            if (!removed.isEmpty()) {
                store.rewrite(records.values());
                log.info("dedup.cleanup removed={} cutoff={}", removed.size(), cutoff);
            }
            return new RetentionResult(removed, cutoff);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Folds the store's append log into a fresh snapshot.
     */
    public void compact() {
        lock.writeLock().lock();
        try {
            store.rewrite(records.values());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        store.close();
    }

    private DuplicateCheck check(JobApplicationRecord candidate) {
        metricsService.incrementDedupChecked();
        List<DuplicateMatch> matches = findDuplicatesLocked(candidate);
        if (matches.isEmpty()) {
            return new DuplicateCheck(candidate.id(), false, null);
        }
        DuplicateMatch best = matches.get(0);
        boolean duplicate = classifier.isDefinitive(best);
        if (duplicate) {
            metricsService.incrementDuplicateDetected(best.matchType());
            log.debug("dedup.duplicate existingId={} type={} score={}",
                    best.existingId(), best.matchType().tag(), best.similarityScore());
        }
        return new DuplicateCheck(candidate.id(), duplicate, best);
    }

    private List<DuplicateMatch> findDuplicatesLocked(JobApplicationRecord candidate) {
        List<DuplicateMatch> matches = new ArrayList<>();
        for (JobApplicationRecord existing : records.values()) {
            if (existing == candidate) {
                continue;
            }
            classifier.classify(candidate, existing).ifPresent(matches::add);
        }
        matches.sort(BY_SCORE_DESC);
        return matches;
    }

    private JobApplicationRecord toCandidate(ApplicationRequest request) {
        String description = request.description();
        int prefixLength = options.getDescriptionPrefixLength();
        String excerpt = description.length() <= prefixLength ? description : description.substring(0, prefixLength);
        return JobApplicationRecord.builder()
                .id(idGenerator.generate(request.title(), request.company(), request.url()))
                .jobTitle(request.title())
                .company(request.company())
                .normalizedTitle(normalizer.normalizeTitle(request.title()))
                .normalizedCompany(normalizer.normalizeCompany(request.company()))
                .jobUrl(request.url())
                .applicationDate(clock.instant())
                .jobDescription(excerpt)
                .location(request.location())
                .salaryRange(request.salaryRange())
                .jobSource(request.source())
                .status(ApplicationStatus.APPLIED)
                .build();
    }

    /**
     * Recomputes the comparison keys from the raw title and company with the current rules
     * and aliases. A stored key is kept only when its raw field is missing.
     */
    private JobApplicationRecord withNormalizedFields(JobApplicationRecord record) {
        String title = normalizer.normalizeTitle(record.jobTitle());
        String company = normalizer.normalizeCompany(record.company());
        return record.withNormalized(
                title.isEmpty() ? record.normalizedTitle() : title,
                company.isEmpty() ? record.normalizedCompany() : company);
    }

    private static JobApplicationRecord stampDuplicateOf(JobApplicationRecord record, DuplicateMatch match) {
        return new JobApplicationRecord(record.id(), record.jobTitle(), record.company(), record.normalizedTitle(),
                record.normalizedCompany(), record.jobUrl(), record.applicationDate(), record.jobDescription(),
                record.location(), record.salaryRange(), record.jobSource(), record.status(),
                match.similarityScore(), match.existingId());
    }

    private void compactIfNeeded() {
        if (store.needsCompaction()) {
            store.rewrite(records.values());
        }
    }
}
