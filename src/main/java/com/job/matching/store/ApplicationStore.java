package com.job.matching.store;

import com.job.matching.core.model.JobApplicationRecord;

import java.util.Collection;
import java.util.Map;

/**
 * Durable storage behind the duplicate index.
 */
public interface ApplicationStore extends AutoCloseable {

    /**
     * Loads every stored record keyed by id, in insertion order.
     *
     * @throws StorageCorruptionException if stored data cannot be parsed
     */
    Map<String, JobApplicationRecord> loadAll();

    /**
     * Persists a new or updated record. The record is durable when this returns;
     * a later append for the same id supersedes earlier ones.
     *
     * @throws java.io.UncheckedIOException if the write fails
     */
    void append(JobApplicationRecord record);

    /**
     * Replaces the stored contents with exactly {@code records}.
     */
    void rewrite(Collection<JobApplicationRecord> records);

    /**
     * Whether enough appends have accumulated that a {@link #rewrite} is worthwhile.
     */
    boolean needsCompaction();

    @Override
    void close();
}
