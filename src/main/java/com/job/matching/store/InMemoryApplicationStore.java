package com.job.matching.store;

import com.job.matching.core.model.JobApplicationRecord;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-durable store for tests and short-lived runs.
 */
public class InMemoryApplicationStore implements ApplicationStore {

    private final Map<String, JobApplicationRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized Map<String, JobApplicationRecord> loadAll() {
        return new LinkedHashMap<>(records);
    }

    @Override
    public synchronized void append(JobApplicationRecord record) {
        records.put(record.id(), record);
    }

    @Override
    public synchronized void rewrite(Collection<JobApplicationRecord> newRecords) {
        records.clear();
        for (JobApplicationRecord record : newRecords) {
            records.put(record.id(), record);
        }
    }

    @Override
    public boolean needsCompaction() {
        return false;
    }

    public synchronized int size() {
        return records.size();
    }

    @Override
    public void close() {
    }
}
