package com.job.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC. On close every key set through this
 * context gets back the value it had before, or is removed if it had none, so
 * contexts can nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMatch(job.getId())) {
 *     log.info("match.scored score={} recommendation={}", score, recommendation);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forMatch(String jobId) {
        LogContext ctx = new LogContext();
        ctx.put("jobId", jobId);
        ctx.put("operation", "match");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static LogContext forDedup(String jobId) {
        LogContext ctx = new LogContext();
        ctx.put("jobId", jobId);
        ctx.put("operation", "dedup");
        return ctx;
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        List<Map.Entry<String, String>> entries = new ArrayList<>(previous.entrySet());
        for (int i = entries.size() - 1; i >= 0; i--) {
            Map.Entry<String, String> entry = entries.get(i);
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
