package com.job.matching.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Match context sets job id and operation, then clears them")
    void testForMatch() {
        try (LogContext ctx = LogContext.forMatch("job-7")) {
            assertEquals("job-7", MDC.get("jobId"));
            assertEquals("match", MDC.get("operation"));
        }
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Batch context carries the batch id")
    void testForBatch() {
        String batchId = LogContext.generateBatchId();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            assertEquals(batchId, MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
    }

    @Test
    @DisplayName("Extra keys are removed on close, unrelated keys are kept")
    void testWith() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forDedup("job-9").with("source", "linkedin")) {
            assertEquals("dedup", MDC.get("operation"));
            assertEquals("linkedin", MDC.get("source"));
        }
        assertNull(MDC.get("source"));
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Closing a nested context restores the outer values")
    void testNested() {
        try (LogContext outer = LogContext.forMatch("job-1")) {
            try (LogContext inner = LogContext.forDedup("fingerprint-1")) {
                assertEquals("fingerprint-1", MDC.get("jobId"));
                assertEquals("dedup", MDC.get("operation"));
            }
            assertEquals("job-1", MDC.get("jobId"));
            assertEquals("match", MDC.get("operation"));
        }
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Batch ids are unique")
    void testBatchIds() {
        assertNotEquals(LogContext.generateBatchId(), LogContext.generateBatchId());
    }
}
