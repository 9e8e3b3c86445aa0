package com.job.matching.matching;

import com.job.matching.TestFixtures;
import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchResult;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BatchMatcherTest {

    private BatchMatcher batchMatcher;

    @BeforeEach
    void setUp() {
        batchMatcher = new BatchMatcher(CompositeMatcher.createDefault(), 3);
    }

    @AfterEach
    void tearDown() {
        batchMatcher.close();
    }

    private static List<JobRequirement> jobs() {
        JobRequirement weak = TestFixtures.job("c-weak", "Barista", "Cafe")
                .requiredSkills("latte art")
                .experienceLevel("Lead")
                .build();
        return List.of(TestFixtures.seniorPythonJob("b-strong"), weak, TestFixtures.seniorPythonJob("a-strong"));
    }

    @Test
    @DisplayName("Ranks by score, then by job id")
    void testRanking() {
        List<MatchResult> results = batchMatcher.matchAll(TestFixtures.strongResume(), jobs(), null);

        assertEquals(List.of("a-strong", "b-strong", "c-weak"), results.stream().map(MatchResult::jobId).toList());
        assertTrue(results.get(1).overallScore() >= results.get(2).overallScore());
    }

    @Test
    @DisplayName("Returns only the top N")
    void testTopN() {
        List<MatchResult> results = batchMatcher.matchAll(TestFixtures.strongResume(), jobs(), null,
                2, () -> false, ProgressCallback.NOOP);

        assertEquals(List.of("a-strong", "b-strong"), results.stream().map(MatchResult::jobId).toList());
    }

    @Test
    @DisplayName("Reports progress for every scored posting")
    void testProgress() {
        AtomicLong calls = new AtomicLong();
        AtomicLong lastTotal = new AtomicLong();

        batchMatcher.matchAll(TestFixtures.strongResume(), jobs(), null, 10, () -> false,
                (processed, total, message) -> {
                    calls.incrementAndGet();
                    lastTotal.set(total);
                });

        assertEquals(3, calls.get());
        assertEquals(3, lastTotal.get());
    }

    @Test
    @DisplayName("Stop signal skips postings not yet started")
    void testStopSignal() {
        List<MatchResult> results = batchMatcher.matchAll(TestFixtures.strongResume(), jobs(), null,
                10, () -> true, ProgressCallback.NOOP);

        assertTrue(results.isEmpty());
    }

    @Test
    @DisplayName("A failing posting is skipped, the rest are returned")
    void testFailureIsolation() {
        CompositeMatcher matcher = mock(CompositeMatcher.class);
        List<JobRequirement> jobs = jobs();
        MatchResult ok = CompositeMatcher.createDefault()
                .match(TestFixtures.strongResume(), jobs.get(0), UserPreferences.defaults());
        when(matcher.match(any(ParsedResume.class), eq(jobs.get(0)), any())).thenReturn(ok);
        when(matcher.match(any(ParsedResume.class), eq(jobs.get(1)), any()))
                .thenThrow(new IllegalStateException("boom"));
        when(matcher.match(any(ParsedResume.class), eq(jobs.get(2)), any()))
                .thenThrow(new IllegalStateException("boom"));

        try (BatchMatcher failing = new BatchMatcher(matcher, 2)) {
            List<MatchResult> results = failing.matchAll(TestFixtures.strongResume(), jobs, null,
                    10, () -> false, ProgressCallback.NOOP);

            assertEquals(1, results.size());
            assertEquals("b-strong", results.get(0).jobId());
        }
    }

    @Test
    @DisplayName("Rejects a non-positive worker count")
    void testWorkers() {
        assertThrows(IllegalArgumentException.class, () -> new BatchMatcher(CompositeMatcher.createDefault(), 0));
    }
}
