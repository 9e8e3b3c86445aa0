package com.job.matching.config;

import com.job.matching.embedding.CachingEmbeddingProvider;
import com.job.matching.embedding.EmbeddingProvider;
import com.job.matching.embedding.NoOpEmbeddingProvider;
import com.job.matching.matching.InvalidWeightsException;
import com.job.matching.metrics.NoOpMetricsService;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static Config config(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .build();
    }

    @Test
    @DisplayName("Every setting has a default")
    void testDefaults() {
        EngineConfig engineConfig = EngineConfig.from(config(Map.of()));

        assertEquals(0.8, engineConfig.getMatchingOptions().getHighlyRecommendedThreshold());
        assertEquals(20, engineConfig.getMatchingOptions().getTopN());
        assertEquals(0.85, engineConfig.getDuplicateOptions().getHighSimilarityThreshold());
        assertEquals(Path.of("data"), engineConfig.getStoreDirectory());
        assertEquals(1000, engineConfig.getMaxLogEntries());
        assertFalse(engineConfig.isEmbeddingEnabled());
        assertEquals("http://localhost:11434", engineConfig.getOllamaBaseUrl());
        assertEquals("all-minilm", engineConfig.getOllamaModel());
        assertEquals(Duration.ofSeconds(2), engineConfig.getEmbeddingTimeout());
        assertEquals(10_000L, engineConfig.getEmbeddingCacheMaxSize());
        assertEquals(Duration.ofHours(1), engineConfig.getEmbeddingCacheTtl());
    }

    @Test
    @DisplayName("Configured values override the defaults")
    void testOverrides() {
        EngineConfig engineConfig = EngineConfig.from(config(Map.of(
                "job-matching.weights.skills", "0.5",
                "job-matching.weights.experience", "0.1",
                "job-matching.batch.workers", "8",
                "job-matching.application.min-score", "0.7",
                "dedup.thresholds.title", "0.75",
                "dedup.store.directory", "/var/lib/jobs",
                "embedding.ollama.model", "nomic-embed-text",
                "embedding.timeout-ms", "500")));

        assertEquals(0.5, engineConfig.getMatchingOptions().getWeights().skills());
        assertEquals(8, engineConfig.getMatchingOptions().getBatchWorkers());
        assertEquals(0.7, engineConfig.getMatchingOptions().getMinApplicationScore());
        assertEquals(0.75, engineConfig.getDuplicateOptions().getTitleThreshold());
        assertEquals(Path.of("/var/lib/jobs"), engineConfig.getStoreDirectory());
        assertEquals("nomic-embed-text", engineConfig.getOllamaModel());
        assertEquals(Duration.ofMillis(500), engineConfig.getEmbeddingTimeout());
    }

    @Test
    @DisplayName("Weights that do not sum to 1 fail at load")
    void testInvalidWeights() {
        Config bad = config(Map.of("job-matching.weights.skills", "0.9"));

        assertThrows(InvalidWeightsException.class, () -> EngineConfig.from(bad));
    }

    @Test
    @DisplayName("Inconsistent thresholds fail at load")
    void testInvalidThresholds() {
        Config bad = config(Map.of("job-matching.thresholds.recommended", "0.9"));

        assertThrows(IllegalArgumentException.class, () -> EngineConfig.from(bad));
    }

    @Test
    @DisplayName("Embeddings are off unless enabled")
    void testEmbeddingProvider() {
        EmbeddingProvider disabled = EngineConfig.from(config(Map.of()))
                .createEmbeddingProvider(new NoOpMetricsService());
        assertInstanceOf(NoOpEmbeddingProvider.class, disabled);
        assertFalse(disabled.isAvailable());

        EmbeddingProvider enabled = EngineConfig.from(config(Map.of("embedding.enabled", "true")))
                .createEmbeddingProvider(new NoOpMetricsService());
        assertInstanceOf(CachingEmbeddingProvider.class, enabled);
    }

    @Test
    @DisplayName("Bundled properties load with the documented defaults")
    void testLoad() {
        EngineConfig engineConfig = EngineConfig.load();

        assertEquals(0.35, engineConfig.getMatchingOptions().getWeights().skills());
        assertEquals(500, engineConfig.getDuplicateOptions().getDescriptionPrefixLength());
    }
}
