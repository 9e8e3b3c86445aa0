package com.job.matching.config;

import com.job.matching.dedup.DuplicateOptions;
import com.job.matching.embedding.CachingEmbeddingProvider;
import com.job.matching.embedding.EmbeddingProvider;
import com.job.matching.embedding.NoOpEmbeddingProvider;
import com.job.matching.embedding.OllamaEmbeddingProvider;
import com.job.matching.matching.MatchingOptions;
import com.job.matching.matching.MatchingWeights;
import com.job.matching.metrics.MetricsService;
import com.job.matching.store.JsonlApplicationStore;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine settings read from MicroProfile Config.
 *
 * <p>Sources, highest priority first: system properties, environment variables,
 * {@code META-INF/microprofile-config.properties}. Every key has a default.</p>
 *
 * <pre>
 * job-matching.weights.skills=0.35
 * job-matching.thresholds.highly-recommended=0.8
 * dedup.store.directory=data
 * embedding.enabled=false
 * </pre>
 *
 * Weights are validated on load, so a bad edit fails at startup with
 * {@link com.job.matching.matching.InvalidWeightsException}.
 */
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private final MatchingOptions matchingOptions;
    private final DuplicateOptions duplicateOptions;
    private final Path storeDirectory;
    private final int maxLogEntries;
    private final boolean embeddingEnabled;
    private final String ollamaBaseUrl;
    private final String ollamaModel;
    private final Duration embeddingTimeout;
    private final long embeddingCacheMaxSize;
    private final Duration embeddingCacheTtl;

    private EngineConfig(Config config) {
        MatchingWeights weights = new MatchingWeights(
                getDouble(config, "job-matching.weights.skills", 0.35),
                getDouble(config, "job-matching.weights.experience", 0.25),
                getDouble(config, "job-matching.weights.education", 0.10),
                getDouble(config, "job-matching.weights.location", 0.15),
                getDouble(config, "job-matching.weights.culture", 0.10),
                getDouble(config, "job-matching.weights.salary", 0.05));

        this.matchingOptions = MatchingOptions.builder()
                .weights(weights)
                .highlyRecommendedThreshold(getDouble(config, "job-matching.thresholds.highly-recommended", 0.8))
                .recommendedThreshold(getDouble(config, "job-matching.thresholds.recommended", 0.6))
                .considerThreshold(getDouble(config, "job-matching.thresholds.consider", 0.4))
                .skillMatchThreshold(getDouble(config, "job-matching.skills.match-threshold", 0.85))
                .batchWorkers(getInt(config, "job-matching.batch.workers", 4))
                .topN(getInt(config, "job-matching.batch.top-n", 20))
                .minApplicationScore(getDouble(config, "job-matching.application.min-score", 0.6))
                .autoApplyScore(getDouble(config, "job-matching.application.auto-apply-score", 0.8))
                .build();

        this.duplicateOptions = DuplicateOptions.builder()
                .highSimilarityThreshold(getDouble(config, "dedup.thresholds.high-similarity", 0.85))
                .potentialThreshold(getDouble(config, "dedup.thresholds.potential", 0.70))
                .titleThreshold(getDouble(config, "dedup.thresholds.title", 0.8))
                .companyThreshold(getDouble(config, "dedup.thresholds.company", 0.9))
                .descriptionThreshold(getDouble(config, "dedup.thresholds.description", 0.7))
                .descriptionPrefixLength(getInt(config, "dedup.description-prefix-length", 500))
                .build();

        this.storeDirectory = Path.of(config.getOptionalValue("dedup.store.directory", String.class).orElse("data"));
        this.maxLogEntries = getInt(config, "dedup.compaction.max-log-entries",
                JsonlApplicationStore.DEFAULT_MAX_LOG_ENTRIES);

        this.embeddingEnabled = config.getOptionalValue("embedding.enabled", Boolean.class).orElse(false);
        this.ollamaBaseUrl = config.getOptionalValue("embedding.ollama.base-url", String.class)
                .orElse("http://localhost:11434");
        this.ollamaModel = config.getOptionalValue("embedding.ollama.model", String.class).orElse("all-minilm");
        this.embeddingTimeout = Duration.ofMillis(config.getOptionalValue("embedding.timeout-ms", Long.class)
                .orElse(2000L));
        this.embeddingCacheMaxSize = config.getOptionalValue("embedding.cache.max-size", Long.class).orElse(10_000L);
        this.embeddingCacheTtl = Duration.ofSeconds(config.getOptionalValue("embedding.cache.ttl-seconds", Long.class)
                .orElse(3600L));
    }

    /**
     * Reads the process-wide MicroProfile configuration.
     */
    public static EngineConfig load() {
        EngineConfig engineConfig = from(ConfigProvider.getConfig());
        log.info("config.loaded storeDirectory={} embeddingEnabled={} model={}",
                engineConfig.storeDirectory, engineConfig.embeddingEnabled, engineConfig.ollamaModel);
        return engineConfig;
    }

    public static EngineConfig from(Config config) {
        return new EngineConfig(config);
    }

    /**
     * The configured embedding backend: a cached Ollama provider when enabled,
     * otherwise {@link NoOpEmbeddingProvider}.
     */
    public EmbeddingProvider createEmbeddingProvider(MetricsService metricsService) {
        if (!embeddingEnabled) {
            return new NoOpEmbeddingProvider();
        }
        EmbeddingProvider ollama = OllamaEmbeddingProvider.builder()
                .baseUrl(ollamaBaseUrl)
                .model(ollamaModel)
                .timeout(embeddingTimeout)
                .build();
        return new CachingEmbeddingProvider(ollama, embeddingCacheMaxSize, embeddingCacheTtl, metricsService);
    }

    public JsonlApplicationStore createStore() {
        return new JsonlApplicationStore(storeDirectory, maxLogEntries);
    }

    public MatchingOptions getMatchingOptions() {
        return matchingOptions;
    }

    public DuplicateOptions getDuplicateOptions() {
        return duplicateOptions;
    }

    public Path getStoreDirectory() {
        return storeDirectory;
    }

    public int getMaxLogEntries() {
        return maxLogEntries;
    }

    public boolean isEmbeddingEnabled() {
        return embeddingEnabled;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    public String getOllamaModel() {
        return ollamaModel;
    }

    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public long getEmbeddingCacheMaxSize() {
        return embeddingCacheMaxSize;
    }

    public Duration getEmbeddingCacheTtl() {
        return embeddingCacheTtl;
    }

    private static double getDouble(Config config, String name, double defaultValue) {
        return config.getOptionalValue(name, Double.class).orElse(defaultValue);
    }

    private static int getInt(Config config, String name, int defaultValue) {
        return config.getOptionalValue(name, Integer.class).orElse(defaultValue);
    }
}
