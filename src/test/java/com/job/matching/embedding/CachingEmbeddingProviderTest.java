package com.job.matching.embedding;

import com.job.matching.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingEmbeddingProviderTest {

    @Mock
    private EmbeddingProvider delegate;

    private SimpleMeterRegistry registry;
    private CachingEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new CachingEmbeddingProvider(delegate, 100, Duration.ofMinutes(10),
                new MicrometerMetricsService(registry));
    }

    @Test
    @DisplayName("Second lookup of the same text is served from cache")
    void cachesByText() {
        when(delegate.embed("java")).thenReturn(new float[]{1, 2});

        provider.embed("java");
        float[] second = provider.embed("java");

        assertArrayEquals(new float[]{1, 2}, second);
        verify(delegate, times(1)).embed("java");
        assertEquals(1, provider.size());
        assertEquals(1.0, registry.get("job.embedding.cache.hit").counter().count());
        assertEquals(1.0, registry.get("job.embedding.cache.miss").counter().count());
    }

    @Test
    @DisplayName("Callers cannot corrupt cached vectors")
    void returnsCopies() {
        when(delegate.embed("java")).thenReturn(new float[]{1, 2});

        float[] first = provider.embed("java");
        first[0] = 99;

        assertArrayEquals(new float[]{1, 2}, provider.embed("java"));
    }

    @Test
    @DisplayName("Failures are not cached")
    void failuresNotCached() {
        when(delegate.embed("java"))
                .thenThrow(new EmbeddingUnavailableException("down"))
                .thenReturn(new float[]{3});

        assertThrows(EmbeddingUnavailableException.class, () -> provider.embed("java"));
        assertArrayEquals(new float[]{3}, provider.embed("java"));
        verify(delegate, times(2)).embed("java");
    }

    @Test
    @DisplayName("invalidateAll empties the cache")
    void invalidate() {
        when(delegate.embed("java")).thenReturn(new float[]{1});
        provider.embed("java");

        provider.invalidateAll();

        assertEquals(0, provider.size());
    }

    @Test
    @DisplayName("Availability and name come from the delegate")
    void delegatesMetadata() {
        when(delegate.isAvailable()).thenReturn(true);
        when(delegate.getProviderName()).thenReturn("Ollama/all-minilm");

        assertTrue(provider.isAvailable());
        assertEquals("Ollama/all-minilm+cache", provider.getProviderName());
    }

    @Test
    @DisplayName("NoOp provider is never available")
    void noOpProvider() {
        NoOpEmbeddingProvider noOp = new NoOpEmbeddingProvider();
        assertFalse(noOp.isAvailable());
        assertThrows(EmbeddingUnavailableException.class, () -> noOp.embed("java"));
    }
}
