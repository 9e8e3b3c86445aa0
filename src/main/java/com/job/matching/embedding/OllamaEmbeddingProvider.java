package com.job.matching.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Embedding provider backed by a local Ollama server.
 *
 * Ollama must be running (default: http://localhost:11434) with an embedding
 * model pulled, e.g. {@code ollama pull all-minilm}.
 *
 * <pre>
 * EmbeddingProvider provider = OllamaEmbeddingProvider.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("all-minilm")
 *     .timeout(Duration.ofSeconds(2))
 *     .build();
 * </pre>
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "all-minilm";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaEmbeddingProvider(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public float[] embed(String text) {
        EmbeddingResponse response = callOllama(text == null ? "" : text);
        List<Float> values = response.embedding();
        if (values == null || values.isEmpty()) {
            throw new EmbeddingUnavailableException("Ollama returned an empty embedding for model " + model);
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
        }
        return vector;
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("embedding.ollama.unavailable baseUrl={} reason={}", baseUrl, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private EmbeddingResponse callOllama(String prompt) {
        try {
            String requestBody = objectMapper.writeValueAsString(new EmbeddingRequest(model, prompt));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EmbeddingUnavailableException(
                        "Ollama returned status " + response.statusCode() + ": " + response.body());
            }
            return objectMapper.readValue(response.body(), EmbeddingResponse.class);
        } catch (IOException e) {
            throw new EmbeddingUnavailableException("Error calling Ollama: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while calling Ollama", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaEmbeddingProvider build() {
            return new OllamaEmbeddingProvider(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingRequest(String model, String prompt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingResponse(List<Float> embedding) {}
}
