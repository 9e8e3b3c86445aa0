package com.job.matching.embedding;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against an in-process HTTP stub that mimics the Ollama embeddings API.
 */
class OllamaEmbeddingProviderTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastRequestBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"embedding\":[0.25,0.5,-0.75]}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/embeddings", exchange -> {
            lastRequestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, status, responseBody);
        });
        server.createContext("/api/tags", exchange -> respond(exchange, 200, "{\"models\":[]}"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private OllamaEmbeddingProvider provider() {
        return provider(baseUrl + "/");
    }

    private static OllamaEmbeddingProvider provider(String url) {
        return OllamaEmbeddingProvider.builder()
                .baseUrl(url)
                .model("all-minilm")
                .timeout(Duration.ofSeconds(2))
                .build();
    }

    @Nested
    @DisplayName("Embedding requests")
    class Embedding {

        @Test
        @DisplayName("Parses the embedding vector")
        void parsesVector() {
            float[] vector = provider().embed("kubernetes");

            assertArrayEquals(new float[]{0.25f, 0.5f, -0.75f}, vector);
            assertTrue(lastRequestBody.get().contains("\"model\":\"all-minilm\""));
            assertTrue(lastRequestBody.get().contains("\"prompt\":\"kubernetes\""));
        }

        @Test
        @DisplayName("Ignores unknown response fields")
        void ignoresUnknownFields() {
            responseBody = "{\"embedding\":[1.0],\"model\":\"all-minilm\",\"took_ms\":3}";
            assertArrayEquals(new float[]{1.0f}, provider().embed("go"));
        }

        @Test
        @DisplayName("Non-200 status is reported as unavailable")
        void errorStatus() {
            status = 500;
            responseBody = "{\"error\":\"model not found\"}";
            EmbeddingUnavailableException e = assertThrows(EmbeddingUnavailableException.class,
                    () -> provider().embed("go"));
            assertTrue(e.getMessage().contains("500"));
        }

        @Test
        @DisplayName("Empty vector is reported as unavailable")
        void emptyVector() {
            responseBody = "{\"embedding\":[]}";
            assertThrows(EmbeddingUnavailableException.class, () -> provider().embed("go"));
        }

        @Test
        @DisplayName("Connection failure is reported as unavailable")
        void connectionFailure() throws IOException {
            OllamaEmbeddingProvider offline = provider(unusedAddress());
            assertThrows(EmbeddingUnavailableException.class, () -> offline.embed("go"));
        }
    }

    @Nested
    @DisplayName("Availability")
    class Availability {

        @Test
        @DisplayName("Available when the tags endpoint answers")
        void available() {
            assertTrue(provider().isAvailable());
        }

        @Test
        @DisplayName("Unavailable when nothing listens")
        void unavailable() throws IOException {
            assertFalse(provider(unusedAddress()).isAvailable());
        }
    }

    private static String unusedAddress() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return "http://127.0.0.1:" + socket.getLocalPort();
        }
    }

    @Test
    @DisplayName("Provider name includes model")
    void providerName() {
        assertEquals("Ollama/all-minilm", provider().getProviderName());
        assertEquals("Ollama/all-minilm", OllamaEmbeddingProvider.builder().build().getProviderName());
    }
}
