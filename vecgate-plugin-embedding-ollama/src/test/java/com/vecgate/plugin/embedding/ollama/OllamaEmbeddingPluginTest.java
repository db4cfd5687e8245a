package com.vecgate.plugin.embedding.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.vecgate.config.EnvironmentLookup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaEmbeddingPluginTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<JsonNode> lastRequest = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"model\":\"nomic-embed-text\",\"embeddings\":[[0.25,-0.5,1.0]]}";

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/embed", exchange -> {
            lastRequest.set(MAPPER.readTree(exchange.getRequestBody()));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void embed_singleInputStripsModelPrefix() throws Exception {
        OllamaEmbeddingPlugin plugin = new OllamaEmbeddingPlugin(baseUrl);

        List<double[]> vectors = plugin.embed("ollama/nomic-embed-text", List.of("hello world"), Map.of());

        assertEquals(1, vectors.size());
        assertArrayEquals(new double[]{0.25, -0.5, 1.0}, vectors.get(0));
        assertEquals("nomic-embed-text", lastRequest.get().path("model").asText());
        assertEquals("hello world", lastRequest.get().path("input").asText());
    }

    @Test
    void embed_apiBaseConfigOverridesConstructorBase() throws Exception {
        OllamaEmbeddingPlugin plugin = new OllamaEmbeddingPlugin("http://127.0.0.1:1");

        List<double[]> vectors = plugin.embed("nomic-embed-text", List.of("a", "b"), Map.of("api_base", baseUrl));

        assertEquals(1, vectors.size());
        assertTrue(lastRequest.get().path("input").isArray());
        assertEquals(2, lastRequest.get().path("input").size());
    }

    @Test
    void embed_failsOnNonOkStatus() {
        status = 404;
        responseBody = "{\"error\":\"model \\\"missing\\\" not found\"}";
        OllamaEmbeddingPlugin plugin = new OllamaEmbeddingPlugin(baseUrl);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> plugin.embed("missing", List.of("x"), Map.of()));
        assertTrue(e.getMessage().startsWith("Ollama embed API error: 404"));
    }

    @Test
    void embed_emptyInputsSkipsCall() throws Exception {
        assertTrue(new OllamaEmbeddingPlugin(baseUrl).embed("m", List.of(), Map.of()).isEmpty());
        assertNull(lastRequest.get());
    }

    @Test
    void fromEnvironment_readsOllamaBaseUrl() throws Exception {
        OllamaEmbeddingPlugin plugin = OllamaEmbeddingPlugin.fromEnvironment(
                EnvironmentLookup.of(Map.of("OLLAMA_BASE_URL", baseUrl)));

        assertEquals(1, plugin.embed("nomic-embed-text", List.of("from env"), Map.of()).size());
        assertEquals("from env", lastRequest.get().path("input").asText());
    }
}
