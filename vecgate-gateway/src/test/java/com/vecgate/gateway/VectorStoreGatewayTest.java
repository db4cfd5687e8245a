package com.vecgate.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.vecgate.config.EnvironmentLookup;
import com.vecgate.config.ProviderParams;
import com.vecgate.config.VectorStoreConfigurationException;
import com.vecgate.plugin.EmbeddingPlugin;
import com.vecgate.plugin.ProviderResponseException;
import com.vecgate.plugin.VectorStoreProviderRegistry;
import com.vecgate.plugin.model.CreateResponse;
import com.vecgate.plugin.model.SearchResponse;
import com.vecgate.plugin.qdrant.QdrantVectorStoreProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorStoreGatewayTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final EmbeddingPlugin EMBEDDINGS = (model, inputs, config) -> List.of(new double[]{0.5, 0.5});
    private static final ProviderParams PARAMS = ProviderParams.of(Map.of(
            ProviderParams.EMBEDDING_MODEL, "ollama/nomic-embed-text",
            ProviderParams.API_KEY, "secret"));

    private HttpServer server;
    private EnvironmentLookup env;
    private VectorStoreGateway gateway;
    /** "METHOD path" → captured request */
    private final Map<String, HttpExchangeCapture> captured = new ConcurrentHashMap<>();

    private static final class HttpExchangeCapture {
        final JsonNode body;
        final String apiKey;

        HttpExchangeCapture(JsonNode body, String apiKey) {
            this.body = body;
            this.apiKey = apiKey;
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/collections/docs/points/search", exchange -> respond(exchange, 200,
                "{\"result\":{\"points\":[{\"id\":7,\"payload\":{\"content\":\"vectors\",\"lang\":\"en\"},\"score\":0.91}]},\"status\":\"ok\"}"));
        server.createContext("/collections/docs", exchange -> respond(exchange, 200,
                "{\"result\":true,\"status\":\"ok\",\"time\":0.01}"));
        server.createContext("/collections/missing/points/search", exchange -> respond(exchange, 404,
                "{\"status\":{\"error\":\"Not found: Collection `missing` doesn't exist!\"}}"));
        server.start();

        env = EnvironmentLookup.of(Map.of("QDRANT_API_BASE", "http://127.0.0.1:" + server.getAddress().getPort() + "/"));
        VectorStoreProviderRegistry registry = new VectorStoreProviderRegistry();
        registry.register(new QdrantVectorStoreProvider(EMBEDDINGS));
        gateway = new VectorStoreGateway(registry, null, env);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        JsonNode requestBody = MAPPER.readTree(exchange.getRequestBody());
        captured.put(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath(),
                new HttpExchangeCapture(requestBody, exchange.getRequestHeaders().getFirst("api-key")));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void search_sendsEmbeddedQueryWithApiKeyAndParsesPoints() throws Exception {
        SearchResponse response = gateway.search("qdrant", "docs", List.of("what", "is", "qdrant"),
                Map.of("limit", 2, "with_payload", true), PARAMS);

        HttpExchangeCapture request = captured.get("POST /collections/docs/points/search");
        assertEquals("secret", request.apiKey);
        assertEquals(2, request.body.path("limit").asInt());
        assertEquals(2, request.body.path("vector").size());
        assertTrue(request.body.path("with_payload").asBoolean());

        assertEquals("what is qdrant", response.getSearchQuery());
        assertEquals(1, response.getData().size());
        assertEquals("vectors", response.getData().get(0).getContent().get(0).getText());
        assertEquals("7", response.getData().get(0).getFileId());
        assertEquals(Map.of("lang", "en"), response.getData().get(0).getAttributes());
    }

    @Test
    void search_dropsParamsQdrantDoesNotRecognize() throws Exception {
        gateway.search("qdrant", "docs", "hi",
                Map.of("limit", 2, "rewrite_query", true, "ranking_options", Map.of("ranker", "auto")), PARAMS);

        JsonNode body = captured.get("POST /collections/docs/points/search").body;
        assertEquals(2, body.path("limit").asInt());
        assertFalse(body.has("rewrite_query"));
        assertFalse(body.has("ranking_options"));
        assertTrue(body.has("vector"));
    }

    @Test
    void create_putsCollectionAndFillsName() throws Exception {
        CreateResponse response = gateway.create("qdrant",
                Map.of("name", "docs", "metadata", Map.of("vector_size", 384, "distance", "Euclid")), PARAMS);

        HttpExchangeCapture request = captured.get("PUT /collections/docs");
        assertEquals(384, request.body.path("vectors").path("size").asInt());
        assertEquals("Euclid", request.body.path("vectors").path("distance").asText());
        assertEquals("docs", response.getId());
        assertEquals("docs", response.getName());
        assertEquals("completed", response.getStatus());
    }

    @Test
    void search_failsWithProviderErrorOnHttpError() {
        ProviderResponseException e = assertThrows(ProviderResponseException.class,
                () -> gateway.search("qdrant", "missing", "hello", null, PARAMS));

        assertEquals(404, e.getStatusCode());
        assertTrue(e.getMessage().contains("doesn't exist"));
    }

    @Test
    void search_failsFastForUnknownProviderOrMissingBase() {
        assertThrows(VectorStoreConfigurationException.class,
                () -> gateway.search("weaviate", "docs", "hello", null, PARAMS));

        VectorStoreProviderRegistry registry = new VectorStoreProviderRegistry();
        registry.register(new QdrantVectorStoreProvider(EMBEDDINGS));
        VectorStoreGateway noBase = new VectorStoreGateway(registry, null, EnvironmentLookup.NONE);
        assertThrows(VectorStoreConfigurationException.class,
                () -> noBase.search("qdrant", "docs", "hello", null, PARAMS));
        assertTrue(captured.isEmpty());
    }
}
