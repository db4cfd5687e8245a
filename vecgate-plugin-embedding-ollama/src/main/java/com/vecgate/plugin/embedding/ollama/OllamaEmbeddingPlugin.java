package com.vecgate.plugin.embedding.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vecgate.config.EnvironmentLookup;
import com.vecgate.plugin.EmbeddingPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Embedding capability that calls Ollama /api/embed. Model ids may carry an {@code ollama/} prefix
 * (e.g. "ollama/nomic-embed-text"), which is stripped before the call.
 * Config: "api_base" overrides the base URL for one call.
 */
public final class OllamaEmbeddingPlugin implements EmbeddingPlugin {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingPlugin.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String ENV_BASE_URL = "OLLAMA_BASE_URL";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String MODEL_PREFIX = "ollama/";
    private static final String CONFIG_API_BASE = "api_base";

    private final String baseUrl;
    private final HttpClient httpClient;

    public OllamaEmbeddingPlugin(String baseUrl, HttpClient httpClient) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public OllamaEmbeddingPlugin(String baseUrl) {
        this(baseUrl, null);
    }

    public OllamaEmbeddingPlugin() {
        this(DEFAULT_BASE_URL);
    }

    /** Reads OLLAMA_BASE_URL from the given environment (default http://localhost:11434). */
    public static OllamaEmbeddingPlugin fromEnvironment(EnvironmentLookup env) {
        return new OllamaEmbeddingPlugin(env.getNonBlank(ENV_BASE_URL));
    }

    @Override
    public List<double[]> embed(String model, List<String> inputs, Map<String, Object> config) throws Exception {
        if (inputs == null || inputs.isEmpty()) {
            return List.of();
        }
        String effectiveModel = Objects.requireNonNull(model, "model").trim();
        if (effectiveModel.startsWith(MODEL_PREFIX)) {
            effectiveModel = effectiveModel.substring(MODEL_PREFIX.length());
        }
        String effectiveBaseUrl = config != null && config.get(CONFIG_API_BASE) != null
                ? Objects.toString(config.get(CONFIG_API_BASE)).trim() : baseUrl;

        Map<String, Object> reqBody = new HashMap<>();
        reqBody.put("model", effectiveModel);
        reqBody.put("input", inputs.size() == 1 ? inputs.get(0) : inputs);
        String json = MAPPER.writeValueAsString(reqBody);

        URI uri = URI.create(effectiveBaseUrl + "/api/embed");
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(60))
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new IllegalStateException("Ollama embed API error: " + response.statusCode() + " " + response.body());
        }

        JsonNode root = MAPPER.readTree(response.body());
        List<double[]> embeddings = new ArrayList<>();
        JsonNode embNode = root.path("embeddings");
        if (embNode.isArray()) {
            for (JsonNode arr : embNode) {
                if (arr.isArray()) {
                    double[] vec = new double[arr.size()];
                    for (int i = 0; i < arr.size(); i++) vec[i] = arr.get(i).asDouble(0);
                    embeddings.add(vec);
                }
            }
        }
        log.debug("Ollama embedded {} input(s) with model={} dims={}", inputs.size(), effectiveModel,
                embeddings.isEmpty() ? 0 : embeddings.get(0).length);
        return embeddings;
    }
}
