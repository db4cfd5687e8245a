package com.vecgate.plugin.qdrant;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.vecgate.config.EnvironmentLookup;
import com.vecgate.config.ProviderParams;
import com.vecgate.config.VectorStoreConfigurationException;
import com.vecgate.plugin.EmbeddingGenerationException;
import com.vecgate.plugin.EmbeddingPlugin;
import com.vecgate.plugin.LoggingContext;
import com.vecgate.plugin.ProviderHttpResponse;
import com.vecgate.plugin.ProviderRequest;
import com.vecgate.plugin.RequestBodies;
import com.vecgate.plugin.VectorStoreEndpoints;
import com.vecgate.plugin.VectorStoreEndpoints.Endpoint;
import com.vecgate.plugin.VectorStoreProvider;
import com.vecgate.plugin.model.CreateResponse;
import com.vecgate.plugin.model.FileCounts;
import com.vecgate.plugin.model.ResultContent;
import com.vecgate.plugin.model.SearchResponse;
import com.vecgate.plugin.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Vector store provider for the Qdrant REST API. The vector store id is the Qdrant collection name.
 * Search queries are embedded through the configured {@link EmbeddingPlugin}, then sent to
 * {@code POST /collections/{name}/points/search}; collections are created with
 * {@code PUT /collections/{name}}.
 * <p>
 * Env: QDRANT_API_KEY (optional, sent as {@code api-key} header), QDRANT_API_BASE (required unless
 * {@code api_base} is passed, e.g. {@code https://xyz.cloud.qdrant.io:6333}).
 */
public final class QdrantVectorStoreProvider implements VectorStoreProvider {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreProvider.class);
    /** Rejects bodies with content after the first JSON value (e.g. an HTML error page appended). */
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    public static final String PROVIDER_NAME = "qdrant";

    static final String ENV_API_KEY = "QDRANT_API_KEY";
    static final String ENV_API_BASE = "QDRANT_API_BASE";
    static final String API_KEY_HEADER = "api-key";

    /** Search parameters Qdrant understands. */
    public static final Set<String> OPTIONAL_PARAMS = Set.of(
            "limit", "offset", "filter", "search_params", "with_payload", "with_vectors", "score_threshold");

    /** Payload keys checked, in order, for the result text; excluded from attributes. */
    private static final List<String> CONTENT_KEYS = List.of("text", "content", "document");

    private static final String LIMIT = "limit";
    private static final String VECTOR = "vector";
    private static final int DEFAULT_LIMIT = 10;
    private static final String NAME = "name";
    private static final String METADATA = "metadata";
    private static final String VECTOR_SIZE = "vector_size";
    private static final String DISTANCE = "distance";
    /** text-embedding-ada-002 dimension. */
    private static final int DEFAULT_VECTOR_SIZE = 1536;
    private static final String DEFAULT_DISTANCE = "Cosine";

    private static final VectorStoreEndpoints ENDPOINTS = new VectorStoreEndpoints(
            List.of(
                    new Endpoint("POST", "/collections/{collection_name}/points/search"),
                    new Endpoint("GET", "/collections/{collection_name}/points/{point_id}"),
                    new Endpoint("POST", "/collections/{collection_name}/points")),
            List.of(
                    new Endpoint("PUT", "/collections/{collection_name}/points"),
                    new Endpoint("POST", "/collections/{collection_name}/points/delete"),
                    new Endpoint("PUT", "/collections/{collection_name}")));

    private final EmbeddingPlugin embeddings;
    private final SearchParamsMerge searchParamsMerge;
    private final Clock clock;

    public QdrantVectorStoreProvider(EmbeddingPlugin embeddings, SearchParamsMerge searchParamsMerge, Clock clock) {
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
        this.searchParamsMerge = searchParamsMerge != null ? searchParamsMerge : SearchParamsMerge.RAW;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public QdrantVectorStoreProvider(EmbeddingPlugin embeddings) {
        this(embeddings, SearchParamsMerge.RAW, Clock.systemUTC());
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    public SearchParamsMerge getSearchParamsMerge() {
        return searchParamsMerge;
    }

    @Override
    public Map<String, String> resolveAuth(String explicitApiKey, EnvironmentLookup env) {
        String apiKey = explicitApiKey != null && !explicitApiKey.isBlank() ? explicitApiKey.trim() : null;
        if (apiKey == null && env != null) {
            apiKey = env.getNonBlank(ENV_API_KEY);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        if (apiKey != null) {
            headers.put(API_KEY_HEADER, apiKey);
        }
        return headers;
    }

    /**
     * Returns a copy of {@code headers} with the {@code api-key} header added when a key resolves
     * from {@code params} or the environment.
     */
    public Map<String, String> validateEnvironment(Map<String, String> headers, ProviderParams params,
                                                   EnvironmentLookup env) {
        Map<String, String> out = headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
        String explicit = params != null ? params.getApiKey() : null;
        out.putAll(resolveAuth(explicit, env));
        return out;
    }

    @Override
    public String resolveBaseUrl(String explicitBase, EnvironmentLookup env) {
        String base = explicitBase != null && !explicitBase.isBlank() ? explicitBase.trim() : null;
        if (base == null && env != null) {
            base = env.getNonBlank(ENV_API_BASE);
        }
        if (base == null) {
            throw new VectorStoreConfigurationException("Qdrant API base URL is required. Set "
                    + ENV_API_BASE + " environment variable or pass " + ProviderParams.API_BASE + " in provider params.");
        }
        return stripTrailingSlashes(base);
    }

    @Override
    public Map<String, Object> filterOptionalParams(Map<String, Object> candidateParams) {
        return mapOptionalParams(candidateParams, null);
    }

    /**
     * Copies allow-listed entries of {@code nonDefaultParams} into a copy of {@code optionalParams}.
     */
    public Map<String, Object> mapOptionalParams(Map<String, Object> nonDefaultParams, Map<String, Object> optionalParams) {
        Map<String, Object> out = optionalParams != null ? new LinkedHashMap<>(optionalParams) : new LinkedHashMap<>();
        if (nonDefaultParams == null) return out;
        for (Map.Entry<String, Object> e : nonDefaultParams.entrySet()) {
            if (OPTIONAL_PARAMS.contains(e.getKey())) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    @Override
    public ProviderRequest buildSearchRequest(String vectorStoreId, Object query, Map<String, Object> searchParams,
                                              String baseUrl, LoggingContext loggingContext, ProviderParams params) {
        String queryText = normalizeQuery(query);
        ProviderParams p = params != null ? params : ProviderParams.EMPTY;

        String embeddingModel = p.getEmbeddingModel();
        if (embeddingModel == null) {
            throw new VectorStoreConfigurationException(ProviderParams.EMBEDDING_MODEL
                    + " is required in provider params for Qdrant. Set an embedding model, e.g. params['"
                    + ProviderParams.EMBEDDING_MODEL + "'] = 'ollama/nomic-embed-text'.");
        }

        double[] queryVector = embedQuery(embeddingModel, queryText, p.getEmbeddingConfig());

        Map<String, Object> sp = searchParams != null ? searchParams : Map.of();
        Object limit = sp.get(LIMIT) != null ? sp.get(LIMIT) : DEFAULT_LIMIT;

        String url = baseUrl + "/collections/" + vectorStoreId + "/points/search";

        Map<String, Object> head = new LinkedHashMap<>();
        head.put(VECTOR, queryVector);
        head.put(LIMIT, limit);
        Map<String, Object> overlay = searchParamsMerge == SearchParamsMerge.ALLOW_LISTED ? filterOptionalParams(sp) : sp;
        Map<String, Object> body = RequestBodies.merge(head, overlay);

        if (loggingContext != null) {
            loggingContext.put(LoggingContext.INPUT, queryText);
            loggingContext.put(LoggingContext.EMBEDDING_MODEL, embeddingModel);
        }
        log.debug("Qdrant search request collection={} limit={} embeddingModel={} merge={}",
                vectorStoreId, body.get(LIMIT), embeddingModel, searchParamsMerge);
        return new ProviderRequest("POST", url, body);
    }

    private static String normalizeQuery(Object query) {
        if (query instanceof List) {
            List<String> parts = new ArrayList<>();
            for (Object o : (List<?>) query) {
                parts.add(Objects.toString(o, ""));
            }
            return String.join(" ", parts);
        }
        return Objects.toString(query, "");
    }

    private double[] embedQuery(String model, String queryText, Map<String, Object> config) {
        List<double[]> vectors;
        try {
            vectors = embeddings.embed(model, List.of(queryText), config);
        } catch (Exception e) {
            throw new EmbeddingGenerationException("Failed to generate embedding for query: " + e.getMessage(), e);
        }
        if (vectors == null || vectors.isEmpty() || vectors.get(0) == null) {
            throw new EmbeddingGenerationException("Failed to generate embedding for query: model "
                    + model + " returned no vector", null);
        }
        return vectors.get(0);
    }

    @Override
    public SearchResponse parseSearchResponse(ProviderHttpResponse response, LoggingContext loggingContext) {
        try {
            JsonNode root = readBody(response);
            if (!root.isObject()) {
                throw new IllegalStateException("response is not a JSON object");
            }
            JsonNode points = root.path("result").path("points");
            List<SearchResult> results = new ArrayList<>();
            if (!points.isMissingNode() && !points.isNull()) {
                if (!points.isArray()) {
                    throw new IllegalStateException("'result.points' is not an array");
                }
                for (JsonNode point : points) {
                    results.add(toSearchResult(point));
                }
            }
            String searchQuery = loggingContext != null ? loggingContext.getString(LoggingContext.INPUT, "") : "";
            log.debug("Qdrant search returned {} point(s)", results.size());
            return SearchResponse.page(searchQuery, results);
        } catch (Exception e) {
            throw getErrorFactory().create("Failed to parse Qdrant search response: " + e.getMessage(),
                    response.getStatusCode(), response.getHeaders(), e);
        }
    }

    private static SearchResult toSearchResult(JsonNode point) {
        if (!point.isObject()) {
            throw new IllegalStateException("Qdrant point is not an object: " + point);
        }
        JsonNode payload = point.path("payload");
        if (payload.isMissingNode() || payload.isNull()) {
            payload = MAPPER.createObjectNode();
        } else if (!payload.isObject()) {
            throw new IllegalStateException("Qdrant point payload is not an object: " + payload);
        }

        String text = "";
        for (String key : CONTENT_KEYS) {
            if (payload.has(key)) {
                text = asText(payload.get(key));
                break;
            }
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (!CONTENT_KEYS.contains(f.getKey())) {
                attributes.put(f.getKey(), MAPPER.convertValue(f.getValue(), Object.class));
            }
        }

        JsonNode scoreNode = point.path("score");
        double score = scoreNode.isNumber() ? scoreNode.asDouble() : 0.0;
        JsonNode idNode = point.path("id");
        String fileId = idNode.isMissingNode() || idNode.isNull() ? null : asText(idNode);

        return new SearchResult(score, List.of(ResultContent.text(text)), fileId, null, attributes);
    }

    private static String asText(JsonNode node) {
        if (node == null || node.isNull()) return "";
        return node.isValueNode() ? node.asText() : node.toString();
    }

    @Override
    public ProviderRequest buildCreateRequest(Map<String, Object> createParams, String baseUrl) {
        Object nameObj = createParams != null ? createParams.get(NAME) : null;
        String collectionName = nameObj != null ? Objects.toString(nameObj).trim() : "";
        if (collectionName.isEmpty()) {
            throw new VectorStoreConfigurationException("Collection name is required for Qdrant vector store creation");
        }

        String url = baseUrl + "/collections/" + collectionName;

        Map<String, Object> metadata = metadataOf(createParams);
        Map<String, Object> vectorParams = new LinkedHashMap<>();
        vectorParams.put("size", metadata.containsKey(VECTOR_SIZE) ? metadata.get(VECTOR_SIZE) : DEFAULT_VECTOR_SIZE);
        vectorParams.put(DISTANCE, metadata.containsKey(DISTANCE) ? metadata.get(DISTANCE) : DEFAULT_DISTANCE);

        Map<String, Object> extras = new LinkedHashMap<>(metadata);
        extras.remove(VECTOR_SIZE);
        extras.remove(DISTANCE);

        Map<String, Object> body = RequestBodies.merge(Map.of("vectors", vectorParams), extras);
        log.debug("Qdrant create collection request name={} vectors={}", collectionName, vectorParams);
        return new ProviderRequest("PUT", url, body);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> metadataOf(Map<String, Object> createParams) {
        Object m = createParams.get(METADATA);
        if (m instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) m);
        }
        return new LinkedHashMap<>();
    }

    @Override
    public CreateResponse parseCreateResponse(ProviderHttpResponse response) {
        try {
            readBody(response);
        } catch (Exception e) {
            throw getErrorFactory().create("Failed to parse Qdrant create response: " + e.getMessage(),
                    response.getStatusCode(), response.getHeaders(), e);
        }
        return CreateResponse.builder()
                .createdAt(clock.instant().getEpochSecond())
                .bytes(0)
                .fileCounts(FileCounts.ZERO)
                .status(CreateResponse.STATUS_COMPLETED)
                .metadata(Map.of())
                .build();
    }

    @Override
    public VectorStoreEndpoints getEndpoints() {
        return ENDPOINTS;
    }

    private static JsonNode readBody(ProviderHttpResponse response) throws Exception {
        JsonNode root = MAPPER.readTree(response.getBody());
        if (root == null || root.isMissingNode()) {
            throw new IllegalStateException("empty response body");
        }
        return root;
    }

    private static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') end--;
        return url.substring(0, end);
    }
}
