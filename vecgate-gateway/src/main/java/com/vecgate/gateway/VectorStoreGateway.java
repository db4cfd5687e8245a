package com.vecgate.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vecgate.config.EnvironmentLookup;
import com.vecgate.config.ProviderParams;
import com.vecgate.plugin.LoggingContext;
import com.vecgate.plugin.ProviderHttpResponse;
import com.vecgate.plugin.ProviderRequest;
import com.vecgate.plugin.VectorStoreProvider;
import com.vecgate.plugin.VectorStoreProviderRegistry;
import com.vecgate.plugin.model.CreateResponse;
import com.vecgate.plugin.model.SearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Runs uniform vector store calls against the provider selected by name: resolve base URL and auth,
 * build the provider request, send it over HTTP, parse the response. No retries; errors from the
 * provider's builders and parsers propagate unchanged.
 */
public final class VectorStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreGateway.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final VectorStoreProviderRegistry registry;
    private final HttpClient httpClient;
    private final EnvironmentLookup env;

    public VectorStoreGateway(VectorStoreProviderRegistry registry, HttpClient httpClient, EnvironmentLookup env) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.env = env != null ? env : EnvironmentLookup.system();
    }

    public VectorStoreGateway(VectorStoreProviderRegistry registry) {
        this(registry, null, EnvironmentLookup.system());
    }

    /**
     * Searches a vector store.
     *
     * @param providerName provider discriminant (e.g. "qdrant")
     * @param vectorStoreId vector store id (provider collection name)
     * @param query         String or List of fragments
     * @param searchParams  optional search parameters (may be null); keys the provider does not
     *                      recognize are dropped before the request is built
     * @param params        caller params (api key/base, embedding model)
     */
    public SearchResponse search(String providerName, String vectorStoreId, Object query,
                                 Map<String, Object> searchParams, ProviderParams params)
            throws IOException, InterruptedException {
        VectorStoreProvider provider = registry.require(providerName);
        ProviderParams p = params != null ? params : ProviderParams.EMPTY;
        String baseUrl = provider.resolveBaseUrl(p.getApiBase(), env);
        Map<String, String> headers = provider.resolveAuth(p.getApiKey(), env);

        Map<String, Object> accepted = provider.filterOptionalParams(searchParams);
        LoggingContext loggingContext = new LoggingContext();
        ProviderRequest request = provider.buildSearchRequest(vectorStoreId, query, accepted, baseUrl,
                loggingContext, p);
        ProviderHttpResponse response = send(provider, request, headers);
        return provider.parseSearchResponse(response, loggingContext);
    }

    /**
     * Creates a vector store. The returned acknowledgment carries the collection name as id and name.
     *
     * @param createParams "name" (required) and optional "metadata"
     */
    public CreateResponse create(String providerName, Map<String, Object> createParams, ProviderParams params)
            throws IOException, InterruptedException {
        VectorStoreProvider provider = registry.require(providerName);
        ProviderParams p = params != null ? params : ProviderParams.EMPTY;
        String baseUrl = provider.resolveBaseUrl(p.getApiBase(), env);
        Map<String, String> headers = provider.resolveAuth(p.getApiKey(), env);

        ProviderRequest request = provider.buildCreateRequest(createParams, baseUrl);
        ProviderHttpResponse response = send(provider, request, headers);
        CreateResponse created = provider.parseCreateResponse(response);
        String name = Objects.toString(createParams.get("name")).trim();
        return created.withIdAndName(name, name);
    }

    private ProviderHttpResponse send(VectorStoreProvider provider, ProviderRequest request,
                                      Map<String, String> headers) throws IOException, InterruptedException {
        String json = MAPPER.writeValueAsString(request.getBody());
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(request.getUrl()))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .method(request.getMethod(), HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        headers.forEach(builder::header);

        log.debug("{} request {}", provider.getProviderName(), request);
        HttpResponse<String> res = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        ProviderHttpResponse response = ProviderHttpResponse.from(res);
        if (!response.isSuccess()) {
            log.warn("{} request {} failed with status {}", provider.getProviderName(), request, response.getStatusCode());
            throw provider.getErrorFactory().create(provider.getProviderName() + " request failed: "
                    + response.getStatusCode() + " " + response.getBody(), response.getStatusCode(), response.getHeaders());
        }
        return response;
    }
}
