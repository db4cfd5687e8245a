package com.vecgate.plugin;

import com.vecgate.config.EnvironmentLookup;
import com.vecgate.config.ProviderParams;
import com.vecgate.plugin.model.CreateResponse;
import com.vecgate.plugin.model.SearchResponse;

import java.util.Map;

/**
 * Contract for a vector store provider adapter: translates the gateway's uniform search/create calls
 * into the provider's REST dialect and maps the provider's responses back.
 * Implementations are stateless; every method is a pure transformation except
 * {@link #buildSearchRequest}, which invokes the embedding capability and writes to the caller's
 * {@link LoggingContext}.
 * <p>
 * Selected by {@link #getProviderName()} through {@link VectorStoreProviderRegistry}.
 */
public interface VectorStoreProvider {

    /** Provider discriminant (e.g. "qdrant"), lower case. */
    String getProviderName();

    /**
     * Resolves auth headers. Explicit key wins over the provider's environment variable.
     *
     * @param explicitApiKey key from caller params; may be null or blank
     * @param env            environment lookup
     * @return header map (empty when no key resolves; never null)
     */
    Map<String, String> resolveAuth(String explicitApiKey, EnvironmentLookup env);

    /**
     * Resolves the provider base URL without trailing slash.
     *
     * @throws com.vecgate.config.VectorStoreConfigurationException if no base URL resolves
     */
    String resolveBaseUrl(String explicitBase, EnvironmentLookup env);

    /**
     * Returns a fresh map with only the provider-recognized optional parameters.
     * The input map is not modified.
     */
    Map<String, Object> filterOptionalParams(Map<String, Object> candidateParams);

    /**
     * Builds the search request. {@code query} is a String or a List of fragments.
     *
     * @throws com.vecgate.config.VectorStoreConfigurationException if no embedding model is configured
     * @throws EmbeddingGenerationException                         if the query embedding fails
     */
    ProviderRequest buildSearchRequest(String vectorStoreId, Object query, Map<String, Object> searchParams,
                                       String baseUrl, LoggingContext loggingContext, ProviderParams params);

    /**
     * Maps the provider's search response to the uniform shape.
     *
     * @throws RuntimeException built by the provider's {@link ProviderErrorFactory} when the body cannot be read
     */
    SearchResponse parseSearchResponse(ProviderHttpResponse response, LoggingContext loggingContext);

    /**
     * Builds the create-collection request.
     *
     * @throws com.vecgate.config.VectorStoreConfigurationException if the collection name is missing
     */
    ProviderRequest buildCreateRequest(Map<String, Object> createParams, String baseUrl);

    /**
     * Validates the provider's create response and synthesizes the acknowledgment.
     */
    CreateResponse parseCreateResponse(ProviderHttpResponse response);

    /** Endpoint templates this provider exposes, grouped by read/write access. */
    VectorStoreEndpoints getEndpoints();

    /** Factory used for every response-parsing failure. */
    default ProviderErrorFactory getErrorFactory() {
        return ProviderErrorFactory.DEFAULT;
    }
}
