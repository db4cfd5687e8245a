package com.vecgate.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied parameters for one vector store provider call (credentials, endpoint,
 * embedding model). Keys follow the gateway's snake_case naming; unknown keys are retained
 * so providers can read their own extras via {@link #get(String)}.
 * Passed to {@code VectorStoreProvider} builders and to the gateway for auth/base resolution.
 */
public interface ProviderParams {

    /** Explicit API key; overrides the provider's environment fallback. */
    String API_KEY = "api_key";

    /** Explicit API base URL; overrides the provider's environment fallback. */
    String API_BASE = "api_base";

    /** Embedding model used to turn a search query into a vector (e.g. "ollama/nomic-embed-text"). */
    String EMBEDDING_MODEL = "embedding_model";

    /** Extra embedding options (Map) forwarded verbatim to the embedding capability. */
    String EMBEDDING_CONFIG = "embedding_config";

    /** Empty params (no explicit key, base or embedding model). */
    ProviderParams EMPTY = new ProviderParams() {
        @Override
        public Object get(String key) {
            return null;
        }
        @Override
        public Map<String, Object> getParamMap() {
            return Collections.emptyMap();
        }
    };

    /**
     * Gets a parameter by key.
     *
     * @param key parameter key
     * @return value or null if absent
     */
    Object get(String key);

    /**
     * Returns the full parameter map (read-only).
     *
     * @return unmodifiable map of parameter name to value
     */
    Map<String, Object> getParamMap();

    /** Explicit API key, or null when absent or blank. */
    default String getApiKey() {
        return nonBlank(get(API_KEY));
    }

    /** Explicit API base, or null when absent or blank. */
    default String getApiBase() {
        return nonBlank(get(API_BASE));
    }

    /** Embedding model, or null when absent or blank. */
    default String getEmbeddingModel() {
        return nonBlank(get(EMBEDDING_MODEL));
    }

    /**
     * Extra embedding options. Never null; a non-map value is treated as absent.
     */
    @SuppressWarnings("unchecked")
    default Map<String, Object> getEmbeddingConfig() {
        Object cfg = get(EMBEDDING_CONFIG);
        if (cfg instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) cfg);
        }
        return Collections.emptyMap();
    }

    /**
     * Creates params from a map.
     *
     * @param params parameter map (may be null; will be copied and made unmodifiable)
     * @return ProviderParams instance
     */
    static ProviderParams of(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        return new ProviderParams() {
            @Override
            public Object get(String key) {
                return copy.get(Objects.requireNonNull(key, "key"));
            }
            @Override
            public Map<String, Object> getParamMap() {
                return copy;
            }
        };
    }

    private static String nonBlank(Object value) {
        if (value == null) return null;
        String s = Objects.toString(value).trim();
        return s.isEmpty() ? null : s;
    }
}
