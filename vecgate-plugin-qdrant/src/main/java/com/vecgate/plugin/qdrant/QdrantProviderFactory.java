package com.vecgate.plugin.qdrant;

import com.vecgate.config.EnvironmentLookup;
import com.vecgate.plugin.EmbeddingPlugin;
import com.vecgate.plugin.VectorStoreProvider;
import com.vecgate.plugin.VectorStoreProviderFactory;

import java.time.Clock;

/**
 * SPI factory for the Qdrant vector store provider. Reads QDRANT_SEARCH_PARAMS_MERGE from env
 * (RAW by default). Always enabled; QDRANT_API_BASE is resolved per call.
 */
public final class QdrantProviderFactory implements VectorStoreProviderFactory {

    static final String ENV_SEARCH_PARAMS_MERGE = "QDRANT_SEARCH_PARAMS_MERGE";

    private final EnvironmentLookup env;

    public QdrantProviderFactory() {
        this(EnvironmentLookup.system());
    }

    QdrantProviderFactory(EnvironmentLookup env) {
        this.env = env;
    }

    @Override
    public String getProviderName() {
        return QdrantVectorStoreProvider.PROVIDER_NAME;
    }

    @Override
    public VectorStoreProvider create(EmbeddingPlugin embeddings) {
        SearchParamsMerge merge = SearchParamsMerge.parse(
                env.getNonBlank(ENV_SEARCH_PARAMS_MERGE), SearchParamsMerge.RAW);
        return new QdrantVectorStoreProvider(embeddings, merge, Clock.systemUTC());
    }
}
