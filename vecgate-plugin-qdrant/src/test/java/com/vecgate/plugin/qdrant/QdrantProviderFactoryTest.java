package com.vecgate.plugin.qdrant;

import com.vecgate.config.EnvironmentLookup;
import com.vecgate.plugin.EmbeddingPlugin;
import com.vecgate.plugin.VectorStoreProvider;
import com.vecgate.plugin.VectorStoreProviderRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QdrantProviderFactoryTest {

    private static final EmbeddingPlugin EMBEDDINGS = (model, inputs, config) -> List.of(new double[]{1.0});

    @Test
    void create_defaultsToRawMerge() {
        VectorStoreProvider provider = new QdrantProviderFactory(EnvironmentLookup.NONE).create(EMBEDDINGS);

        QdrantVectorStoreProvider qdrant = assertInstanceOf(QdrantVectorStoreProvider.class, provider);
        assertEquals(SearchParamsMerge.RAW, qdrant.getSearchParamsMerge());
        assertEquals("qdrant", provider.getProviderName());
    }

    @Test
    void create_readsMergeModeFromEnvironment() {
        EnvironmentLookup env = EnvironmentLookup.of(Map.of("QDRANT_SEARCH_PARAMS_MERGE", "allow-listed"));

        QdrantVectorStoreProvider qdrant = (QdrantVectorStoreProvider) new QdrantProviderFactory(env).create(EMBEDDINGS);

        assertEquals(SearchParamsMerge.ALLOW_LISTED, qdrant.getSearchParamsMerge());
    }

    @Test
    void create_rejectsUnknownMergeMode() {
        EnvironmentLookup env = EnvironmentLookup.of(Map.of("QDRANT_SEARCH_PARAMS_MERGE", "sometimes"));

        assertThrows(IllegalArgumentException.class, () -> new QdrantProviderFactory(env).create(EMBEDDINGS));
    }

    @Test
    void loadInstalled_discoversQdrantViaServiceLoader() {
        VectorStoreProviderRegistry registry = VectorStoreProviderRegistry.loadInstalled(EMBEDDINGS);

        assertTrue(registry.getProviderNames().contains("qdrant"));
        assertInstanceOf(QdrantVectorStoreProvider.class, registry.require("Qdrant"));
    }
}
