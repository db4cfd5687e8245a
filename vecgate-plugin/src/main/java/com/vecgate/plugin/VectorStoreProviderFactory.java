package com.vecgate.plugin;

/**
 * SPI for pluggable vector store providers. Implementations are discovered via
 * {@link java.util.ServiceLoader} (META-INF/services/com.vecgate.plugin.VectorStoreProviderFactory)
 * and registered in {@link VectorStoreProviderRegistry} under {@link #getProviderName()}.
 */
public interface VectorStoreProviderFactory {

    /** Provider discriminant (e.g. "qdrant"). Must match {@link VectorStoreProvider#getProviderName()}. */
    String getProviderName();

    /**
     * Creates the provider. Typically reads optional env settings in the factory.
     *
     * @param embeddings embedding capability used to vectorize search queries
     */
    VectorStoreProvider create(EmbeddingPlugin embeddings);

    /**
     * Whether this factory should be registered. Override to skip registration based on env.
     */
    default boolean isEnabled() {
        return true;
    }
}
