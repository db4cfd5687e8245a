package com.vecgate.plugin;

import com.vecgate.config.VectorStoreConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of vector store providers by provider name (case-insensitive). The gateway resolves the
 * provider discriminant of each call here; providers are registered explicitly or discovered via
 * {@link VectorStoreProviderFactory} on the classpath.
 */
public final class VectorStoreProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreProviderRegistry.class);

    /** provider name (lower case) → provider */
    private final Map<String, VectorStoreProvider> providers = new ConcurrentHashMap<>();

    /**
     * Creates a registry with every enabled {@link VectorStoreProviderFactory} found by
     * {@link ServiceLoader} on the current classpath.
     *
     * @param embeddings embedding capability passed to each factory
     */
    public static VectorStoreProviderRegistry loadInstalled(EmbeddingPlugin embeddings) {
        VectorStoreProviderRegistry registry = new VectorStoreProviderRegistry();
        for (VectorStoreProviderFactory factory : ServiceLoader.load(VectorStoreProviderFactory.class)) {
            if (!factory.isEnabled()) {
                log.debug("Vector store provider {} disabled; skipping", factory.getProviderName());
                continue;
            }
            registry.register(factory.create(embeddings));
        }
        return registry;
    }

    /**
     * Registers a provider under its {@link VectorStoreProvider#getProviderName()}.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public void register(VectorStoreProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String name = normalize(provider.getProviderName());
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Provider name must be non-blank");
        }
        if (providers.putIfAbsent(name, provider) != null) {
            throw new IllegalArgumentException("Vector store provider already registered: " + name);
        }
        log.info("Registered vector store provider {}", name);
    }

    /**
     * Returns the provider for the given name, or null if not registered.
     */
    public VectorStoreProvider get(String providerName) {
        if (providerName == null || providerName.isBlank()) return null;
        return providers.get(normalize(providerName));
    }

    /**
     * Returns the provider for the given name.
     *
     * @throws VectorStoreConfigurationException if no provider is registered under that name
     */
    public VectorStoreProvider require(String providerName) {
        VectorStoreProvider provider = get(providerName);
        if (provider == null) {
            throw new VectorStoreConfigurationException("Unknown vector store provider: " + providerName
                    + " (registered: " + getProviderNames() + ")");
        }
        return provider;
    }

    /** Sorted names of all registered providers. */
    public Set<String> getProviderNames() {
        return Collections.unmodifiableSet(new TreeSet<>(providers.keySet()));
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
