package com.vecgate.plugin;

import java.util.List;
import java.util.Map;

/**
 * Contract for the embedding capability: turns text into vectors for similarity search.
 * Providers call it with a single-element batch per search query.
 */
@FunctionalInterface
public interface EmbeddingPlugin {

    /**
     * Embeds the given inputs.
     *
     * @param model  embedding model id (e.g. "ollama/nomic-embed-text")
     * @param inputs texts to embed
     * @param config extra options (e.g. "api_base"); never null
     * @return one vector per input, in input order
     * @throws Exception on execution failure
     */
    List<double[]> embed(String model, List<String> inputs, Map<String, Object> config) throws Exception;
}
