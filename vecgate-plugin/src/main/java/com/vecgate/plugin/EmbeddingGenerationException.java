package com.vecgate.plugin;

/**
 * Thrown when the embedding capability fails to produce a vector for a search query.
 * The original failure is always attached as the cause.
 */
public final class EmbeddingGenerationException extends RuntimeException {

    public EmbeddingGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
