package com.vecgate.config;

/**
 * Thrown when a required input supplied by the caller or the environment is missing
 * (no API base, no embedding model, no collection name, unknown provider).
 * Always raised before any network call; callers should not retry.
 */
public final class VectorStoreConfigurationException extends IllegalArgumentException {

    public VectorStoreConfigurationException(String message) {
        super(message);
    }
}
