package com.vecgate.plugin;

import java.util.List;
import java.util.Map;

/**
 * Builds the provider's standard error from a message and the triggering HTTP status and headers.
 * Used uniformly for response-parsing failures and non-success HTTP responses.
 */
@FunctionalInterface
public interface ProviderErrorFactory {

    /** Produces {@link ProviderResponseException}. */
    ProviderErrorFactory DEFAULT = ProviderResponseException::new;

    RuntimeException create(String message, int statusCode, Map<String, List<String>> headers);

    /**
     * Same as {@link #create(String, int, Map)} with {@code cause} attached when the built error has none.
     */
    default RuntimeException create(String message, int statusCode, Map<String, List<String>> headers,
                                    Throwable cause) {
        RuntimeException error = create(message, statusCode, headers);
        if (cause != null && error.getCause() == null) {
            error.initCause(cause);
        }
        return error;
    }
}
