package com.vecgate.plugin;

import java.util.List;
import java.util.Map;

/**
 * Thrown when a provider returned a response the adapter could not interpret (bad JSON, unexpected
 * structure) or an unsuccessful status. Carries the status code and headers of the triggering response.
 */
public final class ProviderResponseException extends RuntimeException {

    private final int statusCode;
    private final Map<String, List<String>> headers;

    public ProviderResponseException(String message, int statusCode, Map<String, List<String>> headers) {
        this(message, statusCode, headers, null);
    }

    public ProviderResponseException(String message, int statusCode, Map<String, List<String>> headers,
                                     Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }
}
