package com.vecgate.plugin;

import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

/**
 * Raw provider HTTP response handed to response parsers: status, headers and body text.
 */
public final class ProviderHttpResponse {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;

    public ProviderHttpResponse(int statusCode, Map<String, List<String>> headers, String body) {
        this.statusCode = statusCode;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.body = body != null ? body : "";
    }

    /** Response with no headers. */
    public static ProviderHttpResponse of(int statusCode, String body) {
        return new ProviderHttpResponse(statusCode, Map.of(), body);
    }

    public static ProviderHttpResponse from(HttpResponse<String> response) {
        return new ProviderHttpResponse(response.statusCode(), response.headers().map(), response.body());
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
