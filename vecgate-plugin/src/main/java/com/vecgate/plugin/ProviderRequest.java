package com.vecgate.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP request produced by a provider builder: method, absolute URL and JSON body.
 */
public final class ProviderRequest {

    private final String method;
    private final String url;
    private final Map<String, Object> body;

    public ProviderRequest(String method, String url, Map<String, Object> body) {
        this.method = Objects.requireNonNull(method, "method");
        this.url = Objects.requireNonNull(url, "url");
        this.body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : Collections.emptyMap();
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    /** Body as an ordered, read-only map (serialized as JSON by the transport). */
    public Map<String, Object> getBody() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
