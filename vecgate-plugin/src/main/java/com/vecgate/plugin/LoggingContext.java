package com.vecgate.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-owned, mutable call details for one gateway call. Providers record what they sent
 * (e.g. the normalized query and embedding model) and read it back when building the response.
 * One instance per call; not shared across calls.
 */
public final class LoggingContext {

    /** Normalized query text sent for embedding. */
    public static final String INPUT = "input";

    /** Embedding model used for the query. */
    public static final String EMBEDDING_MODEL = "embedding_model";

    private final Map<String, Object> callDetails = new LinkedHashMap<>();

    public void put(String key, Object value) {
        callDetails.put(Objects.requireNonNull(key, "key"), value);
    }

    public Object get(String key) {
        return callDetails.get(key);
    }

    /** Returns the value as a string, or {@code defaultValue} if absent. */
    public String getString(String key, String defaultValue) {
        Object v = callDetails.get(key);
        return v != null ? Objects.toString(v) : defaultValue;
    }

    /** Read-only view of all recorded details. */
    public Map<String, Object> getCallDetails() {
        return Collections.unmodifiableMap(callDetails);
    }
}
