package com.vecgate.config;

import java.util.Map;

/**
 * Source of named environment values (API keys, base URLs). Production code uses
 * {@link #system()}; tests pass a map via {@link #of(Map)}.
 */
@FunctionalInterface
public interface EnvironmentLookup {

    /** Lookup that always returns null. */
    EnvironmentLookup NONE = name -> null;

    /**
     * Returns the value for the given name, or null if unset.
     *
     * @param name variable name (e.g. QDRANT_API_BASE)
     */
    String get(String name);

    /**
     * Returns the value for the given name trimmed, or null if unset or blank.
     */
    default String getNonBlank(String name) {
        String v = get(name);
        if (v == null || v.isBlank()) return null;
        return v.trim();
    }

    /** Process environment ({@link System#getenv(String)}). */
    static EnvironmentLookup system() {
        return System::getenv;
    }

    /** Fixed lookup backed by a copy of the given map. */
    static EnvironmentLookup of(Map<String, String> values) {
        if (values == null || values.isEmpty()) return NONE;
        Map<String, String> copy = Map.copyOf(values);
        return copy::get;
    }
}
