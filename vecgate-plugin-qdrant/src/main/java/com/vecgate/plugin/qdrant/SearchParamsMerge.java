package com.vecgate.plugin.qdrant;

import java.util.Locale;

/**
 * Which search parameters are overlaid onto the Qdrant search body after {@code vector} and {@code limit}.
 */
public enum SearchParamsMerge {

    /** Every search parameter as given by the caller. */
    RAW,

    /** Only parameters in the Qdrant allow-list; other keys are dropped. */
    ALLOW_LISTED;

    /**
     * Parses a config value (case-insensitive, '-' accepted for '_'); null or blank yields {@code defaultValue}.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static SearchParamsMerge parse(String value, SearchParamsMerge defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown search params merge mode: " + value
                    + " (use RAW or ALLOW_LISTED)", e);
        }
    }
}
