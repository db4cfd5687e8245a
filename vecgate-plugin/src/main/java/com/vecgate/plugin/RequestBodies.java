package com.vecgate.plugin;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Explicit ordered merge for JSON request bodies: layers are applied left to right and
 * later keys overwrite earlier ones. Key order of first insertion is preserved.
 */
public final class RequestBodies {

    private RequestBodies() {
    }

    /**
     * Merges the given layers into a fresh mutable map. Null layers are skipped; inputs are not modified.
     */
    @SafeVarargs
    public static Map<String, Object> merge(Map<String, ?>... layers) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (layers == null) return out;
        for (Map<String, ?> layer : layers) {
            if (layer != null) {
                out.putAll(layer);
            }
        }
        return out;
    }
}
