package io.surfworks.sentinel.license;

import java.util.Map;

/**
 * Snapshot of what the licensing service says this activation is entitled to.
 *
 * @param features custom license fields (feature name to value)
 */
public record Entitlements(Map<String, String> features) {

    public Entitlements {
        features = features == null ? Map.of() : Map.copyOf(features);
    }

    public static Entitlements none() {
        return new Entitlements(Map.of());
    }
}
