package io.apiversioner.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of evaluating a version's deprecation metadata at a point in time.
 *
 * @param status  lifecycle state
 * @param headers response headers to add, in emission order (empty for ACTIVE)
 */
public record DeprecationOutcome(DeprecationStatus status, Map<String, String> headers) {

    private static final DeprecationOutcome ACTIVE = new DeprecationOutcome(DeprecationStatus.ACTIVE, Map.of());

    public DeprecationOutcome {
        Objects.requireNonNull(status, "status must not be null");
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }

    /** The outcome for a version without deprecation metadata. */
    public static DeprecationOutcome active() {
        return ACTIVE;
    }

    public boolean isDeprecated() {
        return status != DeprecationStatus.ACTIVE;
    }

    public boolean isSunset() {
        return status == DeprecationStatus.SUNSET;
    }
}
