package io.apiversioner.core.model;

import java.util.Objects;

/**
 * Response header names used for deprecation signalling. Defaults follow RFC 8594 (Sunset), the
 * Deprecation header draft, RFC 8288 (Link) and RFC 7234 (Warning).
 */
public record DeprecationHeaderNames(String deprecation, String sunset, String link, String warning) {

    public static final DeprecationHeaderNames DEFAULTS =
            new DeprecationHeaderNames("Deprecation", "Sunset", "Link", "Warning");

    public DeprecationHeaderNames {
        Objects.requireNonNull(deprecation, "deprecation header name must not be null");
        Objects.requireNonNull(sunset, "sunset header name must not be null");
        Objects.requireNonNull(link, "link header name must not be null");
        Objects.requireNonNull(warning, "warning header name must not be null");
    }
}
