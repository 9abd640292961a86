package io.apiversioner.core.model;

import java.util.Objects;

/**
 * Outcome of resolving one request.
 *
 * @param spec             the endpoint version selected to serve the request
 * @param requestedVersion version asked for (or the default), {@code null} when UNSPECIFIED
 * @param source           where the requested version came from
 * @param strategyName     name of the strategy that supplied the token, nullable
 * @param negotiated       true when the served version differs from the requested one
 * @param deprecation      lifecycle evaluation of {@code spec}
 * @param rejected         true when strict-sunset mode refuses a sunset version
 */
public record ResolutionResult(
        VersionSpec spec,
        Version requestedVersion,
        ResolutionSource source,
        String strategyName,
        boolean negotiated,
        DeprecationOutcome deprecation,
        boolean rejected) {

    public ResolutionResult {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(deprecation, "deprecation must not be null");
    }

    /** Handler reference of the selected endpoint version. */
    public String handlerRef() {
        return spec.handlerRef();
    }

    /** The version actually served. */
    public Version resolvedVersion() {
        return spec.version();
    }
}
