package io.apiversioner.core.model;

/** Where the requested version of a resolution came from. */
public enum ResolutionSource {
    /** Extracted from the request by a strategy. */
    STRATEGY,
    /** No strategy matched; the configured default version was used. */
    DEFAULT,
    /** No strategy matched and no default exists; the route's latest version was served. */
    UNSPECIFIED
}
