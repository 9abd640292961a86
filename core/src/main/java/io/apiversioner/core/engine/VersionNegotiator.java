package io.apiversioner.core.engine;

import io.apiversioner.core.error.IncomparableVersionException;
import io.apiversioner.core.error.UnsupportedVersionException;
import io.apiversioner.core.model.Version;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Picks the version that serves a request among the versions registered for a route.
 *
 * <p>
 * Order: the exact requested version, then the first direct matrix fallback that is available,
 * then the configured default if available. Anything else is unsupported.
 *
 * <p>
 * Thread-safe and stateless after construction.
 */
public final class VersionNegotiator {

    private final CompatibilityMatrix matrix;
    private final Version defaultVersion;

    public VersionNegotiator(CompatibilityMatrix matrix, Version defaultVersion) {
        this.matrix = Objects.requireNonNull(matrix, "matrix must not be null");
        this.defaultVersion = defaultVersion;
    }

    /** Negotiates without a request path for error reporting. */
    public Negotiation negotiate(Version requested, Collection<Version> available) {
        return negotiate(requested, available, null);
    }

    /**
     * @param requested   the requested version
     * @param available   versions registered for the route, non-empty
     * @param requestPath included in the error when negotiation fails, nullable
     * @throws IllegalArgumentException     if {@code available} is empty
     * @throws IncomparableVersionException if {@code available} holds a version of another format
     * @throws UnsupportedVersionException  if no candidate is available
     */
    public Negotiation negotiate(Version requested, Collection<Version> available, String requestPath) {
        Objects.requireNonNull(requested, "requested must not be null");
        if (available == null || available.isEmpty()) {
            throw new IllegalArgumentException("available versions must not be empty");
        }
        for (Version v : available) {
            if (v.format() != requested.format()) {
                throw new IncomparableVersionException(requested, v);
            }
        }

        if (available.contains(requested)) {
            return new Negotiation(requested, true, false);
        }
        for (Version fallback : matrix.fallbacks(requested)) {
            if (available.contains(fallback)) {
                return new Negotiation(fallback, false, false);
            }
        }
        if (defaultVersion != null && available.contains(defaultVersion)) {
            return new Negotiation(defaultVersion, false, true);
        }
        List<Version> sorted = new ArrayList<>(available);
        sorted.sort(null);
        throw new UnsupportedVersionException(requested, sorted, requestPath);
    }

    public CompatibilityMatrix matrix() {
        return matrix;
    }
}
