package io.apiversioner.core.strategy;

import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.StrategyKind;
import java.util.Optional;

/**
 * Extracts a raw version token from one facet of a request.
 *
 * <p>
 * Implementations are pure and thread-safe: the same request always yields the same token, and
 * absence is reported as {@link Optional#empty()} rather than an exception. Token validation is
 * the resolver's job.
 */
public interface VersionStrategy {

    /** Stable identifier used in logs, errors and the discovery document. */
    String name();

    StrategyKind kind();

    /** Evaluation order; lower values are evaluated first. */
    int priority();

    /**
     * Returns the raw version token carried by the request, if any. Surrounding whitespace is
     * already trimmed; a returned token is never blank.
     */
    Optional<String> extract(RequestView request);

    /**
     * Returns the path used for route lookup. Strategies that carry the version in the path strip
     * it here; all others return the path unchanged.
     */
    default String routePath(String path) {
        return path;
    }
}
