package io.apiversioner.core.engine;

import io.apiversioner.core.model.ResolutionSource;
import io.apiversioner.core.model.Version;
import java.util.Objects;

/**
 * Output of {@link StrategyResolver}: which version the client asked for and where it came from.
 *
 * @param version      the requested version, {@code null} when UNSPECIFIED
 * @param source       STRATEGY, DEFAULT or UNSPECIFIED
 * @param strategyName strategy that produced the token, {@code null} unless STRATEGY
 * @param rawToken     the extracted token before parsing, {@code null} unless STRATEGY
 */
public record RequestedVersion(Version version, ResolutionSource source, String strategyName, String rawToken) {

    public RequestedVersion {
        Objects.requireNonNull(source, "source must not be null");
        if (source == ResolutionSource.UNSPECIFIED && version != null) {
            throw new IllegalArgumentException("UNSPECIFIED request cannot carry a version");
        }
        if (source != ResolutionSource.UNSPECIFIED && version == null) {
            throw new IllegalArgumentException(source + " request must carry a version");
        }
    }

    static RequestedVersion extracted(Version version, String strategyName, String rawToken) {
        return new RequestedVersion(version, ResolutionSource.STRATEGY, strategyName, rawToken);
    }

    static RequestedVersion defaulted(Version version) {
        return new RequestedVersion(version, ResolutionSource.DEFAULT, null, null);
    }

    static RequestedVersion unspecified() {
        return new RequestedVersion(null, ResolutionSource.UNSPECIFIED, null, null);
    }

    public boolean isSpecified() {
        return version != null;
    }
}
