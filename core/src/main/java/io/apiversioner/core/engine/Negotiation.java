package io.apiversioner.core.engine;

import io.apiversioner.core.model.Version;
import java.util.Objects;

/**
 * Result of {@link VersionNegotiator#negotiate}.
 *
 * @param version    the version to serve; always one of the available versions
 * @param exact      the requested version itself was available
 * @param viaDefault the configured default was used after the matrix yielded nothing
 */
public record Negotiation(Version version, boolean exact, boolean viaDefault) {

    public Negotiation {
        Objects.requireNonNull(version, "version must not be null");
    }
}
