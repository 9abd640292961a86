package io.apiversioner.core.error;

import io.apiversioner.core.model.Version;
import java.util.List;

/**
 * Thrown when the requested version is not registered for the route and neither the compatibility
 * matrix nor the default version yields an alternative. URN:
 * {@code urn:api-versioner:error:unsupported-version}
 */
public final class UnsupportedVersionException extends VersionRequestException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:unsupported-version";

    private final transient Version requested;
    private final transient List<Version> available;

    public UnsupportedVersionException(Version requested, List<Version> available, String requestPath) {
        super("API version " + requested + " is not supported (available: " + available + ")", requestPath);
        this.requested = requested;
        this.available = List.copyOf(available);
    }

    /** The version the client asked for. */
    public Version requested() {
        return requested;
    }

    /** Versions registered for the route, ascending. */
    public List<Version> available() {
        return available;
    }

    @Override
    public String urn() {
        return URN;
    }
}
