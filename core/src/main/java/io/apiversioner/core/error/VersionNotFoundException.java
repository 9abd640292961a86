package io.apiversioner.core.error;

import io.apiversioner.core.model.Version;

/**
 * Thrown by exact lookups when the route exists but not in the requested version. URN:
 * {@code urn:api-versioner:error:version-not-found}
 */
public final class VersionNotFoundException extends VersionRequestException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:version-not-found";

    private final String method;
    private final transient Version version;

    public VersionNotFoundException(String path, String method, Version version) {
        super("Route " + method + " " + path + " has no version " + version, path);
        this.method = method;
        this.version = version;
    }

    public String method() {
        return method;
    }

    public Version version() {
        return version;
    }

    @Override
    public String urn() {
        return URN;
    }
}
