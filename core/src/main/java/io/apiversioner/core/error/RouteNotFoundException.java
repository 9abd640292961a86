package io.apiversioner.core.error;

/**
 * Thrown when no registered route template matches the request path and method. URN:
 * {@code urn:api-versioner:error:route-not-found}
 */
public final class RouteNotFoundException extends VersionRequestException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:route-not-found";

    private final String method;

    public RouteNotFoundException(String path, String method) {
        super("No route registered for " + method + " " + path, path);
        this.method = method;
    }

    public String method() {
        return method;
    }

    @Override
    public String urn() {
        return URN;
    }
}
