package io.apiversioner.core.error;

/**
 * Thrown when a route cannot be registered: duplicate (path, method, version), an attribute set
 * twice, registration after the table was built, or a deprecation policy violation.
 */
public final class RouteRegistrationException extends VersionStartupException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:route-registration-failed";

    public RouteRegistrationException(String message) {
        super(message, null);
    }

    public RouteRegistrationException(String message, String source) {
        super(message, source);
    }

    @Override
    public String urn() {
        return URN;
    }
}
