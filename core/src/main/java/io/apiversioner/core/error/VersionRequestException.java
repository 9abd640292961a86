package io.apiversioner.core.error;

/**
 * Abstract parent for per-request resolution errors. Carries the request path when known; errors
 * raised below the engine (for example by {@code Version.parse}) have a {@code null} path.
 */
public abstract class VersionRequestException extends VersioningException {

    private static final long serialVersionUID = 1L;

    private final String requestPath;

    protected VersionRequestException(String message, String requestPath) {
        super(message, Phase.REQUEST);
        this.requestPath = requestPath;
    }

    protected VersionRequestException(String message, Throwable cause, String requestPath) {
        super(message, cause, Phase.REQUEST);
        this.requestPath = requestPath;
    }

    /** The request path being resolved, or {@code null} if not known at the throw site. */
    public String requestPath() {
        return requestPath;
    }
}
