package io.apiversioner.core.error;

/**
 * Abstract parent for startup-time configuration errors: config parsing, route registration and
 * policy validation. Carries a {@code source} identifying the file or resource that caused the
 * error, or {@code null} for programmatic registration.
 */
public abstract class VersionStartupException extends VersioningException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected VersionStartupException(String message, String source) {
        super(message, Phase.STARTUP);
        this.source = source;
    }

    protected VersionStartupException(String message, Throwable cause, String source) {
        super(message, cause, Phase.STARTUP);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
