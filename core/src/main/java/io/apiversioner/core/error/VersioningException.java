package io.apiversioner.core.error;

/**
 * Abstract base for all api-versioner exceptions. Never thrown directly; use the concrete
 * subclasses under {@link VersionStartupException} or {@link VersionRequestException}.
 */
public abstract class VersioningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        STARTUP,
        REQUEST
    }

    private final Phase phase;

    protected VersioningException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected VersioningException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Stable URN identifying the error type, used as the problem {@code type}. */
    public abstract String urn();

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
