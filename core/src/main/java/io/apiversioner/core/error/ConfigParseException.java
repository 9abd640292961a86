package io.apiversioner.core.error;

/** Thrown when a versioning config or route manifest has invalid syntax or fails schema validation. */
public final class ConfigParseException extends VersionStartupException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:config-parse-failed";

    public ConfigParseException(String message, String source) {
        super(message, source);
    }

    public ConfigParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }

    @Override
    public String urn() {
        return URN;
    }
}
