package io.apiversioner.standalone.config;

/**
 * Thrown when the gateway configuration cannot be loaded: missing file, invalid YAML, an invalid
 * {@code versioning} or {@code routes} block, or an unusable environment override.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
