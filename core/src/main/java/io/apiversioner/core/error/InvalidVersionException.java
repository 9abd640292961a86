package io.apiversioner.core.error;

import io.apiversioner.core.model.VersionFormat;

/**
 * Thrown when a version token does not match the grammar of the configured format. URN:
 * {@code urn:api-versioner:error:invalid-version}
 */
public final class InvalidVersionException extends VersionRequestException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:invalid-version";

    private final String token;
    private final VersionFormat format;
    private final String strategyName;

    public InvalidVersionException(String token, VersionFormat format) {
        this(token, format, null, null, null);
    }

    public InvalidVersionException(
            String token, VersionFormat format, String strategyName, String requestPath, Throwable cause) {
        super(buildMessage(token, format, strategyName), cause, requestPath);
        this.token = token;
        this.format = format;
        this.strategyName = strategyName;
    }

    private static String buildMessage(String token, VersionFormat format, String strategyName) {
        String base = "Invalid " + format.name().toLowerCase() + " version '" + token + "'";
        return strategyName != null ? base + " (extracted by strategy '" + strategyName + "')" : base;
    }

    /** The raw token that failed to parse. */
    public String token() {
        return token;
    }

    /** The format the token was parsed against. */
    public VersionFormat format() {
        return format;
    }

    /** Name of the strategy that produced the token, or {@code null}. */
    public String strategyName() {
        return strategyName;
    }

    @Override
    public String urn() {
        return URN;
    }
}
