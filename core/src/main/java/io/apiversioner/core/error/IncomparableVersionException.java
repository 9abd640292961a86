package io.apiversioner.core.error;

import io.apiversioner.core.model.Version;

/**
 * Thrown when two versions of different formats are compared. URN:
 * {@code urn:api-versioner:error:incomparable-versions}
 */
public final class IncomparableVersionException extends VersionRequestException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:incomparable-versions";

    private final transient Version left;
    private final transient Version right;

    public IncomparableVersionException(Version left, Version right) {
        super(
                "Cannot compare " + left.format() + " version '" + left + "' with " + right.format()
                        + " version '" + right + "'",
                null);
        this.left = left;
        this.right = right;
    }

    public Version left() {
        return left;
    }

    public Version right() {
        return right;
    }

    @Override
    public String urn() {
        return URN;
    }
}
