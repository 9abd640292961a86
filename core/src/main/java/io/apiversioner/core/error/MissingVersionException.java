package io.apiversioner.core.error;

import java.util.List;

/**
 * Thrown in strict mode when no strategy produced a version and no default is configured. URN:
 * {@code urn:api-versioner:error:missing-version}
 */
public final class MissingVersionException extends VersionRequestException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:api-versioner:error:missing-version";

    private final List<String> strategiesTried;

    public MissingVersionException(List<String> strategiesTried, String requestPath) {
        super("No API version specified (strategies tried: " + strategiesTried + ")", requestPath);
        this.strategiesTried = List.copyOf(strategiesTried);
    }

    /** Names of the strategies that were evaluated, in evaluation order. */
    public List<String> strategiesTried() {
        return strategiesTried;
    }

    @Override
    public String urn() {
        return URN;
    }
}
