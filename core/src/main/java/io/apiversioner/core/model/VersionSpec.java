package io.apiversioner.core.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * One registered (path template, method, version) endpoint and the handler that serves it.
 *
 * @param pathTemplate unversioned path template, e.g. {@code /users/{id}}
 * @param method       HTTP method, normalized to upper case
 * @param version      the endpoint version
 * @param handlerRef   opaque identifier the adapter maps to a handler
 * @param deprecation  lifecycle metadata, or {@code null} when not deprecated
 */
public record VersionSpec(
        String pathTemplate, String method, Version version, String handlerRef, DeprecationInfo deprecation) {

    /** Orders specs of one route by ascending version. */
    public static final Comparator<VersionSpec> BY_VERSION = Comparator.comparing(VersionSpec::version);

    public VersionSpec {
        Objects.requireNonNull(pathTemplate, "pathTemplate must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(handlerRef, "handlerRef must not be null");
        method = method.toUpperCase(Locale.ROOT);
    }

    public boolean isDeprecated() {
        return deprecation != null;
    }
}
