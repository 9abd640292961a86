package io.apiversioner.core.spi;

import io.apiversioner.core.model.DeprecationStatus;
import io.apiversioner.core.model.ResolutionSource;

/**
 * SPI for observability hooks on request resolution.
 *
 * <p>
 * Adapters provide implementations that bridge to metrics or audit systems. The core has no
 * telemetry dependency; this is a plain Java interface.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the engine and logged; they never
 * affect resolution.
 */
public interface VersioningListener {

    /** Called once per successfully resolved request. */
    void onVersionResolved(VersionResolvedEvent event);

    /** Called when the served version differs from the requested one (fallback or default). */
    void onVersionNegotiated(VersionNegotiatedEvent event);

    /** Called when a DEPRECATED or SUNSET version is selected, including strict-sunset rejections. */
    void onDeprecatedVersionServed(DeprecatedVersionServedEvent event);

    /** Called when resolution fails with a request-phase error. */
    void onResolutionFailed(ResolutionFailedEvent event);

    // --- Event records ---

    /** Versions are in canonical string form; {@code requestedVersion} is null when unspecified. */
    record VersionResolvedEvent(
            String requestPath,
            String method,
            String requestedVersion,
            String resolvedVersion,
            ResolutionSource source,
            String strategyName) {}

    record VersionNegotiatedEvent(
            String requestPath, String method, String requestedVersion, String resolvedVersion, boolean viaDefault) {}

    record DeprecatedVersionServedEvent(
            String requestPath, String method, String version, DeprecationStatus status, boolean rejected) {}

    /** {@code errorType} is the error URN. */
    record ResolutionFailedEvent(String requestPath, String method, String errorType, String errorDetail) {}
}
