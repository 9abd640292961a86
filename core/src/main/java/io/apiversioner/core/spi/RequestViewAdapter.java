package io.apiversioner.core.spi;

import io.apiversioner.core.model.RequestView;
import java.util.Map;

/**
 * Bridges a framework-native request/response type and the engine's {@link RequestView}.
 *
 * <p>
 * Each host framework provides one implementation. Lifecycle management (building the engine,
 * registering routes, starting the server) stays with the adapter; this SPI covers only the
 * per-request conversions.
 *
 * <p>
 * Implementations MUST be thread-safe. A single instance is shared across request threads.
 *
 * @param <R> the native request/response type (e.g. a Javalin {@code Context})
 */
public interface RequestViewAdapter<R> {

    /**
     * Creates a read-only view of the native request: path without query string, upper-case
     * method, all header values, all query parameter values.
     */
    RequestView wrap(R nativeRequest);

    /**
     * Writes response headers (deprecation signalling, resolved version) to the native response.
     * Existing headers with the same name are replaced.
     */
    void applyHeaders(Map<String, String> headers, R nativeResponse);
}
