package io.apiversioner.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Framework-neutral, read-only view of an inbound HTTP request. Adapters produce instances by
 * wrapping their native request type; the engine never touches framework types.
 *
 * @param path    the request path without query string, e.g. {@code /api/v2/users/42}
 * @param method  the HTTP method, normalized to upper case
 * @param headers case-insensitive header multimap
 * @param query   query parameter multimap
 */
public record RequestView(String path, String method, RequestHeaders headers, QueryParameters query) {

    public RequestView {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(method, "method must not be null");
        method = method.toUpperCase(Locale.ROOT);
        headers = headers != null ? headers : RequestHeaders.empty();
        query = query != null ? query : QueryParameters.empty();
    }

    /** Convenience constructor for requests without headers or query. */
    public RequestView(String path, String method) {
        this(path, method, RequestHeaders.empty(), QueryParameters.empty());
    }

    /** The raw {@code Accept} header, or {@code null}. */
    public String accept() {
        return headers.first("accept");
    }
}
