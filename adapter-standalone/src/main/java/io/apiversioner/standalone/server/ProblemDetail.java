package io.apiversioner.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apiversioner.core.error.IncomparableVersionException;
import io.apiversioner.core.error.InvalidVersionException;
import io.apiversioner.core.error.MissingVersionException;
import io.apiversioner.core.error.RouteNotFoundException;
import io.apiversioner.core.error.UnsupportedVersionException;
import io.apiversioner.core.error.VersionNotFoundException;
import io.apiversioner.core.error.VersionRequestException;
import io.apiversioner.core.model.Version;

/**
 * Builds RFC 9457 Problem Details bodies for requests the gateway refuses.
 *
 * <pre>{@code
 * {
 *   "type": "urn:api-versioner:error:unsupported-version",
 *   "title": "Unsupported API Version",
 *   "status": 400,
 *   "detail": "API version 2.5 is not supported (available: [1.0, 2.0])",
 *   "instance": "/v1/users",
 *   "available_versions": ["1.0", "2.0"]
 * }
 * }</pre>
 *
 * Stateless and thread-safe.
 */
public final class ProblemDetail {

    /** Media type of every problem response. */
    public static final String CONTENT_TYPE = "application/problem+json";

    static final String URN_VERSION_SUNSET = "urn:api-versioner:error:version-sunset";
    static final String URN_BAD_REQUEST = "urn:api-versioner:error:bad-request";
    static final String URN_METHOD_NOT_ALLOWED = "urn:api-versioner:error:method-not-allowed";
    static final String URN_INTERNAL_ERROR = "urn:api-versioner:error:internal-error";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProblemDetail() {
        // utility class
    }

    /**
     * Maps a request-phase resolution failure: 400 for invalid, missing and unsupported versions,
     * 404 for unknown routes and versions, 500 for versions of mixed formats.
     */
    public static JsonNode fromResolutionError(VersionRequestException e, String instancePath) {
        ObjectNode node = build(e.urn(), titleOf(e), statusOf(e), e.detail(), instancePath);
        if (e instanceof UnsupportedVersionException unsupported) {
            ArrayNode available = node.putArray("available_versions");
            for (Version v : unsupported.available()) {
                available.add(v.toString());
            }
        }
        return node;
    }

    /** HTTP status for a resolution failure. */
    public static int statusOf(VersionRequestException e) {
        if (e instanceof InvalidVersionException
                || e instanceof MissingVersionException
                || e instanceof UnsupportedVersionException) {
            return 400;
        }
        if (e instanceof RouteNotFoundException || e instanceof VersionNotFoundException) {
            return 404;
        }
        if (e instanceof IncomparableVersionException) {
            return 500;
        }
        return 400;
    }

    /** Strict-sunset mode refused a version past its sunset date. */
    public static JsonNode versionSunset(Version version, String replacement, String instancePath) {
        String detail = "API version " + version + " has reached its sunset date and is no longer served";
        if (replacement != null) {
            detail += "; use " + replacement + " instead";
        }
        return build(URN_VERSION_SUNSET, "API Version Sunset", 410, detail, instancePath);
    }

    /** The request itself could not be read, independent of any version. */
    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    public static JsonNode methodNotAllowed(String detail, String instancePath) {
        return build(URN_METHOD_NOT_ALLOWED, "Method Not Allowed", 405, detail, instancePath);
    }

    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }

    private static String titleOf(VersionRequestException e) {
        if (e instanceof InvalidVersionException) return "Invalid API Version";
        if (e instanceof MissingVersionException) return "Missing API Version";
        if (e instanceof UnsupportedVersionException) return "Unsupported API Version";
        if (e instanceof RouteNotFoundException) return "Not Found";
        if (e instanceof VersionNotFoundException) return "API Version Not Found";
        if (e instanceof IncomparableVersionException) return "Incomparable API Versions";
        return "Bad Request";
    }
}
