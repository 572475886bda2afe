package uk.gegc.docgen.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://docgen.gegc.uk/docs/errors";

    // ==================== Request Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI UNKNOWN_SECTION = URI.create(BASE_URL + "/unknown-section");
    public static final URI UNSUPPORTED_FORMAT = URI.create(BASE_URL + "/unsupported-format");

    // ==================== Artifact Errors ====================
    public static final URI ARTIFACT_NOT_FOUND = URI.create(BASE_URL + "/artifact-not-found");
    public static final URI ARTIFACT_STORAGE_FAILED = URI.create(BASE_URL + "/artifact-storage-failed");
    public static final URI EXPORT_FAILED = URI.create(BASE_URL + "/export-failed");

    // ==================== Upstream Errors ====================
    public static final URI UPSTREAM_RATE_LIMITED = URI.create(BASE_URL + "/upstream-rate-limited");
    public static final URI UPSTREAM_UNAUTHORIZED = URI.create(BASE_URL + "/upstream-unauthorized");
    public static final URI UPSTREAM_FORBIDDEN = URI.create(BASE_URL + "/upstream-forbidden");
    public static final URI UPSTREAM_SERVER_ERROR = URI.create(BASE_URL + "/upstream-server-error");
    public static final URI UPSTREAM_RESPONSE_UNPARSEABLE = URI.create(BASE_URL + "/upstream-response-unparseable");
    public static final URI UPSTREAM_UNAVAILABLE = URI.create(BASE_URL + "/upstream-unavailable");
    public static final URI UPSTREAM_ERROR = URI.create(BASE_URL + "/upstream-error");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
