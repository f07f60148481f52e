package uk.gegc.accounting.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://accounting.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI USER_NOT_FOUND = URI.create(BASE_URL + "/user-not-found");
    public static final URI SESSION_NOT_FOUND = URI.create(BASE_URL + "/session-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_AMOUNT = URI.create(BASE_URL + "/invalid-amount");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Credit Errors ====================
    public static final URI INSUFFICIENT_CREDITS = URI.create(BASE_URL + "/insufficient-credits");
    public static final URI INSUFFICIENT_CREDITS_FOR_SESSION = URI.create(BASE_URL + "/insufficient-credits-for-session");

    // ==================== Conflict Errors ====================
    public static final URI SESSION_ALREADY_SETTLED = URI.create(BASE_URL + "/session-already-settled");
    public static final URI SESSION_ALREADY_EXISTS = URI.create(BASE_URL + "/session-already-exists");
    public static final URI USER_ALREADY_EXISTS = URI.create(BASE_URL + "/user-already-exists");
    public static final URI CONCURRENCY_CONFLICT = URI.create(BASE_URL + "/concurrency-conflict");
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Server Errors ====================
    public static final URI STORAGE_ERROR = URI.create(BASE_URL + "/storage-error");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
