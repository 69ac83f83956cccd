package uk.gegc.aegis.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Partner integrations branch on these values, so existing entries must never change.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://aegis.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI ANSWER_VALIDATION_FAILED = URI.create(BASE_URL + "/answer-validation-failed");
    public static final URI INVALID_TENANT_ID = URI.create(BASE_URL + "/invalid-tenant-id");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");

    // ==================== Configuration Errors ====================
    public static final URI RULESET_CONFIGURATION = URI.create(BASE_URL + "/ruleset-configuration");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== State Errors ====================
    public static final URI SESSION_ALREADY_COMPLETED = URI.create(BASE_URL + "/session-already-completed");
    public static final URI NOT_ELIGIBLE = URI.create(BASE_URL + "/not-eligible");
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    // ==================== Resource Exhaustion ====================
    public static final URI CODE_GENERATION_EXHAUSTED = URI.create(BASE_URL + "/code-generation-exhausted");
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");

    // ==================== System Errors ====================
    public static final URI INTERNAL_ERROR = URI.create(BASE_URL + "/internal-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
