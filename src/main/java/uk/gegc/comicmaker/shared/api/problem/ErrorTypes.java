package uk.gegc.comicmaker.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs.
 * Each constant points to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://comicmaker.app/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");
    public static final URI PROJECT_NOT_FOUND = URI.create(BASE_URL + "/project-not-found");
    public static final URI ASSET_MISSING = URI.create(BASE_URL + "/asset-missing");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI INVALID_PROJECT_STATUS = URI.create(BASE_URL + "/invalid-project-status");
    public static final URI SCENE_PANEL_RULE = URI.create(BASE_URL + "/scene-panel-rule");
    public static final URI CONTENT_BLOCKED = URI.create(BASE_URL + "/content-blocked");
    public static final URI INVALID_PLAN = URI.create(BASE_URL + "/invalid-plan");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");
    public static final URI INVALID_WEBHOOK_SIGNATURE = URI.create(BASE_URL + "/invalid-webhook-signature");

    // ==================== Plan Errors ====================
    public static final URI PLAN_LIMIT_EXCEEDED = URI.create(BASE_URL + "/plan-limit-exceeded");
    public static final URI QUOTA_EXCEEDED = URI.create(BASE_URL + "/quota-exceeded");
    public static final URI PAYMENT_NOT_SUCCESSFUL = URI.create(BASE_URL + "/payment-not-successful");

    // ==================== State Errors ====================
    public static final URI TASK_ALREADY_RUNNING = URI.create(BASE_URL + "/task-already-running");
    public static final URI PDF_ALREADY_EXISTS = URI.create(BASE_URL + "/pdf-already-exists");
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    // ==================== Processing Errors ====================
    public static final URI STORY_PARSE_FAILED = URI.create(BASE_URL + "/story-parse-failed");

    // ==================== Upstream Errors ====================
    public static final URI LLM_PROVIDER_ERROR = URI.create(BASE_URL + "/llm-provider-error");
    public static final URI IMAGE_PROVIDER_ERROR = URI.create(BASE_URL + "/image-provider-error");
    public static final URI PAYMENT_GATEWAY_ERROR = URI.create(BASE_URL + "/payment-gateway-error");
    public static final URI STORAGE_ERROR = URI.create(BASE_URL + "/storage-error");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");
    public static final URI GENERIC_ERROR = URI.create(BASE_URL + "/error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
