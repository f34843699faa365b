package uk.gegc.comicmaker.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authorization.AuthorizationDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.comicmaker.features.asset.domain.exception.AssetMissingException;
import uk.gegc.comicmaker.features.asset.domain.exception.BlobStorageException;
import uk.gegc.comicmaker.features.asset.domain.exception.DownloadNotAllowedException;
import uk.gegc.comicmaker.features.asset.domain.exception.PdfAlreadyExistsException;
import uk.gegc.comicmaker.features.billing.domain.exception.InvalidPlanRequestedException;
import uk.gegc.comicmaker.features.billing.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.comicmaker.features.billing.domain.exception.PaymentOrderCreateFailedException;
import uk.gegc.comicmaker.features.comic.domain.exception.ImageProviderException;
import uk.gegc.comicmaker.features.generation.domain.exception.TaskAlreadyRunningException;
import uk.gegc.comicmaker.features.plan.domain.exception.PaymentNotSuccessfulException;
import uk.gegc.comicmaker.features.plan.domain.exception.PlanLimitExceededException;
import uk.gegc.comicmaker.features.plan.domain.exception.QuotaExceededException;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectAccessDeniedException;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectInvalidStatusException;
import uk.gegc.comicmaker.features.project.domain.exception.ProjectNotFoundException;
import uk.gegc.comicmaker.features.project.domain.exception.ScenePanelRuleViolationException;
import uk.gegc.comicmaker.features.story.domain.exception.ContentBlockedException;
import uk.gegc.comicmaker.features.story.domain.exception.LlmProviderException;
import uk.gegc.comicmaker.features.story.domain.exception.StoryParseFailedException;
import uk.gegc.comicmaker.features.user.domain.exception.UserAlreadyExistsException;
import uk.gegc.comicmaker.shared.api.problem.ErrorTypes;
import uk.gegc.comicmaker.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.comicmaker.shared.exception.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ==================== 404 ====================

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleProjectNotFound(ProjectNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ErrorTypes.PROJECT_NOT_FOUND, "Project Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ErrorTypes.RESOURCE_NOT_FOUND, "Resource Not Found", ex.getMessage(), request);
    }

    // ==================== 400 ====================

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(ProjectInvalidStatusException.class)
    public ResponseEntity<ProblemDetail> handleInvalidStatus(ProjectInvalidStatusException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_PROJECT_STATUS,
                "Invalid Project Status",
                ex.getMessage(),
                request,
                Map.of("projectStatus", String.valueOf(ex.getStatus()))
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ScenePanelRuleViolationException.class)
    public ResponseEntity<ProblemDetail> handleScenePanelRule(ScenePanelRuleViolationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.SCENE_PANEL_RULE, "Scene Panel Rule Violation", ex.getMessage(), request);
    }

    @ExceptionHandler(ContentBlockedException.class)
    public ResponseEntity<ProblemDetail> handleContentBlocked(ContentBlockedException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.CONTENT_BLOCKED, "Content Blocked", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidPlanRequestedException.class)
    public ResponseEntity<ProblemDetail> handleInvalidPlan(InvalidPlanRequestedException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.INVALID_PLAN, "Invalid Plan Requested", ex.getMessage(), request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        List<ViolationDetail> violations = ex.getConstraintViolations()
                .stream()
                .map(v -> new ViolationDetail(v.getPropertyPath().toString(), v.getMessage()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.CONSTRAINT_VIOLATION,
                "Constraint Violation",
                "One or more constraints were violated",
                request
        );
        problem.setProperty("violations", violations);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".",
                request
        );
        problem.setProperty("parameter", param);
        problem.setProperty("expectedType", requiredType);
        return ResponseEntity.badRequest().body(problem);
    }

    // ==================== 401 / 403 ====================

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorized(UnauthorizedException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, ErrorTypes.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler({
            ProjectAccessDeniedException.class,
            DownloadNotAllowedException.class,
            AccessDeniedException.class,
            AuthorizationDeniedException.class
    })
    public ResponseEntity<ProblemDetail> handleAccessDenied(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED, "Access Denied", ex.getMessage(), request);
    }

    @ExceptionHandler(PlanLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handlePlanLimit(PlanLimitExceededException ex, HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, ErrorTypes.PLAN_LIMIT_EXCEEDED, "Plan Limit Exceeded", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidWebhookSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSignature(InvalidWebhookSignatureException ex, HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, ErrorTypes.INVALID_WEBHOOK_SIGNATURE, "Invalid Webhook Signature",
                "Webhook signature verification failed", request);
    }

    // ==================== 409 / 429 ====================

    @ExceptionHandler(TaskAlreadyRunningException.class)
    public ResponseEntity<ProblemDetail> handleTaskAlreadyRunning(TaskAlreadyRunningException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ErrorTypes.TASK_ALREADY_RUNNING, "Task Already Running", ex.getMessage(), request);
    }

    @ExceptionHandler(PdfAlreadyExistsException.class)
    public ResponseEntity<ProblemDetail> handlePdfAlreadyExists(PdfAlreadyExistsException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ErrorTypes.PDF_ALREADY_EXISTS, "PDF Already Exists", ex.getMessage(), request);
    }

    @ExceptionHandler(UserAlreadyExistsException.class)
    public ResponseEntity<ProblemDetail> handleUserAlreadyExists(UserAlreadyExistsException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ErrorTypes.DATA_CONFLICT, "Data Conflict", ex.getMessage(), request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        logger.error("Data integrity violation: {}", ex.getMostSpecificCause().getMessage(), ex);
        return respond(HttpStatus.CONFLICT, ErrorTypes.DATA_CONFLICT, "Data Conflict",
                "The request conflicts with existing data", request);
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ProblemDetail> handleQuotaExceeded(QuotaExceededException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.TOO_MANY_REQUESTS,
                ErrorTypes.QUOTA_EXCEEDED,
                "Quota Exceeded",
                ex.getMessage(),
                request,
                Map.of("used", ex.getUsed(), "quota", ex.getQuota())
        );
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(problem);
    }

    // ==================== 422 ====================

    @ExceptionHandler(StoryParseFailedException.class)
    public ResponseEntity<ProblemDetail> handleStoryParseFailed(StoryParseFailedException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorTypes.STORY_PARSE_FAILED, "Story Parse Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(AssetMissingException.class)
    public ResponseEntity<ProblemDetail> handleAssetMissing(AssetMissingException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorTypes.ASSET_MISSING, "Asset Missing", ex.getMessage(), request);
    }

    @ExceptionHandler(PaymentNotSuccessfulException.class)
    public ResponseEntity<ProblemDetail> handlePaymentNotSuccessful(PaymentNotSuccessfulException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorTypes.PAYMENT_NOT_SUCCESSFUL, "Payment Not Successful", ex.getMessage(), request);
    }

    // ==================== 502 ====================

    @ExceptionHandler(UpstreamServiceException.class)
    public ResponseEntity<ProblemDetail> handleUpstream(UpstreamServiceException ex, HttpServletRequest request) {
        logger.warn("Upstream failure ({}): {}", ex.getClass().getSimpleName(), ex.getMessage());
        URI type;
        String title;
        if (ex instanceof LlmProviderException) {
            type = ErrorTypes.LLM_PROVIDER_ERROR;
            title = "LLM Provider Error";
        } else if (ex instanceof ImageProviderException) {
            type = ErrorTypes.IMAGE_PROVIDER_ERROR;
            title = "Image Provider Error";
        } else if (ex instanceof PaymentOrderCreateFailedException) {
            type = ErrorTypes.PAYMENT_GATEWAY_ERROR;
            title = "Payment Gateway Error";
        } else if (ex instanceof BlobStorageException) {
            type = ErrorTypes.STORAGE_ERROR;
            title = "Storage Error";
        } else {
            type = ErrorTypes.GENERIC_ERROR;
            title = "Upstream Service Error";
        }
        return respond(HttpStatus.BAD_GATEWAY, type, title, ex.getMessage(), request);
    }

    // ==================== Framework ====================

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String reason = ex.getReason() != null ? ex.getReason() : ex.getMessage();

        URI errorType = switch (status) {
            case UNAUTHORIZED -> ErrorTypes.UNAUTHORIZED;
            case FORBIDDEN -> ErrorTypes.ACCESS_DENIED;
            case NOT_FOUND -> ErrorTypes.RESOURCE_NOT_FOUND;
            case CONFLICT -> ErrorTypes.DATA_CONFLICT;
            case BAD_REQUEST -> ErrorTypes.VALIDATION_FAILED;
            default -> ErrorTypes.GENERIC_ERROR;
        };
        return respond(status, errorType, status.getReasonPhrase(), reason, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                "Malformed JSON",
                "Request body is malformed or cannot be read",
                request
        );
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error", "An unexpected error occurred", request);
    }

    private ResponseEntity<ProblemDetail> respond(HttpStatus status, URI type, String title, String detail,
                                                  HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(status, type, title, detail, request);
        return ResponseEntity.status(status).body(problem);
    }

    private record ViolationDetail(String field, String message) {
    }

    private record FieldValidationError(String field, String message) {
    }
}
