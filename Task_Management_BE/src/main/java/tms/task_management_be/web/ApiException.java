package tms.task_management_be.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Service-level failure carrying the error code and HTTP status the API reports.
 * {@code details} is a short machine-readable key such as {@code "meeting"} or {@code "occurrence_count_invalid"}.
 */
public class ApiException extends RuntimeException {
    private final String code;
    private final HttpStatus status;
    private final String details;

    private ApiException(String code, String message, String details, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
        this.details = details;
    }

    public static ApiException validation(String message, String details) {
        return new ApiException("VALIDATION", message, details, HttpStatus.BAD_REQUEST);
    }

    /** Bad request with a code more specific than {@code VALIDATION}. */
    public static ApiException badRequest(String code, String message, String details) {
        return new ApiException(code, message, details, HttpStatus.BAD_REQUEST);
    }

    public static ApiException conflict(String message, String details) {
        return new ApiException("CONFLICT", message, details, HttpStatus.CONFLICT);
    }

    public static ApiException notFound(String message, String details) {
        return new ApiException("NOT_FOUND", message, details, HttpStatus.NOT_FOUND);
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDetails() {
        return details;
    }

    public ResponseEntity<ApiErrorResponse> toResponse(String requestId) {
        return ResponseEntity.status(status)
                .body(ApiErrorResponse.of(code, getMessage(), details, status.value(), requestId));
    }
}
