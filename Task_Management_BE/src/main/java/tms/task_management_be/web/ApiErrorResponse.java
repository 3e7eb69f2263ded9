package tms.task_management_be.web;

/**
 * Error envelope returned by every endpoint: {@code {"error": {...}}}.
 */
public record ApiErrorResponse(ErrorBody error) {

    public record ErrorBody(String code, String message, String details, int httpStatus, String requestId) {
    }

    public static ApiErrorResponse of(String code, String message, String details, int httpStatus, String requestId) {
        return new ApiErrorResponse(new ErrorBody(code, message, details, httpStatus, requestId));
    }
}
