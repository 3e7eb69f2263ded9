package tms.task_management_be.web;

import tms.task_management_be.calendar.InvalidDateException;
import tms.task_management_be.meeting.recurrence.AmbiguousRecurrenceException;
import tms.task_management_be.period.UnsupportedPeriodTypeException;
import tms.task_management_be.report.snapshot.PeriodNotClosedException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex, HttpServletRequest request) {
        return ex.toResponse(requestId(request));
    }

    @ExceptionHandler(InvalidDateException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidDate(InvalidDateException ex, HttpServletRequest request) {
        return ApiException.validation(ex.getMessage(), "invalid_date").toResponse(requestId(request));
    }

    @ExceptionHandler(UnsupportedPeriodTypeException.class)
    public ResponseEntity<ApiErrorResponse> handleUnsupportedPeriod(UnsupportedPeriodTypeException ex,
                                                                    HttpServletRequest request) {
        return ApiException.badRequest("UNSUPPORTED_PERIOD_TYPE", ex.getMessage(), "period_type")
                .toResponse(requestId(request));
    }

    @ExceptionHandler(AmbiguousRecurrenceException.class)
    public ResponseEntity<ApiErrorResponse> handleAmbiguousRecurrence(AmbiguousRecurrenceException ex,
                                                                      HttpServletRequest request) {
        return ApiException.badRequest("AMBIGUOUS_RECURRENCE", ex.getMessage(), "recurrence_bounds")
                .toResponse(requestId(request));
    }

    @ExceptionHandler(PeriodNotClosedException.class)
    public ResponseEntity<ApiErrorResponse> handlePeriodNotClosed(PeriodNotClosedException ex,
                                                                  HttpServletRequest request) {
        return ApiException.conflict(ex.getMessage(), "period_not_closed").toResponse(requestId(request));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                                  HttpServletRequest request) {
        ApiErrorResponse body = ApiErrorResponse.of(
                "BAD_REQUEST",
                ex.getMessage() != null ? ex.getMessage() : "Invalid input.",
                null,
                HttpStatus.BAD_REQUEST.value(),
                requestId(request));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiErrorResponse> handleBinding(Exception ex, HttpServletRequest request) {
        ApiErrorResponse body = ApiErrorResponse.of(
                "VALIDATION",
                "Invalid input. Check the request parameters.",
                ex.getMessage(),
                HttpStatus.BAD_REQUEST.value(),
                requestId(request));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), ex);
        ApiErrorResponse body = ApiErrorResponse.of(
                "UNKNOWN",
                "An unexpected error occurred. Try again or contact the administrator.",
                ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                requestId(request));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static String requestId(HttpServletRequest request) {
        return request.getHeader(REQUEST_ID_HEADER);
    }
}
