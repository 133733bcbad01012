package com.fintech.marketdata.api;

import com.fintech.marketdata.ingestion.RunInProgressException;
import com.fintech.marketdata.loader.HistoryLoader;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps failures of the REST layer to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(HistoryLoader.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleLoaderValidation(HistoryLoader.ValidationException ex, WebRequest request) {
        String path = pathOf(request);
        log.warn("Loader validation error on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), "SERVICE_VALIDATION_ERROR", ex.getMessage(), path));
    }

    /**
     * Storage unavailable or circuit open. Details stay in the log.
     */
    @ExceptionHandler(HistoryLoader.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(HistoryLoader.ServiceException ex, WebRequest request) {
        String path = pathOf(request);
        log.error("Service exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(), "SERVICE_ERROR",
                "Stored history is temporarily unavailable.", path));
    }

    @ExceptionHandler(SeriesNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SeriesNotFoundException ex, WebRequest request) {
        String path = pathOf(request);
        log.debug("Not found on {}: {}", path, ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse(HttpStatus.NOT_FOUND.value(), "NOT_FOUND", ex.getMessage(), path));
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<ErrorResponse> handleRunInProgress(RunInProgressException ex, WebRequest request) {
        String path = pathOf(request);
        log.warn("Rejected on {}: {}", path, ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse(HttpStatus.CONFLICT.value(), "RUN_IN_PROGRESS", ex.getMessage(), path));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, WebRequest request) {
        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ValidationError(
                fieldName(violation),
                violation.getInvalidValue() != null ? violation.getInvalidValue().toString() : "null",
                violation.getMessage()))
            .collect(Collectors.toList());

        String path = pathOf(request);
        log.warn("Validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(), "VALIDATION_ERROR", "Request validation failed", path, validationErrors));
    }

    /**
     * Request body failed bean validation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBodyValidation(MethodArgumentNotValidException ex, WebRequest request) {
        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> new ErrorResponse.ValidationError(
                fieldError.getField(),
                String.valueOf(fieldError.getRejectedValue()),
                fieldError.getDefaultMessage()))
            .collect(Collectors.toList());

        String path = pathOf(request);
        log.warn("Body validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(), "VALIDATION_ERROR", "Request validation failed", path, validationErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        String path = pathOf(request);
        Throwable cause = ex.getMostSpecificCause();
        log.warn("Unreadable body on {}: {}", path, cause.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(), "MALFORMED_REQUEST", cause.getMessage(), path));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                WebRequest request) {
        String path = pathOf(request);
        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.ValidationError(ex.getParameterName(), null, "This parameter is required"))));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        log.warn("Type mismatch on {}: {} expected {} but got {}", path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getName(),
                ex.getValue() != null ? ex.getValue().toString() : "null",
                String.format("Expected type: %s", expectedType)))));
    }

    /**
     * Unknown timeframe, unknown category, bad range.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        String path = pathOf(request);
        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), "INVALID_ARGUMENT", ex.getMessage(), path));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        String path = pathOf(request);
        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "INTERNAL_ERROR",
            "An unexpected error occurred. Please contact support if this persists.",
            path));
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private static String fieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
