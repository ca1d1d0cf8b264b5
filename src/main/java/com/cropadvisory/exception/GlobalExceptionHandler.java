package com.cropadvisory.exception;

import com.cropadvisory.config.RequestGuardFilter;
import com.cropadvisory.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.Violation> violations = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> new ApiError.Violation(fe.getField(), fe.getRejectedValue(), fe.getDefaultMessage()))
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED",
                     "One or more fields failed validation", request, violations);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.Violation> violations = ex.getConstraintViolations().stream()
            .map(v -> new ApiError.Violation(lastNode(v.getPropertyPath().toString()), v.getInvalidValue(), v.getMessage()))
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED",
                     "One or more parameters failed validation", request, violations);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
                     "Parameter '" + ex.getParameterName() + "' is required", request, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "TYPE_MISMATCH", msg, request, null);
    }

    @ExceptionHandler({JobNotFoundException.class, PerformanceNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            AdvisoryException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(DataUnavailableException.class)
    public ResponseEntity<ApiError> handleDataUnavailable(
            DataUnavailableException ex, HttpServletRequest request) {
        log.error("Required upstream data unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                     "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String errorCode, String message,
            HttpServletRequest request, List<ApiError.Violation> violations) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(RequestGuardFilter.requestId(request))
            .timestamp(Instant.now())
            .violations(violations)
            .build();

        return ResponseEntity.status(status).body(body);
    }

    // "performance.location" -> "location"
    private static String lastNode(String propertyPath) {
        int dot = propertyPath.lastIndexOf('.');
        return dot < 0 ? propertyPath : propertyPath.substring(dot + 1);
    }
}
