package com.phillippitts.hybridfactor.presentation.exception;

import com.phillippitts.hybridfactor.exception.InvalidFactorizationRequestException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidFactorizationRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidFactorizationRequestException ex) {
        LOG.warn("Invalid request: field={}, reason={}", ex.getField(), ex.getReason());
        return badRequest(ex.getClass().getSimpleName(), "Invalid factorization request", ex.getMessage());
    }

    /**
     * Client error - required query parameter absent (HTTP 400).
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException ex) {
        LOG.warn("Missing request parameter: {}", ex.getParameterName());
        return badRequest("MissingParameter", "Invalid factorization request",
                "Parameter '" + ex.getParameterName() + "' is required");
    }

    /**
     * Client error - query parameter of the wrong type (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.warn("Malformed request parameter: {}", ex.getName());
        return badRequest("MalformedParameter", "Invalid factorization request",
                "Parameter '" + ex.getName() + "' is malformed");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please retry or contact support with the race id from the logs",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String code, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
