package com.phillippitts.arithmeticapi.presentation.exception;

import com.phillippitts.arithmeticapi.exception.ArithmeticApiException;
import com.phillippitts.arithmeticapi.exception.InvalidOperandException;
import com.phillippitts.arithmeticapi.exception.NonFiniteResultException;
import com.phillippitts.arithmeticapi.presentation.dto.ApiError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to {@code {"error": "..."}} bodies. Business errors are always 400.
 * Framework routing errors keep their own status; anything else is logged and answered with 500
 * without exposing internal details.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred";

    /**
     * Client error - missing operand, invalid operand, division by zero (HTTP 400).
     */
    @ExceptionHandler(ArithmeticApiException.class)
    ResponseEntity<ApiError> handleArithmeticFailure(ArithmeticApiException ex) {
        if (ex instanceof InvalidOperandException invalid && invalid.getField() != null) {
            LOG.warn("Rejected arithmetic request: reason={}, field={}", ex.getFailureReason(), invalid.getField());
        } else if (ex instanceof NonFiniteResultException nonFinite) {
            LOG.warn("Rejected arithmetic request: reason={}, operation={}",
                    ex.getFailureReason(), nonFinite.getOperation().getName());
        } else {
            LOG.warn("Rejected arithmetic request: reason={}", ex.getFailureReason());
        }
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getMessage()));
    }

    /**
     * Catch-all. Spring MVC exceptions (unknown route, unsupported method) keep their status code;
     * everything else is unexpected (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.debug("Request rejected by framework: status={}, exception={}",
                    status.value(), ex.getClass().getSimpleName());
            return ResponseEntity
                .status(status)
                .headers(errorResponse.getHeaders())
                .body(new ApiError(reasonPhrase(status)));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(UNEXPECTED_ERROR_MESSAGE));
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : "Request failed";
    }
}
