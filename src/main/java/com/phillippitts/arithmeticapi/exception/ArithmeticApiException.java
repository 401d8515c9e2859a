package com.phillippitts.arithmeticapi.exception;

/**
 * Base exception for all arithmetic-api application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 *
 * <p>The message is client-facing: it is returned verbatim in the {@code error} field.
 */
public class ArithmeticApiException extends RuntimeException {

    public ArithmeticApiException(String message) {
        super(message);
    }

    public ArithmeticApiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable reason used as a metrics tag and in logs.
     */
    public String getFailureReason() {
        return "error";
    }
}
