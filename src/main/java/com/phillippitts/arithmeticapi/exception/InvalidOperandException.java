package com.phillippitts.arithmeticapi.exception;

/**
 * Thrown when an operand is present but cannot be used as a number under the active
 * validation mode, or when the computation itself fails.
 */
public class InvalidOperandException extends ArithmeticApiException {

    private final String field;

    public InvalidOperandException(String message, String field) {
        super(message);
        this.field = field;
    }

    public InvalidOperandException(String message, Throwable cause) {
        super(message, cause);
        this.field = null;
    }

    /**
     * Name of the offending operand, or {@code null} when the failure is not tied to one field.
     */
    public String getField() {
        return field;
    }

    @Override
    public String getFailureReason() {
        return "invalid_operand";
    }
}
