package com.phillippitts.arithmeticapi.exception;

/**
 * Thrown when the request payload is absent, is not a JSON object, or lacks {@code num1} or {@code num2}.
 */
public class MissingOperandException extends ArithmeticApiException {

    public MissingOperandException(String message) {
        super(message);
    }

    @Override
    public String getFailureReason() {
        return "missing_operand";
    }
}
