package com.phillippitts.arithmeticapi.exception;

/**
 * Thrown by the divide operation when the divisor is zero. Raised before any division is attempted.
 */
public class DivisionByZeroException extends ArithmeticApiException {

    public static final String MESSAGE = "Cannot divide by zero";

    public DivisionByZeroException() {
        super(MESSAGE);
    }

    @Override
    public String getFailureReason() {
        return "division_by_zero";
    }
}
