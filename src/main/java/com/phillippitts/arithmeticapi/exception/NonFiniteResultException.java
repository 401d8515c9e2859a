package com.phillippitts.arithmeticapi.exception;

import com.phillippitts.arithmeticapi.domain.Operation;

/**
 * Thrown when a floating-point computation overflows to infinity or yields NaN.
 * JSON has no representation for either value.
 */
public class NonFiniteResultException extends ArithmeticApiException {

    public static final String MESSAGE = "Result is not a finite number";

    private final Operation operation;

    public NonFiniteResultException(Operation operation) {
        super(MESSAGE);
        this.operation = operation;
    }

    public Operation getOperation() {
        return operation;
    }

    @Override
    public String getFailureReason() {
        return "non_finite_result";
    }
}
