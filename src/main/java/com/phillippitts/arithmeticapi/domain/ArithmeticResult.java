package com.phillippitts.arithmeticapi.domain;

import java.util.Objects;

/**
 * Outcome of a successful computation.
 *
 * @param operation the operation that produced the value
 * @param value     a {@link java.math.BigInteger} for exact integer results, otherwise a finite {@link Double}
 */
public record ArithmeticResult(Operation operation, Number value) {

    public ArithmeticResult {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
