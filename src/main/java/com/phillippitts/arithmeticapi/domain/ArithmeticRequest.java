package com.phillippitts.arithmeticapi.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Validated operands of a single arithmetic request.
 *
 * <p>Each operand is either a {@link BigInteger} (a JSON integer kept exact under strict
 * validation) or a finite {@link Double}. Instances are produced by
 * {@link com.phillippitts.arithmeticapi.service.validation.OperandParser}; the raw JSON payload
 * never reaches the computation.
 *
 * @param num1 left operand
 * @param num2 right operand
 */
public record ArithmeticRequest(Number num1, Number num2) {

    public ArithmeticRequest {
        requireSupported(num1, "num1");
        requireSupported(num2, "num2");
    }

    public static ArithmeticRequest of(double num1, double num2) {
        return new ArithmeticRequest(num1, num2);
    }

    public static ArithmeticRequest of(BigInteger num1, BigInteger num2) {
        return new ArithmeticRequest(num1, num2);
    }

    /** True when both operands are exact integers. */
    public boolean isIntegral() {
        return num1 instanceof BigInteger && num2 instanceof BigInteger;
    }

    /** True when the right operand is zero, including {@code -0.0}. */
    public boolean hasZeroDivisor() {
        if (num2 instanceof BigInteger big) {
            return big.signum() == 0;
        }
        return num2.doubleValue() == 0.0;
    }

    private static void requireSupported(Number value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value instanceof Double d) {
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException(field + " must be finite, got: " + d);
            }
        } else if (!(value instanceof BigInteger)) {
            throw new IllegalArgumentException(
                    field + " must be a BigInteger or Double, got: " + value.getClass().getSimpleName());
        }
    }
}
