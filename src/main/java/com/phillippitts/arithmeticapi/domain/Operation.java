package com.phillippitts.arithmeticapi.domain;

import java.math.BigInteger;
import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;

/**
 * The four binary operations served by the API, one per POST route.
 *
 * <p>Each operation has a floating-point form. Addition, subtraction and multiplication also
 * have an exact integer form used when both operands are integers under strict validation.
 * Division is always carried out in floating point.
 */
public enum Operation {

    ADD("add", (a, b) -> a + b, BigInteger::add),
    SUBTRACT("subtract", (a, b) -> a - b, BigInteger::subtract),
    MULTIPLY("multiply", (a, b) -> a * b, BigInteger::multiply),
    DIVIDE("divide", (a, b) -> a / b, null);

    private final String routeName;
    private final DoubleBinaryOperator floating;
    private final BinaryOperator<BigInteger> exact;

    Operation(String routeName, DoubleBinaryOperator floating, BinaryOperator<BigInteger> exact) {
        this.routeName = routeName;
        this.floating = floating;
        this.exact = exact;
    }

    /** Lower-case name, echoed in success responses. */
    public String getName() {
        return routeName;
    }

    /** Route path, e.g. {@code /add}. */
    public String getPath() {
        return "/" + routeName;
    }

    public boolean supportsExactArithmetic() {
        return exact != null;
    }

    public double apply(double left, double right) {
        return floating.applyAsDouble(left, right);
    }

    /**
     * Applies the exact integer form.
     *
     * @throws UnsupportedOperationException for {@link #DIVIDE}
     */
    public BigInteger apply(BigInteger left, BigInteger right) {
        if (exact == null) {
            throw new UnsupportedOperationException(routeName + " has no exact integer form");
        }
        return exact.apply(left, right);
    }
}
