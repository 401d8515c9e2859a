package com.phillippitts.arithmeticapi.service;

import com.phillippitts.arithmeticapi.config.properties.ArithmeticProperties;
import com.phillippitts.arithmeticapi.domain.ArithmeticRequest;
import com.phillippitts.arithmeticapi.domain.ArithmeticResult;
import com.phillippitts.arithmeticapi.domain.Operation;
import com.phillippitts.arithmeticapi.exception.ArithmeticApiException;
import com.phillippitts.arithmeticapi.exception.DivisionByZeroException;
import com.phillippitts.arithmeticapi.exception.InvalidOperandException;
import com.phillippitts.arithmeticapi.exception.NonFiniteResultException;
import com.phillippitts.arithmeticapi.service.metrics.ArithmeticMetrics;
import com.phillippitts.arithmeticapi.service.validation.OperandParser;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/**
 * Validates and computes one arithmetic request.
 *
 * <p>Single pass, no state: parse, validate, compute, return. Every failure surfaces as an
 * {@link ArithmeticApiException}; nothing is retried.
 */
@Service
public class ArithmeticService {

    /** Message for runtime faults raised while computing. */
    static final String COMPUTATION_FAILED_MESSAGE = "Invalid input type";

    private static final Logger LOG = LogManager.getLogger(ArithmeticService.class);

    private final OperandParser parser;
    private final ArithmeticMetrics metrics;
    private final ArithmeticProperties props;

    public ArithmeticService(OperandParser parser, ArithmeticMetrics metrics, ArithmeticProperties props) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.props = Objects.requireNonNull(props, "props");
    }

    @PostConstruct
    void logConfiguration() {
        LOG.info("Arithmetic service ready: validationMode={}, echoOperation={}",
                parser.getMode(), props.isEchoOperation());
    }

    /**
     * Parses the body and applies the operation selected by the route.
     *
     * @param operation routed operation
     * @param body raw request body, may be {@code null}
     * @return computed result
     * @throws ArithmeticApiException on any validation or computation failure
     */
    public ArithmeticResult calculate(Operation operation, String body) {
        long start = System.nanoTime();
        try {
            ArithmeticResult result = compute(operation, parser.parse(body));
            metrics.incrementSuccess(operation);
            return result;
        } catch (ArithmeticApiException e) {
            metrics.incrementFailure(operation, e.getFailureReason());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.nanoTime() - start);
        }
    }

    /**
     * Computes {@code num1 <op> num2}.
     *
     * <p>Exact integer arithmetic is used when both operands are integers and the operation has
     * an integer form; mixed operands use doubles. Division always yields a double, computed in
     * decimal when an operand is an integer so that operands beyond the double range still divide.
     * A zero divisor is rejected before dividing.
     *
     * @throws DivisionByZeroException if dividing by zero
     * @throws NonFiniteResultException if a double result overflows or is NaN
     * @throws InvalidOperandException if the computation itself fails
     */
    public ArithmeticResult compute(Operation operation, ArithmeticRequest request) {
        if (operation == Operation.DIVIDE && request.hasZeroDivisor()) {
            throw new DivisionByZeroException();
        }

        Number value;
        try {
            if (request.isIntegral() && operation.supportsExactArithmetic()) {
                value = operation.apply((BigInteger) request.num1(), (BigInteger) request.num2());
            } else if (operation == Operation.DIVIDE && hasIntegerOperand(request)) {
                value = divideDecimal(request);
            } else {
                value = computeFloating(operation, request);
            }
        } catch (ArithmeticException e) {
            throw new InvalidOperandException(COMPUTATION_FAILED_MESSAGE, e);
        }

        LOG.debug("Computed {}: result={}", operation.getName(), value);
        return new ArithmeticResult(operation, value);
    }

    private static double computeFloating(Operation operation, ArithmeticRequest request) {
        return requireFinite(operation,
                operation.apply(request.num1().doubleValue(), request.num2().doubleValue()));
    }

    private static double divideDecimal(ArithmeticRequest request) {
        BigDecimal quotient = toDecimal(request.num1()).divide(toDecimal(request.num2()), MathContext.DECIMAL128);
        return requireFinite(Operation.DIVIDE, quotient.doubleValue());
    }

    private static boolean hasIntegerOperand(ArithmeticRequest request) {
        return request.num1() instanceof BigInteger || request.num2() instanceof BigInteger;
    }

    private static BigDecimal toDecimal(Number value) {
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        return new BigDecimal(value.doubleValue());
    }

    private static double requireFinite(Operation operation, double result) {
        if (!Double.isFinite(result)) {
            throw new NonFiniteResultException(operation);
        }
        return result;
    }
}
