package com.phillippitts.arithmeticapi.service.metrics;

import com.phillippitts.arithmeticapi.domain.Operation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for arithmetic operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Request handling latency per operation</li>
 *   <li>Success/failure counts per operation, failures tagged with a reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ArithmeticMetrics {

    private static final String METRIC_PREFIX = "arithmetic.operation";

    private final MeterRegistry registry;

    public ArithmeticMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one request took from parsing to result, successful or not.
     *
     * @param operation the routed operation
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(Operation operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to validate and compute an arithmetic request")
                .tag("operation", operation.getName())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(Operation operation) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful arithmetic requests")
                .tag("operation", operation.getName())
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for an operation.
     *
     * @param operation the routed operation
     * @param reason failure reason (missing_operand, invalid_operand, division_by_zero, ...)
     */
    public void incrementFailure(Operation operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of rejected arithmetic requests")
                .tag("operation", operation.getName())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
