/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so that a single
 * {@code @ControllerAdvice} can translate them into HTTP responses.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.arithmeticapi.exception.ArithmeticApiException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.arithmeticapi.exception.MissingOperandException} - Payload absent
 *       or missing {@code num1}/{@code num2}</li>
 *   <li>{@link com.phillippitts.arithmeticapi.exception.InvalidOperandException} - Operand present
 *       but not numeric under the active validation mode</li>
 *   <li>{@link com.phillippitts.arithmeticapi.exception.DivisionByZeroException} - Zero divisor on
 *       {@code /divide}</li>
 *   <li>{@link com.phillippitts.arithmeticapi.exception.NonFiniteResultException} - Computation
 *       overflowed to infinity or NaN</li>
 * </ul>
 *
 * <p>Every subclass reports a {@code failureReason} tag and maps to HTTP 400 via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.arithmeticapi.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.exception;
