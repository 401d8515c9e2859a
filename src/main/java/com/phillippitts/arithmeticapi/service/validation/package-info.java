/**
 * Request payload validation.
 *
 * <p>{@link com.phillippitts.arithmeticapi.service.validation.OperandParser} is the only place
 * that touches raw JSON. It produces a typed
 * {@link com.phillippitts.arithmeticapi.domain.ArithmeticRequest} or throws a
 * {@link com.phillippitts.arithmeticapi.exception.MissingOperandException} /
 * {@link com.phillippitts.arithmeticapi.exception.InvalidOperandException} whose message depends
 * on the configured {@link com.phillippitts.arithmeticapi.service.validation.ValidationMode}.
 *
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.service.validation;
