/**
 * Service layer for arithmetic requests.
 *
 * <p>{@link com.phillippitts.arithmeticapi.service.ArithmeticService} coordinates validation
 * ({@code service.validation}), computation and instrumentation ({@code service.metrics}).
 * It has no dependency on the presentation layer.
 *
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.service;
