/**
 * Domain models for a single arithmetic request.
 *
 * <p>All types are immutable and validate themselves on construction:
 * <ul>
 *   <li>{@link com.phillippitts.arithmeticapi.domain.Operation} - the four routed operations</li>
 *   <li>{@link com.phillippitts.arithmeticapi.domain.ArithmeticRequest} - validated operand pair</li>
 *   <li>{@link com.phillippitts.arithmeticapi.domain.ArithmeticResult} - computed value</li>
 * </ul>
 *
 * <p>Nothing here outlives the request that created it.
 *
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.domain;
