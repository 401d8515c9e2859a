/**
 * Request/response objects for the HTTP API contract.
 *
 * <p>A response is either an {@link com.phillippitts.arithmeticapi.presentation.dto.ArithmeticResponse}
 * (HTTP 200) or an {@link com.phillippitts.arithmeticapi.presentation.dto.ApiError} (HTTP 4xx/5xx),
 * never both.
 *
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.presentation.dto;
