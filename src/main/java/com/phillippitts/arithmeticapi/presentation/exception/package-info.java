/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.arithmeticapi.exception.ArithmeticApiException} and subclasses → 400 Bad Request</li>
 *   <li>Spring MVC {@code ErrorResponse} exceptions (404, 405, ...) → their own status</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "error": "Cannot divide by zero"
 * }
 * </pre>
 *
 * <p>Stack traces and exception messages of unexpected faults are logged, never returned.
 *
 * @see com.phillippitts.arithmeticapi.exception
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.presentation.exception;
