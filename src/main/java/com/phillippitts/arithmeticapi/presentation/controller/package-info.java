/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.arithmeticapi.presentation.controller.WelcomeController}
 *       - {@code GET /}, plaintext list of routes</li>
 *   <li>{@link com.phillippitts.arithmeticapi.presentation.controller.ArithmeticController}
 *       - {@code POST /add}, {@code /subtract}, {@code /multiply}, {@code /divide}</li>
 * </ul>
 *
 * @see com.phillippitts.arithmeticapi.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.presentation.controller;
