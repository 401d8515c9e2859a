/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP boundary of the application. Presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - routes for {@code /} and the four operations</li>
 *   <li>{@code presentation.dto} - success and error response bodies</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they pick the operation from the route, delegate to
 * {@link com.phillippitts.arithmeticapi.service.ArithmeticService} and let
 * {@code GlobalExceptionHandler} shape every failure.
 *
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.presentation;
