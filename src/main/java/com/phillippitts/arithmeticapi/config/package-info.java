/**
 * Application-wide configuration.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code arithmetic.*} properties loaded from
 *       {@code application.properties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filter)</li>
 * </ul>
 *
 * @see com.phillippitts.arithmeticapi.config.properties.ArithmeticProperties
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.config;
