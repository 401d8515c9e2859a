/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Structured logging uses Log4j2. {@link com.phillippitts.arithmeticapi.config.logging.MdcFilter}
 * injects a {@code requestId} into the ThreadContext for every HTTP request so that all log lines
 * of one request can be correlated.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - X-Request-ID header value, or a generated UUID</li>
 *   <li>{@code method} - HTTP method</li>
 *   <li>{@code uri} - request URI, which names the operation for arithmetic routes</li>
 * </ul>
 *
 * <p>Log Format (see {@code log4j2-spring.xml}):
 * <pre>
 * 2025-10-17 15:42:32.529 [http-nio-5000-exec-1] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.arithmeticapi.config.logging;
