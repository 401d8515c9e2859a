package com.phillippitts.arithmeticapi.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Validates that the MDC request id set by MdcFilter reaches log events written while a request
 * is rejected.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LoggingFormatIntegrationTest {

    private static final String HANDLER_LOGGER =
            "com.phillippitts.arithmeticapi.presentation.exception.GlobalExceptionHandler";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(HANDLER_LOGGER);
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void shouldIncludeRequestIdInRejectionLog() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.add("X-Request-ID", "abc123");

        ResponseEntity<String> response = restTemplate.exchange(
                "http://127.0.0.1:" + port + "/divide",
                HttpMethod.POST,
                new HttpEntity<>("{\"num1\":10,\"num2\":0}", headers),
                String.class
        );

        assertThat(response.getStatusCode().is4xxClientError()).isTrue();

        await().atMost(3, SECONDS).until(() -> findRejection() != null);

        LogEvent event = findRejection();
        ReadOnlyStringMap contextData = event.getContextData();
        assertThat(contextData.<String>getValue("requestId")).isEqualTo("abc123");
        assertThat(contextData.<String>getValue("uri")).isEqualTo("/divide");
        assertThat(event.getMessage().getFormattedMessage()).contains("reason=division_by_zero");
        assertThat(event.getLoggerName()).isEqualTo(HANDLER_LOGGER);
    }

    @Test
    void shouldNameOperationWhenResultOverflows() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.add("X-Request-ID", "overflow-1");

        ResponseEntity<String> response = restTemplate.exchange(
                "http://127.0.0.1:" + port + "/multiply",
                HttpMethod.POST,
                new HttpEntity<>("{\"num1\":1e308,\"num2\":10}", headers),
                String.class
        );

        assertThat(response.getStatusCode().is4xxClientError()).isTrue();

        await().atMost(3, SECONDS).until(() -> findRejection("reason=non_finite_result") != null);

        LogEvent event = findRejection("reason=non_finite_result");
        assertThat(event.getContextData().<String>getValue("requestId")).isEqualTo("overflow-1");
        assertThat(event.getMessage().getFormattedMessage()).contains("operation=multiply");
    }

    private LogEvent findRejection() {
        return findRejection("Rejected arithmetic request");
    }

    private LogEvent findRejection(String fragment) {
        return appender.getEvents().stream()
                .filter(e -> e.getMessage() != null
                        && String.valueOf(e.getMessage().getFormattedMessage()).contains("Rejected arithmetic request")
                        && String.valueOf(e.getMessage().getFormattedMessage()).contains(fragment))
                .findFirst()
                .orElse(null);
    }

    /**
     * Simple in-memory Log4j2 appender that captures LogEvents for assertions.
     */
    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return Collections.unmodifiableList(events);
        }
    }
}
