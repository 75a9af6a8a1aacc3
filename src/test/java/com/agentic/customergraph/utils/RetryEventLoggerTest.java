package com.agentic.customergraph.utils;

import com.agentic.customergraph.exception.GraphDatabaseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryEventLoggerTest {

    private final RetryEventLogger retryLogger = new RetryEventLogger();

    @Test
    @DisplayName("Leaves no retry keys in the MDC")
    void clearsMdc() {
        GraphDatabaseException failure = new GraphDatabaseException("database is locked", "acme", true);

        retryLogger.logRetryAttempt("upload acme/e1", 2, 5, failure);
        retryLogger.logRetryExhausted("upload acme/e1", 5, failure);
        retryLogger.logRetrySuccess("upload acme/e1", 3);

        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_OPERATION));
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_ATTEMPT));
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_EXCEPTION));
    }

    @Test
    @DisplayName("Describes failures sanitized and truncated")
    void describe() {
        assertEquals("no message", RetryEventLogger.describe(null));
        assertEquals("no message", RetryEventLogger.describe(new RuntimeException()));
        assertEquals("token=[REDACTED] rejected", RetryEventLogger.describe(new RuntimeException("token=abc rejected")));

        String described = RetryEventLogger.describe(new RuntimeException("y".repeat(300)));
        assertEquals(RetryEventLogger.MAX_MESSAGE_LENGTH + 3, described.length());
        assertTrue(described.endsWith("..."));
    }
}
