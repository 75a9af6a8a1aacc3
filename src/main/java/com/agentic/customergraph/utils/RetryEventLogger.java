package com.agentic.customergraph.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging of upload retries.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>retry.operation</code> - the operation being retried</li>
 *   <li><code>retry.attempt</code> - attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - class of the failure that triggered the retry</li>
 * </ul>
 *
 * <pre>
 * INFO  [RetryEventLogger] Retry attempt 2/5 for upload acme/extraction_0001: GraphDatabaseException - database is locked
 * WARN  [RetryEventLogger] Retry exhausted for upload acme/extraction_0001 after 5 attempts: ...
 * </pre>
 */
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    static final String MDC_RETRY_OPERATION = "retry.operation";
    static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    static final String MDC_RETRY_EXCEPTION = "retry.exception";

    static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs that {@code operation} failed on {@code attempt} and is about to be retried.
     */
    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
            logger.info("Retry attempt {}/{} for {}: {} - {}",
                attempt, maxAttempts, operation, exceptionName, describe(failure));
        } finally {
            clearMDC();
        }
    }

    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                operation, totalAttempts, exceptionName, describe(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs a success; silent when the first attempt succeeded.
     */
    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            logger.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    static String describe(final Throwable failure) {
        if (failure == null || failure.getMessage() == null) {
            return "no message";
        }
        String message = SensitiveDataSanitizer.sanitize(failure.getMessage());
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
