package com.agentic.customergraph.utils;

import com.agentic.customergraph.exception.CustomerGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a failure seen during upload is transient and worth another attempt.
 *
 * <p>A {@link CustomerGraphException} answers through its {@code retryable}
 * flag, which the raising component derived from its own cause. Other
 * failures are checked, in order:</p>
 * <ul>
 *   <li>timeouts and I/O failures, always transient</li>
 *   <li>SQLite result codes: BUSY, LOCKED, IOERR and FULL are transient; CONSTRAINT is not</li>
 *   <li>error message patterns for connection, lock and network trouble</li>
 * </ul>
 * <p>The cause chain is walked until one of these gives an answer.</p>
 */
public final class TransientFailurePredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientFailurePredicate.class);

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_IOERR = 10;
    private static final int SQLITE_FULL = 13;

    private static final Set<Integer> TRANSIENT_SQLITE_CODES = Set.of(SQLITE_BUSY, SQLITE_LOCKED, SQLITE_IOERR, SQLITE_FULL);

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "connection\\s+(refused|reset|closed|timed\\s*out|lost|broken)" +
        "|unable\\s+to\\s+connect" +
        "|too\\s+many\\s+(connections|requests)" +
        "|network\\s+(is\\s+unreachable|error|timeout)" +
        "|socket\\s+(timeout|closed|reset)" +
        "|read\\s+timed\\s*out" +
        "|database\\s+(is\\s+locked|unavailable)" +
        "|sqlite_busy" +
        "|deadlock\\s+detected" +
        "|temporarily\\s+unavailable" +
        "|service\\s+unavailable" +
        "|try\\s+(again|later)" +
        ")"
    );

    @Override
    public boolean test(final Throwable throwable) {
        if (throwable == null) {
            return false;
        }

        if (throwable instanceof CustomerGraphException graphException) {
            return graphException.isRetryable();
        }

        if (throwable instanceof TimeoutException
                || throwable instanceof SQLTimeoutException
                || throwable instanceof SQLTransientException) {
            logger.debug("Transient failure by type: {}", throwable.getClass().getSimpleName());
            return true;
        }

        if (throwable instanceof IOException || throwable instanceof UncheckedIOException) {
            logger.debug("I/O failure treated as transient: {}", throwable.getMessage());
            return true;
        }

        if (throwable instanceof SQLException sqlException
                && TRANSIENT_SQLITE_CODES.contains(sqlException.getErrorCode())) {
            logger.debug("Transient SQLite result code {}: {}", sqlException.getErrorCode(), sqlException.getMessage());
            return true;
        }

        if (isTransientByMessage(throwable.getMessage())) {
            return true;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return test(cause);
        }
        return false;
    }

    private boolean isTransientByMessage(final String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        if (TRANSIENT_MESSAGE_PATTERN.matcher(message).find()) {
            logger.debug("Transient failure by message: {}",
                message.length() > 100 ? message.substring(0, 100) + "..." : message);
            return true;
        }
        return false;
    }
}
