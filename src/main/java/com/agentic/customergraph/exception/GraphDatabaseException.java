package com.agentic.customergraph.exception;

/**
 * Failure reported by a Graph Database backend. Whether it is retryable is
 * decided by the backend from the underlying cause.
 */
public class GraphDatabaseException extends CustomerGraphException {

    public GraphDatabaseException(String message, String customerId, boolean retryable, Throwable cause) {
        super(message, customerId, null, PipelineStage.UPLOAD, WriteOutcome.NOTHING_WRITTEN, retryable, cause);
    }

    public GraphDatabaseException(String message, String customerId, boolean retryable) {
        this(message, customerId, retryable, null);
    }
}
