package com.agentic.customergraph.exception;

/**
 * Failure reading or writing the Extraction Store. I/O problems are retryable;
 * attempts to overwrite an existing snapshot are not.
 */
public class ExtractionStoreException extends CustomerGraphException {

    public ExtractionStoreException(String message, String customerId, String extractionId, boolean retryable,
            Throwable cause) {
        super(message, customerId, extractionId, PipelineStage.STORE, WriteOutcome.NOTHING_WRITTEN, retryable, cause);
    }

    public ExtractionStoreException(String message, String customerId, String extractionId, boolean retryable) {
        this(message, customerId, extractionId, retryable, null);
    }
}
