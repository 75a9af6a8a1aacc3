package com.agentic.customergraph.exception;

import java.time.Duration;

public class UploadTimeoutException extends CustomerGraphException {

    private final String operation;
    private final Duration timeout;

    public UploadTimeoutException(String customerId, String extractionId, String operation, Duration timeout,
            WriteOutcome writeOutcome, Throwable cause) {
        super("Operation " + operation + " timed out after " + timeout.toMillis() + " ms",
            customerId, extractionId, PipelineStage.UPLOAD, writeOutcome, true, cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
