package com.agentic.customergraph.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base type of every failure raised by the extraction and upload pipeline.
 * Carries the customer and extraction being processed and the failing stage.
 */
public class CustomerGraphException extends RuntimeException {

    private final String customerId;
    private final String extractionId;
    private final PipelineStage stage;
    private final WriteOutcome writeOutcome;
    private final boolean retryable;

    public CustomerGraphException(
            @NotNull String message,
            @Nullable String customerId,
            @Nullable String extractionId,
            @NotNull PipelineStage stage,
            @NotNull WriteOutcome writeOutcome,
            boolean retryable,
            @Nullable Throwable cause) {
        super(message, cause);
        this.customerId = customerId;
        this.extractionId = extractionId;
        this.stage = stage;
        this.writeOutcome = writeOutcome;
        this.retryable = retryable;
    }

    @Nullable
    public String getCustomerId() {
        return customerId;
    }

    @Nullable
    public String getExtractionId() {
        return extractionId;
    }

    @NotNull
    public PipelineStage getStage() {
        return stage;
    }

    @NotNull
    public WriteOutcome getWriteOutcome() {
        return writeOutcome;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
