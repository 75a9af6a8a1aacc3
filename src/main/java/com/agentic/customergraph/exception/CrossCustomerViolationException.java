package com.agentic.customergraph.exception;

/**
 * Raised when data belonging to one customer shows up while another customer
 * is being processed. Always fatal for the batch.
 */
public class CrossCustomerViolationException extends CustomerGraphException {

    private final String foreignCustomerId;

    public CrossCustomerViolationException(String customerId, String extractionId, String foreignCustomerId) {
        super("Record for customer " + foreignCustomerId + " encountered while processing customer " + customerId,
            customerId, extractionId, PipelineStage.UPLOAD, WriteOutcome.NOTHING_WRITTEN, false, null);
        this.foreignCustomerId = foreignCustomerId;
    }

    public String getForeignCustomerId() {
        return foreignCustomerId;
    }
}
