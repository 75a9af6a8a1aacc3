package com.agentic.customergraph.exception;

public class SnapshotNotFoundException extends CustomerGraphException {

    public SnapshotNotFoundException(String customerId, String extractionId) {
        super("No snapshot " + extractionId + " for customer " + customerId,
            customerId, extractionId, PipelineStage.STORE, WriteOutcome.NOTHING_WRITTEN, false, null);
    }
}
