package com.agentic.customergraph.exception;

public class EmptyGraphException extends CustomerGraphException {

    public EmptyGraphException(String customerId, String extractionId) {
        super("Graph for extraction " + extractionId + " has no entities",
            customerId, extractionId, PipelineStage.ASSEMBLY, WriteOutcome.NOTHING_WRITTEN, false, null);
    }
}
