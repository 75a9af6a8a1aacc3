package com.agentic.customergraph.exception;

/**
 * Raised when an upload stopped after some vertices or edges were written.
 * The counts reflect the writes that completed before the failure.
 */
public class PartialUploadFailureException extends CustomerGraphException {

    private final int nodesWritten;
    private final int edgesWritten;

    public PartialUploadFailureException(String customerId, String extractionId, int nodesWritten, int edgesWritten,
            Throwable cause) {
        super("Upload of " + extractionId + " failed after " + nodesWritten + " vertices and "
                + edgesWritten + " edges: " + (cause != null ? cause.getMessage() : "unknown error"),
            customerId, extractionId, PipelineStage.UPLOAD, WriteOutcome.PARTIAL_WRITE_RETRY_SAFE, true, cause);
        this.nodesWritten = nodesWritten;
        this.edgesWritten = edgesWritten;
    }

    public int getNodesWritten() {
        return nodesWritten;
    }

    public int getEdgesWritten() {
        return edgesWritten;
    }
}
