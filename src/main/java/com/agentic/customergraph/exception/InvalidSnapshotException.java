package com.agentic.customergraph.exception;

import java.util.List;

/**
 * Raised when a stored snapshot cannot be uploaded as is: an edge without
 * evidence or an edge whose endpoint is not among the snapshot's nodes.
 */
public class InvalidSnapshotException extends CustomerGraphException {

    private final List<String> problems;

    public InvalidSnapshotException(String customerId, String extractionId, List<String> problems) {
        super("Snapshot " + extractionId + " is invalid: " + String.join("; ", problems),
            customerId, extractionId, PipelineStage.UPLOAD, WriteOutcome.NOTHING_WRITTEN, false, null);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
