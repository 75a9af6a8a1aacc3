package com.agentic.customergraph.upload;

import java.time.Duration;

/**
 * One metric event per processed extraction.
 */
public record UploadMetricEvent(
    String customerId,
    String extractionId,
    UploadOutcome outcome,
    Duration elapsed,
    int nodesWritten,
    int edgesWritten,
    int attempts
) {
}
