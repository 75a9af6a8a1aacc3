package com.agentic.customergraph.upload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one bulk upload run.
 *
 * <p>{@code processed} counts the extractions attempted (or validated, in a
 * dry run); extractions that already had a SUCCEEDED record are counted in
 * {@code skipped} instead. A dry run never reports successes.</p>
 */
public record BulkUploadResult(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("processed") int processed,
    @JsonProperty("succeeded") int succeeded,
    @JsonProperty("failed") int failed,
    @JsonProperty("skipped") int skipped,
    @JsonProperty("nodes_written") int nodesWritten,
    @JsonProperty("edges_written") int edgesWritten,
    @JsonProperty("duration_seconds") double durationSeconds,
    @JsonProperty("dry_run") boolean dryRun,
    @JsonProperty("cancelled") boolean cancelled
) {

    /**
     * Share of processed extractions that succeeded, 0.0 when nothing was processed.
     */
    @JsonProperty("success_rate")
    public double successRate() {
        return processed == 0 ? 0.0 : (double) succeeded / processed;
    }
}
