package com.agentic.customergraph.api;

import com.agentic.customergraph.core.GraphMetrics;
import com.agentic.customergraph.core.GraphSnapshot;
import com.agentic.customergraph.core.SnapshotMetadata;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtractionSummaryResponse(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("extraction_id") String extractionId,
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("edge_count") int edgeCount,
    @JsonProperty("metadata") SnapshotMetadata metadata,
    @JsonProperty("metrics") GraphMetrics metrics
) {

    public static ExtractionSummaryResponse of(final GraphSnapshot snapshot) {
        return new ExtractionSummaryResponse(
            snapshot.customerId(),
            snapshot.extractionId(),
            snapshot.nodes().size(),
            snapshot.edges().size(),
            snapshot.metadata(),
            snapshot.metrics());
    }
}
