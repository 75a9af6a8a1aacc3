package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Immutable entity and relationship graph produced by one extraction; the
 * unit of persistence in the Extraction Store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphSnapshot(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("extraction_id") String extractionId,
    @JsonProperty("nodes") List<Entity> nodes,
    @JsonProperty("edges") List<Relationship> edges,
    @JsonProperty("metadata") SnapshotMetadata metadata,
    @JsonProperty("metrics") GraphMetrics metrics
) {
    public GraphSnapshot {
        Objects.requireNonNull(customerId, "customerId must not be null");
        Objects.requireNonNull(extractionId, "extractionId must not be null");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
