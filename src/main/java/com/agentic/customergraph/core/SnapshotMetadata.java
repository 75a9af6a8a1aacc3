package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotMetadata(
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("source_extraction_method") String sourceExtractionMethod,
    @JsonProperty("quality_score") double qualityScore,
    @JsonProperty("content_type") @Nullable String contentType,
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("edge_count") int edgeCount
) {
}
