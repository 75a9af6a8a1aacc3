package com.agentic.customergraph.api;

import com.agentic.customergraph.storage.UploadRecordStore.UploadRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadRecordResponse(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("extraction_id") String extractionId,
    @JsonProperty("status") String status,
    @JsonProperty("attempt_count") int attemptCount,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("nodes_written") int nodesWritten,
    @JsonProperty("edges_written") int edgesWritten,
    @JsonProperty("recorded_at") Instant recordedAt
) {

    public static UploadRecordResponse of(final UploadRecord record) {
        return new UploadRecordResponse(
            record.customerId(),
            record.extractionId(),
            record.status().name(),
            record.attemptCount(),
            record.lastError(),
            record.nodesWritten(),
            record.edgesWritten(),
            record.recordedAt());
    }
}
