package com.agentic.customergraph.upload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Invocation of the Bulk Upload Coordinator for one customer.
 */
public record BulkUploadRequest(
    @JsonProperty("customer_id") @NotBlank String customerId,
    @JsonProperty("dry_run") boolean dryRun
) {
}
