package com.agentic.customergraph.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 7807 problem document. Pipeline failures add the customer, extraction,
 * stage and write outcome they carry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance,
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("extraction_id") String extractionId,
    String stage,
    @JsonProperty("write_outcome") String writeOutcome
) {

    public ErrorResponse(String type, String title, int status, String detail, String instance) {
        this(type, title, status, detail, instance, null, null, null, null);
    }
}
