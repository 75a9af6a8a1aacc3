package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import org.jetbrains.annotations.Nullable;

/**
 * Input of one extraction: the customer, an optional caller-chosen extraction
 * id and the two upstream analyses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionRequest(
    @JsonProperty("customer_id")
    @NotBlank(message = "customer_id is required")
    String customerId,

    @JsonProperty("extraction_id")
    @Nullable String extractionId,

    @JsonProperty("file_analysis")
    @Nullable FileAnalysis fileAnalysis,

    @JsonProperty("needs_analysis")
    @Nullable NeedsAnalysis needsAnalysis
) {

    public FileAnalysis fileAnalysisOrEmpty() {
        return fileAnalysis != null ? fileAnalysis : FileAnalysis.empty();
    }

    public NeedsAnalysis needsAnalysisOrEmpty() {
        return needsAnalysis != null ? needsAnalysis : NeedsAnalysis.empty();
    }

    public ExtractionRequest withExtractionId(String newExtractionId) {
        return new ExtractionRequest(customerId, newExtractionId, fileAnalysis, needsAnalysis);
    }
}
