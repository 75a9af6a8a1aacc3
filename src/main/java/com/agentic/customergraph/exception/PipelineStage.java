package com.agentic.customergraph.exception;

/**
 * Stage of the extraction or upload pipeline where a failure happened.
 */
public enum PipelineStage {
    ENTITY_EXTRACTION,
    RELATIONSHIP_EXTRACTION,
    ASSEMBLY,
    STORE,
    UPLOAD
}
