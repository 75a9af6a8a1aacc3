package com.agentic.customergraph.exception;

/**
 * Raised when no PERSON entity can be derived from the analyses, leaving the
 * graph without an anchor for its relationships.
 */
public class MissingPrimarySubjectException extends CustomerGraphException {

    public MissingPrimarySubjectException(String customerId, String extractionId) {
        super("No primary subject could be derived for customer " + customerId,
            customerId, extractionId, PipelineStage.ENTITY_EXTRACTION, WriteOutcome.NOTHING_WRITTEN, false, null);
    }
}
