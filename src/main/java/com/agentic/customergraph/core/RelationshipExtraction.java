package com.agentic.customergraph.core;

import java.util.List;

/**
 * Output of relationship inference.
 *
 * @param relationships deduplicated edges, all carrying evidence
 * @param evidenceMissing candidate edges dropped because they had no evidence
 * @param scorerFailures candidate pairs skipped because the similarity scorer failed
 */
public record RelationshipExtraction(
    List<Relationship> relationships,
    int evidenceMissing,
    int scorerFailures
) {
    public RelationshipExtraction {
        relationships = List.copyOf(relationships);
    }
}
