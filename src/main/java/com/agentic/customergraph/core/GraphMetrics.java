package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Summary metrics of a graph snapshot.
 *
 * @param entityCounts entities per type
 * @param relationshipCounts relationships per type
 * @param entityTypeDiversity number of distinct entity types present
 * @param relationshipTypeDiversity number of distinct relationship types present
 * @param evidenceCoverage share of relationships carrying evidence (1.0 when there are none)
 * @param meaningfulRelationshipRatio share of relationships with a non-generic type and evidence
 * @param meanEntityConfidence mean entity confidence
 * @param meanRelationshipConfidence mean relationship confidence (0.0 when there are none)
 * @param graphDensity edges over possible directed edges
 * @param centralEntities labels of the most connected entities
 * @param rejectedRelationships candidate edges dropped before or during assembly
 * @param qualityScore weighted average of type diversity, evidence coverage and meaningful ratio
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphMetrics(
    @JsonProperty("entity_counts") Map<EntityType, Integer> entityCounts,
    @JsonProperty("relationship_counts") Map<RelationshipType, Integer> relationshipCounts,
    @JsonProperty("entity_type_diversity") int entityTypeDiversity,
    @JsonProperty("relationship_type_diversity") int relationshipTypeDiversity,
    @JsonProperty("evidence_coverage") double evidenceCoverage,
    @JsonProperty("meaningful_relationship_ratio") double meaningfulRelationshipRatio,
    @JsonProperty("mean_entity_confidence") double meanEntityConfidence,
    @JsonProperty("mean_relationship_confidence") double meanRelationshipConfidence,
    @JsonProperty("graph_density") double graphDensity,
    @JsonProperty("central_entities") List<String> centralEntities,
    @JsonProperty("rejected_relationships") int rejectedRelationships,
    @JsonProperty("quality_score") double qualityScore
) {
    public GraphMetrics {
        entityCounts = entityCounts != null ? Map.copyOf(entityCounts) : Map.of();
        relationshipCounts = relationshipCounts != null ? Map.copyOf(relationshipCounts) : Map.of();
        centralEntities = centralEntities != null ? List.copyOf(centralEntities) : List.of();
    }
}
