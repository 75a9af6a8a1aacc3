package com.agentic.customergraph.core;

import com.agentic.customergraph.exception.CustomerGraphException;
import com.agentic.customergraph.exception.EmptyGraphException;
import com.agentic.customergraph.exception.ExtractionStoreException;
import com.agentic.customergraph.storage.ExtractionStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * Combines extracted entities and relationships into one immutable
 * {@link GraphSnapshot}, computes its metrics and publishes it to the
 * {@link ExtractionStore}.
 *
 * <p>Relationships without evidence or with an endpoint outside the entity
 * set never reach the snapshot; they are counted as rejected.</p>
 */
public final class GraphAssembler {

    private static final Logger logger = LoggerFactory.getLogger(GraphAssembler.class);

    static final int CENTRAL_ENTITY_COUNT = 3;

    private final ExtractionSettings settings;
    private final ExtractionStore extractionStore;
    private final Clock clock;

    public GraphAssembler(@NotNull ExtractionSettings settings, @NotNull ExtractionStore extractionStore,
            @NotNull Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.extractionStore = Objects.requireNonNull(extractionStore, "extractionStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Builds the snapshot and writes it. The write is all or nothing.
     *
     * @throws EmptyGraphException if there are no entities
     * @throws ExtractionStoreException if the snapshot could not be written
     */
    @NotNull
    public GraphSnapshot assemble(
            @NotNull String customerId,
            @NotNull String extractionId,
            @NotNull List<Entity> entities,
            @NotNull RelationshipExtraction relationships,
            @NotNull String extractionMethod,
            @Nullable String contentType) {
        GraphSnapshot snapshot = build(customerId, extractionId, entities, relationships, extractionMethod, contentType);
        try {
            extractionStore.write(snapshot).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CustomerGraphException graphException) {
                throw graphException;
            }
            throw new ExtractionStoreException("Failed to write snapshot: " + cause.getMessage(),
                customerId, extractionId, true, cause);
        }
        logger.info("Assembled snapshot {} for customer {}: {} nodes, {} edges, quality {}",
            extractionId, customerId, snapshot.nodes().size(), snapshot.edges().size(),
            String.format("%.3f", snapshot.metrics().qualityScore()));
        return snapshot;
    }

    /**
     * Builds the snapshot without writing it.
     */
    @NotNull
    public GraphSnapshot build(
            @NotNull String customerId,
            @NotNull String extractionId,
            @NotNull List<Entity> entities,
            @NotNull RelationshipExtraction relationships,
            @NotNull String extractionMethod,
            @Nullable String contentType) {
        if (entities.isEmpty()) {
            throw new EmptyGraphException(customerId, extractionId);
        }

        Map<String, Entity> nodes = new LinkedHashMap<>();
        for (Entity entity : entities) {
            if (!customerId.equals(entity.getCustomerId()) || !extractionId.equals(entity.getExtractionId())) {
                throw new IllegalArgumentException("Entity " + entity.getId() + " belongs to "
                    + entity.getCustomerId() + "/" + entity.getExtractionId()
                    + ", not " + customerId + "/" + extractionId);
            }
            nodes.merge(entity.getId(), entity, Entity::mergeWith);
        }

        List<Relationship> edges = new ArrayList<>();
        int rejected = relationships.evidenceMissing();
        for (Relationship relationship : relationships.relationships()) {
            if (!relationship.hasEvidence()) {
                logger.warn("Rejecting relationship {} without evidence", relationship.getId());
                rejected++;
            } else if (!nodes.containsKey(relationship.getSourceId()) || !nodes.containsKey(relationship.getTargetId())) {
                logger.warn("Rejecting relationship {} with unresolved endpoint", relationship.getId());
                rejected++;
            } else {
                edges.add(relationship);
            }
        }

        List<Entity> nodeList = new ArrayList<>(nodes.values());
        GraphMetrics metrics = computeMetrics(nodeList, edges, rejected);
        SnapshotMetadata metadata = new SnapshotMetadata(
            clock.instant(), extractionMethod, metrics.qualityScore(), contentType, nodeList.size(), edges.size());
        return new GraphSnapshot(customerId, extractionId, nodeList, edges, metadata, metrics);
    }

    @NotNull
    GraphMetrics computeMetrics(@NotNull List<Entity> nodes, @NotNull List<Relationship> edges, int rejected) {
        Map<EntityType, Integer> entityCounts = new EnumMap<>(EntityType.class);
        double entityConfidence = 0.0;
        for (Entity node : nodes) {
            entityCounts.merge(node.getType(), 1, Integer::sum);
            entityConfidence += node.getConfidence();
        }

        Map<RelationshipType, Integer> relationshipCounts = new EnumMap<>(RelationshipType.class);
        Map<String, Integer> degree = new HashMap<>();
        double edgeConfidence = 0.0;
        int withEvidence = 0;
        int meaningful = 0;
        for (Relationship edge : edges) {
            relationshipCounts.merge(edge.getType(), 1, Integer::sum);
            edgeConfidence += edge.getConfidence();
            if (edge.hasEvidence()) {
                withEvidence++;
            }
            if (edge.isMeaningful()) {
                meaningful++;
            }
            degree.merge(edge.getSourceId(), 1, Integer::sum);
            degree.merge(edge.getTargetId(), 1, Integer::sum);
        }

        int n = nodes.size();
        int m = edges.size();
        double evidenceCoverage = m == 0 ? 1.0 : (double) withEvidence / m;
        double meaningfulRatio = m == 0 ? 0.0 : (double) meaningful / m;
        double density = n > 1 ? (double) m / ((double) n * (n - 1)) : 0.0;
        double typeDiversity = Math.min(1.0, (double) entityCounts.size() / EntityType.COUNT);

        double quality = settings.typeDiversityWeight() * typeDiversity
            + settings.evidenceCoverageWeight() * evidenceCoverage
            + settings.meaningfulRatioWeight() * meaningfulRatio;

        List<String> central = nodes.stream()
            .filter(node -> degree.containsKey(node.getId()))
            .sorted(Comparator.comparingInt((Entity node) -> degree.get(node.getId())).reversed())
            .limit(CENTRAL_ENTITY_COUNT)
            .map(Entity::getLabel)
            .toList();

        return new GraphMetrics(
            entityCounts,
            relationshipCounts,
            entityCounts.size(),
            relationshipCounts.size(),
            evidenceCoverage,
            meaningfulRatio,
            n == 0 ? 0.0 : entityConfidence / n,
            m == 0 ? 0.0 : edgeConfidence / m,
            density,
            central,
            rejected,
            Math.min(1.0, quality));
    }
}
