package com.agentic.customergraph.core;

import com.agentic.customergraph.exception.CustomerGraphException;
import com.agentic.customergraph.exception.PipelineStage;
import com.agentic.customergraph.exception.WriteOutcome;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs one extraction end to end: entities, then relationships, then the
 * assembled snapshot written to the Extraction Store.
 *
 * <p>The pipeline is synchronous and keeps no state between requests. A
 * failure in any stage aborts the extraction before anything is written and
 * is reported as a {@link CustomerGraphException} naming the stage.</p>
 */
public final class GraphExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(GraphExtractionService.class);

    static final String EXTRACTION_METHOD_PREFIX = "rule-based+";
    static final String MDC_CUSTOMER = "customer.id";
    static final String MDC_EXTRACTION = "extraction.id";

    private final EntityExtractor entityExtractor;
    private final RelationshipExtractor relationshipExtractor;
    private final GraphAssembler graphAssembler;
    private final String extractionMethod;
    private final Clock clock;

    /**
     * @param scorerName name of the similarity scorer, recorded in snapshot metadata
     */
    public GraphExtractionService(
            @NotNull EntityExtractor entityExtractor,
            @NotNull RelationshipExtractor relationshipExtractor,
            @NotNull GraphAssembler graphAssembler,
            @NotNull String scorerName,
            @NotNull Clock clock) {
        this.entityExtractor = Objects.requireNonNull(entityExtractor, "entityExtractor must not be null");
        this.relationshipExtractor = Objects.requireNonNull(relationshipExtractor,
            "relationshipExtractor must not be null");
        this.graphAssembler = Objects.requireNonNull(graphAssembler, "graphAssembler must not be null");
        this.extractionMethod = EXTRACTION_METHOD_PREFIX + Objects.requireNonNull(scorerName, "scorerName");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Extracts and stores the snapshot of one request. When the request has
     * no extraction id, a timestamped one is generated.
     *
     * @throws com.agentic.customergraph.exception.MissingPrimarySubjectException if no subject is named
     * @throws com.agentic.customergraph.exception.EmptyGraphException if no entity results
     * @throws IllegalArgumentException if the customer id is blank
     */
    @NotNull
    public GraphSnapshot extract(@NotNull ExtractionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String customerId = request.customerId();
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customer_id must not be blank");
        }
        String extractionId = request.extractionId() != null && !request.extractionId().isBlank()
            ? request.extractionId()
            : GraphIds.newExtractionId(clock.instant());

        MDC.put(MDC_CUSTOMER, customerId);
        MDC.put(MDC_EXTRACTION, extractionId);
        try {
            FileAnalysis fileAnalysis = request.fileAnalysisOrEmpty();
            NeedsAnalysis needsAnalysis = request.needsAnalysisOrEmpty();

            List<Entity> entities = runStage(PipelineStage.ENTITY_EXTRACTION, customerId, extractionId,
                () -> entityExtractor.extract(customerId, extractionId, fileAnalysis, needsAnalysis));
            RelationshipExtraction relationships = runStage(PipelineStage.RELATIONSHIP_EXTRACTION,
                customerId, extractionId, () -> relationshipExtractor.extract(entities));
            GraphSnapshot snapshot = runStage(PipelineStage.ASSEMBLY, customerId, extractionId,
                () -> graphAssembler.assemble(customerId, extractionId, entities, relationships,
                    extractionMethod, fileAnalysis.contentType()));

            logger.info("Extraction {} for customer {} produced {} entities and {} relationships "
                    + "({} without evidence dropped)",
                extractionId, customerId, snapshot.nodes().size(), snapshot.edges().size(),
                relationships.evidenceMissing());
            return snapshot;
        } finally {
            MDC.remove(MDC_CUSTOMER);
            MDC.remove(MDC_EXTRACTION);
        }
    }

    public String getExtractionMethod() {
        return extractionMethod;
    }

    private <T> T runStage(PipelineStage stage, String customerId, String extractionId, Supplier<T> work) {
        try {
            return work.get();
        } catch (CustomerGraphException | IllegalArgumentException e) {
            logger.warn("Extraction {} for customer {} failed at {}: {}", extractionId, customerId, stage,
                e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure at {} for extraction {}", stage, extractionId, e);
            throw new CustomerGraphException("Extraction failed at " + stage + ": " + e.getMessage(),
                customerId, extractionId, stage, WriteOutcome.NOTHING_WRITTEN, false, e);
        }
    }
}
