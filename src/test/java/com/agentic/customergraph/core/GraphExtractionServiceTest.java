package com.agentic.customergraph.core;

import com.agentic.customergraph.exception.ExtractionStoreException;
import com.agentic.customergraph.exception.MissingPrimarySubjectException;
import com.agentic.customergraph.exception.PipelineStage;
import com.agentic.customergraph.exception.WriteOutcome;
import com.agentic.customergraph.similarity.LexicalSimilarityScorer;
import com.agentic.customergraph.storage.ExtractionStore;
import com.agentic.customergraph.storage.impl.InMemoryExtractionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphExtractionServiceTest {

    private static final String CUSTOMER = "customer-1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private InMemoryExtractionStore store;
    private GraphExtractionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryExtractionStore();
        service = serviceWith(store);
    }

    private static GraphExtractionService serviceWith(ExtractionStore store) {
        ExtractionSettings settings = ExtractionSettings.defaults();
        return new GraphExtractionService(
            new EntityExtractor(settings, CLOCK),
            new RelationshipExtractor(settings, new LexicalSimilarityScorer()),
            new GraphAssembler(settings, store, CLOCK),
            "lexical",
            CLOCK);
    }

    private static ExtractionRequest timWolff(String extractionId) {
        NeedsAnalysis needs = new NeedsAnalysis("Tim Wolff", 0.75, Map.of("certainty", 0.8), null, null, null);
        return new ExtractionRequest(CUSTOMER, extractionId, null, needs);
    }

    @Test
    @DisplayName("Generates a timestamped extraction id when none is given")
    void generatesExtractionId() {
        GraphSnapshot snapshot = service.extract(timWolff(null));

        assertTrue(snapshot.extractionId().matches("extraction_1714557600_[0-9a-f]{8}"),
            snapshot.extractionId());
        assertEquals(List.of(snapshot.extractionId()), store.listExtractions(CUSTOMER).join());
        assertEquals("rule-based+lexical", snapshot.metadata().sourceExtractionMethod());
    }

    @Test
    @DisplayName("Keeps a caller-chosen extraction id")
    void keepsGivenExtractionId() {
        GraphSnapshot snapshot = service.extract(timWolff("extraction_0000000042_custom01"));

        assertEquals("extraction_0000000042_custom01", snapshot.extractionId());
        assertEquals(2, snapshot.nodes().size());
        assertEquals(1, snapshot.edges().size());
    }

    @Test
    @DisplayName("Empty analyses fail at entity extraction and write no snapshot")
    void emptyInputWritesNothing() {
        ExtractionRequest empty = new ExtractionRequest(CUSTOMER, null, FileAnalysis.empty(), NeedsAnalysis.empty());

        MissingPrimarySubjectException error = assertThrows(MissingPrimarySubjectException.class,
            () -> service.extract(empty));

        assertEquals(PipelineStage.ENTITY_EXTRACTION, error.getStage());
        assertEquals(WriteOutcome.NOTHING_WRITTEN, error.getWriteOutcome());
        assertTrue(store.listExtractions(CUSTOMER).join().isEmpty());
        assertNull(MDC.get("customer.id"), "MDC is cleared after a failure");
    }

    @Test
    @DisplayName("Blank customer ids are rejected")
    void blankCustomer() {
        ExtractionRequest request = new ExtractionRequest(" ", null, null, null);

        assertThrows(IllegalArgumentException.class, () -> service.extract(request));
    }

    @Test
    @DisplayName("Store I/O failures surface as retryable store errors")
    void storeFailureIsRetryable() {
        ExtractionStore broken = new InMemoryExtractionStore() {
            @Override
            public CompletableFuture<Void> write(GraphSnapshot snapshot) {
                return CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full")));
            }
        };

        ExtractionStoreException error = assertThrows(ExtractionStoreException.class,
            () -> serviceWith(broken).extract(timWolff(null)));

        assertTrue(error.isRetryable());
        assertEquals(PipelineStage.STORE, error.getStage());
    }
}
