package com.agentic.customergraph.storage;

import com.agentic.customergraph.core.GraphSnapshot;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Object storage of graph snapshots, keyed by customer and extraction id.
 *
 * <p>Layout: {@code customer-graphs/{customer_id}/extractions/{extraction_id}/{nodes.json|edges.json}}.
 * Writes are atomic: a reader sees either the whole snapshot or nothing.
 * Snapshots are immutable once written.</p>
 *
 * Implementations: FileSystemExtractionStore, InMemoryExtractionStore
 */
public interface ExtractionStore {

    /**
     * Writes a snapshot. Fails with a non-retryable
     * {@link com.agentic.customergraph.exception.ExtractionStoreException} when
     * the key already holds a snapshot.
     */
    CompletableFuture<Void> write(@NotNull GraphSnapshot snapshot);

    /**
     * Reads a snapshot.
     *
     * @throws com.agentic.customergraph.exception.SnapshotNotFoundException (as the future's cause) if absent
     */
    CompletableFuture<GraphSnapshot> read(@NotNull String customerId, @NotNull String extractionId);

    /**
     * Lists the extraction ids stored for a customer, ascending, so the last
     * element is the latest extraction.
     */
    CompletableFuture<List<String>> listExtractions(@NotNull String customerId);

    /**
     * Lists every customer that has at least one snapshot.
     */
    CompletableFuture<List<String>> listCustomers();

    default CompletableFuture<Optional<String>> latest(@NotNull String customerId) {
        return listExtractions(customerId)
            .thenApply(ids -> ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(ids.size() - 1)));
    }
}
