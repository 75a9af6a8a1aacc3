package com.agentic.customergraph.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Graph store capability consumed by the Bulk Upload Coordinator.
 *
 * <p>Every element is scoped by customer id. Writes are upserts keyed by
 * element id: writing the same id twice leaves one element. Edges are never
 * created for endpoints that do not exist yet.</p>
 *
 * Implementations: InMemoryGraphDatabase, SQLiteGraphDatabase
 */
public interface GraphDatabase extends AutoCloseable {

    CompletableFuture<Void> initialize();

    /**
     * Inserts or updates a vertex.
     */
    CompletableFuture<Void> upsertVertex(
        @NotNull String customerId,
        @NotNull String id,
        @NotNull String type,
        @NotNull Map<String, Object> properties);

    /**
     * Inserts or updates an edge.
     *
     * @throws com.agentic.customergraph.exception.GraphDatabaseException (as the future's cause)
     *         if either endpoint is missing for the customer
     */
    CompletableFuture<Void> upsertEdge(
        @NotNull String customerId,
        @NotNull String id,
        @NotNull String fromId,
        @NotNull String toId,
        @NotNull String type,
        @NotNull Map<String, Object> properties);

    /**
     * Returns up to {@code limit} records of one kind for a customer, ordered by id.
     */
    CompletableFuture<List<GraphRecord>> queryByCustomer(
        @NotNull String customerId, @NotNull RecordKind kind, int limit);

    default CompletableFuture<List<GraphRecord>> queryByCustomer(@NotNull String customerId, @NotNull RecordKind kind) {
        return queryByCustomer(customerId, kind, Integer.MAX_VALUE);
    }

    CompletableFuture<Long> countByCustomer(@NotNull String customerId, @NotNull RecordKind kind);

    @Override
    void close() throws Exception;

    enum RecordKind {
        VERTEX,
        EDGE
    }

    /**
     * A stored vertex or edge. {@code fromId} and {@code toId} are null for vertices.
     */
    record GraphRecord(
            @NotNull String id,
            @NotNull RecordKind kind,
            @NotNull String customerId,
            @NotNull String type,
            @Nullable String fromId,
            @Nullable String toId,
            @NotNull Map<String, Object> properties) {
    }
}
