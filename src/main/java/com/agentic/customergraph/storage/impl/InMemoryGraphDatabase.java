package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.exception.GraphDatabaseException;
import com.agentic.customergraph.storage.GraphDatabase;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Graph Database held in memory, partitioned by customer id.
 * Vertices and edges are kept in id-ordered maps so queries are stable.
 */
public class InMemoryGraphDatabase implements GraphDatabase {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphDatabase.class);

    private final ConcurrentHashMap<String, ConcurrentSkipListMap<String, GraphRecord>> vertices =
        new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<String, GraphRecord>> edges =
        new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphDatabase initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsertVertex(@NotNull String customerId, @NotNull String id, @NotNull String type,
            @NotNull Map<String, Object> properties) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            partition(vertices, customerId).put(id,
                new GraphRecord(id, RecordKind.VERTEX, customerId, type, null, null, withoutNulls(properties)));
            logger.debug("Upserted vertex {} for customer {}", id, customerId);
        });
    }

    @Override
    public CompletableFuture<Void> upsertEdge(@NotNull String customerId, @NotNull String id, @NotNull String fromId,
            @NotNull String toId, @NotNull String type, @NotNull Map<String, Object> properties) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            ConcurrentSkipListMap<String, GraphRecord> customerVertices = partition(vertices, customerId);
            if (!customerVertices.containsKey(fromId) || !customerVertices.containsKey(toId)) {
                throw new GraphDatabaseException(
                    "Edge " + id + " references a vertex missing for customer " + customerId, customerId, false);
            }
            partition(edges, customerId).put(id,
                new GraphRecord(id, RecordKind.EDGE, customerId, type, fromId, toId, withoutNulls(properties)));
            logger.debug("Upserted edge {} for customer {}", id, customerId);
        });
    }

    @Override
    public CompletableFuture<List<GraphRecord>> queryByCustomer(@NotNull String customerId, @NotNull RecordKind kind,
            int limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> partition(kind == RecordKind.VERTEX ? vertices : edges, customerId)
            .values().stream()
            .limit(Math.max(0, limit))
            .toList());
    }

    @Override
    public CompletableFuture<Long> countByCustomer(@NotNull String customerId, @NotNull RecordKind kind) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(
            () -> (long) partition(kind == RecordKind.VERTEX ? vertices : edges, customerId).size());
    }

    @Override
    public void close() {
        vertices.clear();
        edges.clear();
        initialized = false;
        logger.info("InMemoryGraphDatabase closed");
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> properties) {
        Map<String, Object> copy = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static ConcurrentSkipListMap<String, GraphRecord> partition(
            ConcurrentHashMap<String, ConcurrentSkipListMap<String, GraphRecord>> store, String customerId) {
        return store.computeIfAbsent(customerId, k -> new ConcurrentSkipListMap<>());
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Graph database not initialized. Call initialize() first.");
        }
    }
}
