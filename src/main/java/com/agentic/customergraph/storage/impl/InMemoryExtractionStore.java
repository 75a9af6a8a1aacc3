package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.core.GraphSnapshot;
import com.agentic.customergraph.exception.ExtractionStoreException;
import com.agentic.customergraph.exception.SnapshotNotFoundException;
import com.agentic.customergraph.storage.ExtractionStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Extraction Store held in memory. A snapshot becomes visible with a single
 * map insertion, which makes writes atomic.
 */
public class InMemoryExtractionStore implements ExtractionStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryExtractionStore.class);

    private final ConcurrentHashMap<String, ConcurrentSkipListMap<String, GraphSnapshot>> snapshots =
        new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> write(@NotNull GraphSnapshot snapshot) {
        return CompletableFuture.runAsync(() -> {
            ConcurrentSkipListMap<String, GraphSnapshot> byExtraction =
                snapshots.computeIfAbsent(snapshot.customerId(), k -> new ConcurrentSkipListMap<>());
            GraphSnapshot existing = byExtraction.putIfAbsent(snapshot.extractionId(), snapshot);
            if (existing != null) {
                throw new ExtractionStoreException("Snapshot already exists: " + snapshot.extractionId(),
                    snapshot.customerId(), snapshot.extractionId(), false);
            }
            logger.debug("Stored snapshot {} for customer {}", snapshot.extractionId(), snapshot.customerId());
        });
    }

    @Override
    public CompletableFuture<GraphSnapshot> read(@NotNull String customerId, @NotNull String extractionId) {
        return CompletableFuture.supplyAsync(() -> {
            ConcurrentSkipListMap<String, GraphSnapshot> byExtraction = snapshots.get(customerId);
            GraphSnapshot snapshot = byExtraction != null ? byExtraction.get(extractionId) : null;
            if (snapshot == null) {
                throw new SnapshotNotFoundException(customerId, extractionId);
            }
            return snapshot;
        });
    }

    @Override
    public CompletableFuture<List<String>> listExtractions(@NotNull String customerId) {
        return CompletableFuture.supplyAsync(() -> {
            ConcurrentSkipListMap<String, GraphSnapshot> byExtraction = snapshots.get(customerId);
            return byExtraction != null ? new ArrayList<>(byExtraction.keySet()) : new ArrayList<>();
        });
    }

    @Override
    public CompletableFuture<List<String>> listCustomers() {
        return CompletableFuture.supplyAsync(() -> snapshots.keySet().stream().sorted().toList());
    }
}
