package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.storage.UploadRecordStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Upload Record Store held in memory. Records of a customer live in one
 * append-only list.
 */
public class InMemoryUploadRecordStore implements UploadRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryUploadRecordStore.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<UploadRecord>> records = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> append(@NotNull UploadRecord record) {
        return CompletableFuture.runAsync(() -> {
            records.computeIfAbsent(record.customerId(), k -> new CopyOnWriteArrayList<>()).add(record);
            logger.debug("Appended {} record for {}/{}", record.status(), record.customerId(), record.extractionId());
        });
    }

    @Override
    public CompletableFuture<List<UploadRecord>> history(@NotNull String customerId, @NotNull String extractionId) {
        return CompletableFuture.supplyAsync(() -> records.getOrDefault(customerId, new CopyOnWriteArrayList<>())
            .stream()
            .filter(r -> r.extractionId().equals(extractionId))
            .toList());
    }

    @Override
    public CompletableFuture<List<UploadRecord>> latestByCustomer(@NotNull String customerId) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, UploadRecord> latest = new LinkedHashMap<>();
            for (UploadRecord record : records.getOrDefault(customerId, new CopyOnWriteArrayList<>())) {
                latest.put(record.extractionId(), record);
            }
            List<UploadRecord> result = new ArrayList<>(latest.values());
            result.sort(Comparator.comparing(UploadRecord::extractionId));
            return result;
        });
    }

    @Override
    public void close() {
        records.clear();
    }
}
