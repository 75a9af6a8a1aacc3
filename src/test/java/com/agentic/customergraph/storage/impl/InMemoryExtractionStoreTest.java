package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.SnapshotFixtures;
import com.agentic.customergraph.exception.ExtractionStoreException;
import com.agentic.customergraph.exception.SnapshotNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryExtractionStoreTest {

    private final InMemoryExtractionStore store = new InMemoryExtractionStore();

    @Test
    @DisplayName("Lists extractions ascending and resolves the latest")
    void listsAndResolvesLatest() {
        store.write(SnapshotFixtures.snapshot("acme", SnapshotFixtures.extractionId(2), 1)).join();
        store.write(SnapshotFixtures.snapshot("acme", SnapshotFixtures.extractionId(1), 1)).join();

        assertEquals(List.of(SnapshotFixtures.extractionId(1), SnapshotFixtures.extractionId(2)),
            store.listExtractions("acme").join());
        assertEquals(SnapshotFixtures.extractionId(2), store.latest("acme").join().orElseThrow());
        assertTrue(store.latest("beta").join().isEmpty());
    }

    @Test
    @DisplayName("Rejects a second write to the same key")
    void immutable() {
        store.write(SnapshotFixtures.snapshot("acme", SnapshotFixtures.extractionId(1), 1)).join();

        CompletionException error = assertThrows(CompletionException.class,
            () -> store.write(SnapshotFixtures.snapshot("acme", SnapshotFixtures.extractionId(1), 2)).join());

        assertInstanceOf(ExtractionStoreException.class, error.getCause());
        assertEquals(2, store.read("acme", SnapshotFixtures.extractionId(1)).join().nodes().size());
    }

    @Test
    @DisplayName("Reading an unknown snapshot fails with SnapshotNotFound")
    void notFound() {
        CompletionException error = assertThrows(CompletionException.class,
            () -> store.read("acme", "extraction_0000000001_00000001").join());

        assertInstanceOf(SnapshotNotFoundException.class, error.getCause());
    }
}
