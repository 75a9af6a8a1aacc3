package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.storage.GraphDatabase.RecordKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryGraphDatabaseTest extends AbstractGraphDatabaseTest {

    private InMemoryGraphDatabase db;

    @BeforeEach
    void setUp() {
        db = new InMemoryGraphDatabase();
        db.initialize().join();
    }

    @Override
    protected GraphDatabase database() {
        return db;
    }

    @Test
    @DisplayName("Operations before initialize fail fast")
    void requiresInitialize() {
        InMemoryGraphDatabase fresh = new InMemoryGraphDatabase();

        assertThrows(IllegalStateException.class, () -> fresh.upsertVertex("acme", "node_a", "PERSON", Map.of()));
        assertThrows(IllegalStateException.class, () -> fresh.countByCustomer("acme", RecordKind.VERTEX));
    }
}
