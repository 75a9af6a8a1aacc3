package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.storage.GraphDatabase.RecordKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SQLiteGraphDatabaseTest extends AbstractGraphDatabaseTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphDatabase db;

    @BeforeEach
    void setUp() throws SQLException {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("graph.db").toString());
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        db = new SQLiteGraphDatabase(connectionManager);
        db.initialize().join();
    }

    @AfterEach
    void tearDown() {
        db.close();
        connectionManager.close();
    }

    @Override
    protected GraphDatabase database() {
        return db;
    }

    @Test
    @DisplayName("Data survives reopening the database file")
    void persistsAcrossConnections() {
        db.upsertVertex("acme", "node_a", "PERSON", Map.of("label", "Tim")).join();
        connectionManager.close();

        connectionManager = new SQLiteConnectionManager(tempDir.resolve("graph.db").toString());
        db = new SQLiteGraphDatabase(connectionManager);

        assertEquals(1L, db.countByCustomer("acme", RecordKind.VERTEX).join());
        assertEquals("Tim", db.queryByCustomer("acme", RecordKind.VERTEX).join().get(0).properties().get("label"));
    }
}
