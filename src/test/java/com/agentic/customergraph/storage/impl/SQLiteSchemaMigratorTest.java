package com.agentic.customergraph.storage.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SQLiteSchemaMigratorTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private Connection conn;

    @BeforeEach
    void setUp() {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("schema.db").toString());
        conn = connectionManager.getWriteConnection();
    }

    @AfterEach
    void tearDown() {
        connectionManager.releaseWriteConnection(conn);
        connectionManager.close();
    }

    @Test
    @DisplayName("An empty database is at version 0")
    void emptyDatabase() throws SQLException {
        assertEquals(0, new SQLiteSchemaMigrator().getCurrentVersion(conn));
    }

    @Test
    @DisplayName("Migrating creates the graph and upload tables")
    void createsTables() throws SQLException {
        SQLiteSchemaMigrator migrator = new SQLiteSchemaMigrator();
        migrator.migrateToLatest(conn);

        assertEquals(1, migrator.getCurrentVersion(conn));
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT COUNT(*) FROM sqlite_master WHERE type='table' "
                     + "AND name IN ('graph_vertices', 'graph_edges', 'upload_records')")) {
            assertTrue(rs.next());
            assertEquals(3, rs.getInt(1));
        }
    }

    @Test
    @DisplayName("Running migrations twice is a no-op")
    void idempotent() throws SQLException {
        SQLiteSchemaMigrator migrator = new SQLiteSchemaMigrator();
        migrator.migrateToLatest(conn);
        migrator.migrateToLatest(conn);

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM schema_version")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    @DisplayName("A missing migration script fails and rolls back")
    void missingScript() {
        SQLiteSchemaMigrator broken = new SQLiteSchemaMigrator(List.of(
            new SQLiteSchemaMigrator.Migration(1, "missing", "/db/migrations/V999__missing.sql")));

        assertThrows(IllegalStateException.class, () -> broken.migrateToLatest(conn));
    }

    @Test
    void splitsStatementsAndDropsComments() {
        List<String> statements = SQLiteSchemaMigrator.Migration.splitStatements(
            "-- header\nCREATE TABLE a (x INT);\n\nCREATE TABLE b (y INT); -- trailing\n");

        assertEquals(List.of("CREATE TABLE a (x INT)", "CREATE TABLE b (y INT)"), statements);
    }
}
