package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.storage.UploadRecordStore;
import com.agentic.customergraph.storage.UploadRecordStore.UploadRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SQLiteUploadRecordStoreTest extends AbstractUploadRecordStoreTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteUploadRecordStore store;

    @BeforeEach
    void setUp() throws SQLException {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("uploads.db").toString());
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        store = new SQLiteUploadRecordStore(connectionManager);
        store.initialize().join();
    }

    @AfterEach
    void tearDown() {
        store.close();
        connectionManager.close();
    }

    @Override
    protected UploadRecordStore store() {
        return store;
    }

    @Test
    @DisplayName("Recorded timestamps survive the round trip")
    void keepsTimestamps() {
        UploadRecord pending = UploadRecord.pending("acme", "extraction_1");
        store.append(pending).join();

        UploadRecord read = store.history("acme", "extraction_1").join().get(0);

        assertEquals(pending, read);
    }
}
