package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.exception.GraphDatabaseException;
import com.agentic.customergraph.storage.UploadRecordStore;
import com.agentic.customergraph.utils.TransientFailurePredicate;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Upload Record Store on the append-only {@code upload_records} table.
 * Rows are only ever inserted; the autoincrement {@code seq} orders them.
 */
public final class SQLiteUploadRecordStore implements UploadRecordStore {

    private static final Logger LOG = Logger.getLogger(SQLiteUploadRecordStore.class);

    private static final String COLUMNS =
        "customer_id, extraction_id, status, attempt_count, last_error, nodes_written, edges_written, recorded_at";

    private final SQLiteConnectionManager connectionManager;
    private final TransientFailurePredicate transientFailure = new TransientFailurePredicate();

    public SQLiteUploadRecordStore(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> LOG.info("Initialized SQLiteUploadRecordStore"));
    }

    @Override
    public CompletableFuture<Void> append(@NotNull UploadRecord record) {
        return CompletableFuture.runAsync(() -> {
            String sql = "INSERT INTO upload_records (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, record.customerId());
                stmt.setString(2, record.extractionId());
                stmt.setString(3, record.status().name());
                stmt.setInt(4, record.attemptCount());
                stmt.setString(5, record.lastError());
                stmt.setInt(6, record.nodesWritten());
                stmt.setInt(7, record.edgesWritten());
                stmt.setString(8, record.recordedAt().toString());
                stmt.executeUpdate();
                LOG.debugf("Appended %s record for %s/%s", record.status(), record.customerId(), record.extractionId());
            } catch (SQLException e) {
                throw failure("Failed to append upload record for " + record.extractionId(), record.customerId(), e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<UploadRecord>> history(@NotNull String customerId, @NotNull String extractionId) {
        return CompletableFuture.supplyAsync(() -> query(
            "SELECT " + COLUMNS + " FROM upload_records WHERE customer_id = ? AND extraction_id = ? ORDER BY seq",
            customerId, extractionId));
    }

    @Override
    public CompletableFuture<List<UploadRecord>> latestByCustomer(@NotNull String customerId) {
        return CompletableFuture.supplyAsync(() -> query("""
            SELECT %s FROM upload_records r
            WHERE r.customer_id = ?
              AND r.seq = (SELECT MAX(seq) FROM upload_records l
                           WHERE l.customer_id = r.customer_id AND l.extraction_id = r.extraction_id)
            ORDER BY r.extraction_id
            """.formatted(COLUMNS), customerId));
    }

    @Override
    public void close() {
        LOG.debug("SQLiteUploadRecordStore closed; connections are owned by the connection manager");
    }

    private List<UploadRecord> query(String sql, String customerId, String... params) {
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, customerId);
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 2, params[i]);
            }
            List<UploadRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(new UploadRecord(
                        rs.getString("customer_id"),
                        rs.getString("extraction_id"),
                        UploadStatus.valueOf(rs.getString("status")),
                        rs.getInt("attempt_count"),
                        rs.getString("last_error"),
                        rs.getInt("nodes_written"),
                        rs.getInt("edges_written"),
                        Instant.parse(rs.getString("recorded_at"))));
                }
            }
            return records;
        } catch (SQLException e) {
            throw failure("Failed to read upload records", customerId, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private GraphDatabaseException failure(String message, String customerId, SQLException e) {
        return new GraphDatabaseException(message + ": " + e.getMessage(), customerId, transientFailure.test(e), e);
    }
}
