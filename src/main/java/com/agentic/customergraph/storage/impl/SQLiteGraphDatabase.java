package com.agentic.customergraph.storage.impl;

import com.agentic.customergraph.exception.GraphDatabaseException;
import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.utils.TransientFailurePredicate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Graph Database on SQLite relational tables ({@code graph_vertices},
 * {@code graph_edges}). Both tables are keyed by {@code (customer_id, id)},
 * so upserts are idempotent and customers never share rows. Properties are
 * stored as JSON text.
 */
public final class SQLiteGraphDatabase implements GraphDatabase {

    private static final Logger LOG = Logger.getLogger(SQLiteGraphDatabase.class);
    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() { };

    private final SQLiteConnectionManager connectionManager;
    private final TransientFailurePredicate transientFailure = new TransientFailurePredicate();

    public SQLiteGraphDatabase(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> LOG.info("Initialized SQLiteGraphDatabase"));
    }

    @Override
    public CompletableFuture<Void> upsertVertex(@NotNull String customerId, @NotNull String id, @NotNull String type,
            @NotNull Map<String, Object> properties) {
        return CompletableFuture.runAsync(() -> {
            String sql = """
                INSERT INTO graph_vertices (customer_id, id, vertex_type, properties, updated_at)
                VALUES (?, ?, ?, ?, datetime('now'))
                ON CONFLICT(customer_id, id) DO UPDATE SET
                    vertex_type = excluded.vertex_type,
                    properties = excluded.properties,
                    updated_at = datetime('now')
                """;
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, customerId);
                stmt.setString(2, id);
                stmt.setString(3, type);
                stmt.setString(4, toJson(customerId, properties));
                stmt.executeUpdate();
                LOG.debugf("Upserted vertex %s for customer %s", id, customerId);
            } catch (SQLException e) {
                throw failure("Failed to upsert vertex " + id, customerId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsertEdge(@NotNull String customerId, @NotNull String id, @NotNull String fromId,
            @NotNull String toId, @NotNull String type, @NotNull Map<String, Object> properties) {
        return CompletableFuture.runAsync(() -> {
            String sql = """
                INSERT INTO graph_edges (customer_id, id, from_id, to_id, edge_type, properties, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, datetime('now'))
                ON CONFLICT(customer_id, id) DO UPDATE SET
                    from_id = excluded.from_id,
                    to_id = excluded.to_id,
                    edge_type = excluded.edge_type,
                    properties = excluded.properties,
                    updated_at = datetime('now')
                """;
            Connection conn = connectionManager.getWriteConnection();
            try {
                if (!vertexExists(conn, customerId, fromId) || !vertexExists(conn, customerId, toId)) {
                    throw new GraphDatabaseException(
                        "Edge " + id + " references a vertex missing for customer " + customerId, customerId, false);
                }
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setString(1, customerId);
                    stmt.setString(2, id);
                    stmt.setString(3, fromId);
                    stmt.setString(4, toId);
                    stmt.setString(5, type);
                    stmt.setString(6, toJson(customerId, properties));
                    stmt.executeUpdate();
                }
                LOG.debugf("Upserted edge %s for customer %s", id, customerId);
            } catch (SQLException e) {
                throw failure("Failed to upsert edge " + id, customerId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<GraphRecord>> queryByCustomer(@NotNull String customerId, @NotNull RecordKind kind,
            int limit) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = kind == RecordKind.VERTEX
                ? "SELECT id, vertex_type, NULL, NULL, properties FROM graph_vertices "
                    + "WHERE customer_id = ? ORDER BY id LIMIT ?"
                : "SELECT id, edge_type, from_id, to_id, properties FROM graph_edges "
                    + "WHERE customer_id = ? ORDER BY id LIMIT ?";
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, customerId);
                stmt.setInt(2, Math.max(0, limit));
                List<GraphRecord> records = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        records.add(new GraphRecord(rs.getString(1), kind, customerId, rs.getString(2),
                            rs.getString(3), rs.getString(4), fromJson(customerId, rs.getString(5))));
                    }
                }
                return records;
            } catch (SQLException e) {
                throw failure("Failed to query " + kind + " records", customerId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Long> countByCustomer(@NotNull String customerId, @NotNull RecordKind kind) {
        return CompletableFuture.supplyAsync(() -> {
            String table = kind == RecordKind.VERTEX ? "graph_vertices" : "graph_edges";
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT COUNT(*) FROM " + table + " WHERE customer_id = ?")) {
                stmt.setString(1, customerId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            } catch (SQLException e) {
                throw failure("Failed to count " + kind + " records", customerId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public void close() {
        LOG.debug("SQLiteGraphDatabase closed; connections are owned by the connection manager");
    }

    private boolean vertexExists(Connection conn, String customerId, String vertexId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT 1 FROM graph_vertices WHERE customer_id = ? AND id = ?")) {
            stmt.setString(1, customerId);
            stmt.setString(2, vertexId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private GraphDatabaseException failure(String message, String customerId, SQLException e) {
        return new GraphDatabaseException(message + ": " + e.getMessage(), customerId, transientFailure.test(e), e);
    }

    private static String toJson(String customerId, Map<String, Object> properties) {
        try {
            return SnapshotJson.MAPPER.writeValueAsString(properties);
        } catch (JsonProcessingException e) {
            throw new GraphDatabaseException("Properties are not serializable: " + e.getOriginalMessage(),
                customerId, false, e);
        }
    }

    private static Map<String, Object> fromJson(String customerId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return SnapshotJson.MAPPER.readValue(json, PROPERTIES_TYPE);
        } catch (JsonProcessingException e) {
            throw new GraphDatabaseException("Stored properties are corrupt: " + e.getOriginalMessage(),
                customerId, false, e);
        }
    }
}
