package com.agentic.customergraph.storage.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the classpath migrations under {@code /db/migrations/} in version order.
 * Applied versions are tracked in the {@code schema_version} table, which the
 * first migration creates.
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this(List.of(new Migration(1, "Customer graph schema", MIGRATION_PATH + "V001__customer_graph_schema.sql")));
    }

    SQLiteSchemaMigrator(List<Migration> migrations) {
        this.migrations = List.copyOf(migrations);
    }

    /**
     * @return the highest applied version, 0 for an empty database
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Applies every migration newer than the current version in one transaction.
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    migration.apply(conn);
                }
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public List<Migration> getMigrations() {
        return migrations;
    }

    /**
     * Migration loaded from a classpath SQL script.
     */
    public record Migration(int version, String description, String resourcePath) {

        void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(loadResource())) {
                    LOG.tracef("Executing: %s", statement.substring(0, Math.min(50, statement.length())));
                    stmt.execute(statement);
                }
                stmt.execute("INSERT INTO schema_version (version, description, applied_at) VALUES ("
                    + version + ", '" + description.replace("'", "''") + "', datetime('now'))");
            }
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }

        /**
         * Splits a script on semicolons, dropping {@code --} line comments.
         * The scripts hold no string literals containing either.
         */
        static List<String> splitStatements(String sql) {
            StringBuilder cleaned = new StringBuilder();
            for (String line : sql.split("\n")) {
                int comment = line.indexOf("--");
                String code = comment >= 0 ? line.substring(0, comment) : line;
                if (!code.isBlank()) {
                    cleaned.append(code).append('\n');
                }
            }
            List<String> statements = new ArrayList<>();
            for (String part : cleaned.toString().split(";")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    statements.add(trimmed);
                }
            }
            return statements;
        }
    }
}
