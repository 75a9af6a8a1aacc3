package com.agentic.customergraph.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;

import org.jboss.logging.Logger;

import com.agentic.customergraph.config.CustomerGraphConfig;
import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.storage.UploadRecordStore;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer of the SQLite Graph Database and Upload Record Store.
 *
 * <p>Active when {@code customer-graph.storage.backend=sqlite} at build time:</p>
 * <pre>
 * customer-graph.storage.backend=sqlite
 * customer-graph.storage.sqlite.path=data/customer-graph.db
 * </pre>
 *
 * <p>Both stores share one connection manager; migrations run once on startup.</p>
 */
@ApplicationScoped
@IfBuildProperty(name = "customer-graph.storage.backend", stringValue = "sqlite")
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @Inject
    CustomerGraphConfig config;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphDatabase graphDatabase;
    private SQLiteUploadRecordStore uploadRecordStore;

    @PostConstruct
    void initialize() {
        CustomerGraphConfig.Sqlite sqlite = config.storage().sqlite();
        LOG.infof("Initializing SQLite storage with database: %s", sqlite.path());

        connectionManager = new SQLiteConnectionManager(
            sqlite.path(), sqlite.busyTimeout(), sqlite.walMode(), sqlite.readPoolSize());

        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to run SQLite schema migrations", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        LOG.info("SQLite storage initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "customer-graph.storage.backend", stringValue = "sqlite")
    public GraphDatabase produceGraphDatabase() {
        if (graphDatabase == null) {
            graphDatabase = new SQLiteGraphDatabase(connectionManager);
            graphDatabase.initialize().join();
            LOG.info("Created SQLiteGraphDatabase instance");
        }
        return graphDatabase;
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "customer-graph.storage.backend", stringValue = "sqlite")
    public UploadRecordStore produceUploadRecordStore() {
        if (uploadRecordStore == null) {
            uploadRecordStore = new SQLiteUploadRecordStore(connectionManager);
            uploadRecordStore.initialize().join();
            LOG.info("Created SQLiteUploadRecordStore instance");
        }
        return uploadRecordStore;
    }
}
