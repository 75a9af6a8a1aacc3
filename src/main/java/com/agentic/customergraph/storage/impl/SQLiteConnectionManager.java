package com.agentic.customergraph.storage.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

/**
 * Hands out SQLite connections for the graph and upload-record tables.
 *
 * <p>Reads come from a small pool. Writes go through a single connection
 * guarded by a lock, since SQLite allows one writer at a time. Every
 * connection runs in WAL mode with foreign keys enforced.</p>
 *
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/customer-graph.db");
 * Connection conn = manager.getWriteConnection();
 * try {
 *     // write
 * } finally {
 *     manager.releaseWriteConnection(conn);
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int DEFAULT_CACHE_SIZE = -2000; // 2MB

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, true, DEFAULT_POOL_SIZE);
    }

    /**
     * @param databasePath path to the database file
     * @param busyTimeout how long SQLite waits on a locked database
     * @param walMode whether to enable write-ahead logging
     * @param readPoolSize number of pooled read connections
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        if (readPoolSize < 1) {
            throw new IllegalArgumentException("readPoolSize must be at least 1");
        }
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(readPoolSize);
        this.writeLock = new ReentrantLock();
    }

    /**
     * Opens a new connection with pragmas applied.
     */
    public Connection createConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
        ensureParentDirectory();

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setCacheSize(DEFAULT_CACHE_SIZE);

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            applyPragmas(conn);
            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create SQLite connection to " + databasePath, e);
        }
    }

    public Connection getReadConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Pooled read connection unusable, creating new one", e);
            }
        }
        return createConnection();
    }

    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (closed || conn.isClosed() || !readPool.offer(conn)) {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Returns the write connection with the write lock held. Callers must
     * hand it back through {@link #releaseWriteConnection(Connection)} on the
     * same thread.
     */
    public Connection getWriteConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new IllegalStateException("Failed to get write connection", e);
        }
    }

    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    private void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    private void ensureParentDirectory() {
        if (databasePath.startsWith(":memory:")) {
            return;
        }
        Path parentDir = Paths.get(databasePath).toAbsolutePath().getParent();
        if (parentDir != null && !Files.exists(parentDir)) {
            try {
                Files.createDirectories(parentDir);
                LOG.infof("Created database directory: %s", parentDir);
            } catch (IOException e) {
                throw new IllegalStateException("Could not create database directory " + parentDir, e);
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        if (writeConnection != null) {
            try {
                writeConnection.close();
            } catch (SQLException e) {
                LOG.debug("Error closing write connection", e);
            }
            writeConnection = null;
        }
        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }
        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}
