package br.edu.ifba.cadgraph.storage.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import br.edu.ifba.cadgraph.storage.GraphStoreUnavailableException;

/**
 * Manages SQLite connections for the graph store.
 * Thread-safe with connection pooling for read operations.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>WAL mode enabled by default so transformer reads do not block batch commits</li>
 *   <li>Connection pool for read operations</li>
 *   <li>Exclusive write connection with ReentrantLock</li>
 *   <li>Configurable busy timeout for lock waiting</li>
 *   <li>Foreign key enforcement enabled</li>
 * </ul>
 *
 * <p>Usage:</p>
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/cad-graph.db");
 * try (Connection conn = manager.createConnection()) {
 *     // Use connection
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final boolean DEFAULT_WAL_MODE = true;
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int DEFAULT_CACHE_SIZE = -8000; // 8MB

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    /**
     * Creates a connection manager with default settings.
     *
     * @param databasePath path to SQLite database file
     */
    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, DEFAULT_WAL_MODE, DEFAULT_POOL_SIZE);
    }

    /**
     * Creates a connection manager with custom settings.
     *
     * @param databasePath path to SQLite database file
     * @param busyTimeout how long to wait for locks
     * @param walMode whether to enable WAL mode
     * @param readPoolSize number of connections kept in the read pool
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        if (readPoolSize < 1) {
            throw new IllegalArgumentException("readPoolSize must be positive, got " + readPoolSize);
        }
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(readPoolSize);
        this.writeLock = new ReentrantLock();
    }

    /**
     * Creates a new connection with pragmas configured.
     *
     * @return configured Connection
     * @throws GraphStoreUnavailableException if the database cannot be opened
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
            throw new GraphStoreUnavailableException("jdbc:sqlite:" + databasePath, e);
        }
    }

    /**
     * Opens a connection and runs a trivial query.
     *
     * @throws GraphStoreUnavailableException if the database is not usable
     */
    public void verifyConnectivity() {
        try (Connection conn = createConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            if (!rs.next()) {
                throw new SQLException("Connectivity check returned no row");
            }
        } catch (SQLException e) {
            throw new GraphStoreUnavailableException("jdbc:sqlite:" + databasePath, e);
        }
    }

    /**
     * Gets a connection for read operations from the pool.
     * Creates a new connection if pool is empty.
     *
     * @return pooled read Connection
     */
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
                LOG.debug("Pooled read connection unusable, opening a new one", e);
            }
        }
        return createConnection();
    }

    /**
     * Returns a read connection to the pool, closing it when the pool is full.
     *
     * @param conn the connection to release
     */
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
     * Gets the exclusive connection for write operations.
     * The write lock stays held until {@link #releaseWriteConnection(Connection)}.
     *
     * @return write Connection with lock held
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
            throw new GraphStoreUnavailableException("jdbc:sqlite:" + databasePath, e);
        }
    }

    /**
     * Releases the write connection lock.
     *
     * @param conn the write connection (must match current write connection)
     */
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
                throw new GraphStoreUnavailableException("jdbc:sqlite:" + databasePath, e);
            }
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    /**
     * Closes the connection manager and all connections.
     */
    @Override
    public void close() {
        closed = true;

        writeLock.lock();
        try {
            if (writeConnection != null) {
                writeConnection.close();
                writeConnection = null;
            }
        } catch (SQLException e) {
            LOG.debug("Error closing write connection", e);
        } finally {
            writeLock.unlock();
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
