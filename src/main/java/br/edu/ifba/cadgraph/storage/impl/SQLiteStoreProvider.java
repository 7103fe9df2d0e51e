package br.edu.ifba.cadgraph.storage.impl;

import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.cadgraph.storage.GraphStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer of the SQLite graph store.
 *
 * <p>Active when {@code cadgraph.storage.backend=sqlite}, which is also the
 * default when the property is missing.</p>
 *
 * <p>Example configuration:</p>
 * <pre>
 * cadgraph.storage.backend=sqlite
 * cadgraph.storage.sqlite.path=data/cad-graph.db
 * </pre>
 */
@ApplicationScoped
@IfBuildProperty(name = "cadgraph.storage.backend", stringValue = "sqlite", enableIfMissing = true)
public class SQLiteStoreProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStoreProvider.class);

    @ConfigProperty(name = "cadgraph.storage.sqlite.path", defaultValue = "data/cad-graph.db")
    String databasePath;

    @ConfigProperty(name = "cadgraph.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "cadgraph.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "cadgraph.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphStore graphStore;

    /**
     * Produces the SQLite-backed GraphStore. Schema migrations run on the
     * store's first initialization.
     */
    @Produces
    @ApplicationScoped
    public GraphStore produceGraphStore() {
        if (graphStore == null) {
            LOG.infof("Creating SQLiteGraphStore with database: %s", databasePath);
            connectionManager = new SQLiteConnectionManager(
                databasePath,
                Duration.ofMillis(busyTimeoutMs),
                walMode,
                readPoolSize
            );
            graphStore = new SQLiteGraphStore(connectionManager);
        }
        return graphStore;
    }

    @PreDestroy
    void shutdown() {
        if (graphStore != null) {
            LOG.info("Shutting down SQLite graph store");
            graphStore.close();
        }
        if (connectionManager != null) {
            connectionManager.close();
        }
    }
}
