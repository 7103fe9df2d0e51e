package br.edu.ifba.cadgraph.storage.impl;

import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.cadgraph.storage.GraphStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer of the Neo4j graph store, active when {@code cadgraph.storage.backend=neo4j}.
 *
 * <p>Example configuration:</p>
 * <pre>
 * cadgraph.storage.backend=neo4j
 * cadgraph.storage.neo4j.uri=bolt://localhost:7687
 * cadgraph.storage.neo4j.username=neo4j
 * cadgraph.storage.neo4j.password=${NEO4J_PASSWORD}
 * </pre>
 */
@ApplicationScoped
@IfBuildProperty(name = "cadgraph.storage.backend", stringValue = "neo4j")
public class Neo4jStoreProvider {

    private static final Logger LOG = Logger.getLogger(Neo4jStoreProvider.class);

    @ConfigProperty(name = "cadgraph.storage.neo4j.uri", defaultValue = "bolt://localhost:7687")
    String uri;

    @ConfigProperty(name = "cadgraph.storage.neo4j.username", defaultValue = "neo4j")
    String username;

    @ConfigProperty(name = "cadgraph.storage.neo4j.password")
    String password;

    @ConfigProperty(name = "cadgraph.storage.neo4j.database")
    Optional<String> database;

    @ConfigProperty(name = "cadgraph.storage.neo4j.connection-timeout-ms", defaultValue = "10000")
    long connectionTimeoutMs;

    @ConfigProperty(name = "cadgraph.storage.neo4j.transaction-timeout-ms", defaultValue = "60000")
    long transactionTimeoutMs;

    private Neo4jGraphStore graphStore;

    @Produces
    @ApplicationScoped
    public GraphStore produceGraphStore() {
        if (graphStore == null) {
            Neo4jConnectionSettings settings = new Neo4jConnectionSettings(
                uri,
                username,
                password,
                database.filter(name -> !name.isBlank()).orElse(null),
                Duration.ofMillis(connectionTimeoutMs),
                Duration.ofMillis(transactionTimeoutMs)
            );
            LOG.infof("Creating Neo4jGraphStore: %s", settings);
            graphStore = Neo4jGraphStore.connect(settings);
        }
        return graphStore;
    }

    @PreDestroy
    void shutdown() {
        if (graphStore != null) {
            LOG.info("Shutting down Neo4j graph store");
            graphStore.close();
        }
    }
}
