package br.edu.ifba.cadgraph.storage.impl;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.TransactionConfig;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.storage.CommitStats;
import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.storage.GraphStoreException;
import br.edu.ifba.cadgraph.storage.GraphStoreUnavailableException;

/**
 * Neo4j implementation of GraphStore.
 *
 * <p>Every node carries the {@code :CadEntity} label plus its entity type label
 * (e.g. {@code :SketchLine}) and is merged on {@code (document_id, stable_id)}.
 * Relationship endpoints are merged too, so a relationship whose target has not
 * been loaded yet creates a placeholder node ({@code placeholder = true}) that
 * the node's own batch later enriches.</p>
 *
 * <p>Labels and relationship types cannot be Cypher parameters; they are
 * whitelisted through {@link #cypherIdentifier(String)} and grouped so each group
 * is one {@code UNWIND} statement. Each batch runs in one explicit transaction
 * with a server-side timeout.</p>
 */
public final class Neo4jGraphStore implements GraphStore {

    private static final Logger LOG = Logger.getLogger(Neo4jGraphStore.class);

    private static final String BASE_LABEL = "CadEntity";
    private static final Set<String> INTERNAL_KEYS = Set.of("document_id", "stable_id", "label", "category", "placeholder");

    private static final String COUNT_EXISTING_NODES = """
        UNWIND $ids AS id
        MATCH (n:CadEntity {document_id: $documentId, stable_id: id})
        WHERE n.placeholder = false
        RETURN count(n) AS c
        """;

    private static final String COUNT_EXISTING_RELATIONSHIPS = """
        UNWIND $rows AS row
        MATCH (:CadEntity {document_id: $documentId, stable_id: row.source})-[r]->(:CadEntity {document_id: $documentId, stable_id: row.target})
        WHERE type(r) = row.type
        RETURN count(r) AS c
        """;

    private static final String CURRENT_LABELS = """
        UNWIND $ids AS id
        MATCH (n:CadEntity {document_id: $documentId, stable_id: id})
        WHERE n.label IS NOT NULL
        RETURN n.stable_id AS stable_id, n.label AS label
        """;

    private static final String NODE_COLUMNS =
        "n.stable_id AS stable_id, n.label AS label, n.category AS category, properties(n) AS props";

    private final Driver driver;
    private final String endpoint;
    private final String database;
    private final Duration transactionTimeout;

    /**
     * Creates a store over an existing driver. The store owns the driver and closes it.
     *
     * @param driver the Neo4j driver
     * @param endpoint URI used in diagnostics
     * @param database target database, or null for the default one
     * @param transactionTimeout server-side transaction timeout
     */
    public Neo4jGraphStore(Driver driver, String endpoint, String database, Duration transactionTimeout) {
        this.driver = driver;
        this.endpoint = endpoint;
        this.database = database;
        this.transactionTimeout = transactionTimeout;
    }

    /**
     * Creates a driver from connection settings. Connectivity is checked by {@link #initialize()}.
     */
    public static Neo4jGraphStore connect(Neo4jConnectionSettings settings) {
        LOG.infof("Connecting to Neo4j at %s", settings.uri());
        Config config = Config.builder()
            .withConnectionTimeout(settings.connectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .build();
        Driver driver = GraphDatabase.driver(settings.uri(),
            AuthTokens.basic(settings.username(), settings.password()), config);
        return new Neo4jGraphStore(driver, settings.uri(), settings.database(), settings.transactionTimeout());
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            try {
                driver.verifyConnectivity();
            } catch (RuntimeException e) {
                throw new GraphStoreUnavailableException(endpoint, e);
            }

            try (Session session = openSession()) {
                session.run("CREATE INDEX cad_entity_key IF NOT EXISTS FOR (n:CadEntity) ON (n.document_id, n.stable_id)")
                    .consume();
                session.run("CREATE INDEX cad_entity_category IF NOT EXISTS FOR (n:CadEntity) ON (n.document_id, n.category)")
                    .consume();
            } catch (RuntimeException e) {
                throw new GraphStoreException("initialize", null, "index creation", e);
            }
            LOG.infof("Initialized Neo4jGraphStore at %s", endpoint);
        });
    }

    // ===== Write Operations =====

    @Override
    public CompletableFuture<CommitStats> upsertBatch(@NotNull String documentId, @NotNull GraphBatch batch) {
        return CompletableFuture.supplyAsync(() -> {
            if (batch.isEmpty()) {
                return CommitStats.EMPTY;
            }

            try (Session session = openSession();
                 Transaction tx = session.beginTransaction(transactionConfig())) {
                int nodesMerged = batch.nodes().isEmpty() ? 0 : countExistingNodes(tx, documentId, batch.nodes());
                writeNodes(tx, documentId, batch.nodes());

                int relationshipsMerged = batch.relationships().isEmpty()
                    ? 0
                    : countExistingRelationships(tx, documentId, batch.relationships());
                writeRelationships(tx, documentId, batch.relationships());

                tx.commit();

                CommitStats stats = new CommitStats(
                    batch.nodes().size() - nodesMerged, nodesMerged,
                    batch.relationships().size() - relationshipsMerged, relationshipsMerged);
                LOG.debugf("Committed batch %d for document %s: %s", batch.sequence(), documentId, stats);
                return stats;
            } catch (RuntimeException e) {
                throw new GraphStoreException("upsertBatch", documentId, "batch " + batch.sequence(), e);
            }
        });
    }

    private int countExistingNodes(Transaction tx, String documentId, List<GraphNode> nodes) {
        List<String> ids = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes) {
            ids.add(node.stableId());
        }
        return tx.run(COUNT_EXISTING_NODES, Map.of("documentId", documentId, "ids", ids))
            .single().get("c").asInt();
    }

    private int countExistingRelationships(Transaction tx, String documentId, List<GraphRelationship> relationships) {
        List<Map<String, Object>> rows = new ArrayList<>(relationships.size());
        for (GraphRelationship relationship : relationships) {
            rows.add(Map.of(
                "source", relationship.sourceId(),
                "target", relationship.targetId(),
                "type", relationship.type().wireName()));
        }
        return tx.run(COUNT_EXISTING_RELATIONSHIPS, Map.of("documentId", documentId, "rows", rows))
            .single().get("c").asInt();
    }

    private void writeNodes(Transaction tx, String documentId, List<GraphNode> nodes) {
        Map<String, List<Map<String, Object>>> rowsByLabel = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            Map<String, Object> row = new HashMap<>();
            row.put("stable_id", node.stableId());
            row.put("label", node.label());
            row.put("category", node.category().name());
            row.put("properties", node.properties());
            rowsByLabel.computeIfAbsent(cypherIdentifier(node.label()), k -> new ArrayList<>()).add(row);
        }

        Map<String, String> currentLabels = new HashMap<>();
        tx.run(CURRENT_LABELS, Map.of("documentId", documentId, "ids", nodes.stream().map(GraphNode::stableId).toList()))
            .list()
            .forEach(record -> currentLabels.put(record.get("stable_id").asString(), record.get("label").asString()));
        for (Map.Entry<String, List<String>> stale : staleLabels(currentLabels, nodes).entrySet()) {
            tx.run(removeLabelQuery(stale.getKey()), Map.of("documentId", documentId, "ids", stale.getValue()))
                .consume();
        }

        for (Map.Entry<String, List<Map<String, Object>>> group : rowsByLabel.entrySet()) {
            tx.run(upsertNodesQuery(group.getKey()), Map.of("documentId", documentId, "rows", group.getValue()))
                .consume();
        }
    }

    static String upsertNodesQuery(String label) {
        return """
            UNWIND $rows AS row
            MERGE (n:CadEntity {document_id: $documentId, stable_id: row.stable_id})
            SET n:`%s`, n += row.properties, n.label = row.label, n.category = row.category, n.placeholder = false
            """.formatted(label);
    }

    static String removeLabelQuery(String label) {
        return """
            UNWIND $ids AS id
            MATCH (n:CadEntity {document_id: $documentId, stable_id: id})
            REMOVE n:`%s`
            """.formatted(label);
    }

    /**
     * Type labels to strip before an upsert: nodes whose stored label differs
     * from the incoming one, grouped by the stored label.
     *
     * @param currentLabels stored label by stable id, for nodes that already exist
     * @param nodes incoming nodes
     * @return stable ids by sanitized label to remove
     */
    static Map<String, List<String>> staleLabels(Map<String, String> currentLabels, List<GraphNode> nodes) {
        Map<String, List<String>> stale = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            String current = currentLabels.get(node.stableId());
            if (current == null) {
                continue;
            }
            String currentLabel = cypherIdentifier(current);
            if (!currentLabel.equals(cypherIdentifier(node.label())) && !BASE_LABEL.equals(currentLabel)) {
                stale.computeIfAbsent(currentLabel, k -> new ArrayList<>()).add(node.stableId());
            }
        }
        return stale;
    }

    private void writeRelationships(Transaction tx, String documentId, List<GraphRelationship> relationships) {
        Map<RelationshipType, List<Map<String, Object>>> rowsByType = new LinkedHashMap<>();
        for (GraphRelationship relationship : relationships) {
            rowsByType.computeIfAbsent(relationship.type(), k -> new ArrayList<>()).add(Map.of(
                "source", relationship.sourceId(),
                "target", relationship.targetId(),
                "properties", relationship.properties()));
        }

        for (Map.Entry<RelationshipType, List<Map<String, Object>>> group : rowsByType.entrySet()) {
            String query = """
                UNWIND $rows AS row
                MERGE (a:CadEntity {document_id: $documentId, stable_id: row.source})
                  ON CREATE SET a.placeholder = true, a.label = 'Placeholder', a.category = 'PLACEHOLDER'
                MERGE (b:CadEntity {document_id: $documentId, stable_id: row.target})
                  ON CREATE SET b.placeholder = true, b.label = 'Placeholder', b.category = 'PLACEHOLDER'
                MERGE (a)-[r:`%s`]->(b)
                SET r += row.properties
                """.formatted(cypherIdentifier(group.getKey().wireName()));
            tx.run(query, Map.of("documentId", documentId, "rows", group.getValue())).consume();
        }
    }

    // ===== Query Operations =====

    @Override
    public CompletableFuture<GraphNode> getNode(@NotNull String documentId, @NotNull String stableId) {
        return CompletableFuture.supplyAsync(() -> {
            List<GraphNode> nodes = readNodes("getNode",
                "MATCH (n:CadEntity {document_id: $documentId, stable_id: $value}) RETURN " + NODE_COLUMNS,
                documentId, stableId);
            return nodes.isEmpty() ? null : nodes.get(0);
        });
    }

    @Override
    public CompletableFuture<List<GraphNode>> getNodesByLabel(@NotNull String documentId, @NotNull String label) {
        return CompletableFuture.supplyAsync(() -> readNodes("getNodesByLabel",
            "MATCH (n:CadEntity {document_id: $documentId}) WHERE n.label = $value AND n.placeholder = false RETURN "
                + NODE_COLUMNS + " ORDER BY stable_id",
            documentId, label));
    }

    @Override
    public CompletableFuture<List<GraphNode>> getNodesByCategory(@NotNull String documentId,
            @NotNull NodeCategory category) {
        return CompletableFuture.supplyAsync(() -> readNodes("getNodesByCategory",
            "MATCH (n:CadEntity {document_id: $documentId}) WHERE n.category = $value RETURN "
                + NODE_COLUMNS + " ORDER BY stable_id",
            documentId, category.name()));
    }

    @Override
    public CompletableFuture<List<GraphRelationship>> getRelationshipsByType(@NotNull String documentId,
            @NotNull RelationshipType type) {
        return CompletableFuture.supplyAsync(() -> {
            String query = """
                MATCH (a:CadEntity {document_id: $documentId})-[r:`%s`]->(b:CadEntity {document_id: $documentId})
                RETURN a.stable_id AS source, b.stable_id AS target, properties(r) AS props
                ORDER BY source, target
                """.formatted(cypherIdentifier(type.wireName()));
            try (Session session = openSession()) {
                return session.executeRead(tx -> tx.run(query, Map.of("documentId", documentId))
                    .list(record -> GraphRelationship.of(
                        record.get("source").asString(),
                        record.get("target").asString(),
                        type,
                        record.get("props").asMap())), transactionConfig());
            } catch (RuntimeException e) {
                throw new GraphStoreException("getRelationshipsByType", documentId, query, e);
            }
        });
    }

    // ===== Statistics Operations =====

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String documentId) {
        return CompletableFuture.supplyAsync(() -> {
            try (Session session = openSession()) {
                return session.executeRead(tx -> {
                    Record nodes = tx.run("""
                        MATCH (n:CadEntity {document_id: $documentId})
                        RETURN count(n) AS nodes, sum(CASE WHEN n.placeholder THEN 1 ELSE 0 END) AS placeholders
                        """, Map.of("documentId", documentId)).single();
                    long relationships = tx.run(
                        "MATCH (:CadEntity {document_id: $documentId})-[r]->(:CadEntity) RETURN count(r) AS c",
                        Map.of("documentId", documentId)).single().get("c").asLong();
                    return new GraphStats(nodes.get("nodes").asLong(), nodes.get("placeholders").asLong(),
                        relationships);
                }, transactionConfig());
            } catch (RuntimeException e) {
                throw new GraphStoreException("getStats", documentId, e);
            }
        });
    }

    @Override
    public void close() {
        LOG.infof("Closing Neo4j driver for %s", endpoint);
        driver.close();
    }

    // ===== Helper Methods =====

    /**
     * Restricts a label or relationship type to {@code [A-Za-z0-9_]} so it can be
     * spliced into a Cypher statement between backticks.
     *
     * @param name label or type name
     * @return sanitized identifier, never empty
     */
    static String cypherIdentifier(String name) {
        if (name == null || name.isBlank()) {
            return "Unknown";
        }
        String sanitized = name.trim().replaceAll("[^A-Za-z0-9_]", "_");
        return Character.isDigit(sanitized.charAt(0)) ? "_" + sanitized : sanitized;
    }

    private List<GraphNode> readNodes(String operation, String query, String documentId, String value) {
        try (Session session = openSession()) {
            return session.executeRead(tx -> tx.run(query, Map.of("documentId", documentId, "value", value))
                .list(this::toNode), transactionConfig());
        } catch (RuntimeException e) {
            throw new GraphStoreException(operation, documentId, query, e);
        }
    }

    private GraphNode toNode(Record record) {
        Map<String, Object> properties = new LinkedHashMap<>(record.get("props").asMap());
        properties.keySet().removeAll(INTERNAL_KEYS);
        return new GraphNode(
            record.get("stable_id").asString(),
            record.get("label").asString(),
            NodeCategory.valueOf(record.get("category").asString()),
            properties);
    }

    private Session openSession() {
        return database == null || database.isBlank()
            ? driver.session()
            : driver.session(SessionConfig.forDatabase(database));
    }

    private TransactionConfig transactionConfig() {
        return TransactionConfig.builder().withTimeout(transactionTimeout).build();
    }
}
