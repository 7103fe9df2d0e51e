package br.edu.ifba.cadgraph.storage.impl;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.storage.CommitStats;
import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.storage.GraphStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of GraphStore.
 *
 * <p>Uses relational tables (graph_nodes, graph_relationships) keyed by
 * (document_id, stable_id) and (document_id, source_id, target_id, rel_type).
 * Properties are stored as JSON objects and merged with {@code json_patch} on
 * conflict, so an upsert never drops a property written by an earlier run.</p>
 *
 * <p>Features:</p>
 * <ul>
 *   <li>One transaction per batch on the exclusive write connection</li>
 *   <li>Placeholder rows for relationship endpoints loaded by a later batch</li>
 *   <li>Created/merged accounting from a pre-read inside the same transaction</li>
 *   <li>Document isolation via document_id filtering</li>
 * </ul>
 */
public final class SQLiteGraphStore implements GraphStore {

    private static final Logger LOG = Logger.getLogger(SQLiteGraphStore.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {};

    private static final String NODE_STATE_SQL =
        "SELECT placeholder FROM graph_nodes WHERE document_id = ? AND stable_id = ?";

    private static final String UPSERT_NODE_SQL = """
        INSERT INTO graph_nodes (document_id, stable_id, label, category, properties, placeholder)
        VALUES (?, ?, ?, ?, ?, 0)
        ON CONFLICT(document_id, stable_id) DO UPDATE SET
            label = excluded.label,
            category = excluded.category,
            properties = json_patch(graph_nodes.properties, excluded.properties),
            placeholder = 0,
            updated_at = datetime('now')
        """;

    private static final String INSERT_PLACEHOLDER_SQL = """
        INSERT INTO graph_nodes (document_id, stable_id, label, category, properties, placeholder)
        VALUES (?, ?, 'Placeholder', 'PLACEHOLDER', '{}', 1)
        ON CONFLICT(document_id, stable_id) DO NOTHING
        """;

    private static final String RELATIONSHIP_EXISTS_SQL = """
        SELECT 1 FROM graph_relationships
        WHERE document_id = ? AND source_id = ? AND target_id = ? AND rel_type = ?
        """;

    private static final String UPSERT_RELATIONSHIP_SQL = """
        INSERT INTO graph_relationships (document_id, source_id, target_id, rel_type, properties)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT(document_id, source_id, target_id, rel_type) DO UPDATE SET
            properties = json_patch(graph_relationships.properties, excluded.properties),
            updated_at = datetime('now')
        """;

    private final SQLiteConnectionManager connectionManager;
    private final boolean runMigrations;

    /**
     * Creates a new SQLiteGraphStore that migrates the schema on {@link #initialize()}.
     *
     * @param connectionManager the SQLite connection manager
     */
    public SQLiteGraphStore(SQLiteConnectionManager connectionManager) {
        this(connectionManager, true);
    }

    /**
     * @param connectionManager the SQLite connection manager
     * @param runMigrations whether {@link #initialize()} applies pending schema migrations
     */
    public SQLiteGraphStore(SQLiteConnectionManager connectionManager, boolean runMigrations) {
        this.connectionManager = connectionManager;
        this.runMigrations = runMigrations;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            connectionManager.verifyConnectivity();
            if (runMigrations) {
                Connection conn = connectionManager.getWriteConnection();
                try {
                    new SQLiteSchemaMigrator().migrateToLatest(conn);
                } catch (SQLException e) {
                    throw new GraphStoreException("initialize", null, "schema migration", e);
                } finally {
                    connectionManager.releaseWriteConnection(conn);
                }
            }
            LOG.infof("Initialized SQLiteGraphStore at %s", connectionManager.getDatabasePath());
        });
    }

    // ========== Write Operations ==========

    @Override
    public CompletableFuture<CommitStats> upsertBatch(@NotNull String documentId, @NotNull GraphBatch batch) {
        return CompletableFuture.supplyAsync(() -> {
            if (batch.isEmpty()) {
                return CommitStats.EMPTY;
            }

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                int[] nodeCounts = writeNodes(conn, documentId, batch.nodes());
                writePlaceholders(conn, documentId, batch.relationships());
                int[] relationshipCounts = writeRelationships(conn, documentId, batch.relationships());
                conn.commit();

                CommitStats stats = new CommitStats(nodeCounts[0], nodeCounts[1],
                    relationshipCounts[0], relationshipCounts[1]);
                LOG.debugf("Committed batch %d for document %s: %s", batch.sequence(), documentId, stats);
                return stats;
            } catch (SQLException | RuntimeException e) {
                rollback(conn);
                throw new GraphStoreException("upsertBatch", documentId, "batch " + batch.sequence(), e);
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException e) {
                    LOG.warn("Failed to reset auto-commit", e);
                }
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    /**
     * @return {created, merged}
     */
    private int[] writeNodes(Connection conn, String documentId, List<GraphNode> nodes) throws SQLException {
        int created = 0;
        int merged = 0;
        if (nodes.isEmpty()) {
            return new int[] {0, 0};
        }

        try (PreparedStatement state = conn.prepareStatement(NODE_STATE_SQL);
             PreparedStatement upsert = conn.prepareStatement(UPSERT_NODE_SQL)) {
            for (GraphNode node : nodes) {
                state.setString(1, documentId);
                state.setString(2, node.stableId());
                try (ResultSet rs = state.executeQuery()) {
                    if (rs.next() && rs.getInt(1) == 0) {
                        merged++;
                    } else {
                        created++;
                    }
                }

                upsert.setString(1, documentId);
                upsert.setString(2, node.stableId());
                upsert.setString(3, node.label());
                upsert.setString(4, node.category().name());
                upsert.setString(5, toJson(node.properties()));
                upsert.addBatch();
            }
            upsert.executeBatch();
        }
        return new int[] {created, merged};
    }

    private void writePlaceholders(Connection conn, String documentId, List<GraphRelationship> relationships)
            throws SQLException {
        if (relationships.isEmpty()) {
            return;
        }

        Set<String> endpoints = new LinkedHashSet<>();
        for (GraphRelationship relationship : relationships) {
            endpoints.add(relationship.sourceId());
            endpoints.add(relationship.targetId());
        }

        try (PreparedStatement stmt = conn.prepareStatement(INSERT_PLACEHOLDER_SQL)) {
            for (String stableId : endpoints) {
                stmt.setString(1, documentId);
                stmt.setString(2, stableId);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    /**
     * @return {created, merged}
     */
    private int[] writeRelationships(Connection conn, String documentId, List<GraphRelationship> relationships)
            throws SQLException {
        int created = 0;
        int merged = 0;
        if (relationships.isEmpty()) {
            return new int[] {0, 0};
        }

        try (PreparedStatement exists = conn.prepareStatement(RELATIONSHIP_EXISTS_SQL);
             PreparedStatement upsert = conn.prepareStatement(UPSERT_RELATIONSHIP_SQL)) {
            for (GraphRelationship relationship : relationships) {
                exists.setString(1, documentId);
                exists.setString(2, relationship.sourceId());
                exists.setString(3, relationship.targetId());
                exists.setString(4, relationship.type().wireName());
                try (ResultSet rs = exists.executeQuery()) {
                    if (rs.next()) {
                        merged++;
                    } else {
                        created++;
                    }
                }

                upsert.setString(1, documentId);
                upsert.setString(2, relationship.sourceId());
                upsert.setString(3, relationship.targetId());
                upsert.setString(4, relationship.type().wireName());
                upsert.setString(5, toJson(relationship.properties()));
                upsert.addBatch();
            }
            upsert.executeBatch();
        }
        return new int[] {created, merged};
    }

    // ========== Query Operations ==========

    @Override
    public CompletableFuture<GraphNode> getNode(@NotNull String documentId, @NotNull String stableId) {
        return CompletableFuture.supplyAsync(() -> {
            List<GraphNode> nodes = queryNodes("getNode",
                "SELECT stable_id, label, category, properties FROM graph_nodes WHERE document_id = ? AND stable_id = ?",
                documentId, stableId);
            return nodes.isEmpty() ? null : nodes.get(0);
        });
    }

    @Override
    public CompletableFuture<List<GraphNode>> getNodesByLabel(@NotNull String documentId, @NotNull String label) {
        return CompletableFuture.supplyAsync(() -> queryNodes("getNodesByLabel",
            """
            SELECT stable_id, label, category, properties FROM graph_nodes
            WHERE document_id = ? AND label = ? AND placeholder = 0
            ORDER BY stable_id
            """,
            documentId, label));
    }

    @Override
    public CompletableFuture<List<GraphNode>> getNodesByCategory(@NotNull String documentId,
            @NotNull NodeCategory category) {
        return CompletableFuture.supplyAsync(() -> queryNodes("getNodesByCategory",
            """
            SELECT stable_id, label, category, properties FROM graph_nodes
            WHERE document_id = ? AND category = ?
            ORDER BY stable_id
            """,
            documentId, category.name()));
    }

    @Override
    public CompletableFuture<List<GraphRelationship>> getRelationshipsByType(@NotNull String documentId,
            @NotNull RelationshipType type) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT source_id, target_id, properties FROM graph_relationships
                WHERE document_id = ? AND rel_type = ?
                ORDER BY source_id, target_id
                """;

            List<GraphRelationship> relationships = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, documentId);
                stmt.setString(2, type.wireName());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        relationships.add(GraphRelationship.of(
                            rs.getString("source_id"),
                            rs.getString("target_id"),
                            type,
                            fromJson(rs.getString("properties"))));
                    }
                }
            } catch (SQLException e) {
                throw new GraphStoreException("getRelationshipsByType", documentId, sql, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return relationships;
        });
    }

    // ========== Statistics Operations ==========

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String documentId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try {
                long nodeCount = count(conn, "SELECT COUNT(*) FROM graph_nodes WHERE document_id = ?", documentId);
                long placeholderCount = count(conn,
                    "SELECT COUNT(*) FROM graph_nodes WHERE document_id = ? AND placeholder = 1", documentId);
                long relationshipCount = count(conn,
                    "SELECT COUNT(*) FROM graph_relationships WHERE document_id = ?", documentId);
                return new GraphStats(nodeCount, placeholderCount, relationshipCount);
            } catch (SQLException e) {
                throw new GraphStoreException("getStats", documentId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public void close() {
        LOG.info("Closed SQLiteGraphStore");
    }

    // ========== Helper Methods ==========

    private List<GraphNode> queryNodes(String operation, String sql, String documentId, String argument) {
        List<GraphNode> nodes = new ArrayList<>();
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, documentId);
            stmt.setString(2, argument);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    nodes.add(new GraphNode(
                        rs.getString("stable_id"),
                        rs.getString("label"),
                        NodeCategory.valueOf(rs.getString("category")),
                        fromJson(rs.getString("properties"))));
                }
            }
        } catch (SQLException e) {
            throw new GraphStoreException(operation, documentId, sql, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
        return nodes;
    }

    private long count(Connection conn, String sql, String documentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, documentId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            LOG.warn("Failed to rollback", rollbackEx);
        }
    }

    private static String toJson(Map<String, Object> properties) {
        try {
            return OBJECT_MAPPER.writeValueAsString(properties);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Properties are not serializable: " + properties.keySet(), e);
        }
    }

    private static Map<String, Object> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return OBJECT_MAPPER.readValue(json, PROPERTIES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt properties column: " + json, e);
        }
    }
}
