package br.edu.ifba.cadgraph.storage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;

/**
 * Graph store with per-document isolation.
 *
 * All operations take a documentId that partitions the graph; the same stable id
 * in two documents refers to two distinct nodes.
 *
 * Writes are upserts only: nodes are keyed by stable id, relationships by
 * (source, target, type). Nothing in this interface deletes data.
 *
 * Implementations: SQLiteGraphStore, Neo4jGraphStore, InMemoryGraphStore
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Initializes the backend (schema, indexes, connectivity check).
     * Must be called before any other operation.
     *
     * @return a CompletableFuture that completes when the store is usable; completes
     *         exceptionally with {@link GraphStoreUnavailableException} if the backend cannot be reached
     */
    CompletableFuture<Void> initialize();

    // ===== Write Operations =====

    /**
     * Upserts a batch in a single transaction: all records are committed or none is.
     *
     * <p>Nodes are written first. A relationship whose endpoint does not exist yet
     * creates a placeholder node for it, which a later node upsert enriches.
     * Replacing a placeholder counts as a creation.</p>
     *
     * @param documentId the document partition
     * @param batch the records to write
     * @return counts of created and merged records
     */
    CompletableFuture<CommitStats> upsertBatch(@NotNull String documentId, @NotNull GraphBatch batch);

    // ===== Query Operations =====

    /**
     * Gets a node by stable id.
     *
     * @param documentId the document partition
     * @param stableId the node key
     * @return the node (possibly a placeholder), or null if absent
     */
    CompletableFuture<GraphNode> getNode(@NotNull String documentId, @NotNull String stableId);

    /**
     * Gets all non-placeholder nodes carrying the given label.
     */
    CompletableFuture<List<GraphNode>> getNodesByLabel(@NotNull String documentId, @NotNull String label);

    /**
     * Gets all nodes of the given category.
     */
    CompletableFuture<List<GraphNode>> getNodesByCategory(@NotNull String documentId, @NotNull NodeCategory category);

    /**
     * Gets all relationships of the given type.
     */
    CompletableFuture<List<GraphRelationship>> getRelationshipsByType(@NotNull String documentId,
            @NotNull RelationshipType type);

    // ===== Statistics Operations =====

    /**
     * Counts nodes (placeholders included) and relationships of a document.
     */
    CompletableFuture<GraphStats> getStats(@NotNull String documentId);

    /**
     * Graph size statistics.
     */
    record GraphStats(long nodeCount, long placeholderCount, long relationshipCount) {
    }
}
