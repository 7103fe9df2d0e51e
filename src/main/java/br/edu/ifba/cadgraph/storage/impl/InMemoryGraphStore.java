package br.edu.ifba.cadgraph.storage.impl;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.storage.CommitStats;
import br.edu.ifba.cadgraph.storage.GraphStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory graph store.
 * One adjacency structure per document; a batch is applied atomically under the
 * document's monitor, so readers never observe half a batch.
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

    // documentId -> graph
    private final ConcurrentHashMap<String, DocumentGraph> documents = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphStore initialized");
            }
        });
    }

    @Override
    public CompletableFuture<CommitStats> upsertBatch(@NotNull String documentId, @NotNull GraphBatch batch) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            DocumentGraph graph = documents.computeIfAbsent(documentId, k -> new DocumentGraph());
            CommitStats stats;
            synchronized (graph) {
                stats = graph.apply(batch);
            }
            logger.debug("Upserted batch {} for document {}: {}", batch.sequence(), documentId, stats);
            return stats;
        });
    }

    @Override
    public CompletableFuture<GraphNode> getNode(@NotNull String documentId, @NotNull String stableId) {
        ensureInitialized();
        DocumentGraph graph = documents.get(documentId);
        if (graph == null) {
            return CompletableFuture.completedFuture(null);
        }
        synchronized (graph) {
            return CompletableFuture.completedFuture(graph.nodes.get(stableId));
        }
    }

    @Override
    public CompletableFuture<List<GraphNode>> getNodesByLabel(@NotNull String documentId, @NotNull String label) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> selectNodes(documentId,
            node -> !node.isPlaceholder() && node.label().equals(label)));
    }

    @Override
    public CompletableFuture<List<GraphNode>> getNodesByCategory(@NotNull String documentId,
            @NotNull NodeCategory category) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> selectNodes(documentId, node -> node.category() == category));
    }

    @Override
    public CompletableFuture<List<GraphRelationship>> getRelationshipsByType(@NotNull String documentId,
            @NotNull RelationshipType type) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            DocumentGraph graph = documents.get(documentId);
            if (graph == null) {
                return List.of();
            }
            synchronized (graph) {
                List<GraphRelationship> result = new ArrayList<>();
                for (GraphRelationship relationship : graph.relationships.values()) {
                    if (relationship.type() == type) {
                        result.add(relationship);
                    }
                }
                return result;
            }
        });
    }

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String documentId) {
        ensureInitialized();
        DocumentGraph graph = documents.get(documentId);
        if (graph == null) {
            return CompletableFuture.completedFuture(new GraphStats(0, 0, 0));
        }
        synchronized (graph) {
            long placeholders = graph.nodes.values().stream().filter(GraphNode::isPlaceholder).count();
            return CompletableFuture.completedFuture(
                new GraphStats(graph.nodes.size(), placeholders, graph.relationships.size()));
        }
    }

    @Override
    public void close() {
        documents.clear();
        initialized = false;
        logger.info("InMemoryGraphStore closed");
    }

    private List<GraphNode> selectNodes(String documentId, Predicate<GraphNode> filter) {
        DocumentGraph graph = documents.get(documentId);
        if (graph == null) {
            return List.of();
        }
        synchronized (graph) {
            List<GraphNode> result = new ArrayList<>();
            for (GraphNode node : graph.nodes.values()) {
                if (filter.test(node)) {
                    result.add(node);
                }
            }
            return result;
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Store not initialized. Call initialize() first.");
        }
    }

    /**
     * Nodes and relationships of one document. Guarded by its own monitor.
     */
    private static final class DocumentGraph {

        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Map<GraphRelationship.Key, GraphRelationship> relationships = new LinkedHashMap<>();

        CommitStats apply(GraphBatch batch) {
            int nodesCreated = 0;
            int nodesMerged = 0;
            int relationshipsCreated = 0;
            int relationshipsMerged = 0;

            for (GraphNode node : batch.nodes()) {
                GraphNode existing = nodes.get(node.stableId());
                if (existing == null || existing.isPlaceholder()) {
                    nodes.put(node.stableId(), node);
                    nodesCreated++;
                } else {
                    Map<String, Object> merged = new LinkedHashMap<>(existing.properties());
                    merged.putAll(node.properties());
                    nodes.put(node.stableId(), new GraphNode(node.stableId(), node.label(), node.category(), merged));
                    nodesMerged++;
                }
            }

            for (GraphRelationship relationship : batch.relationships()) {
                nodes.putIfAbsent(relationship.sourceId(), GraphNode.placeholder(relationship.sourceId()));
                nodes.putIfAbsent(relationship.targetId(), GraphNode.placeholder(relationship.targetId()));

                GraphRelationship existing = relationships.get(relationship.key());
                if (existing == null) {
                    relationships.put(relationship.key(), relationship);
                    relationshipsCreated++;
                } else {
                    Map<String, Object> merged = new LinkedHashMap<>(existing.properties());
                    merged.putAll(relationship.properties());
                    relationships.put(relationship.key(), GraphRelationship.of(
                        relationship.sourceId(), relationship.targetId(), relationship.type(), merged));
                    relationshipsMerged++;
                }
            }
            return new CommitStats(nodesCreated, nodesMerged, relationshipsCreated, relationshipsMerged);
        }
    }
}
