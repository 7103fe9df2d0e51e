package br.edu.ifba.cadgraph.transform;

import java.util.List;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.utils.RetryExhaustedException;
import br.edu.ifba.cadgraph.utils.StoreCallGuard;

/**
 * Read access to the persisted graph of one document, with reads retried like writes.
 */
public final class DerivationContext {

    private final GraphStore store;
    private final String documentId;
    private final StoreCallGuard storeGuard;

    public DerivationContext(@NotNull GraphStore store, @NotNull String documentId,
            @NotNull StoreCallGuard storeGuard) {
        this.store = store;
        this.documentId = documentId;
        this.storeGuard = storeGuard;
    }

    public String documentId() {
        return documentId;
    }

    public List<GraphNode> nodesByCategory(@NotNull NodeCategory category) throws RetryExhaustedException {
        return storeGuard.execute("getNodesByCategory:" + category,
            () -> store.getNodesByCategory(documentId, category));
    }

    public List<GraphNode> nodesByLabel(@NotNull String label) throws RetryExhaustedException {
        return storeGuard.execute("getNodesByLabel:" + label, () -> store.getNodesByLabel(documentId, label));
    }

    public List<GraphRelationship> relationshipsByType(@NotNull RelationshipType type) throws RetryExhaustedException {
        return storeGuard.execute("getRelationshipsByType:" + type,
            () -> store.getRelationshipsByType(documentId, type));
    }
}
