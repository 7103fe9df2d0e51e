package br.edu.ifba.cadgraph.transform;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.storage.impl.InMemoryGraphStore;
import br.edu.ifba.cadgraph.utils.RetryEventLogger;
import br.edu.ifba.cadgraph.utils.StoreCallGuard;
import br.edu.ifba.cadgraph.utils.TransientStoreFailurePredicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdjacencyDerivationPassTest {

    private static GraphRelationship bounded(String source, String target) {
        return GraphRelationship.of(source, target, RelationshipType.BOUNDED_BY);
    }

    @Test
    void testOneEdgePerPairFromSmallerId() {
        List<GraphRelationship> edges = AdjacencyDerivationPass.adjacency(Set.of("face-b", "face-a"), List.of(
            bounded("face-b", "e1"),
            bounded("face-a", "e1")));

        assertEquals(1, edges.size());
        GraphRelationship edge = edges.get(0);
        assertEquals("face-a", edge.sourceId());
        assertEquals("face-b", edge.targetId());
        assertEquals(RelationshipType.ADJACENT_TO, edge.type());
        assertEquals(1, edge.properties().get(AdjacencyDerivationPass.SHARED_BOUNDARIES));
    }

    @Test
    void testSharedBoundariesCounted() {
        List<GraphRelationship> edges = AdjacencyDerivationPass.adjacency(Set.of("p1", "p2"), List.of(
            bounded("p1", "c1"), bounded("p1", "c2"), bounded("p1", "c3"),
            bounded("p2", "c2"), bounded("p2", "c3"), bounded("p2", "c4")));

        assertEquals(1, edges.size());
        assertEquals(2, edges.get(0).properties().get(AdjacencyDerivationPass.SHARED_BOUNDARIES));
    }

    @Test
    void testOnlyMembersConsidered() {
        // edge e1 is itself bounded by vertex v1; edges are not members
        List<GraphRelationship> edges = AdjacencyDerivationPass.adjacency(Set.of("f1", "f2"), List.of(
            bounded("f1", "e1"),
            bounded("e1", "v1"),
            bounded("e2", "v1"),
            bounded("f2", "e2")));

        assertTrue(edges.isEmpty(), "Faces meeting only at a vertex are not adjacent");
    }

    @Test
    void testThreeMembersOnOneBoundary() {
        List<GraphRelationship> edges = AdjacencyDerivationPass.adjacency(Set.of("a", "b", "c"), List.of(
            bounded("a", "x"), bounded("b", "x"), bounded("c", "x")));

        assertEquals(3, edges.size());
        assertEquals(List.of("a->b", "a->c", "b->c"),
            edges.stream().map(edge -> edge.sourceId() + "->" + edge.targetId()).toList());
    }

    @Test
    void testDeriveReadsLabelsFromStore() throws Exception {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.initialize().join();
        store.upsertBatch("doc", new GraphBatch(1,
            List.of(
                GraphNode.builder("prof1", "Profile", NodeCategory.PROFILE).build(),
                GraphNode.builder("prof2", "Profile", NodeCategory.PROFILE).build(),
                GraphNode.builder("face1", "BRepFace", NodeCategory.BREP).build(),
                GraphNode.builder("face2", "BRepFace", NodeCategory.BREP).build()),
            List.of(
                bounded("prof1", "line1"), bounded("prof2", "line1"),
                bounded("face1", "edge1"), bounded("face2", "edge1"),
                // a profile and a face never pair up
                bounded("prof1", "edge1")))).join();
        StoreCallGuard retry = new StoreCallGuard(2, Duration.ofMillis(1), Duration.ofMillis(1), Duration.ofSeconds(5),
            new TransientStoreFailurePredicate(), new RetryEventLogger());

        List<GraphRelationship> edges = new AdjacencyDerivationPass().derive(new DerivationContext(store, "doc", retry));

        assertEquals(List.of("prof1->prof2", "face1->face2"),
            edges.stream().map(edge -> edge.sourceId() + "->" + edge.targetId()).toList());
    }
}
