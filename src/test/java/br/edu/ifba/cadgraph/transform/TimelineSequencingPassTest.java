package br.edu.ifba.cadgraph.transform;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
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

class TimelineSequencingPassTest {

    private static final String DOC = "doc-timeline";

    private InMemoryGraphStore store;
    private DerivationContext context;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.initialize().join();
        StoreCallGuard retry = new StoreCallGuard(2, Duration.ofMillis(1), Duration.ofMillis(1), Duration.ofSeconds(5),
            new TransientStoreFailurePredicate(), new RetryEventLogger());
        context = new DerivationContext(store, DOC, retry);
    }

    private static GraphNode feature(String id, String component, Integer index) {
        return GraphNode.builder(id, "ExtrudeFeature", NodeCategory.FEATURE)
            .property(TimelineSequencingPass.COMPONENT_ID, component)
            .property(TimelineSequencingPass.TIMELINE_INDEX, index)
            .build();
    }

    private void load(GraphNode... nodes) {
        store.upsertBatch(DOC, new GraphBatch(1, List.of(nodes), List.of())).join();
    }

    private static String chain(List<GraphRelationship> edges) {
        StringBuilder sb = new StringBuilder();
        for (GraphRelationship edge : edges) {
            sb.append(edge.sourceId()).append("->").append(edge.targetId()).append(' ');
        }
        return sb.toString().trim();
    }

    @Test
    void testChainsFeaturesInTimelineOrder() throws Exception {
        load(feature("f-c", "root", 2), feature("f-a", "root", 0), feature("f-b", "root", 1));

        List<GraphRelationship> edges = new TimelineSequencingPass().derive(context);

        assertEquals("f-a->f-b f-b->f-c", chain(edges));
        assertTrue(edges.stream().allMatch(edge -> edge.type() == RelationshipType.NEXT_IN_TIMELINE));
    }

    @Test
    void testComponentsAreSequencedSeparately() throws Exception {
        load(feature("a1", "comp-a", 0), feature("a2", "comp-a", 3),
            feature("b1", "comp-b", 1), feature("b2", "comp-b", 2));

        List<GraphRelationship> edges = new TimelineSequencingPass().derive(context);

        assertEquals("a1->a2 b1->b2", chain(edges), "No edge crosses components");
    }

    @Test
    void testTiesBrokenByStableId() throws Exception {
        load(feature("y", "root", 4), feature("x", "root", 4));

        assertEquals("x->y", chain(new TimelineSequencingPass().derive(context)));
    }

    @Test
    void testFeaturesWithoutIndexLeftOut() throws Exception {
        load(feature("f1", "root", 0), feature("rolled-back", "root", null), feature("f2", "root", 1));

        assertEquals("f1->f2", chain(new TimelineSequencingPass().derive(context)));
    }

    @Test
    void testSingleFeatureYieldsNothing() throws Exception {
        load(feature("only", "root", 0));

        assertTrue(new TimelineSequencingPass().derive(context).isEmpty());
    }
}
