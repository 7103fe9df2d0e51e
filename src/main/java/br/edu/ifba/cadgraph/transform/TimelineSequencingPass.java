package br.edu.ifba.cadgraph.transform;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.utils.RetryExhaustedException;

/**
 * Chains the features of each component in timeline order with {@code next_in_timeline}.
 *
 * <p>Features are grouped by {@code component_id} and ordered by
 * {@code timeline_index}, ties broken by stable id. Features without an index are
 * left out. A group of N features yields N-1 edges.</p>
 */
public final class TimelineSequencingPass implements DerivationPass {

    private static final Logger logger = LoggerFactory.getLogger(TimelineSequencingPass.class);

    static final String COMPONENT_ID = "component_id";
    static final String TIMELINE_INDEX = "timeline_index";

    @NotNull
    @Override
    public String name() {
        return "timeline-sequencing";
    }

    @NotNull
    @Override
    public List<GraphRelationship> derive(@NotNull DerivationContext context) throws RetryExhaustedException {
        Map<String, List<IndexedFeature>> byComponent = new TreeMap<>();
        int unindexed = 0;
        for (GraphNode feature : context.nodesByCategory(NodeCategory.FEATURE)) {
            if (!(feature.property(TIMELINE_INDEX) instanceof Number index)) {
                unindexed++;
                continue;
            }
            String componentId = Objects.toString(feature.property(COMPONENT_ID), "");
            byComponent.computeIfAbsent(componentId, key -> new ArrayList<>())
                .add(new IndexedFeature(feature.stableId(), index.longValue()));
        }
        if (unindexed > 0) {
            logger.debug("Document {}: {} features without timeline index left out of sequencing",
                context.documentId(), unindexed);
        }

        List<GraphRelationship> edges = new ArrayList<>();
        for (List<IndexedFeature> group : byComponent.values()) {
            group.sort(Comparator.comparingLong(IndexedFeature::index).thenComparing(IndexedFeature::stableId));
            for (int i = 1; i < group.size(); i++) {
                edges.add(GraphRelationship.of(group.get(i - 1).stableId(), group.get(i).stableId(),
                    RelationshipType.NEXT_IN_TIMELINE));
            }
        }
        return edges;
    }

    private record IndexedFeature(String stableId, long index) {
    }
}
