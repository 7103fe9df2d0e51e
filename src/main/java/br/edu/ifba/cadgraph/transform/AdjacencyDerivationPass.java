package br.edu.ifba.cadgraph.transform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.utils.RetryExhaustedException;

/**
 * Links profiles sharing a boundary curve, and faces sharing a boundary edge,
 * with {@code adjacent_to}.
 *
 * <p>One edge per unordered pair, directed from the smaller stable id to the
 * larger, carrying {@code shared_boundaries}. Only {@code bounded_by} targets
 * count; faces touching at a vertex alone are not adjacent.</p>
 */
public final class AdjacencyDerivationPass implements DerivationPass {

    static final List<String> DEFAULT_LABELS = List.of("Profile", "BRepFace");
    static final String SHARED_BOUNDARIES = "shared_boundaries";

    private final List<String> labels;

    public AdjacencyDerivationPass() {
        this(DEFAULT_LABELS);
    }

    public AdjacencyDerivationPass(@NotNull List<String> labels) {
        this.labels = List.copyOf(labels);
    }

    @NotNull
    @Override
    public String name() {
        return "adjacency";
    }

    @NotNull
    @Override
    public List<GraphRelationship> derive(@NotNull DerivationContext context) throws RetryExhaustedException {
        List<GraphRelationship> boundaries = context.relationshipsByType(RelationshipType.BOUNDED_BY);
        List<GraphRelationship> edges = new ArrayList<>();
        for (String label : labels) {
            Set<String> members = new HashSet<>();
            for (GraphNode node : context.nodesByLabel(label)) {
                members.add(node.stableId());
            }
            edges.addAll(adjacency(members, boundaries));
        }
        return edges;
    }

    static List<GraphRelationship> adjacency(Set<String> members, List<GraphRelationship> boundaries) {
        Map<String, SortedSet<String>> sourcesByBoundary = new TreeMap<>();
        for (GraphRelationship boundary : boundaries) {
            if (members.contains(boundary.sourceId())) {
                sourcesByBoundary.computeIfAbsent(boundary.targetId(), key -> new TreeSet<>()).add(boundary.sourceId());
            }
        }

        Map<String, Map<String, Integer>> shared = new TreeMap<>();
        for (SortedSet<String> sources : sourcesByBoundary.values()) {
            List<String> ordered = new ArrayList<>(sources);
            for (int i = 0; i < ordered.size(); i++) {
                for (int j = i + 1; j < ordered.size(); j++) {
                    shared.computeIfAbsent(ordered.get(i), key -> new TreeMap<>())
                        .merge(ordered.get(j), 1, Integer::sum);
                }
            }
        }

        List<GraphRelationship> edges = new ArrayList<>();
        shared.forEach((smaller, neighbours) -> neighbours.forEach((larger, count) ->
            edges.add(GraphRelationship.of(smaller, larger, RelationshipType.ADJACENT_TO,
                Map.of(SHARED_BOUNDARIES, count)))));
        return edges;
    }
}
