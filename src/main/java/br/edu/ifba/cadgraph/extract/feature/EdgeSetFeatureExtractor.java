package br.edu.ifba.cadgraph.extract.feature;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.BRepEdge;
import br.edu.ifba.cadgraph.host.EdgeSet;
import br.edu.ifba.cadgraph.host.EdgeSetFeature;

import static br.edu.ifba.cadgraph.extract.RelationshipCollector.props;

/**
 * Fillets and chamfers.
 *
 * <p>Every edge of every edge set becomes a {@code references} edge with role
 * {@code modified_edge}, carrying the set index, kind and the set's values.
 * Edges consumed by the operation no longer exist in the final B-Rep, so their
 * targets stay placeholders unless another entity resolves them.</p>
 */
public final class EdgeSetFeatureExtractor extends AbstractFeatureExtractor<EdgeSetFeature> {

    public EdgeSetFeatureExtractor() {
        super(EdgeSetFeature.class, fusionTypes("FilletFeature", "ChamferFeature"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull EdgeSetFeature feature, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(feature);
        List<EdgeSet> edgeSets = feature.edgeSets();
        List<Double> radii = new ArrayList<>();
        List<Double> distances = new ArrayList<>();
        int edgeCount = 0;

        RelationshipCollector relationships = featureRelationships(feature, id, context);
        for (int i = 0; i < edgeSets.size(); i++) {
            EdgeSet edgeSet = edgeSets.get(i);
            if (edgeSet.radius() != null) {
                radii.add(edgeSet.radius());
            }
            if (edgeSet.distance() != null) {
                distances.add(edgeSet.distance());
            }
            for (BRepEdge edge : edgeSet.edges()) {
                relationships.to(id, edge, RelationshipType.REFERENCES, props(
                    "role", "modified_edge",
                    "edge_set_index", i,
                    "edge_set_kind", edgeSet.kind(),
                    "radius", edgeSet.radius(),
                    "distance", edgeSet.distance(),
                    "second_distance", edgeSet.secondDistance(),
                    "angle", edgeSet.angle()));
                edgeCount++;
            }
            relationships.to(id, edgeSet.parameter(), RelationshipType.REFERENCES,
                props("role", edgeSet.radius() != null ? "radius" : "distance", "edge_set_index", i));
        }

        GraphNode node = featureNode(feature, id, context)
            .property("edge_set_count", edgeSets.size())
            .property("edge_count", edgeCount)
            .numbers("radii", radii)
            .numbers("distances", distances)
            .build();
        return new Extraction(node, relationships.list());
    }
}
