package br.edu.ifba.cadgraph.extract.feature;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.BRepFace;
import br.edu.ifba.cadgraph.host.ExtrudeFeature;

/**
 * Extrusions: distance and taper parameters, and the start, end and side faces
 * linked back to the feature with {@code produced_by}.
 */
public final class ExtrudeFeatureExtractor extends AbstractFeatureExtractor<ExtrudeFeature> {

    public ExtrudeFeatureExtractor() {
        super(ExtrudeFeature.class, fusionTypes("ExtrudeFeature"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull ExtrudeFeature extrude, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(extrude);
        GraphNode node = featureNode(extrude, id, context)
            .property("operation", extrude.operation())
            .property("extent_type", extrude.extentType())
            .property("distance", extrude.distance())
            .property("taper_angle", extrude.taperAngle())
            .property("is_symmetric", extrude.isSymmetric())
            .build();

        RelationshipCollector relationships = featureRelationships(extrude, id, context)
            .to(id, extrude.distanceParameter(), RelationshipType.REFERENCES, Map.of("role", "distance"))
            .to(id, extrude.taperAngleParameter(), RelationshipType.REFERENCES, Map.of("role", "taper_angle"));
        producedFaces(relationships, id, extrude.startFaces(), "start");
        producedFaces(relationships, id, extrude.endFaces(), "end");
        producedFaces(relationships, id, extrude.sideFaces(), "side");
        return new Extraction(node, relationships.list());
    }

    private static void producedFaces(RelationshipCollector relationships, String featureId,
            List<BRepFace> faces, String role) {
        for (BRepFace face : faces) {
            relationships.from(face, featureId, RelationshipType.PRODUCED_BY, Map.of("role", role));
        }
    }
}
