package br.edu.ifba.cadgraph.extract.feature;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.BRepBody;
import br.edu.ifba.cadgraph.host.RevolveFeature;

/**
 * Revolutions: axis, angle and the bodies taking part in the boolean operation.
 */
public final class RevolveFeatureExtractor extends AbstractFeatureExtractor<RevolveFeature> {

    public RevolveFeatureExtractor() {
        super(RevolveFeature.class, fusionTypes("RevolveFeature"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull RevolveFeature revolve, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(revolve);
        GraphNode node = featureNode(revolve, id, context)
            .property("operation", revolve.operation())
            .property("extent_type", revolve.extentType())
            .property("angle", revolve.angle())
            .property("is_symmetric", revolve.isSymmetric())
            .property("is_solid", revolve.isSolid())
            .build();

        RelationshipCollector relationships = featureRelationships(revolve, id, context)
            .to(id, revolve.axis(), RelationshipType.REFERENCES, Map.of("role", "axis"))
            .to(id, revolve.angleParameter(), RelationshipType.REFERENCES, Map.of("role", "angle"));
        for (BRepBody body : revolve.participantBodies()) {
            relationships.to(id, body, RelationshipType.REFERENCES, Map.of("role", "participant"));
        }
        return new Extraction(node, relationships.list());
    }
}
