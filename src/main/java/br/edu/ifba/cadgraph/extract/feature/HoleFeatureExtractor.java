package br.edu.ifba.cadgraph.extract.feature;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.HoleFeature;

public final class HoleFeatureExtractor extends AbstractFeatureExtractor<HoleFeature> {

    public HoleFeatureExtractor() {
        super(HoleFeature.class, fusionTypes("HoleFeature"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull HoleFeature hole, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(hole);
        GraphNode node = featureNode(hole, id, context)
            .property("hole_type", hole.holeType())
            .property("extent_type", hole.extentType())
            .point("position", hole.position())
            .point("direction", hole.direction())
            .property("diameter", hole.diameter())
            .property("depth", hole.depth())
            .property("tip_angle", hole.tipAngle())
            .property("counterbore_diameter", hole.counterboreDiameter())
            .property("counterbore_depth", hole.counterboreDepth())
            .property("countersink_diameter", hole.countersinkDiameter())
            .property("countersink_angle", hole.countersinkAngle())
            .build();
        return new Extraction(node, featureRelationships(hole, id, context)
            .to(id, hole.diameterParameter(), RelationshipType.REFERENCES, Map.of("role", "diameter"))
            .to(id, hole.depthParameter(), RelationshipType.REFERENCES, Map.of("role", "depth"))
            .list());
    }
}
