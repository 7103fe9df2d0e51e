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
import br.edu.ifba.cadgraph.host.CadEntity;
import br.edu.ifba.cadgraph.host.CircularPatternFeature;
import br.edu.ifba.cadgraph.host.PathPatternFeature;
import br.edu.ifba.cadgraph.host.PatternFeature;
import br.edu.ifba.cadgraph.host.RectangularPatternFeature;

/**
 * Rectangular, circular and path patterns.
 *
 * <p>Input entities are referenced with role {@code pattern_input} in host order.
 * Counts and spacing go on the node; the directions, axis or path are referenced
 * with their own roles.</p>
 */
public final class PatternFeatureExtractor extends AbstractFeatureExtractor<PatternFeature> {

    public PatternFeatureExtractor() {
        super(PatternFeature.class,
            fusionTypes("RectangularPatternFeature", "CircularPatternFeature", "PathPatternFeature"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull PatternFeature pattern, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(pattern);
        List<CadEntity> inputs = pattern.inputEntities();
        GraphNode.Builder node = featureNode(pattern, id, context)
            .property("quantity", pattern.quantity())
            .property("is_symmetric", pattern.isSymmetric())
            .property("input_count", inputs.size());

        RelationshipCollector relationships = featureRelationships(pattern, id, context);
        for (int i = 0; i < inputs.size(); i++) {
            relationships.to(id, inputs.get(i), RelationshipType.REFERENCES,
                Map.of("role", "pattern_input", "sequence_index", i));
        }

        if (pattern instanceof RectangularPatternFeature rectangular) {
            node.property("quantity_two", rectangular.quantityTwo())
                .property("distance_one", rectangular.distanceOne())
                .property("distance_two", rectangular.distanceTwo())
                .property("distance_type", rectangular.distanceType());
            relationships
                .to(id, rectangular.directionOne(), RelationshipType.REFERENCES, Map.of("role", "direction_one"))
                .to(id, rectangular.directionTwo(), RelationshipType.REFERENCES, Map.of("role", "direction_two"));
        } else if (pattern instanceof CircularPatternFeature circular) {
            node.property("total_angle", circular.totalAngle());
            relationships.to(id, circular.axis(), RelationshipType.REFERENCES, Map.of("role", "axis"));
        } else if (pattern instanceof PathPatternFeature path) {
            node.property("distance", path.distance())
                .property("distance_type", path.distanceType())
                .property("is_orientation_along_path", path.isOrientationAlongPath());
            relationships.to(id, path.path(), RelationshipType.REFERENCES, Map.of("role", "path"));
        }
        return new Extraction(node.build(), relationships.list());
    }
}
