package br.edu.ifba.cadgraph.extract.sketch;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.SketchCurve;
import br.edu.ifba.cadgraph.host.SketchPoint;

/**
 * Curve types without a dedicated extractor, currently conic curves.
 */
public final class SketchCurveExtractor extends AbstractSketchEntityExtractor<SketchCurve> {

    public SketchCurveExtractor() {
        super(SketchCurve.class, fusionTypes("SketchConicCurve"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchCurve curve, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(curve);
        List<SketchPoint> definingPoints = curve.definingPoints();
        GraphNode node = node(curve, id)
            .property("length", curve.length())
            .property("defining_point_count", definingPoints.size())
            .build();
        RelationshipCollector relationships = context.relationships()
            .to(id, curve.parentSketch(), RelationshipType.REFERENCES);
        for (int i = 0; i < definingPoints.size(); i++) {
            relationships.to(id, definingPoints.get(i), RelationshipType.REFERENCES,
                Map.of("role", "defining", "sequence_index", i));
        }
        return new Extraction(node, relationships.list());
    }
}
