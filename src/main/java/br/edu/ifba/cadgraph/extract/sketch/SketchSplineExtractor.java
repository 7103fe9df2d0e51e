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
import br.edu.ifba.cadgraph.host.SketchPoint;
import br.edu.ifba.cadgraph.host.SketchSpline;

/**
 * Splines: end points, and fit or control points in host order.
 */
public final class SketchSplineExtractor extends AbstractSketchEntityExtractor<SketchSpline> {

    private static final String CONTROL_POINT_SPLINE = FUSION_PREFIX + "SketchControlPointSpline";

    public SketchSplineExtractor() {
        super(SketchSpline.class, fusionTypes("SketchFittedSpline", "SketchFixedSpline", "SketchControlPointSpline"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchSpline spline, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(spline);
        List<SketchPoint> points = spline.definingPoints();
        String pointRole = CONTROL_POINT_SPLINE.equals(spline.objectType()) ? "control" : "fit";
        GraphNode node = node(spline, id)
            .property("is_closed", spline.isClosed())
            .property("degree", spline.degree())
            .property(pointRole + "_point_count", points.size())
            .property("length", spline.length())
            .build();

        RelationshipCollector relationships = context.relationships()
            .to(id, spline.parentSketch(), RelationshipType.REFERENCES)
            .to(id, spline.startPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "start"))
            .to(id, spline.endPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "end"));
        for (int i = 0; i < points.size(); i++) {
            relationships.to(id, points.get(i), RelationshipType.REFERENCES,
                Map.of("role", pointRole, "sequence_index", i));
        }
        return new Extraction(node, relationships.list());
    }
}
