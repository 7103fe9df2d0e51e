package br.edu.ifba.cadgraph.extract.sketch;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.SketchEllipse;

/**
 * Ellipses and elliptical arcs; only arcs are bounded by start and end points.
 */
public final class SketchEllipseExtractor extends AbstractSketchEntityExtractor<SketchEllipse> {

    public SketchEllipseExtractor() {
        super(SketchEllipse.class, fusionTypes("SketchEllipse", "SketchEllipticalArc"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchEllipse ellipse, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(ellipse);
        GraphNode node = node(ellipse, id)
            .point("center_point", ellipse.centerPoint() != null ? ellipse.centerPoint().geometry() : null)
            .property("major_axis_radius", ellipse.majorAxisRadius())
            .property("minor_axis_radius", ellipse.minorAxisRadius())
            .point("major_axis", ellipse.majorAxis())
            .property("is_closed", ellipse.startPoint() == null)
            .property("length", ellipse.length())
            .build();
        return new Extraction(node, context.relationships()
            .to(id, ellipse.parentSketch(), RelationshipType.REFERENCES)
            .to(id, ellipse.centerPoint(), RelationshipType.REFERENCES, Map.of("role", "center"))
            .to(id, ellipse.startPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "start"))
            .to(id, ellipse.endPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "end"))
            .list());
    }
}
