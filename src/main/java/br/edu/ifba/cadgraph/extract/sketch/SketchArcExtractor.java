package br.edu.ifba.cadgraph.extract.sketch;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.SketchArc;

public final class SketchArcExtractor extends AbstractSketchEntityExtractor<SketchArc> {

    public SketchArcExtractor() {
        super(SketchArc.class, fusionTypes("SketchArc"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchArc arc, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(arc);
        GraphNode node = node(arc, id)
            .point("center_point", arc.centerPoint() != null ? arc.centerPoint().geometry() : null)
            .property("radius", arc.radius())
            .property("start_angle", arc.startAngle())
            .property("end_angle", arc.endAngle())
            .property("length", arc.length())
            .build();
        return new Extraction(node, context.relationships()
            .to(id, arc.parentSketch(), RelationshipType.REFERENCES)
            .to(id, arc.centerPoint(), RelationshipType.REFERENCES, Map.of("role", "center"))
            .to(id, arc.startPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "start"))
            .to(id, arc.endPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "end"))
            .list());
    }
}
