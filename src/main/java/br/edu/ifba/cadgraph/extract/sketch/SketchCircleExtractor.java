package br.edu.ifba.cadgraph.extract.sketch;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.SketchCircle;

public final class SketchCircleExtractor extends AbstractSketchEntityExtractor<SketchCircle> {

    public SketchCircleExtractor() {
        super(SketchCircle.class, fusionTypes("SketchCircle"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchCircle circle, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(circle);
        GraphNode node = node(circle, id)
            .point("center_point", circle.centerPoint() != null ? circle.centerPoint().geometry() : null)
            .property("radius", circle.radius())
            .property("length", circle.length())
            .build();
        return new Extraction(node, context.relationships()
            .to(id, circle.parentSketch(), RelationshipType.REFERENCES)
            .to(id, circle.centerPoint(), RelationshipType.REFERENCES, Map.of("role", "center"))
            .list());
    }
}
