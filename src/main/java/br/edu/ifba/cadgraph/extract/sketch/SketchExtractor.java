package br.edu.ifba.cadgraph.extract.sketch;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.Sketch;

public final class SketchExtractor extends AbstractEntityExtractor<Sketch> {

    public SketchExtractor() {
        super(Sketch.class, NodeCategory.SKETCH, fusionTypes("Sketch"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull Sketch sketch, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(sketch);
        GraphNode node = node(sketch, id)
            .property("name", sketch.name())
            .property("timeline_index", sketch.timelineIndex())
            .property("is_visible", sketch.isVisible())
            .property("component_id", context.referenceIdOf(sketch.parentComponent()))
            .build();
        return new Extraction(node, context.relationships()
            .to(id, sketch.referencePlane(), RelationshipType.REFERENCES, Map.of("role", "reference_plane"))
            .list());
    }
}
