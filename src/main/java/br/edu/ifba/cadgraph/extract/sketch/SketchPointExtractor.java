package br.edu.ifba.cadgraph.extract.sketch;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.SketchPoint;

public final class SketchPointExtractor extends AbstractSketchEntityExtractor<SketchPoint> {

    public SketchPointExtractor() {
        super(SketchPoint.class, fusionTypes("SketchPoint"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchPoint point, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(point);
        return new Extraction(
            node(point, id).point("coordinates", point.geometry()).build(),
            context.relationships().to(id, point.parentSketch(), RelationshipType.REFERENCES).list());
    }
}
