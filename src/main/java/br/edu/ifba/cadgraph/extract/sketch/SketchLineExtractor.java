package br.edu.ifba.cadgraph.extract.sketch;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.SketchLine;

public final class SketchLineExtractor extends AbstractSketchEntityExtractor<SketchLine> {

    public SketchLineExtractor() {
        super(SketchLine.class, fusionTypes("SketchLine"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchLine line, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(line);
        GraphNode node = node(line, id)
            .point("start_point", line.startPoint() != null ? line.startPoint().geometry() : null)
            .point("end_point", line.endPoint() != null ? line.endPoint().geometry() : null)
            .property("length", line.length())
            .build();
        return new Extraction(node, context.relationships()
            .to(id, line.parentSketch(), RelationshipType.REFERENCES)
            .to(id, line.startPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "start"))
            .to(id, line.endPoint(), RelationshipType.BOUNDED_BY, Map.of("role", "end"))
            .list());
    }
}
