package br.edu.ifba.cadgraph.extract.brep;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.BRepBody;

public final class BRepBodyExtractor extends AbstractEntityExtractor<BRepBody> {

    public BRepBodyExtractor() {
        super(BRepBody.class, NodeCategory.BREP, fusionTypes("BRepBody"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull BRepBody body, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(body);
        GraphNode node = node(body, id)
            .property("name", body.name())
            .property("is_solid", body.isSolid())
            .property("is_visible", body.isVisible())
            .property("volume", body.volume())
            .property("area", body.area())
            .property("face_count", body.faces().size())
            .property("edge_count", body.edges().size())
            .property("vertex_count", body.vertices().size())
            .build();
        return new Extraction(node, context.relationships()
            .all(id, body.faces(), RelationshipType.CONTAINS)
            .list());
    }
}
