package br.edu.ifba.cadgraph.extract.brep;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.BRepEdge;
import br.edu.ifba.cadgraph.host.BRepFace;

/**
 * Topological edges. An edge reported on two or more faces gets a
 * {@code shares_edge} link to each of them; boundary edges of open shells get none.
 */
public final class BRepEdgeExtractor extends AbstractEntityExtractor<BRepEdge> {

    public BRepEdgeExtractor() {
        super(BRepEdge.class, NodeCategory.BREP, fusionTypes("BRepEdge"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull BRepEdge edge, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(edge);
        List<BRepFace> faces = edge.faces();
        GraphNode node = node(edge, id)
            .property("curve_type", edge.curveType())
            .property("length", edge.length())
            .property("is_degenerate", edge.isDegenerate())
            .property("tolerance", edge.tolerance())
            .property("face_count", faces.size())
            .build();

        RelationshipCollector relationships = context.relationships()
            .to(id, edge.startVertex(), RelationshipType.BOUNDED_BY, Map.of("role", "start"))
            .to(id, edge.endVertex(), RelationshipType.BOUNDED_BY, Map.of("role", "end"));
        if (faces.size() >= 2) {
            relationships.all(id, faces, RelationshipType.SHARES_EDGE);
        }
        return new Extraction(node, relationships.list());
    }
}
