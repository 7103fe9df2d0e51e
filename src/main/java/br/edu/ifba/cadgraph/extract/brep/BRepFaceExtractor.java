package br.edu.ifba.cadgraph.extract.brep;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.BRepFace;

public final class BRepFaceExtractor extends AbstractEntityExtractor<BRepFace> {

    public BRepFaceExtractor() {
        super(BRepFace.class, NodeCategory.BREP, fusionTypes("BRepFace"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull BRepFace face, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(face);
        GraphNode node = node(face, id)
            .property("surface_type", face.surfaceType())
            .property("area", face.area())
            .property("is_param_reversed", face.isParamReversed())
            .property("body_id", context.referenceIdOf(face.body()))
            .build();
        return new Extraction(node, context.relationships()
            .sequence(id, face.edges(), RelationshipType.BOUNDED_BY)
            .list());
    }
}
