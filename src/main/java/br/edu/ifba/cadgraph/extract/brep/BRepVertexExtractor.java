package br.edu.ifba.cadgraph.extract.brep;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.BRepVertex;

public final class BRepVertexExtractor extends AbstractEntityExtractor<BRepVertex> {

    public BRepVertexExtractor() {
        super(BRepVertex.class, NodeCategory.BREP, fusionTypes("BRepVertex"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull BRepVertex vertex, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        return Extraction.of(node(vertex, context.idOf(vertex))
            .point("coordinates", vertex.geometry())
            .property("tolerance", vertex.tolerance())
            .build());
    }
}
