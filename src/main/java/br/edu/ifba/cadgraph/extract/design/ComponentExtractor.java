package br.edu.ifba.cadgraph.extract.design;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.CadComponent;

public final class ComponentExtractor extends AbstractEntityExtractor<CadComponent> {

    public ComponentExtractor() {
        super(CadComponent.class, NodeCategory.COMPONENT, fusionTypes("Component"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull CadComponent component, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(component);
        GraphNode node = node(component, id)
            .property("name", component.name())
            .property("part_number", component.partNumber())
            .property("is_root", component.isRoot())
            .build();
        return new Extraction(node, context.relationships()
            .all(id, component.sketches(), RelationshipType.CONTAINS)
            .all(id, component.features(), RelationshipType.CONTAINS)
            .all(id, component.bodies(), RelationshipType.CONTAINS)
            .all(id, component.constructionGeometry(), RelationshipType.CONTAINS)
            .all(id, component.children(), RelationshipType.CONTAINS)
            .list());
    }
}
