package br.edu.ifba.cadgraph.extract.design;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.ConstructionGeometry;

/**
 * Construction planes, axes and points, linked with {@code defined_by} to the
 * entities their definition refers to.
 */
public final class ConstructionGeometryExtractor extends AbstractEntityExtractor<ConstructionGeometry> {

    public ConstructionGeometryExtractor() {
        super(ConstructionGeometry.class, NodeCategory.CONSTRUCTION,
            fusionTypes("ConstructionPlane", "ConstructionAxis", "ConstructionPoint"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull ConstructionGeometry geometry, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(geometry);
        GraphNode node = node(geometry, id)
            .property("name", geometry.name())
            .point("origin", geometry.origin())
            .point("direction", geometry.direction())
            .property("is_visible", geometry.isVisible())
            .property("definition_type", geometry.definitionType())
            .build();
        return new Extraction(node, context.relationships()
            .sequence(id, geometry.definingEntities(), RelationshipType.DEFINED_BY)
            .list());
    }
}
