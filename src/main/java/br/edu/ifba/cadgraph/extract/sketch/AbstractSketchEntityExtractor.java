package br.edu.ifba.cadgraph.extract.sketch;

import java.util.Set;

import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.host.SketchEntity;

/**
 * Shared flags of sketch points and curves.
 */
abstract class AbstractSketchEntityExtractor<T extends SketchEntity> extends AbstractEntityExtractor<T> {

    protected AbstractSketchEntityExtractor(Class<T> entityType, Set<String> objectTypes) {
        super(entityType, NodeCategory.SKETCH_GEOMETRY, objectTypes);
    }

    @Override
    protected GraphNode.Builder node(T entity, String stableId) {
        return super.node(entity, stableId)
            .property("is_construction", entity.isConstruction())
            .property("is_fixed", entity.isFixed())
            .property("is_reference", entity.isReference());
    }
}
