package br.edu.ifba.cadgraph.extract;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.host.CadEntity;

/**
 * Base class of the built-in extractors: holds the routing metadata and starts
 * every node with the properties common to all entities.
 */
public abstract class AbstractEntityExtractor<T extends CadEntity> implements EntityExtractor<T> {

    protected static final String FUSION_PREFIX = "adsk::fusion::";

    private final Class<T> entityType;
    private final Set<String> objectTypes;
    private final NodeCategory category;

    protected AbstractEntityExtractor(Class<T> entityType, NodeCategory category, Set<String> objectTypes) {
        this.entityType = entityType;
        this.category = category;
        this.objectTypes = Set.copyOf(objectTypes);
    }

    @NotNull
    @Override
    public Class<T> entityType() {
        return entityType;
    }

    @NotNull
    @Override
    public Set<String> objectTypes() {
        return objectTypes;
    }

    public NodeCategory category() {
        return category;
    }

    /**
     * Node builder labelled with the entity's type name and carrying
     * {@code entity_token} and {@code object_type}.
     */
    protected GraphNode.Builder node(T entity, String stableId) {
        return GraphNode.builder(stableId, entity.typeName(), category)
            .property("entity_token", entity.entityToken())
            .property("object_type", entity.objectType());
    }

    protected static Set<String> fusionTypes(String... simpleNames) {
        return Arrays.stream(simpleNames).map(name -> FUSION_PREFIX + name).collect(Collectors.toUnmodifiableSet());
    }
}
