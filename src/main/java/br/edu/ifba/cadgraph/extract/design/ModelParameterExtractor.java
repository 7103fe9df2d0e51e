package br.edu.ifba.cadgraph.extract.design;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.ModelParameter;

/**
 * Model and user parameters with their expression dependencies and creating entity.
 */
public final class ModelParameterExtractor extends AbstractEntityExtractor<ModelParameter> {

    public ModelParameterExtractor() {
        super(ModelParameter.class, NodeCategory.PARAMETER, fusionTypes("ModelParameter", "UserParameter"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull ModelParameter parameter, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(parameter);
        GraphNode node = node(parameter, id)
            .property("name", parameter.name())
            .property("expression", parameter.expression())
            .property("value", parameter.value())
            .property("unit", parameter.unit())
            .property("comment", parameter.comment())
            .property("is_user_parameter", parameter.isUserParameter())
            .build();
        return new Extraction(node, context.relationships()
            .all(id, parameter.dependentParameters(), RelationshipType.HAS_DEPENDENT)
            .all(id, parameter.dependencyParameters(), RelationshipType.DEPENDENT_ON)
            .to(id, parameter.createdBy(), RelationshipType.CREATED_BY)
            .list());
    }
}
