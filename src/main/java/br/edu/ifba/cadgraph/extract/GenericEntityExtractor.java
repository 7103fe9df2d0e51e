package br.edu.ifba.cadgraph.extract;

import java.util.Set;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.host.CadEntity;

/**
 * Fallback for entity types without a dedicated extractor: a node labelled with
 * the type name, no specialized properties and no relationships.
 */
public final class GenericEntityExtractor extends AbstractEntityExtractor<CadEntity> {

    public GenericEntityExtractor() {
        super(CadEntity.class, NodeCategory.UNKNOWN, Set.of());
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull CadEntity entity, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        return Extraction.of(node(entity, context.idOf(entity)).build());
    }
}
