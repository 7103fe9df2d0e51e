package br.edu.ifba.cadgraph.extract;

import java.util.Set;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.host.CadEntity;

/**
 * Converts one CAD entity category into graph records.
 *
 * <p>An extractor emits the entity's node plus one relationship per direct
 * reference it observes. It never follows references further: reaching the
 * referenced entities is the traversal's job.</p>
 *
 * @param <T> host interface handled by the extractor
 */
public interface EntityExtractor<T extends CadEntity> {

    /**
     * Host interface the entity must implement.
     */
    @NotNull
    Class<T> entityType();

    /**
     * Host object types ({@link CadEntity#objectType()}) routed to this extractor.
     */
    @NotNull
    Set<String> objectTypes();

    /**
     * Converts the entity.
     *
     * @param entity the entity handle
     * @param context identity resolution for the current run
     * @return node and relationships
     * @throws IdentityUnavailableException if the entity itself has no stable identity
     */
    @NotNull
    Extraction extract(@NotNull T entity, @NotNull ExtractionContext context) throws IdentityUnavailableException;
}
