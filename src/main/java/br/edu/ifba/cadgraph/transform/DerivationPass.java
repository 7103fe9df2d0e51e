package br.edu.ifba.cadgraph.transform;

import java.util.List;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.utils.RetryExhaustedException;

/**
 * Computes derived relationships from the persisted structural graph.
 *
 * <p>Passes only read; the transformer writes what they return. The result must
 * depend on the stored graph alone so that re-running a pass upserts the same edges.</p>
 */
public interface DerivationPass {

    /**
     * Short name used in logs and reports.
     */
    @NotNull
    String name();

    @NotNull
    List<GraphRelationship> derive(@NotNull DerivationContext context) throws RetryExhaustedException;
}
