package br.edu.ifba.cadgraph.extract;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one design traversal.
 *
 * @param extractedEntities entities converted and handed to the record builder
 * @param skippedEntities entities left out, in encounter order
 * @param aborted true when the host went away before the traversal finished
 * @param abortReason host error message when aborted
 */
public record TraversalResult(
    long extractedEntities,
    List<SkippedEntity> skippedEntities,
    boolean aborted,
    @Nullable String abortReason
) {

    public TraversalResult {
        skippedEntities = List.copyOf(skippedEntities);
    }
}
