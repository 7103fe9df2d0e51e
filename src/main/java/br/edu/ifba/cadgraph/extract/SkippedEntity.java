package br.edu.ifba.cadgraph.extract;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An entity left out of the graph, with the reason.
 *
 * @param objectType host object type
 * @param entityToken host token when one could be read
 * @param reason why the entity was skipped
 */
public record SkippedEntity(@NotNull String objectType, @Nullable String entityToken, @NotNull String reason) {
}
