package br.edu.ifba.cadgraph.core;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Output of converting one CAD entity: its node plus the relationships observed
 * from its direct references.
 */
public record Extraction(@NotNull GraphNode node, @NotNull List<GraphRelationship> relationships) {

    public Extraction {
        relationships = List.copyOf(relationships);
    }

    public static Extraction of(@NotNull GraphNode node) {
        return new Extraction(node, List.of());
    }
}
