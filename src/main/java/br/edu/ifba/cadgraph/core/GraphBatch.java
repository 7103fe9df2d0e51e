package br.edu.ifba.cadgraph.core;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Size-bounded set of records committed as one transaction.
 *
 * @param sequence 1-based position of the batch within its run
 * @param nodes deduplicated node records
 * @param relationships deduplicated relationship records
 */
public record GraphBatch(long sequence, @NotNull List<GraphNode> nodes, @NotNull List<GraphRelationship> relationships) {

    public GraphBatch {
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
    }

    public static GraphBatch ofRelationships(long sequence, @NotNull List<GraphRelationship> relationships) {
        return new GraphBatch(sequence, List.of(), relationships);
    }

    public int size() {
        return nodes.size() + relationships.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && relationships.isEmpty();
    }
}
