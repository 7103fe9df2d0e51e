package br.edu.ifba.cadgraph.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates extracted records into size-bounded, deduplicated batches.
 *
 * <p>Nodes are deduplicated by stable id and relationships by their
 * (source, target, type) key; when the same key is added twice the later record
 * replaces the earlier one. Once the pending record count reaches
 * {@code maxRecords} the batch is handed to the sink and a new one is started.
 * Deduplication is per batch: two batches of the same run may carry the same key.</p>
 *
 * <p>Not thread-safe. Extraction feeds the builder from a single thread.</p>
 */
public final class GraphRecordBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphRecordBuilder.class);

    private final int maxRecords;
    private final Consumer<GraphBatch> sink;

    private Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private Map<GraphRelationship.Key, GraphRelationship> relationships = new LinkedHashMap<>();
    private long nextSequence = 1;
    private long replacedRecords;

    /**
     * @param maxRecords maximum nodes plus relationships per batch
     * @param sink receives every flushed batch, in order
     */
    public GraphRecordBuilder(int maxRecords, @NotNull Consumer<GraphBatch> sink) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be positive, got " + maxRecords);
        }
        this.maxRecords = maxRecords;
        this.sink = sink;
    }

    public void add(@NotNull Extraction extraction) {
        addNode(extraction.node());
        for (GraphRelationship relationship : extraction.relationships()) {
            addRelationship(relationship);
        }
    }

    public void addNode(@NotNull GraphNode node) {
        GraphNode previous = nodes.put(node.stableId(), node);
        if (previous != null) {
            replacedRecords++;
            if (!previous.equals(node)) {
                logger.debug("Node {} emitted twice with different content, keeping the last one", node.stableId());
            }
        }
        flushIfFull();
    }

    public void addRelationship(@NotNull GraphRelationship relationship) {
        GraphRelationship previous = relationships.put(relationship.key(), relationship);
        if (previous != null) {
            replacedRecords++;
        }
        flushIfFull();
    }

    /**
     * Hands the pending records to the sink as one batch.
     *
     * @return the flushed batch, or null when nothing was pending
     */
    @Nullable
    public GraphBatch flush() {
        if (nodes.isEmpty() && relationships.isEmpty()) {
            return null;
        }
        GraphBatch batch = new GraphBatch(nextSequence++,
            new ArrayList<>(nodes.values()), new ArrayList<>(relationships.values()));
        nodes = new LinkedHashMap<>();
        relationships = new LinkedHashMap<>();

        logger.debug("Flushing batch {} with {} nodes and {} relationships",
            batch.sequence(), batch.nodes().size(), batch.relationships().size());
        sink.accept(batch);
        return batch;
    }

    public int pendingRecords() {
        return nodes.size() + relationships.size();
    }

    /**
     * Number of records that replaced an earlier record with the same key.
     */
    public long replacedRecords() {
        return replacedRecords;
    }

    private void flushIfFull() {
        if (pendingRecords() >= maxRecords) {
            flush();
        }
    }
}
