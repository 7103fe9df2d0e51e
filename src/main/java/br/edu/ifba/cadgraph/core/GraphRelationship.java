package br.edu.ifba.cadgraph.core;

import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Directed relationship record, upserted by its (source, target, type) key.
 *
 * @param sourceId stable id of the source node
 * @param targetId stable id of the target node
 * @param type relationship type
 * @param properties optional attributes such as {@code sequence_index} or {@code role}
 */
public record GraphRelationship(
    @NotNull String sourceId,
    @NotNull String targetId,
    @NotNull RelationshipType type,
    @NotNull Map<String, Object> properties
) {

    public GraphRelationship {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        properties = GraphNode.withoutNulls(properties);
    }

    public static GraphRelationship of(@NotNull String sourceId, @NotNull String targetId, @NotNull RelationshipType type) {
        return new GraphRelationship(sourceId, targetId, type, Map.of());
    }

    public static GraphRelationship of(@NotNull String sourceId, @NotNull String targetId,
            @NotNull RelationshipType type, @NotNull Map<String, Object> properties) {
        return new GraphRelationship(sourceId, targetId, type, properties);
    }

    public Key key() {
        return new Key(sourceId, targetId, type);
    }

    /**
     * Upsert key of a relationship.
     */
    public record Key(String sourceId, String targetId, RelationshipType type) {
    }
}
