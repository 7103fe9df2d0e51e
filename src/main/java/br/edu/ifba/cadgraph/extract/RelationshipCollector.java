package br.edu.ifba.cadgraph.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.host.CadEntity;

/**
 * Collects the relationships of one extraction, resolving referenced entities to
 * stable ids and skipping references that cannot be resolved.
 */
public final class RelationshipCollector {

    private final ExtractionContext context;
    private final List<GraphRelationship> relationships = new ArrayList<>();

    RelationshipCollector(ExtractionContext context) {
        this.context = context;
    }

    public RelationshipCollector to(@NotNull String sourceId, @Nullable CadEntity target, @NotNull RelationshipType type) {
        return to(sourceId, target, type, Map.of());
    }

    public RelationshipCollector to(@NotNull String sourceId, @Nullable CadEntity target,
            @NotNull RelationshipType type, @NotNull Map<String, Object> properties) {
        String targetId = context.referenceIdOf(target);
        if (targetId != null) {
            relationships.add(GraphRelationship.of(sourceId, targetId, type, properties));
        }
        return this;
    }

    /**
     * Adds a relationship pointing at the extracted entity, e.g. face {@code produced_by} feature.
     */
    public RelationshipCollector from(@Nullable CadEntity source, @NotNull String targetId,
            @NotNull RelationshipType type, @NotNull Map<String, Object> properties) {
        String sourceId = context.referenceIdOf(source);
        if (sourceId != null) {
            relationships.add(GraphRelationship.of(sourceId, targetId, type, properties));
        }
        return this;
    }

    /**
     * Adds one relationship per target, numbering them with {@code sequence_index} in list order.
     */
    public RelationshipCollector sequence(@NotNull String sourceId, @NotNull List<? extends CadEntity> targets,
            @NotNull RelationshipType type) {
        for (int i = 0; i < targets.size(); i++) {
            to(sourceId, targets.get(i), type, Map.of("sequence_index", i));
        }
        return this;
    }

    public RelationshipCollector all(@NotNull String sourceId, @NotNull List<? extends CadEntity> targets,
            @NotNull RelationshipType type) {
        for (CadEntity target : targets) {
            to(sourceId, target, type);
        }
        return this;
    }

    public List<GraphRelationship> list() {
        return List.copyOf(relationships);
    }

    /**
     * Small property map helper keeping insertion order and skipping null values.
     */
    public static Map<String, Object> props(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("props expects key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }
}
