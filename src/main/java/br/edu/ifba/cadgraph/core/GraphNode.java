package br.edu.ifba.cadgraph.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.cadgraph.host.Point3D;

/**
 * Flat node record keyed by stable id.
 *
 * <p>Property values are strings, numbers, booleans or lists of numbers; null
 * values are dropped on construction.</p>
 *
 * @param stableId upsert key derived from the entity token
 * @param label entity type name, e.g. {@code SketchLine}
 * @param category coarse node category
 * @param properties type-specific attributes
 */
public record GraphNode(
    @NotNull String stableId,
    @NotNull String label,
    @NotNull NodeCategory category,
    @NotNull Map<String, Object> properties
) {

    public GraphNode {
        Objects.requireNonNull(stableId, "stableId must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(category, "category must not be null");
        properties = withoutNulls(properties);
    }

    /**
     * Creates a minimal node standing in for a relationship endpoint that has
     * not been loaded yet.
     */
    public static GraphNode placeholder(@NotNull String stableId) {
        return new GraphNode(stableId, "Placeholder", NodeCategory.PLACEHOLDER, Map.of());
    }

    public boolean isPlaceholder() {
        return category == NodeCategory.PLACEHOLDER;
    }

    @Nullable
    public Object property(@NotNull String key) {
        return properties.get(key);
    }

    public static Builder builder(@NotNull String stableId, @NotNull String label, @NotNull NodeCategory category) {
        return new Builder(stableId, label, category);
    }

    static Map<String, Object> withoutNulls(@Nullable Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Accumulates properties, silently skipping null values.
     */
    public static final class Builder {

        private final String stableId;
        private final String label;
        private final NodeCategory category;
        private final Map<String, Object> properties = new LinkedHashMap<>();

        private Builder(String stableId, String label, NodeCategory category) {
            this.stableId = stableId;
            this.label = label;
            this.category = category;
        }

        public Builder property(@NotNull String key, @Nullable Object value) {
            if (value != null) {
                properties.put(key, value);
            }
            return this;
        }

        public Builder point(@NotNull String key, @Nullable Point3D point) {
            if (point != null) {
                properties.put(key, point.toList());
            }
            return this;
        }

        public Builder numbers(@NotNull String key, @Nullable List<Double> values) {
            if (values != null && !values.isEmpty()) {
                properties.put(key, List.copyOf(values));
            }
            return this;
        }

        public GraphNode build() {
            return new GraphNode(stableId, label, category, properties);
        }
    }
}
