package br.edu.ifba.cadgraph.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;

/**
 * Relationship types of the persisted graph.
 *
 * <p>Structural types are emitted during extraction and mirror a reference observed
 * in the host model. Derived types are computed by the graph transformer from
 * already-persisted structural data.</p>
 */
public enum RelationshipType {

    CONTAINS(false),
    BOUNDED_BY(false),
    REFERENCES(false),
    PRODUCED_BY(false),
    PRODUCES(false),
    CONSUMES(false),
    SHARES_EDGE(false),
    DEFINED_BY(false),
    HAS_DEPENDENT(false),
    DEPENDENT_ON(false),
    CREATED_BY(false),
    NEXT_IN_TIMELINE(true),
    ADJACENT_TO(true);

    private static final Map<String, RelationshipType> BY_WIRE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(RelationshipType::wireName, Function.identity()));

    private final boolean derived;
    private final String wireName;

    RelationshipType(boolean derived) {
        this.derived = derived;
        this.wireName = name().toLowerCase(Locale.ROOT);
    }

    /**
     * Name stored in the graph, e.g. {@code bounded_by}.
     */
    public String wireName() {
        return wireName;
    }

    public boolean isDerived() {
        return derived;
    }

    /**
     * Resolves a stored relationship type name.
     *
     * @param wireName the stored name
     * @return the matching type
     * @throws IllegalArgumentException if the name is not a known relationship type
     */
    @NotNull
    public static RelationshipType fromWireName(@NotNull String wireName) {
        RelationshipType type = BY_WIRE_NAME.get(wireName);
        if (type == null) {
            throw new IllegalArgumentException("Unknown relationship type: " + wireName);
        }
        return type;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
