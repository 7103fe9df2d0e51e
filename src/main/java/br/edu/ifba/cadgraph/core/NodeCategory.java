package br.edu.ifba.cadgraph.core;

/**
 * Coarse classification of graph nodes, stored next to the label so that
 * queries can select e.g. every feature without enumerating feature types.
 */
public enum NodeCategory {
    COMPONENT,
    SKETCH,
    SKETCH_GEOMETRY,
    DIMENSION,
    CONSTRAINT,
    PROFILE,
    FEATURE,
    BREP,
    PARAMETER,
    CONSTRUCTION,
    UNKNOWN,
    /** Endpoint created by a relationship upsert before the node's own record arrived. */
    PLACEHOLDER
}
