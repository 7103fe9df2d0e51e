package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * Construction plane, axis or point. The concrete kind is given by {@link #objectType()}.
 */
public interface ConstructionGeometry extends CadEntity {

    String name();

    @Nullable
    Point3D origin();

    /**
     * Plane normal or axis direction; null for construction points.
     */
    @Nullable
    Point3D direction();

    boolean isVisible();

    /**
     * How the geometry was defined, e.g. {@code ConstructionPlaneOffsetDefinition}; null for origin geometry.
     */
    @Nullable
    String definitionType();

    /**
     * Faces, edges, planes or points the definition refers to, in host order.
     */
    List<CadEntity> definingEntities();
}
