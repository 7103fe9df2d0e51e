package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

public interface BRepFace extends CadEntity {

    BRepBody body();

    /**
     * Surface geometry type, e.g. {@code PlaneSurfaceType}.
     */
    @Nullable
    String surfaceType();

    @Nullable
    Double area();

    boolean isParamReversed();

    /**
     * Edges bounding the face, in host order.
     */
    List<BRepEdge> edges();
}
