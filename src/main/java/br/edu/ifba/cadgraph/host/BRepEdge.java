package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

public interface BRepEdge extends CadEntity {

    @Nullable
    String curveType();

    double length();

    boolean isDegenerate();

    @Nullable
    Double tolerance();

    BRepVertex startVertex();

    BRepVertex endVertex();

    /**
     * Faces using this edge; two for a manifold edge of a closed solid.
     */
    List<BRepFace> faces();
}
