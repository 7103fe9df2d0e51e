package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * One edge set of a fillet or chamfer: the edges it rounds or bevels and the
 * values driving it. Values that do not apply to the set's kind are null.
 */
public interface EdgeSet {

    /**
     * Host edge set type, e.g. {@code ConstantRadiusFilletEdgeSet} or {@code TwoDistancesChamferEdgeSet}.
     */
    String kind();

    List<BRepEdge> edges();

    /**
     * Fillet radius, or chord length for chord fillets.
     */
    @Nullable
    Double radius();

    @Nullable
    Double distance();

    @Nullable
    Double secondDistance();

    /**
     * Chamfer angle in radians.
     */
    @Nullable
    Double angle();

    /**
     * Parameter driving the radius or the first distance.
     */
    @Nullable
    ModelParameter parameter();

    boolean isTangentChain();
}
