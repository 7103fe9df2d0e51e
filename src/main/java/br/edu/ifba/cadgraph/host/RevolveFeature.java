package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

public interface RevolveFeature extends Feature {

    @Nullable
    String operation();

    /**
     * Host extent definition, e.g. {@code AngleExtentDefinition}.
     */
    @Nullable
    String extentType();

    /**
     * Axis of revolution: a construction axis, sketch line or linear edge.
     */
    @Nullable
    CadEntity axis();

    /**
     * Revolution angle in radians; null when the extent is not angle based.
     */
    @Nullable
    Double angle();

    @Nullable
    ModelParameter angleParameter();

    boolean isSymmetric();

    boolean isSolid();

    /**
     * Bodies the operation joins, cuts or intersects.
     */
    List<BRepBody> participantBodies();
}
