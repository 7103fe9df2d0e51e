package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

public interface ExtrudeFeature extends Feature {

    /**
     * Boolean operation, e.g. {@code NewBodyFeatureOperation}.
     */
    @Nullable
    String operation();

    @Nullable
    String extentType();

    @Nullable
    Double distance();

    @Nullable
    Double taperAngle();

    @Nullable
    ModelParameter distanceParameter();

    @Nullable
    ModelParameter taperAngleParameter();

    boolean isSymmetric();

    List<BRepFace> startFaces();

    List<BRepFace> endFaces();

    List<BRepFace> sideFaces();
}
