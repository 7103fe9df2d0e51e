package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

public interface HoleFeature extends Feature {

    /**
     * {@code SimpleHoleType}, {@code CounterboreHoleType} or {@code CountersinkHoleType}.
     */
    @Nullable
    String holeType();

    @Nullable
    String extentType();

    @Nullable
    Point3D position();

    @Nullable
    Point3D direction();

    @Nullable
    Double diameter();

    /**
     * Depth for distance extents; null for through-all holes.
     */
    @Nullable
    Double depth();

    @Nullable
    Double tipAngle();

    @Nullable
    Double counterboreDiameter();

    @Nullable
    Double counterboreDepth();

    @Nullable
    Double countersinkDiameter();

    @Nullable
    Double countersinkAngle();

    @Nullable
    ModelParameter diameterParameter();

    @Nullable
    ModelParameter depthParameter();
}
