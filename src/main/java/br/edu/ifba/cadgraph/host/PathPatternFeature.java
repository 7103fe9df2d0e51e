package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

public interface PathPatternFeature extends PatternFeature {

    /**
     * Curve the instances follow.
     */
    @Nullable
    CadEntity path();

    @Nullable
    Double distance();

    @Nullable
    String distanceType();

    boolean isOrientationAlongPath();
}
