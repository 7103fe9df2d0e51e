package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

public interface CircularPatternFeature extends PatternFeature {

    @Nullable
    CadEntity axis();

    /**
     * Angle covered by the pattern in radians.
     */
    @Nullable
    Double totalAngle();
}
