package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

/**
 * Fitted, fixed and control point splines. {@link #definingPoints()} returns the
 * fit points or control points.
 */
public interface SketchSpline extends SketchCurve {

    @Nullable
    SketchPoint startPoint();

    @Nullable
    SketchPoint endPoint();

    boolean isClosed();

    @Nullable
    Integer degree();
}
