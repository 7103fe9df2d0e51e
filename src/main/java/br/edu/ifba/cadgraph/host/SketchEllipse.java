package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

/**
 * Ellipses and elliptical arcs. Full ellipses have no start and end points.
 */
public interface SketchEllipse extends SketchCurve {

    SketchPoint centerPoint();

    double majorAxisRadius();

    double minorAxisRadius();

    @Nullable
    Point3D majorAxis();

    @Nullable
    SketchPoint startPoint();

    @Nullable
    SketchPoint endPoint();
}
