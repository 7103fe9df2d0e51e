package br.edu.ifba.cadgraph.host;

import java.util.List;

/**
 * Any sketch curve. Lines, arcs, circles, ellipses and splines have dedicated
 * sub-interfaces; conic curves are exposed through this one.
 */
public interface SketchCurve extends SketchEntity {

    double length();

    /**
     * Points that define the curve (fit or control points for splines), in host order.
     */
    List<SketchPoint> definingPoints();
}
