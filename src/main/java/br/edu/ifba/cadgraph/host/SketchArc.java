package br.edu.ifba.cadgraph.host;

public interface SketchArc extends SketchCurve {

    SketchPoint centerPoint();

    SketchPoint startPoint();

    SketchPoint endPoint();

    double radius();

    /**
     * Start angle in radians.
     */
    double startAngle();

    /**
     * End angle in radians.
     */
    double endAngle();
}
