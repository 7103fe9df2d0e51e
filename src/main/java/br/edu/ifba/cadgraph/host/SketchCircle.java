package br.edu.ifba.cadgraph.host;

public interface SketchCircle extends SketchCurve {

    SketchPoint centerPoint();

    double radius();
}
