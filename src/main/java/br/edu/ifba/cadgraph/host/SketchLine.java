package br.edu.ifba.cadgraph.host;

public interface SketchLine extends SketchCurve {

    SketchPoint startPoint();

    SketchPoint endPoint();
}
