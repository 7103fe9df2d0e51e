package br.edu.ifba.cadgraph.host;

public interface SketchPoint extends SketchEntity {

    Point3D geometry();
}
