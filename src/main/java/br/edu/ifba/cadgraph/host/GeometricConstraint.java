package br.edu.ifba.cadgraph.host;

import java.util.List;

/**
 * A sketch constraint such as coincident, parallel or tangent.
 */
public interface GeometricConstraint extends CadEntity {

    Sketch parentSketch();

    List<SketchEntity> constrainedEntities();
}
