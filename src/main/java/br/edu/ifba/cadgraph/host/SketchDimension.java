package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * A sketch dimension (linear, radial, angular, ...). The kind is given by {@link #objectType()}.
 */
public interface SketchDimension extends CadEntity {

    Sketch parentSketch();

    /**
     * Parameter driving the dimension; null for driven (reference) dimensions.
     */
    @Nullable
    ModelParameter parameter();

    double value();

    boolean isDriving();

    List<SketchEntity> dimensionedEntities();
}
