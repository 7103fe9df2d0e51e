package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * A component of the design tree. Owns sketches, features, bodies and
 * construction geometry and may contain child components.
 */
public interface CadComponent extends CadEntity {

    String name();

    @Nullable
    String partNumber();

    boolean isRoot();

    List<Sketch> sketches();

    /**
     * Features owned by this component. Order is not guaranteed to follow the timeline.
     */
    List<Feature> features();

    List<BRepBody> bodies();

    List<ConstructionGeometry> constructionGeometry();

    List<CadComponent> children();
}
