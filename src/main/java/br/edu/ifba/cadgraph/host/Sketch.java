package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * A 2D sketch and the entities it owns.
 */
public interface Sketch extends CadEntity {

    String name();

    /**
     * Position of the sketch on the construction timeline.
     *
     * @return the timeline index, or null when the sketch is not on the timeline
     */
    @Nullable
    Integer timelineIndex();

    CadComponent parentComponent();

    /**
     * Plane or planar face the sketch was created on.
     */
    @Nullable
    CadEntity referencePlane();

    boolean isVisible();

    List<SketchPoint> points();

    List<SketchCurve> curves();

    List<Profile> profiles();

    List<SketchDimension> dimensions();

    List<GeometricConstraint> constraints();
}
