package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * A modeling feature on the construction timeline.
 */
public interface Feature extends CadEntity {

    String name();

    @Nullable
    Integer timelineIndex();

    CadComponent parentComponent();

    boolean isSuppressed();

    /**
     * Host health state, e.g. {@code HealthyFeatureHealthState}.
     */
    @Nullable
    String healthState();

    /**
     * Profiles consumed by the feature; empty for features that do not take profiles.
     */
    List<Profile> profiles();

    /**
     * Bodies created or modified by the feature.
     */
    List<BRepBody> bodies();
}
