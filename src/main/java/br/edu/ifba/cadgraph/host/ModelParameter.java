package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * A named design parameter (model or user parameter).
 */
public interface ModelParameter extends CadEntity {

    String name();

    String expression();

    double value();

    @Nullable
    String unit();

    @Nullable
    String comment();

    boolean isUserParameter();

    /**
     * Parameters whose expressions reference this one.
     */
    List<ModelParameter> dependentParameters();

    /**
     * Parameters this one's expression references.
     */
    List<ModelParameter> dependencyParameters();

    /**
     * Feature, sketch dimension or other entity that created the parameter; null for user parameters.
     */
    @Nullable
    CadEntity createdBy();
}
