package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * A closed region of a sketch, bounded by one outer loop and zero or more inner loops.
 */
public interface Profile extends CadEntity {

    Sketch parentSketch();

    /**
     * Boundary loops in the order reported by the host.
     */
    List<ProfileLoop> loops();

    @Nullable
    Double area();
}
