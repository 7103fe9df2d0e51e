package br.edu.ifba.cadgraph.host;

import java.util.List;

/**
 * One boundary loop of a {@link Profile}. Not an entity of its own: it has no token.
 */
public interface ProfileLoop {

    boolean isOuter();

    /**
     * Sketch curves forming the loop, in boundary order.
     */
    List<SketchCurve> curves();
}
