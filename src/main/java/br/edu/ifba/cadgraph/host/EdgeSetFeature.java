package br.edu.ifba.cadgraph.host;

import java.util.List;

/**
 * Fillets and chamfers.
 */
public interface EdgeSetFeature extends Feature {

    List<EdgeSet> edgeSets();
}
