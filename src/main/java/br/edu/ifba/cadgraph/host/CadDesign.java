package br.edu.ifba.cadgraph.host;

import java.util.List;

/**
 * Entry point into an open CAD document.
 */
public interface CadDesign {

    String name();

    CadComponent rootComponent();

    /**
     * All model and user parameters of the design, in host order.
     */
    List<ModelParameter> parameters();
}
