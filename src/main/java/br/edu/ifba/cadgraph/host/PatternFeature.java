package br.edu.ifba.cadgraph.host;

import java.util.List;

/**
 * A feature repeating its input entities. Rectangular, circular and path
 * patterns add their own placement through the sub-interfaces.
 */
public interface PatternFeature extends Feature {

    /**
     * Patterned faces, features or bodies, in host order.
     */
    List<CadEntity> inputEntities();

    /**
     * Instance count, first direction for rectangular patterns.
     */
    int quantity();

    boolean isSymmetric();
}
