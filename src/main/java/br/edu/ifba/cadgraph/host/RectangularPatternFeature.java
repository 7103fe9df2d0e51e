package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

public interface RectangularPatternFeature extends PatternFeature {

    @Nullable
    CadEntity directionOne();

    @Nullable
    CadEntity directionTwo();

    /**
     * Instance count along the second direction; null when the pattern is one-directional.
     */
    @Nullable
    Integer quantityTwo();

    @Nullable
    Double distanceOne();

    @Nullable
    Double distanceTwo();

    /**
     * Whether distances are spacings or the total extent, e.g. {@code SpacingPatternDistanceType}.
     */
    @Nullable
    String distanceType();
}
