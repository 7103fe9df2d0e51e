package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

public interface BoxFeature extends Feature {

    @Nullable
    Double length();

    @Nullable
    Double width();

    @Nullable
    Double height();
}
