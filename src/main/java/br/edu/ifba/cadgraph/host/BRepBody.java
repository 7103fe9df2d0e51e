package br.edu.ifba.cadgraph.host;

import java.util.List;

import org.jetbrains.annotations.Nullable;

public interface BRepBody extends CadEntity {

    String name();

    boolean isSolid();

    boolean isVisible();

    @Nullable
    Double volume();

    @Nullable
    Double area();

    List<BRepFace> faces();

    List<BRepEdge> edges();

    List<BRepVertex> vertices();
}
