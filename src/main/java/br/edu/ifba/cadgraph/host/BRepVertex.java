package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.Nullable;

public interface BRepVertex extends CadEntity {

    Point3D geometry();

    @Nullable
    Double tolerance();
}
