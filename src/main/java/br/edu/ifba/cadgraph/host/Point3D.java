package br.edu.ifba.cadgraph.host;

import java.util.List;

/**
 * Immutable point or vector in model space (host units, centimeters for Fusion).
 */
public record Point3D(double x, double y, double z) {

    public List<Double> toList() {
        return List.of(x, y, z);
    }
}
