package br.edu.ifba.cadgraph.host;

/**
 * Common accessors of sketch points and curves.
 */
public interface SketchEntity extends CadEntity {

    Sketch parentSketch();

    boolean isConstruction();

    boolean isFixed();

    /**
     * True when the entity is projected from outside the sketch.
     */
    boolean isReference();
}
