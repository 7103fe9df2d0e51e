package br.edu.ifba.cadgraph.extract.sketch;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.GeometricConstraint;

/**
 * Sketch constraints. The constraint kind is carried by the label; the
 * constrained entities are referenced in host order.
 */
public final class GeometricConstraintExtractor extends AbstractEntityExtractor<GeometricConstraint> {

    public GeometricConstraintExtractor() {
        super(GeometricConstraint.class, NodeCategory.CONSTRAINT, fusionTypes(
            "CoincidentConstraint",
            "CollinearConstraint",
            "ConcentricConstraint",
            "EqualConstraint",
            "HorizontalConstraint",
            "HorizontalPointsConstraint",
            "MidPointConstraint",
            "OffsetConstraint",
            "ParallelConstraint",
            "PerpendicularConstraint",
            "PolygonConstraint",
            "SmoothConstraint",
            "SymmetryConstraint",
            "TangentConstraint",
            "VerticalConstraint",
            "VerticalPointsConstraint"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull GeometricConstraint constraint, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(constraint);
        return new Extraction(
            node(constraint, id).property("entity_count", constraint.constrainedEntities().size()).build(),
            context.relationships()
                .to(id, constraint.parentSketch(), RelationshipType.REFERENCES)
                .sequence(id, constraint.constrainedEntities(), RelationshipType.REFERENCES)
                .list());
    }
}
