package br.edu.ifba.cadgraph.extract.sketch;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.AbstractEntityExtractor;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.RelationshipCollector;
import br.edu.ifba.cadgraph.host.ModelParameter;
import br.edu.ifba.cadgraph.host.SketchDimension;
import br.edu.ifba.cadgraph.host.SketchEntity;

public final class SketchDimensionExtractor extends AbstractEntityExtractor<SketchDimension> {

    public SketchDimensionExtractor() {
        super(SketchDimension.class, NodeCategory.DIMENSION, fusionTypes(
            "SketchLinearDimension",
            "SketchAngularDimension",
            "SketchRadialDimension",
            "SketchDiameterDimension",
            "SketchOffsetDimension",
            "SketchOffsetCurvesDimension",
            "SketchConcentricCircleDimension",
            "SketchEllipseMajorRadiusDimension",
            "SketchEllipseMinorRadiusDimension"));
    }

    @NotNull
    @Override
    public Extraction extract(@NotNull SketchDimension dimension, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        String id = context.idOf(dimension);
        ModelParameter parameter = dimension.parameter();
        GraphNode node = node(dimension, id)
            .property("value", dimension.value())
            .property("expression", parameter != null ? parameter.expression() : null)
            .property("is_driving", dimension.isDriving())
            .build();
        RelationshipCollector relationships = context.relationships()
            .to(id, dimension.parentSketch(), RelationshipType.REFERENCES);
        for (SketchEntity entity : dimension.dimensionedEntities()) {
            relationships.to(id, entity, RelationshipType.REFERENCES, Map.of("role", "entity"));
        }
        relationships.to(id, parameter, RelationshipType.REFERENCES, Map.of("role", "parameter"));
        return new Extraction(node, relationships.list());
    }
}
