package br.edu.ifba.cadgraph.extract;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.extract.brep.BRepBodyExtractor;
import br.edu.ifba.cadgraph.extract.brep.BRepEdgeExtractor;
import br.edu.ifba.cadgraph.extract.brep.BRepFaceExtractor;
import br.edu.ifba.cadgraph.extract.brep.BRepVertexExtractor;
import br.edu.ifba.cadgraph.extract.design.ComponentExtractor;
import br.edu.ifba.cadgraph.extract.design.ConstructionGeometryExtractor;
import br.edu.ifba.cadgraph.extract.design.ModelParameterExtractor;
import br.edu.ifba.cadgraph.extract.feature.BoxFeatureExtractor;
import br.edu.ifba.cadgraph.extract.feature.EdgeSetFeatureExtractor;
import br.edu.ifba.cadgraph.extract.feature.ExtrudeFeatureExtractor;
import br.edu.ifba.cadgraph.extract.feature.FeatureExtractor;
import br.edu.ifba.cadgraph.extract.feature.HoleFeatureExtractor;
import br.edu.ifba.cadgraph.extract.feature.PatternFeatureExtractor;
import br.edu.ifba.cadgraph.extract.feature.RevolveFeatureExtractor;
import br.edu.ifba.cadgraph.extract.sketch.GeometricConstraintExtractor;
import br.edu.ifba.cadgraph.extract.sketch.ProfileExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchArcExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchCircleExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchCurveExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchDimensionExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchEllipseExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchLineExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchPointExtractor;
import br.edu.ifba.cadgraph.extract.sketch.SketchSplineExtractor;
import br.edu.ifba.cadgraph.host.CadEntity;

/**
 * Extractor dispatch: resolves an entity's host object type to its extractor.
 *
 * <p>Unregistered types, and registered types whose handle does not implement
 * the expected interface, go to {@link GenericEntityExtractor} so that object
 * model additions degrade to minimal nodes instead of failing the traversal.</p>
 */
public final class ExtractorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorRegistry.class);

    private final Map<String, EntityExtractor<?>> byObjectType = new HashMap<>();
    private final EntityExtractor<CadEntity> fallback;

    public ExtractorRegistry(@NotNull EntityExtractor<CadEntity> fallback) {
        this.fallback = fallback;
    }

    /**
     * Registry with every built-in extractor and the generic fallback.
     */
    public static ExtractorRegistry withDefaults() {
        ExtractorRegistry registry = new ExtractorRegistry(new GenericEntityExtractor());
        List.of(
            new ComponentExtractor(),
            new ConstructionGeometryExtractor(),
            new ModelParameterExtractor(),
            new SketchExtractor(),
            new SketchPointExtractor(),
            new SketchLineExtractor(),
            new SketchArcExtractor(),
            new SketchCircleExtractor(),
            new SketchEllipseExtractor(),
            new SketchSplineExtractor(),
            new SketchCurveExtractor(),
            new SketchDimensionExtractor(),
            new GeometricConstraintExtractor(),
            new ProfileExtractor(),
            new FeatureExtractor(),
            new ExtrudeFeatureExtractor(),
            new RevolveFeatureExtractor(),
            new EdgeSetFeatureExtractor(),
            new HoleFeatureExtractor(),
            new PatternFeatureExtractor(),
            new BoxFeatureExtractor(),
            new BRepBodyExtractor(),
            new BRepFaceExtractor(),
            new BRepEdgeExtractor(),
            new BRepVertexExtractor()
        ).forEach(registry::register);
        return registry;
    }

    /**
     * Routes every object type declared by the extractor to it, replacing earlier registrations.
     */
    public ExtractorRegistry register(@NotNull EntityExtractor<?> extractor) {
        for (String objectType : extractor.objectTypes()) {
            EntityExtractor<?> previous = byObjectType.put(objectType, extractor);
            if (previous != null && previous != extractor) {
                logger.debug("{} now handled by {} instead of {}", objectType,
                    extractor.getClass().getSimpleName(), previous.getClass().getSimpleName());
            }
        }
        return this;
    }

    /**
     * Converts an entity with the extractor registered for its type.
     *
     * @throws IdentityUnavailableException if the entity has no stable identity
     */
    @NotNull
    public Extraction extract(@NotNull CadEntity entity, @NotNull ExtractionContext context)
            throws IdentityUnavailableException {
        EntityExtractor<?> extractor = byObjectType.get(entity.objectType());
        if (extractor == null) {
            logger.debug("No extractor registered for {}, using generic extraction", entity.objectType());
            return fallback.extract(entity, context);
        }
        return dispatch(extractor, entity, context);
    }

    public boolean isRegistered(@NotNull String objectType) {
        return byObjectType.containsKey(objectType);
    }

    private <T extends CadEntity> Extraction dispatch(EntityExtractor<T> extractor, CadEntity entity,
            ExtractionContext context) throws IdentityUnavailableException {
        if (!extractor.entityType().isInstance(entity)) {
            logger.warn("{} reports type {} but does not implement {}, using generic extraction",
                entity.getClass().getName(), entity.objectType(), extractor.entityType().getSimpleName());
            return fallback.extract(entity, context);
        }
        return extractor.extract(extractor.entityType().cast(entity), context);
    }
}
