package br.edu.ifba.cadgraph.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.core.GraphRecordBuilder;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.host.BRepBody;
import br.edu.ifba.cadgraph.host.CadComponent;
import br.edu.ifba.cadgraph.host.CadDesign;
import br.edu.ifba.cadgraph.host.CadEntity;
import br.edu.ifba.cadgraph.host.Feature;
import br.edu.ifba.cadgraph.host.HostUnavailableException;
import br.edu.ifba.cadgraph.host.Profile;
import br.edu.ifba.cadgraph.host.Sketch;

/**
 * Walks a design in modeling order and feeds every extraction to the record builder.
 *
 * <p>Order: component, its construction geometry, then its features by timeline
 * index (unindexed last). Each feature is followed by the sketches owning its
 * profiles and by the topology of its bodies. Sketches and bodies not reached
 * through a feature come next, then child components. Model parameters are
 * extracted last.</p>
 *
 * <p>Each entity is extracted once per traversal. Entities that cannot be
 * identified or whose extraction fails are skipped and recorded; a
 * {@link HostUnavailableException} stops the traversal and marks it aborted.</p>
 *
 * <p>Not thread-safe: host handles must be read from a single thread.</p>
 */
public final class DesignTraverser {

    private static final Logger logger = LoggerFactory.getLogger(DesignTraverser.class);

    private final ExtractorRegistry registry;
    private final ExtractionContext context;
    private final GraphRecordBuilder builder;

    private final Set<String> visited = new HashSet<>();
    private final Set<CadEntity> skippedHandles = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<SkippedEntity> skipped = new ArrayList<>();
    private long extracted;

    public DesignTraverser(@NotNull ExtractorRegistry registry, @NotNull ExtractionContext context,
            @NotNull GraphRecordBuilder builder) {
        this.registry = registry;
        this.context = context;
        this.builder = builder;
    }

    /**
     * Traverses the whole design. Host loss is reported in the result, not thrown.
     */
    public TraversalResult traverse(@NotNull CadDesign design) {
        try {
            visitComponent(rootComponentOf(design));
            for (CadEntity parameter : list(design::parameters, "design", "parameters")) {
                visit(parameter);
            }
        } catch (HostUnavailableException e) {
            logger.warn("Host became unavailable after {} entities, aborting traversal: {}",
                extracted, e.getMessage());
            return new TraversalResult(extracted, skipped, true, e.getMessage());
        }
        logger.info("Traversal finished: {} entities extracted, {} skipped", extracted, skipped.size());
        return new TraversalResult(extracted, skipped, false, null);
    }

    // ===== Hierarchy =====

    private void visitComponent(@Nullable CadComponent component) {
        if (component == null || !visit(component)) {
            return;
        }
        for (CadEntity geometry : list(component::constructionGeometry, component.objectType(), "construction geometry")) {
            visit(geometry);
        }

        List<Feature> features = new ArrayList<>(list(component::features, component.objectType(), "features"));
        features.sort(Comparator.comparing(this::timelineIndexOf, Comparator.nullsLast(Comparator.naturalOrder())));
        for (Feature feature : features) {
            visitFeature(feature);
        }

        for (Sketch sketch : list(component::sketches, component.objectType(), "sketches")) {
            visitSketch(sketch);
        }
        for (BRepBody body : list(component::bodies, component.objectType(), "bodies")) {
            visitBody(body);
        }
        for (CadComponent child : list(component::children, component.objectType(), "children")) {
            visitComponent(child);
        }
    }

    private void visitFeature(Feature feature) {
        if (!visit(feature)) {
            return;
        }
        for (Profile profile : list(feature::profiles, feature.objectType(), "profiles")) {
            visitSketch(parentSketchOf(profile));
            visit(profile);
        }
        for (BRepBody body : list(feature::bodies, feature.objectType(), "bodies")) {
            visitBody(body);
        }
    }

    private void visitSketch(@Nullable Sketch sketch) {
        if (sketch == null || !visit(sketch)) {
            return;
        }
        String type = sketch.objectType();
        list(sketch::points, type, "points").forEach(this::visit);
        list(sketch::curves, type, "curves").forEach(this::visit);
        list(sketch::profiles, type, "profiles").forEach(this::visit);
        list(sketch::dimensions, type, "dimensions").forEach(this::visit);
        list(sketch::constraints, type, "constraints").forEach(this::visit);
    }

    private void visitBody(BRepBody body) {
        if (!visit(body)) {
            return;
        }
        String type = body.objectType();
        list(body::faces, type, "faces").forEach(this::visit);
        list(body::edges, type, "edges").forEach(this::visit);
        list(body::vertices, type, "vertices").forEach(this::visit);
    }

    // ===== Extraction =====

    /**
     * Extracts the entity unless it was already visited.
     *
     * @return false if the entity had been visited before; true otherwise,
     *         including when it was skipped, so that its children are still reached
     */
    private boolean visit(CadEntity entity) {
        String id;
        try {
            id = context.idOf(entity);
        } catch (IdentityUnavailableException e) {
            skip(entity, e.getMessage());
            return true;
        }
        if (!visited.add(id)) {
            return false;
        }
        try {
            builder.add(registry.extract(entity, context));
            extracted++;
        } catch (IdentityUnavailableException e) {
            skip(entity, e.getMessage());
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Extraction of {} failed: {}", entity.objectType(), e.getMessage(), e);
            skip(entity, "extraction failed: " + e.getMessage());
        }
        return true;
    }

    private void skip(CadEntity entity, String reason) {
        if (!skippedHandles.add(entity)) {
            return;
        }
        String token = tokenOf(entity);
        logger.warn("Skipping {} ({}): {}", entity.objectType(), token, reason);
        skipped.add(new SkippedEntity(entity.objectType(), token, reason));
    }

    private <T> List<T> list(Supplier<List<T>> accessor, String ownerType, String what) {
        try {
            List<T> values = accessor.get();
            return values != null ? values : List.of();
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Could not enumerate {} of {}: {}", what, ownerType, e.getMessage());
            skipped.add(new SkippedEntity(ownerType, null, "could not enumerate " + what + ": " + e.getMessage()));
            return List.of();
        }
    }

    @Nullable
    private CadComponent rootComponentOf(CadDesign design) {
        try {
            return design.rootComponent();
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Could not read the root component: {}", e.getMessage());
            skipped.add(new SkippedEntity("Design", null, "could not read root component: " + e.getMessage()));
            return null;
        }
    }

    @Nullable
    private Integer timelineIndexOf(Feature feature) {
        try {
            return feature.timelineIndex();
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("No timeline index for {}: {}", feature.objectType(), e.getMessage());
            return null;
        }
    }

    @Nullable
    private Sketch parentSketchOf(Profile profile) {
        try {
            return profile.parentSketch();
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("No parent sketch for {}: {}", profile.objectType(), e.getMessage());
            return null;
        }
    }

    @Nullable
    private static String tokenOf(CadEntity entity) {
        try {
            return entity.entityToken();
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("Token of {} unreadable: {}", entity.objectType(), e.getMessage());
            return null;
        }
    }
}
