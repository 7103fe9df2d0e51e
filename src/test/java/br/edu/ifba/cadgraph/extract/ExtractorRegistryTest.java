package br.edu.ifba.cadgraph.extract;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.cadgraph.core.EntityIdentityService;
import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.host.fake.CubeFixture;
import br.edu.ifba.cadgraph.host.fake.FakeHost;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ExtractorRegistry} and the built-in extractors.
 */
class ExtractorRegistryTest {

    private ExtractorRegistry registry;
    private ExtractionContext context;
    private CubeFixture cube;

    @BeforeEach
    void setUp() {
        registry = ExtractorRegistry.withDefaults();
        context = new ExtractionContext(new EntityIdentityService());
        cube = new CubeFixture();
    }

    private static String id(String token) {
        return EntityIdentityService.stableIdFor(token);
    }

    private static List<GraphRelationship> ofType(Extraction extraction, RelationshipType type) {
        return extraction.relationships().stream().filter(r -> r.type() == type).toList();
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("unregistered types fall back to a generic node")
        void testUnknownTypeFallsBack() throws Exception {
            final FakeHost.Unknown entity = new FakeHost.Unknown("SketchTextDefinition", "text-1");

            final Extraction extraction = registry.extract(entity, context);

            assertEquals("SketchTextDefinition", extraction.node().label());
            assertEquals(NodeCategory.UNKNOWN, extraction.node().category());
            assertEquals("adsk::fusion::SketchTextDefinition", extraction.node().property("object_type"));
            assertTrue(extraction.relationships().isEmpty(), "Generic extraction emits no relationships");
        }

        @Test
        @DisplayName("registered type whose handle lacks the interface falls back")
        void testInterfaceMismatchFallsBack() throws Exception {
            final FakeHost.Unknown entity = new FakeHost.Unknown("SketchLine", "not-a-line");

            final Extraction extraction = registry.extract(entity, context);

            assertEquals(NodeCategory.UNKNOWN, extraction.node().category());
            assertEquals("SketchLine", extraction.node().label());
        }

        @Test
        @DisplayName("built-in types are registered")
        void testDefaultRegistrations() {
            assertTrue(registry.isRegistered("adsk::fusion::SketchLine"));
            assertTrue(registry.isRegistered("adsk::fusion::ExtrudeFeature"));
            assertTrue(registry.isRegistered("adsk::fusion::FilletFeature"));
            assertTrue(registry.isRegistered("adsk::fusion::CircularPatternFeature"));
            assertTrue(registry.isRegistered("adsk::fusion::SketchEllipticalArc"));
            assertTrue(registry.isRegistered("adsk::fusion::BRepEdge"));
            assertFalse(registry.isRegistered("adsk::fusion::SketchTextDefinition"));
        }

        @Test
        @DisplayName("every node carries entity_token and object_type")
        void testCommonProperties() throws Exception {
            final Extraction extraction = registry.extract(cube.points.get(0), context);

            assertEquals("point:0", extraction.node().property("entity_token"));
            assertEquals("adsk::fusion::SketchPoint", extraction.node().property("object_type"));
            assertEquals(List.of(0.0, 0.0, 0.0), extraction.node().property("coordinates"));
        }
    }

    @Nested
    @DisplayName("Sketch extractors")
    class SketchExtractors {

        @Test
        @DisplayName("line references its sketch and is bounded by its endpoints")
        void testLine() throws Exception {
            final Extraction extraction = registry.extract(cube.lines.get(0), context);

            assertEquals("SketchLine", extraction.node().label());
            assertEquals(10.0, (Double) extraction.node().property("length"), 1e-9);
            final List<GraphRelationship> references = ofType(extraction, RelationshipType.REFERENCES);
            assertEquals(1, references.size());
            assertEquals(id("sketch:1"), references.get(0).targetId());

            final Map<String, Object> roles = ofType(extraction, RelationshipType.BOUNDED_BY).stream()
                .collect(Collectors.toMap(GraphRelationship::targetId, r -> r.properties().get("role")));
            assertEquals(Map.of(id("point:0"), "start", id("point:1"), "end"), roles);
        }

        @Test
        @DisplayName("profile boundary curves carry sequence_index in loop order")
        void testProfileSequence() throws Exception {
            final Extraction extraction = registry.extract(cube.profile, context);

            final List<GraphRelationship> boundaries = ofType(extraction, RelationshipType.BOUNDED_BY);
            assertEquals(4, boundaries.size());
            for (int i = 0; i < 4; i++) {
                assertEquals(id("line:" + i), boundaries.get(i).targetId());
                assertEquals(i, boundaries.get(i).properties().get("sequence_index"));
                assertEquals(true, boundaries.get(i).properties().get("is_outer"));
            }
            assertEquals(1, extraction.node().property("loop_count"));
        }

        @Test
        @DisplayName("arc references its center and is bounded by start and end")
        void testArc() throws Exception {
            final FakeHost.Point center = new FakeHost.Point("c", cube.sketch, 0, 0, 0);
            final FakeHost.Arc arc = new FakeHost.Arc("arc", cube.sketch, center, cube.points.get(1),
                cube.points.get(3), 10);

            final Extraction extraction = registry.extract(arc, context);

            assertTrue(ofType(extraction, RelationshipType.REFERENCES).stream()
                .anyMatch(r -> r.targetId().equals(id("c")) && "center".equals(r.properties().get("role"))));
            assertEquals(2, ofType(extraction, RelationshipType.BOUNDED_BY).size());
            assertEquals(List.of(0.0, 0.0, 0.0), extraction.node().property("center_point"));
        }

        @Test
        @DisplayName("fitted spline references its fit points in order and is bounded by its ends")
        void testSplineFitPoints() throws Exception {
            final FakeHost.Spline spline = new FakeHost.Spline("spline", cube.sketch);
            spline.fitPoints.addAll(cube.points);

            final Extraction extraction = registry.extract(spline, context);

            assertEquals("SketchFittedSpline", extraction.node().label());
            assertEquals(NodeCategory.SKETCH_GEOMETRY, extraction.node().category());
            final List<GraphRelationship> fit = ofType(extraction, RelationshipType.REFERENCES).stream()
                .filter(r -> "fit".equals(r.properties().get("role")))
                .toList();
            assertEquals(4, fit.size());
            assertEquals(3, fit.get(3).properties().get("sequence_index"));
            assertEquals(2, ofType(extraction, RelationshipType.BOUNDED_BY).size());
        }

        @Test
        @DisplayName("dimension references sketch, entities and its parameter")
        void testDimension() throws Exception {
            final FakeHost.Dimension dimension = new FakeHost.Dimension("dim", cube.sketch, cube.distance);
            dimension.entities.add(cube.lines.get(0));

            final Extraction extraction = registry.extract(dimension, context);

            assertEquals(NodeCategory.DIMENSION, extraction.node().category());
            assertEquals("10 mm", extraction.node().property("expression"));
            final Set<Object> roles = ofType(extraction, RelationshipType.REFERENCES).stream()
                .map(r -> r.properties().get("role"))
                .filter(role -> role != null)
                .collect(Collectors.toSet());
            assertEquals(Set.of("entity", "parameter"), roles);
        }

        @Test
        @DisplayName("references to entities without identity are dropped")
        void testUnresolvedReferenceDropped() throws Exception {
            cube.points.get(1).token = null;

            final Extraction extraction = registry.extract(cube.lines.get(0), context);

            assertEquals(1, ofType(extraction, RelationshipType.BOUNDED_BY).size());
            assertEquals(1, context.unresolvedReferences());
        }
    }

    @Nested
    @DisplayName("Feature and BRep extractors")
    class FeatureAndBRep {

        @Test
        @DisplayName("extrude consumes its profile, produces its body and is referenced by its faces")
        void testExtrude() throws Exception {
            final Extraction extraction = registry.extract(cube.extrude, context);
            final String extrudeId = id("feature:extrude1");

            assertEquals(NodeCategory.FEATURE, extraction.node().category());
            assertEquals(1, extraction.node().property("timeline_index"));
            assertEquals(id("component:root"), extraction.node().property("component_id"));
            assertEquals(10.0, extraction.node().property("distance"));
            assertEquals(id("profile:1"), ofType(extraction, RelationshipType.CONSUMES).get(0).targetId());
            assertEquals(id("body:1"), ofType(extraction, RelationshipType.PRODUCES).get(0).targetId());

            final List<GraphRelationship> producedBy = ofType(extraction, RelationshipType.PRODUCED_BY);
            assertEquals(6, producedBy.size(), "Start, end and four side faces");
            assertTrue(producedBy.stream().allMatch(r -> r.targetId().equals(extrudeId)));
            assertTrue(producedBy.stream().anyMatch(r ->
                r.sourceId().equals(id("face:top")) && "end".equals(r.properties().get("role"))));
        }

        @Test
        @DisplayName("face is bounded by its edges with sequence_index")
        void testFace() throws Exception {
            final Extraction extraction = registry.extract(cube.bottom, context);

            final List<GraphRelationship> edges = ofType(extraction, RelationshipType.BOUNDED_BY);
            assertEquals(4, edges.size());
            assertEquals(id("edge:b2"), edges.get(2).targetId());
            assertEquals(2, edges.get(2).properties().get("sequence_index"));
        }

        @Test
        @DisplayName("manifold edge shares itself with both faces")
        void testEdgeSharesFaces() throws Exception {
            final Extraction extraction = registry.extract(cube.edges.get(0), context);

            final Set<String> faces = ofType(extraction, RelationshipType.SHARES_EDGE).stream()
                .map(GraphRelationship::targetId)
                .collect(Collectors.toSet());
            assertEquals(Set.of(id("face:bottom"), id("face:side0")), faces);
            assertEquals(2, ofType(extraction, RelationshipType.BOUNDED_BY).size());
        }

        @Test
        @DisplayName("edge on a single face emits no shares_edge")
        void testBoundaryEdge() throws Exception {
            final FakeHost.Edge edge = cube.edges.get(0);
            edge.faces.remove(1);

            final Extraction extraction = registry.extract(edge, context);

            assertTrue(ofType(extraction, RelationshipType.SHARES_EDGE).isEmpty());
        }

        @Test
        @DisplayName("component contains its sketches, features, bodies and construction geometry")
        void testComponent() throws Exception {
            final Extraction extraction = registry.extract(cube.root, context);

            assertEquals(4, ofType(extraction, RelationshipType.CONTAINS).size());
            assertEquals(true, extraction.node().property("is_root"));
        }
    }
}
