package br.edu.ifba.cadgraph.extract.design;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import br.edu.ifba.cadgraph.core.EntityIdentityService;
import br.edu.ifba.cadgraph.core.Extraction;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.host.fake.CubeFixture;
import br.edu.ifba.cadgraph.host.fake.FakeHost;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ModelParameterExtractor} and {@link ConstructionGeometryExtractor}.
 */
class DesignEntityExtractorsTest {

    private ExtractionContext context;
    private CubeFixture cube;

    @BeforeEach
    void setUp() {
        context = new ExtractionContext(new EntityIdentityService());
        cube = new CubeFixture();
    }

    private static String id(String token) {
        return EntityIdentityService.stableIdFor(token);
    }

    private static List<String> targets(Extraction extraction, RelationshipType type) {
        return extraction.relationships().stream()
            .filter(r -> r.type() == type)
            .map(GraphRelationship::targetId)
            .toList();
    }

    @Test
    @DisplayName("parameter links its dependents, dependencies and creating feature")
    void testParameterLinks() throws Exception {
        final FakeHost.Parameter width = new FakeHost.Parameter("param:width", "width", "d1 * 2", 20.0);
        final FakeHost.Parameter depth = new FakeHost.Parameter("param:depth", "depth", "width / 4", 5.0);
        width.dependencies.add(cube.distance);
        width.dependents.add(depth);
        width.createdBy = cube.extrude;

        final Extraction extraction = new ModelParameterExtractor().extract(width, context);

        assertEquals("d1 * 2", extraction.node().property("expression"));
        assertEquals(List.of(id("param:depth")), targets(extraction, RelationshipType.HAS_DEPENDENT));
        assertEquals(List.of(id("param:d1")), targets(extraction, RelationshipType.DEPENDENT_ON));
        assertEquals(List.of(id("feature:extrude1")), targets(extraction, RelationshipType.CREATED_BY));
    }

    @Test
    @DisplayName("independent parameter emits no relationships")
    void testIndependentParameter() throws Exception {
        final Extraction extraction = new ModelParameterExtractor().extract(cube.distance, context);

        assertTrue(extraction.relationships().isEmpty());
    }

    @Test
    @DisplayName("offset plane is defined by the face it offsets")
    void testPlaneDefinedBy() throws Exception {
        final FakeHost.Plane offset = new FakeHost.Plane("plane:offset", "Offset1");
        offset.definitionType = "ConstructionPlaneOffsetDefinition";
        offset.definingEntities.add(cube.top);

        final Extraction extraction = new ConstructionGeometryExtractor().extract(offset, context);

        assertEquals("ConstructionPlaneOffsetDefinition", extraction.node().property("definition_type"));
        final List<GraphRelationship> definedBy = extraction.relationships();
        assertEquals(1, definedBy.size());
        assertEquals(RelationshipType.DEFINED_BY, definedBy.get(0).type());
        assertEquals(id("face:top"), definedBy.get(0).targetId());
        assertEquals(0, definedBy.get(0).properties().get("sequence_index"));
    }

    @Test
    @DisplayName("midplane keeps the order of its two defining planes")
    void testMidplaneOrder() throws Exception {
        final FakeHost.Plane midplane = new FakeHost.Plane("plane:mid", "Midplane1");
        midplane.definitionType = "ConstructionPlaneMidplaneDefinition";
        midplane.definingEntities.add(cube.bottom);
        midplane.definingEntities.add(cube.top);

        final Extraction extraction = new ConstructionGeometryExtractor().extract(midplane, context);

        assertEquals(List.of(id("face:bottom"), id("face:top")), targets(extraction, RelationshipType.DEFINED_BY));
    }

    @Test
    @DisplayName("origin plane has no definition")
    void testOriginPlane() throws Exception {
        final Extraction extraction = new ConstructionGeometryExtractor().extract(cube.xyPlane, context);

        assertNull(extraction.node().property("definition_type"));
        assertTrue(extraction.relationships().isEmpty());
    }
}
