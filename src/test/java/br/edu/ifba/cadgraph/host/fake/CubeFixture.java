package br.edu.ifba.cadgraph.host.fake;

import java.util.ArrayList;
import java.util.List;

import br.edu.ifba.cadgraph.host.fake.FakeHost.Body;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Component;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Design;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Edge;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Extrude;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Face;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Line;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Loop;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Parameter;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Plane;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Point;
import br.edu.ifba.cadgraph.host.fake.FakeHost.ProfileImpl;
import br.edu.ifba.cadgraph.host.fake.FakeHost.SketchImpl;
import br.edu.ifba.cadgraph.host.fake.FakeHost.Vertex;

/**
 * A 10 mm cube modeled as one square sketch extruded once.
 *
 * <p>Entity counts: 1 component, 1 construction plane, 1 sketch, 4 points,
 * 4 lines, 1 profile, 1 extrude, 1 body, 6 faces, 12 edges, 8 vertices and
 * 1 model parameter (41 entities). Every face is bounded by 4 edges and every
 * edge lies on 2 faces, so the faces form 12 adjacent pairs.</p>
 */
public final class CubeFixture {

    public static final int ENTITY_COUNT = 41;
    public static final int STRUCTURAL_RELATIONSHIP_COUNT = 113;
    public static final int FACE_ADJACENCY_COUNT = 12;

    public final Design design = new Design();
    public final Component root = new Component("component:root", "Cube");
    public final Plane xyPlane = new Plane("plane:xy", "XY");
    public final SketchImpl sketch = new SketchImpl("sketch:1", "Sketch1", root);
    public final List<Point> points = new ArrayList<>();
    public final List<Line> lines = new ArrayList<>();
    public final ProfileImpl profile = new ProfileImpl("profile:1", sketch);
    public final Parameter distance = new Parameter("param:d1", "d1", "10 mm", 10.0);
    public final Extrude extrude = new Extrude("feature:extrude1", "Extrude1", 1, root);
    public final Body body = new Body("body:1", "Body1");
    public final List<Vertex> vertices = new ArrayList<>();
    public final List<Edge> edges = new ArrayList<>();
    public final Face bottom = new Face("face:bottom", body);
    public final Face top = new Face("face:top", body);
    public final List<Face> sides = new ArrayList<>();

    public CubeFixture() {
        design.name = "Cube";
        design.root = root;
        design.parameters.add(distance);
        root.root = true;
        root.construction.add(xyPlane);

        buildSketch();
        buildBody();

        extrude.profiles.add(profile);
        extrude.bodies.add(body);
        extrude.distance = 10.0;
        extrude.distanceParameter = distance;
        extrude.startFaces.add(bottom);
        extrude.endFaces.add(top);
        extrude.sideFaces.addAll(sides);

        root.sketches.add(sketch);
        root.features.add(extrude);
        root.bodies.add(body);
    }

    private void buildSketch() {
        sketch.timelineIndex = 0;
        sketch.referencePlane = xyPlane;
        double[][] corners = {{0, 0}, {10, 0}, {10, 10}, {0, 10}};
        for (int i = 0; i < corners.length; i++) {
            points.add(new Point("point:" + i, sketch, corners[i][0], corners[i][1], 0));
        }
        for (int i = 0; i < 4; i++) {
            lines.add(new Line("line:" + i, sketch, points.get(i), points.get((i + 1) % 4)));
        }
        sketch.points.addAll(points);
        sketch.curves.addAll(lines);
        profile.loops.add(new Loop(true, List.copyOf(lines)));
        profile.area = 100.0;
        sketch.profiles.add(profile);
    }

    private void buildBody() {
        double[][] corners = {{0, 0}, {10, 0}, {10, 10}, {0, 10}};
        List<Vertex> lower = new ArrayList<>();
        List<Vertex> upper = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            lower.add(new Vertex("vertex:b" + i, corners[i][0], corners[i][1], 0));
            upper.add(new Vertex("vertex:t" + i, corners[i][0], corners[i][1], 10));
        }
        vertices.addAll(lower);
        vertices.addAll(upper);

        List<Edge> lowerEdges = new ArrayList<>();
        List<Edge> upperEdges = new ArrayList<>();
        List<Edge> verticalEdges = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            lowerEdges.add(new Edge("edge:b" + i, lower.get(i), lower.get((i + 1) % 4)));
            upperEdges.add(new Edge("edge:t" + i, upper.get(i), upper.get((i + 1) % 4)));
            verticalEdges.add(new Edge("edge:v" + i, lower.get(i), upper.get(i)));
        }
        edges.addAll(lowerEdges);
        edges.addAll(upperEdges);
        edges.addAll(verticalEdges);

        for (int i = 0; i < 4; i++) {
            sides.add(new Face("face:side" + i, body));
        }
        bottom.edges.addAll(lowerEdges);
        top.edges.addAll(upperEdges);
        for (int i = 0; i < 4; i++) {
            Face side = sides.get(i);
            side.edges.add(lowerEdges.get(i));
            side.edges.add(verticalEdges.get((i + 1) % 4));
            side.edges.add(upperEdges.get(i));
            side.edges.add(verticalEdges.get(i));
        }

        for (int i = 0; i < 4; i++) {
            lowerEdges.get(i).faces.add(bottom);
            lowerEdges.get(i).faces.add(sides.get(i));
            upperEdges.get(i).faces.add(top);
            upperEdges.get(i).faces.add(sides.get(i));
            verticalEdges.get(i).faces.add(sides.get((i + 3) % 4));
            verticalEdges.get(i).faces.add(sides.get(i));
        }

        body.faces.add(bottom);
        body.faces.add(top);
        body.faces.addAll(sides);
        body.edges.addAll(edges);
        body.vertices.addAll(vertices);
    }
}
