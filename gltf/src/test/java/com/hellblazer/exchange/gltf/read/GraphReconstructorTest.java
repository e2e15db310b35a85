/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.exchange.gltf.read;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import com.hellblazer.exchange.scene.GraphEdge;
import com.hellblazer.exchange.scene.TriangleMesh;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.io.IOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GraphReconstructorTest {

    private static final TriangleMesh TRIANGLE = new TriangleMesh(new float[] { 0, 0, 0, 1, 0, 0, 0, 1, 0 },
                                                                  new int[] { 0, 1, 2 });

    private final ObjectMapper mapper = new ObjectMapper();

    private static AssembledMeshes meshes(String... geometryOfMesh0) {
        var geometry = new LinkedHashMap<String, TriangleMesh>();
        for (var name : geometryOfMesh0) {
            geometry.put(name, TRIANGLE);
        }
        return new AssembledMeshes(geometry, Map.of(0, List.of(geometryOfMesh0)));
    }

    private ReconstructedGraph reconstruct(String json, AssembledMeshes meshes) throws IOException {
        JsonNode document = mapper.readTree(json);
        return new GraphReconstructor("world", FrameNamer.sequential()).reconstruct(document, meshes);
    }

    private static List<GraphEdge> instances(ReconstructedGraph graph) {
        return graph.edges().stream().filter(GraphEdge::hasGeometry).toList();
    }

    @Test
    void testSingleInstance() throws IOException {
        var graph = reconstruct("""
                                {"scene": 0, "scenes": [{"nodes": [0]}],
                                 "nodes": [{"name": "part", "mesh": 0}]}""", meshes("tri"));
        assertEquals("world", graph.baseFrame());
        assertEquals(2, graph.edges().size());

        var structural = graph.edges().get(0);
        assertEquals("world", structural.frameFrom());
        assertEquals("part", structural.frameTo());
        assertFalse(structural.hasGeometry());

        var instance = graph.edges().get(1);
        assertEquals("world", instance.frameFrom());
        assertEquals("tri_000000", instance.frameTo());
        assertEquals("tri", instance.geometry());
    }

    @Test
    void testBaseFrameAvoidsNodeNames() throws IOException {
        var graph = reconstruct("""
                                {"scenes": [{"nodes": [0]}],
                                 "nodes": [{"name": "world", "children": [1]}, {"name": "child"}]}""", meshes());
        assertNotEquals("world", graph.baseFrame());
        assertEquals("1000000000", graph.baseFrame());
        assertEquals(graph.baseFrame(), graph.edges().get(0).frameFrom());
        assertEquals("world", graph.edges().get(0).frameTo());
        assertEquals("world", graph.edges().get(1).frameFrom());
    }

    @Test
    void testRenamedBaseFrameKeepsInstanceNames() throws IOException {
        var graph = reconstruct("""
                                {"scenes": [{"nodes": [0]}], "nodes": [{"name": "world", "mesh": 0}]}""",
                                meshes("tri"));
        assertEquals("1000000000", graph.baseFrame());
        var frames = instances(graph).stream().map(GraphEdge::frameTo).toList();
        assertEquals(List.of("tri_000000"), frames);
    }

    @Test
    void testMultiplePrimitivesYieldOneEdgeEach() throws IOException {
        var graph = reconstruct("""
                                {"scenes": [{"nodes": [0]}], "nodes": [{"mesh": 0}]}""",
                                meshes("part_0", "part_1", "part_2"));
        assertEquals(4, graph.edges().size());
        var frames = new HashSet<String>();
        for (var edge : instances(graph)) {
            assertEquals("world", edge.frameFrom());
            frames.add(edge.frameTo());
        }
        assertEquals(3, frames.size());
    }

    @Test
    void testRepeatedInstancesGetDistinctFrames() throws IOException {
        var graph = reconstruct("""
                                {"scenes": [{"nodes": [0, 1, 2, 3]}],
                                 "nodes": [{"mesh": 0}, {"mesh": 0}, {"mesh": 0}, {"mesh": 0}]}""", meshes("tri"));
        var instances = instances(graph);
        assertEquals(4, instances.size());
        assertEquals(4, instances.stream().map(GraphEdge::frameTo).distinct().count());
        assertEquals(8, graph.edges().size());
    }

    @Test
    void testWorklistIsLastInFirstOut() throws IOException {
        var graph = reconstruct("""
                                {"scenes": [{"nodes": [0, 1]}],
                                 "nodes": [{"name": "a", "mesh": 0}, {"name": "b", "mesh": 0}]}""", meshes("tri"));
        assertEquals("b", graph.edges().get(0).frameTo());
        assertEquals("tri_000000", graph.edges().get(1).frameTo());
        assertEquals("a", graph.edges().get(2).frameTo());
        assertEquals("tri_000001", graph.edges().get(3).frameTo());
    }

    @Test
    void testDuplicateAndMissingNodeNames() throws IOException {
        var graph = reconstruct("""
                                {"scenes": [{"nodes": [0, 1, 2]}],
                                 "nodes": [{"name": "a"}, {"name": "a"}, {}]}""", meshes());
        var names = graph.edges().stream().map(GraphEdge::frameTo).toList();
        assertEquals(List.of("2", "a_1", "a"), names);
    }

    @Test
    void testNoScenesUsesParentlessNodes() throws IOException {
        var graph = reconstruct("""
                                {"nodes": [{"name": "child"}, {"name": "root", "children": [0]}]}""", meshes());
        assertEquals(2, graph.edges().size());
        assertEquals("world", graph.edges().get(0).frameFrom());
        assertEquals("root", graph.edges().get(0).frameTo());
        assertEquals("root", graph.edges().get(1).frameFrom());
    }

    @Test
    void testCycleRejected() {
        assertThrows(FormatException.class, () -> reconstruct("""
                                                              {"scenes": [{"nodes": [0]}],
                                                               "nodes": [{"children": [1]}, {"children": [0]}]}""",
                                                              meshes()));
    }

    @Test
    void testBadReferences() {
        assertThrows(FormatException.class, () -> reconstruct("""
                                                              {"scenes": [{"nodes": [4]}], "nodes": [{}]}""",
                                                              meshes()));
        assertThrows(FormatException.class, () -> reconstruct("""
                                                              {"scene": 2, "scenes": [{"nodes": [0]}],
                                                               "nodes": [{}]}""", meshes()));
    }

    @Test
    void testMatrixIsTransposed() throws IOException {
        var node = mapper.readTree("{\"matrix\": [1,0,0,0, 0,1,0,0, 0,0,1,0, 5,6,7,1]}");
        var m = GraphReconstructor.transform(0, node);
        assertEquals(5.0, m.getElement(0, 3));
        assertEquals(6.0, m.getElement(1, 3));
        assertEquals(7.0, m.getElement(2, 3));
        assertEquals(0.0, m.getElement(3, 0));
    }

    @Test
    void testTranslationRotationScale() throws IOException {
        double half = Math.sqrt(0.5);
        var node = mapper.readTree(String.format("{\"translation\": [1, 2, 3], \"rotation\": [0, 0, %s, %s],"
                                                 + " \"scale\": [2, 2, 2]}", half, half));
        var m = GraphReconstructor.transform(0, node);
        var point = new Point3d(1, 0, 0);
        m.transform(point);
        // scaled to (2,0,0), rotated a quarter turn about z, then translated
        assertEquals(1.0, point.x, 1e-9);
        assertEquals(4.0, point.y, 1e-9);
        assertEquals(3.0, point.z, 1e-9);
    }

    @Test
    void testDefaultTransformIsIdentity() throws IOException {
        assertEquals(GraphEdge.identity(), GraphReconstructor.transform(0, mapper.readTree("{}")));
        assertThrows(FormatException.class,
                     () -> GraphReconstructor.transform(0, mapper.readTree("{\"translation\": [1, 2]}")));
    }
}
