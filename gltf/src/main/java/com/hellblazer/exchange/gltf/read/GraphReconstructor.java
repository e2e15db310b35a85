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
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import com.hellblazer.exchange.scene.GraphEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix4d;
import javax.vecmath.Quat4d;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds the transform graph from a document's index based node array.
 * <p>
 * Traversal starts at a synthetic base frame connected to every root of the default scene and walks the nodes with a
 * LIFO worklist. Each visited node yields a structural edge from its parent; a node that instances a mesh yields one
 * more edge per geometry generated for that mesh, each to a freshly minted frame {@code <geometry>_<suffix>}.
 * Traversal order only affects the minted suffixes.
 *
 * @author hal.hildebrand
 */
public class GraphReconstructor {
    private static final Logger log = LoggerFactory.getLogger(GraphReconstructor.class);

    private static final int BASE = -1;

    private final String     preferredBaseFrame;
    private final FrameNamer namer;

    public GraphReconstructor(String preferredBaseFrame, FrameNamer namer) {
        this.preferredBaseFrame = preferredBaseFrame;
        this.namer = namer;
    }

    public ReconstructedGraph reconstruct(JsonNode document, AssembledMeshes meshes) {
        var nodes = document.path("nodes");
        var names = nodeNames(nodes);
        var used = new HashSet<>(names);

        var baseFrame = preferredBaseFrame;
        while (used.contains(baseFrame)) {
            baseFrame = namer.numericName();
            log.debug("Base frame {} collides with a node name, using {}", preferredBaseFrame, baseFrame);
        }
        used.add(baseFrame);

        var edges = new ArrayList<GraphEdge>();
        var visited = new HashSet<Integer>();
        var worklist = new ArrayDeque<int[]>();
        for (var root : roots(document, nodes)) {
            worklist.addLast(new int[] { BASE, root });
        }

        while (!worklist.isEmpty()) {
            var pair = worklist.pollLast();
            int parent = pair[0];
            int index = pair[1];
            if (index < 0 || index >= nodes.size()) {
                throw new FormatException("Reference to node " + index + " of " + nodes.size());
            }
            if (!visited.add(index)) {
                throw new FormatException("Node " + index + " is reachable twice, nodes do not form a tree");
            }
            var node = nodes.get(index);
            for (var child : node.path("children")) {
                worklist.addLast(new int[] { index, child.asInt() });
            }

            var edge = new GraphEdge(parent == BASE ? baseFrame : names.get(parent), names.get(index),
                                     transform(index, node));
            edges.add(edge);
            if (node.has("mesh")) {
                for (var geometry : meshes.geometryNames(node.get("mesh").asInt())) {
                    edges.add(edge.instance(mint(geometry, used), geometry));
                }
            }
        }

        log.debug("Reconstructed {} edges from {} nodes under {}", edges.size(), nodes.size(), baseFrame);
        return new ReconstructedGraph(edges, baseFrame);
    }

    /**
     * Node display names: the declared name, else the index. Repeated names get the node index appended.
     */
    private static List<String> nodeNames(JsonNode nodes) {
        var names = new ArrayList<String>(nodes.size());
        var taken = new HashSet<String>();
        for (int i = 0; i < nodes.size(); i++) {
            var declared = nodes.get(i).path("name");
            var name = declared.isTextual() ? declared.asText() : Integer.toString(i);
            var candidate = name;
            for (int k = 0; !taken.add(candidate); k++) {
                candidate = k == 0 ? name + "_" + i : name + "_" + i + "_" + k;
            }
            names.add(candidate);
        }
        return names;
    }

    private static List<Integer> roots(JsonNode document, JsonNode nodes) {
        var scenes = document.path("scenes");
        if (scenes.size() == 0) {
            // no scene: every node that is nobody's child is a root
            Set<Integer> children = new HashSet<>();
            nodes.forEach(n -> n.path("children").forEach(c -> children.add(c.asInt())));
            var roots = new ArrayList<Integer>();
            for (int i = 0; i < nodes.size(); i++) {
                if (!children.contains(i)) {
                    roots.add(i);
                }
            }
            return roots;
        }
        int scene = document.path("scene").asInt(0);
        if (scene < 0 || scene >= scenes.size()) {
            throw new FormatException("Default scene " + scene + " of " + scenes.size());
        }
        var roots = new ArrayList<Integer>();
        scenes.get(scene).path("nodes").forEach(n -> roots.add(n.asInt()));
        return roots;
    }

    /**
     * Parent to child transform, row-major. glTF stores {@code matrix} column-major; without a matrix the
     * translation, rotation and scale properties are composed as T * R * S.
     */
    static Matrix4d transform(int index, JsonNode node) {
        if (node.has("matrix")) {
            var values = numbers(index, node.get("matrix"), 16, "matrix");
            var m = new Matrix4d(values);
            m.transpose();
            return m;
        }
        var m = GraphEdge.identity();
        if (node.has("rotation")) {
            var q = numbers(index, node.get("rotation"), 4, "rotation");
            m.set(new Quat4d(q[0], q[1], q[2], q[3]));
        }
        if (node.has("scale")) {
            var s = numbers(index, node.get("scale"), 3, "scale");
            for (int row = 0; row < 3; row++) {
                for (int column = 0; column < 3; column++) {
                    m.setElement(row, column, m.getElement(row, column) * s[column]);
                }
            }
        }
        if (node.has("translation")) {
            var t = numbers(index, node.get("translation"), 3, "translation");
            m.setElement(0, 3, t[0]);
            m.setElement(1, 3, t[1]);
            m.setElement(2, 3, t[2]);
        }
        return m;
    }

    private String mint(String geometry, Set<String> used) {
        String frame;
        do {
            frame = geometry + "_" + namer.suffix();
        } while (!used.add(frame));
        return frame;
    }

    private static double[] numbers(int index, JsonNode array, int expected, String field) {
        if (!array.isArray() || array.size() != expected) {
            throw new FormatException("Node " + index + " " + field + " needs " + expected + " numbers");
        }
        var values = new double[expected];
        for (int i = 0; i < expected; i++) {
            values[i] = array.get(i).asDouble();
        }
        return values;
    }
}
