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
package com.hellblazer.exchange.scene;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix4d;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tree of named frames rooted at a base frame. Every frame other than the base has exactly one incoming edge, so
 * edges are keyed by their child frame.
 *
 * @author hal.hildebrand
 */
public class SceneGraph {
    public static final String DEFAULT_BASE_FRAME = "world";

    private static final Logger log = LoggerFactory.getLogger(SceneGraph.class);

    private final String                    baseFrame;
    private final Map<String, GraphEdge>    edges    = new LinkedHashMap<>();
    private final Map<String, List<String>> children = new LinkedHashMap<>();

    public SceneGraph() {
        this(DEFAULT_BASE_FRAME);
    }

    public SceneGraph(String baseFrame) {
        this.baseFrame = Objects.requireNonNull(baseFrame, "baseFrame");
    }

    public String baseFrame() {
        return baseFrame;
    }

    /**
     * Insert or replace the edge leading to {@code edge.frameTo()}. Replacing an edge reparents the frame.
     */
    public void update(GraphEdge edge) {
        if (edge.frameTo().equals(baseFrame)) {
            throw new IllegalArgumentException("Base frame " + baseFrame + " cannot have a parent");
        }
        if (edge.frameTo().equals(edge.frameFrom())) {
            throw new IllegalArgumentException("Frame " + edge.frameTo() + " cannot be its own parent");
        }
        var previous = edges.put(edge.frameTo(), edge);
        if (previous != null) {
            children.get(previous.frameFrom()).remove(previous.frameTo());
        }
        children.computeIfAbsent(edge.frameFrom(), k -> new ArrayList<>()).add(edge.frameTo());
    }

    public void updateAll(Collection<GraphEdge> edges) {
        edges.forEach(this::update);
    }

    public Optional<GraphEdge> get(String frameTo) {
        return Optional.ofNullable(edges.get(frameTo));
    }

    public boolean contains(String frame) {
        return frame.equals(baseFrame) || edges.containsKey(frame);
    }

    public List<GraphEdge> edges() {
        return List.copyOf(edges.values());
    }

    public List<String> children(String frame) {
        return Collections.unmodifiableList(children.getOrDefault(frame, List.of()));
    }

    /**
     * @return every frame name, base frame first
     */
    public Set<String> frames() {
        var frames = new LinkedHashSet<String>();
        frames.add(baseFrame);
        for (var edge : edges.values()) {
            frames.add(edge.frameFrom());
            frames.add(edge.frameTo());
        }
        return frames;
    }

    /**
     * @return frames that instance a geometry
     */
    public List<String> nodesGeometry() {
        return edges.values().stream().filter(GraphEdge::hasGeometry).map(GraphEdge::frameTo).toList();
    }

    /**
     * Transform from {@code frame} to the base frame, the product of edge matrices along the path from the base.
     */
    public Matrix4d worldTransform(String frame) {
        var result = GraphEdge.identity();
        var current = frame;
        int hops = 0;
        while (!current.equals(baseFrame)) {
            var edge = edges.get(current);
            if (edge == null || hops++ > edges.size()) {
                throw new IllegalArgumentException("Frame " + frame + " is not connected to " + baseFrame);
            }
            var m = edge.matrix();
            m.mul(result);
            result = m;
            current = edge.frameFrom();
        }
        return result;
    }

    /**
     * Flatten into a glTF node array. Node 0 is the base frame and the only scene root; the remaining frames follow in
     * breadth first order. Frames not reachable from the base frame are dropped.
     *
     * @param meshIndex geometry name to mesh index
     */
    public FlattenedGraph toGltf(Map<String, Integer> meshIndex) {
        var order = new ArrayList<String>();
        var index = new HashMap<String, Integer>();
        var queue = new ArrayDeque<String>();
        queue.add(baseFrame);
        while (!queue.isEmpty()) {
            var frame = queue.poll();
            index.put(frame, order.size());
            order.add(frame);
            queue.addAll(children(frame));
        }
        if (order.size() - 1 < edges.size()) {
            log.warn("{} frames are not connected to {} and were not flattened", edges.size() - order.size() + 1,
                     baseFrame);
        }

        var nodes = new ArrayList<FlattenedGraph.Node>(order.size());
        for (var frame : order) {
            var childIndices = children(frame).stream().map(index::get).toList();
            double[] matrix = null;
            Integer mesh = null;
            var edge = edges.get(frame);
            if (edge != null) {
                matrix = columnMajor(edge.matrix());
                if (edge.hasGeometry()) {
                    mesh = meshIndex.get(edge.geometry());
                    if (mesh == null) {
                        log.warn("Frame {} references unknown geometry {}", frame, edge.geometry());
                    }
                }
            }
            nodes.add(new FlattenedGraph.Node(frame, matrix, childIndices, mesh));
        }
        return new FlattenedGraph(nodes, List.of(0));
    }

    private static double[] columnMajor(Matrix4d m) {
        var identity = GraphEdge.identity();
        if (identity.equals(m)) {
            return null;
        }
        var values = new double[16];
        for (int column = 0; column < 4; column++) {
            for (int row = 0; row < 4; row++) {
                values[column * 4 + row] = m.getElement(row, column);
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return String.format("SceneGraph[base=%s, %d edges]", baseFrame, edges.size());
    }
}
