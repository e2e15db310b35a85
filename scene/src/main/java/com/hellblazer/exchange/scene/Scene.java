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

import javax.vecmath.Matrix4d;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named geometry plus the transform graph that places instances of it. Geometry keeps insertion order, which is the
 * order meshes are exported in.
 *
 * @author hal.hildebrand
 */
public class Scene {

    private final Map<String, Geometry> geometry = new LinkedHashMap<>();
    private final SceneGraph            graph;

    public Scene() {
        this(new SceneGraph());
    }

    public Scene(SceneGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Scene holding the given geometry and graph as is. Graph edges may reference any of the geometry names.
     */
    public static Scene of(Map<String, ? extends Geometry> geometry, SceneGraph graph) {
        var scene = new Scene(graph);
        geometry.forEach(scene::putGeometry);
        return scene;
    }

    /**
     * Add geometry placed directly under the base frame with an identity transform.
     *
     * @return the frame instancing the geometry
     */
    public String add(String name, Geometry geometry) {
        return add(name, geometry, GraphEdge.identity(), graph.baseFrame());
    }

    /**
     * Add geometry and one instance of it.
     *
     * @param transform from the new frame to {@code parent}
     * @param parent    existing frame to attach to
     * @return the frame instancing the geometry, the geometry name unless that frame is already taken
     */
    public String add(String name, Geometry geometry, Matrix4d transform, String parent) {
        putGeometry(name, geometry);
        if (!graph.contains(parent)) {
            throw new IllegalArgumentException("Unknown parent frame " + parent);
        }
        var frame = name;
        for (int i = 1; graph.contains(frame); i++) {
            frame = name + "_" + i;
        }
        graph.update(new GraphEdge(parent, frame, transform, name));
        return frame;
    }

    private void putGeometry(String name, Geometry value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "geometry");
        if (geometry.putIfAbsent(name, value) != null) {
            throw new IllegalArgumentException("Duplicate geometry name " + name);
        }
    }

    public Map<String, Geometry> geometry() {
        return Collections.unmodifiableMap(geometry);
    }

    public SceneGraph graph() {
        return graph;
    }

    public boolean isEmpty() {
        return geometry.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Scene[%d geometries, %s]", geometry.size(), graph);
    }
}
