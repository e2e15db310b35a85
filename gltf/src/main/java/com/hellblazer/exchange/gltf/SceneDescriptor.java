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
package com.hellblazer.exchange.gltf;

import com.hellblazer.exchange.scene.GraphEdge;
import com.hellblazer.exchange.scene.Scene;
import com.hellblazer.exchange.scene.SceneGraph;
import com.hellblazer.exchange.scene.TriangleMesh;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to construct a {@link Scene} from an imported document: geometry by name, the transform graph as
 * an edge list, and the name of the frame the edges are rooted at.
 *
 * @author hal.hildebrand
 */
public record SceneDescriptor(Map<String, TriangleMesh> geometry, List<GraphEdge> graph, String baseFrame) {

    public SceneDescriptor {
        geometry = Collections.unmodifiableMap(new LinkedHashMap<>(geometry));
        graph = List.copyOf(graph);
        Objects.requireNonNull(baseFrame, "baseFrame");
    }

    public Scene toScene() {
        var sceneGraph = new SceneGraph(baseFrame);
        sceneGraph.updateAll(graph);
        return Scene.of(geometry, sceneGraph);
    }

    /**
     * @return edges that instance a geometry
     */
    public List<GraphEdge> instances() {
        return graph.stream().filter(GraphEdge::hasGeometry).toList();
    }
}
