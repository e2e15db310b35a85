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

import java.util.List;
import java.util.Objects;

/**
 * A transform graph flattened into the index-referencing node array of glTF. Node indices are positions in
 * {@link #nodes()}; {@link #roots()} lists the nodes of the single default scene.
 *
 * @author hal.hildebrand
 */
public record FlattenedGraph(List<Node> nodes, List<Integer> roots) {

    public FlattenedGraph {
        nodes = List.copyOf(nodes);
        roots = List.copyOf(roots);
    }

    /**
     * @param name     frame name
     * @param matrix   16 column-major values, null for identity
     * @param children indices of child nodes
     * @param mesh     index of the instanced mesh, null for a pure transform
     */
    public record Node(String name, double[] matrix, List<Integer> children, Integer mesh) {
        public Node {
            Objects.requireNonNull(name, "name");
            children = List.copyOf(children);
            if (matrix != null && matrix.length != 16) {
                throw new IllegalArgumentException("Node matrix needs 16 values, got " + matrix.length);
            }
        }
    }
}
