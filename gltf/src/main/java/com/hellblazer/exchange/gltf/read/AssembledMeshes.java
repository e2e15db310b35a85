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

import com.hellblazer.exchange.scene.TriangleMesh;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Triangle meshes rebuilt from a document's primitives, and the geometry names generated for each glTF mesh index.
 *
 * @author hal.hildebrand
 */
public record AssembledMeshes(Map<String, TriangleMesh> geometry, Map<Integer, List<String>> meshPrimitives) {

    public AssembledMeshes {
        geometry = Collections.unmodifiableMap(new LinkedHashMap<>(geometry));
        var copy = new LinkedHashMap<Integer, List<String>>();
        meshPrimitives.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        meshPrimitives = Collections.unmodifiableMap(copy);
    }

    /**
     * @return geometry names generated for {@code mesh}, empty when it had no triangle primitives
     */
    public List<String> geometryNames(int mesh) {
        return meshPrimitives.getOrDefault(mesh, List.of());
    }
}
