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

import java.util.Optional;

/**
 * A named drawable held by a {@link Scene}. Positions are always exposed as interleaved xyz triples, whatever the
 * native dimension of the geometry.
 *
 * @author hal.hildebrand
 */
public sealed interface Geometry permits TriangleMesh, LinePath {

    /**
     * @return interleaved xyz positions
     */
    float[] vertices();

    /**
     * @return the unit of length this geometry is expressed in, if declared
     */
    Optional<String> units();

    default int vertexCount() {
        return vertices().length / 3;
    }

    /**
     * Per-axis minimum of the vertex positions.
     *
     * @return {x, y, z}, or zeros when there are no vertices
     */
    default float[] min() {
        return bound(vertices(), true);
    }

    /**
     * Per-axis maximum of the vertex positions.
     *
     * @return {x, y, z}, or zeros when there are no vertices
     */
    default float[] max() {
        return bound(vertices(), false);
    }

    private static float[] bound(float[] xyz, boolean min) {
        var result = new float[3];
        if (xyz.length == 0) {
            return result;
        }
        System.arraycopy(xyz, 0, result, 0, 3);
        for (int i = 3; i < xyz.length; i += 3) {
            for (int axis = 0; axis < 3; axis++) {
                var v = xyz[i + axis];
                if (min ? v < result[axis] : v > result[axis]) {
                    result[axis] = v;
                }
            }
        }
        return result;
    }
}
