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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A set of polylines over shared vertices, planar (2D) or spatial (3D). Planar paths are lifted to z = 0 wherever
 * positions are exposed.
 *
 * @author hal.hildebrand
 */
public final class LinePath implements Geometry {

    private final float[]     points;
    private final int         dimension;
    private final List<int[]> polylines;
    private final String      units;

    /**
     * @param points    interleaved coordinates, {@code dimension} per vertex
     * @param dimension 2 or 3
     * @param polylines each entry an ordered list of vertex indices, at least two long
     * @param units     unit of length, may be null
     */
    public LinePath(float[] points, int dimension, List<int[]> polylines, String units) {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(polylines, "polylines");
        if (dimension != 2 && dimension != 3) {
            throw new IllegalArgumentException("Paths are 2D or 3D, not " + dimension + "D");
        }
        if (points.length % dimension != 0) {
            throw new IllegalArgumentException(
            "Points length " + points.length + " is not a multiple of dimension " + dimension);
        }
        int count = points.length / dimension;
        var copies = new ArrayList<int[]>(polylines.size());
        for (var line : polylines) {
            if (line.length < 2) {
                throw new IllegalArgumentException("Polyline needs at least two vertices");
            }
            for (int index : line) {
                if (index < 0 || index >= count) {
                    throw new IllegalArgumentException("Polyline index " + index + " out of range for " + count);
                }
            }
            copies.add(line.clone());
        }
        this.points = points.clone();
        this.dimension = dimension;
        this.polylines = Collections.unmodifiableList(copies);
        this.units = units;
    }

    /**
     * A single open polyline through every point in order.
     */
    public static LinePath polyline(float[] points, int dimension) {
        int count = points.length / dimension;
        var line = new int[count];
        for (int i = 0; i < count; i++) {
            line[i] = i;
        }
        return new LinePath(points, dimension, List.of(line), null);
    }

    public LinePath withUnits(String units) {
        return new LinePath(points, dimension, polylines, units);
    }

    public int dimension() {
        return dimension;
    }

    public List<int[]> polylines() {
        return polylines;
    }

    @Override
    public float[] vertices() {
        int count = points.length / dimension;
        var xyz = new float[count * 3];
        for (int i = 0; i < count; i++) {
            for (int axis = 0; axis < dimension; axis++) {
                xyz[i * 3 + axis] = points[i * dimension + axis];
            }
        }
        return xyz;
    }

    @Override
    public Optional<String> units() {
        return Optional.ofNullable(units);
    }

    /**
     * Expands the polylines into independent segments, two xyz endpoints per segment, as drawn with line-list
     * topology.
     *
     * @return interleaved xyz endpoints
     */
    public float[] toLineList() {
        var xyz = vertices();
        var result = new float[lineVertexCount() * 3];
        int cursor = 0;
        for (var line : polylines) {
            for (int k = 0; k < line.length - 1; k++) {
                System.arraycopy(xyz, line[k] * 3, result, cursor, 3);
                System.arraycopy(xyz, line[k + 1] * 3, result, cursor + 3, 3);
                cursor += 6;
            }
        }
        return result;
    }

    /**
     * @return number of endpoints produced by {@link #toLineList()}
     */
    public int lineVertexCount() {
        int segments = 0;
        for (var line : polylines) {
            segments += line.length - 1;
        }
        return segments * 2;
    }

    @Override
    public String toString() {
        return String.format("LinePath[%dD, %d vertices, %d polylines]", dimension, points.length / dimension,
                             polylines.size());
    }
}
