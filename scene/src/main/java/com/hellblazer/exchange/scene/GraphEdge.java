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
import java.util.Objects;

/**
 * A directed edge of the transform graph. The matrix maps coordinates in {@code frameTo} into {@code frameFrom} and
 * is row-major; a geometry name marks the child frame as an instance of that geometry.
 *
 * @author hal.hildebrand
 */
public record GraphEdge(String frameFrom, String frameTo, Matrix4d matrix, String geometry) {

    public GraphEdge {
        Objects.requireNonNull(frameFrom, "frameFrom");
        Objects.requireNonNull(frameTo, "frameTo");
        matrix = matrix == null ? identity() : new Matrix4d(matrix);
    }

    public GraphEdge(String frameFrom, String frameTo, Matrix4d matrix) {
        this(frameFrom, frameTo, matrix, null);
    }

    public static Matrix4d identity() {
        var m = new Matrix4d();
        m.setIdentity();
        return m;
    }

    @Override
    public Matrix4d matrix() {
        return new Matrix4d(matrix);
    }

    public boolean hasGeometry() {
        return geometry != null;
    }

    /**
     * @return the same edge instancing a geometry under a different child frame
     */
    public GraphEdge instance(String frame, String geometryName) {
        return new GraphEdge(frameFrom, frame, matrix, geometryName);
    }
}
