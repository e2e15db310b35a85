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

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Objects;
import java.util.Optional;

/**
 * Indexed triangle mesh. Vertices are interleaved xyz floats, faces are interleaved vertex index triples.
 *
 * @author hal.hildebrand
 */
public final class TriangleMesh implements Geometry {

    private final float[] vertices;
    private final int[]   faces;
    private final Visuals visuals;
    private final String  units;
    private       float[] vertexNormals;

    public TriangleMesh(float[] vertices, int[] faces) {
        this(vertices, faces, ColorVisuals.none(), null, null);
    }

    /**
     * @param vertices      xyz per vertex
     * @param faces         three vertex indices per face
     * @param visuals       colour or texture information
     * @param units         unit of length, may be null
     * @param vertexNormals xyz per vertex, null to compute on demand
     */
    public TriangleMesh(float[] vertices, int[] faces, Visuals visuals, String units, float[] vertexNormals) {
        Objects.requireNonNull(vertices, "vertices");
        Objects.requireNonNull(faces, "faces");
        if (vertices.length % 3 != 0) {
            throw new IllegalArgumentException("Vertices must be xyz triples, length " + vertices.length);
        }
        if (faces.length % 3 != 0) {
            throw new IllegalArgumentException("Faces must be index triples, length " + faces.length);
        }
        int vertexCount = vertices.length / 3;
        for (int index : faces) {
            if (index < 0 || index >= vertexCount) {
                throw new IllegalArgumentException(
                "Face index " + index + " out of range for " + vertexCount + " vertices");
            }
        }
        if (vertexNormals != null && vertexNormals.length != vertices.length) {
            throw new IllegalArgumentException(
            "Expected " + vertices.length + " normal components, got " + vertexNormals.length);
        }
        this.vertices = vertices.clone();
        this.faces = faces.clone();
        this.visuals = Objects.requireNonNull(visuals, "visuals");
        this.units = units;
        this.vertexNormals = vertexNormals == null ? null : vertexNormals.clone();
    }

    public TriangleMesh withVisuals(Visuals visuals) {
        return new TriangleMesh(vertices, faces, visuals, units, vertexNormals);
    }

    public TriangleMesh withUnits(String units) {
        return new TriangleMesh(vertices, faces, visuals, units, vertexNormals);
    }

    @Override
    public float[] vertices() {
        return vertices.clone();
    }

    public int[] faces() {
        return faces.clone();
    }

    public int faceCount() {
        return faces.length / 3;
    }

    public Point3f vertex(int index) {
        return new Point3f(vertices[index * 3], vertices[index * 3 + 1], vertices[index * 3 + 2]);
    }

    public int[] face(int index) {
        return new int[] { faces[index * 3], faces[index * 3 + 1], faces[index * 3 + 2] };
    }

    /**
     * @return the largest vertex index referenced by any face, or 0 for a mesh without faces
     */
    public int maxFaceIndex() {
        int max = 0;
        for (int index : faces) {
            max = Math.max(max, index);
        }
        return max;
    }

    public Visuals visuals() {
        return visuals;
    }

    @Override
    public Optional<String> units() {
        return Optional.ofNullable(units);
    }

    public boolean hasExplicitNormals() {
        return vertexNormals != null;
    }

    /**
     * Unit vertex normals. When none were supplied they are computed as the area weighted sum of the adjacent face
     * normals.
     *
     * @return xyz per vertex
     */
    public float[] vertexNormals() {
        if (vertexNormals == null) {
            vertexNormals = computeVertexNormals();
        }
        return vertexNormals.clone();
    }

    private float[] computeVertexNormals() {
        var normals = new float[vertices.length];
        var e1 = new Vector3f();
        var e2 = new Vector3f();
        var n = new Vector3f();
        for (int f = 0; f < faceCount(); f++) {
            var a = vertex(faces[f * 3]);
            var b = vertex(faces[f * 3 + 1]);
            var c = vertex(faces[f * 3 + 2]);
            e1.sub(b, a);
            e2.sub(c, a);
            // unnormalized cross product carries twice the face area
            n.cross(e1, e2);
            for (int k = 0; k < 3; k++) {
                int v = faces[f * 3 + k];
                normals[v * 3] += n.x;
                normals[v * 3 + 1] += n.y;
                normals[v * 3 + 2] += n.z;
            }
        }
        for (int v = 0; v < normals.length; v += 3) {
            n.set(normals[v], normals[v + 1], normals[v + 2]);
            float length = n.length();
            if (length > 0f) {
                normals[v] = n.x / length;
                normals[v + 1] = n.y / length;
                normals[v + 2] = n.z / length;
            }
        }
        return normals;
    }

    @Override
    public String toString() {
        return String.format("TriangleMesh[%d vertices, %d faces, %s]", vertexCount(), faceCount(), visuals);
    }
}
