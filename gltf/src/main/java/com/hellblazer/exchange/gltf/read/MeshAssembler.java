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
import com.hellblazer.exchange.gltf.layout.PrimitiveMode;
import com.hellblazer.exchange.scene.ColorVisuals;
import com.hellblazer.exchange.scene.PbrMaterial;
import com.hellblazer.exchange.scene.TextureVisuals;
import com.hellblazer.exchange.scene.TriangleMesh;
import com.hellblazer.exchange.scene.Visuals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds triangle meshes from the primitives of a document. Primitives with a mode other than triangles are skipped.
 *
 * @author hal.hildebrand
 */
public class MeshAssembler {
    public static final String DEFAULT_NAME = "GLTF_geometry";

    private static final Logger log = LoggerFactory.getLogger(MeshAssembler.class);

    /**
     * @param document  glTF document
     * @param accessors resolved accessors by index
     * @param materials materials by index, empty when materials were not read
     */
    public AssembledMeshes assemble(JsonNode document, List<AccessorData> accessors, List<PbrMaterial> materials) {
        var geometry = new LinkedHashMap<String, TriangleMesh>();
        var meshPrimitives = new LinkedHashMap<Integer, List<String>>();

        int meshIndex = 0;
        for (var mesh : document.path("meshes")) {
            var primitives = mesh.path("primitives");
            var units = mesh.path("extras").path("units");
            var baseName = mesh.path("name").isTextual() ? mesh.get("name").asText() : DEFAULT_NAME;
            var names = new ArrayList<String>();

            for (int j = 0; j < primitives.size(); j++) {
                var primitive = primitives.get(j);
                var mode = PrimitiveMode.fromCode(primitive.path("mode").asInt(PrimitiveMode.TRIANGLES.code()));
                if (mode != PrimitiveMode.TRIANGLES) {
                    log.debug("Skipping {} primitive {} of mesh {}", mode, j, meshIndex);
                    continue;
                }
                var name = primitives.size() > 1 ? baseName + "_" + j : baseName;
                name = unique(name, geometry);
                var triangles = primitive(meshIndex, j, primitive, accessors, materials,
                                          units.isValueNode() && !units.isNull() ? units.asText() : null);
                geometry.put(name, triangles);
                names.add(name);
            }
            meshPrimitives.put(meshIndex, names);
            meshIndex++;
        }
        log.debug("Assembled {} geometries from {} meshes", geometry.size(), meshIndex);
        return new AssembledMeshes(geometry, meshPrimitives);
    }

    private TriangleMesh primitive(int mesh, int index, JsonNode primitive, List<AccessorData> accessors,
                                   List<PbrMaterial> materials, String units) {
        var attributes = primitive.path("attributes");
        if (!attributes.has("POSITION")) {
            throw new FormatException("Primitive " + index + " of mesh " + mesh + " has no POSITION");
        }
        var positions = accessor(accessors, attributes.get("POSITION").asInt());
        var vertices = positions.asFloats();
        int vertexCount = positions.count();

        int[] faces;
        if (primitive.has("indices")) {
            faces = accessor(accessors, primitive.get("indices").asInt()).asInts();
        } else {
            faces = new int[vertexCount];
            for (int i = 0; i < vertexCount; i++) {
                faces[i] = i;
            }
        }
        if (faces.length % 3 != 0) {
            throw new FormatException(
            "Primitive " + index + " of mesh " + mesh + " has " + faces.length + " indices, not triangles");
        }

        Visuals visuals = ColorVisuals.none();
        if (attributes.has("COLOR_0")) {
            visuals = colors(accessor(accessors, attributes.get("COLOR_0").asInt()), vertexCount, visuals);
        }
        if (attributes.has("TEXCOORD_0")) {
            visuals = texture(mesh, primitive, accessor(accessors, attributes.get("TEXCOORD_0").asInt()),
                              vertexCount, materials, visuals);
        }

        float[] normals = null;
        if (attributes.has("NORMAL")) {
            var normal = accessor(accessors, attributes.get("NORMAL").asInt());
            if (normal.count() == vertexCount && normal.componentCount() == 3) {
                normals = normal.asFloats();
            } else {
                log.warn("Ignoring NORMAL of mesh {}: {} normals for {} vertices", mesh, normal.count(), vertexCount);
            }
        }

        try {
            return new TriangleMesh(vertices, faces, visuals, units, normals);
        } catch (IllegalArgumentException e) {
            throw new FormatException("Primitive " + index + " of mesh " + mesh + ": " + e.getMessage(), e);
        }
    }

    private Visuals colors(AccessorData colors, int vertexCount, Visuals fallback) {
        if (colors.count() != vertexCount || colors.componentCount() < 3 || colors.componentCount() > 4) {
            log.warn("Ignoring COLOR_0: {} for {} vertices", colors, vertexCount);
            return fallback;
        }
        var rgba = new byte[vertexCount * 4];
        for (int v = 0; v < vertexCount; v++) {
            for (int c = 0; c < 4; c++) {
                float value = c < colors.componentCount() ? colors.getNormalized(v, c) : 1f;
                rgba[v * 4 + c] = (byte) Math.round(Math.max(0f, Math.min(1f, value)) * 255f);
            }
        }
        return ColorVisuals.perVertex(rgba);
    }

    private Visuals texture(int mesh, JsonNode primitive, AccessorData uvs, int vertexCount,
                            List<PbrMaterial> materials, Visuals fallback) {
        if (!primitive.has("material")) {
            log.warn("Mesh {} has TEXCOORD_0 without a material, skipping UVs", mesh);
            return fallback;
        }
        if (materials.isEmpty()) {
            log.warn("Mesh {} is textured but materials were not loaded, skipping UVs", mesh);
            return fallback;
        }
        int material = primitive.get("material").asInt();
        if (material < 0 || material >= materials.size()) {
            throw new FormatException("Mesh " + mesh + " references material " + material + " of "
                                      + materials.size());
        }
        if (uvs.count() != vertexCount || uvs.componentCount() != 2) {
            log.warn("Ignoring TEXCOORD_0 of mesh {}: {} for {} vertices", mesh, uvs, vertexCount);
            return fallback;
        }
        var uv = uvs.asFloats();
        // glTF puts the UV origin top left, the scene model bottom left
        for (int i = 1; i < uv.length; i += 2) {
            uv[i] = 1f - uv[i];
        }
        return new TextureVisuals(uv, materials.get(material));
    }

    private static AccessorData accessor(List<AccessorData> accessors, int index) {
        if (index < 0 || index >= accessors.size()) {
            throw new FormatException("Reference to accessor " + index + " of " + accessors.size());
        }
        return accessors.get(index);
    }

    private static String unique(String name, Map<String, ?> taken) {
        var candidate = name;
        for (int i = 1; taken.containsKey(candidate); i++) {
            candidate = name + "_" + i;
        }
        if (!candidate.equals(name)) {
            log.debug("Geometry name {} already used, renamed to {}", name, candidate);
        }
        return candidate;
    }
}
