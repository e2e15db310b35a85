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
package com.hellblazer.exchange.gltf.layout;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.exchange.gltf.GltfException.LayoutException;
import com.hellblazer.exchange.gltf.material.MaterialMapper;
import com.hellblazer.exchange.scene.ColorVisuals;
import com.hellblazer.exchange.scene.FlattenedGraph;
import com.hellblazer.exchange.scene.Geometry;
import com.hellblazer.exchange.scene.LinePath;
import com.hellblazer.exchange.scene.Scene;
import com.hellblazer.exchange.scene.TextureVisuals;
import com.hellblazer.exchange.scene.TriangleMesh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.HashMap;

/**
 * Walks a {@link Scene} and produces the glTF document tree plus the ordered buffer items its accessors refer to.
 * Triangle meshes become {@code GL_TRIANGLES} primitives, line paths {@code GL_LINES} primitives.
 *
 * @author hal.hildebrand
 */
public class StructureBuilder {
    public static final String DEFAULT_GENERATOR = "gltf-exchange";

    private static final Logger log = LoggerFactory.getLogger(StructureBuilder.class);

    private final JsonNodeFactory factory;
    private final MaterialMapper  materials;
    private final String          generator;
    private final boolean         includeNormals;

    public StructureBuilder(JsonNodeFactory factory, MaterialMapper materials, String generator,
                            boolean includeNormals) {
        this.factory = factory;
        this.materials = materials;
        this.generator = generator;
        this.includeNormals = includeNormals;
    }

    public GltfStructure build(Scene scene) {
        var meshIndex = new HashMap<String, Integer>();
        int next = 0;
        for (var name : scene.geometry().keySet()) {
            meshIndex.put(name, next++);
        }

        var tree = factory.objectNode();
        tree.put("scene", 0);
        var asset = tree.putObject("asset");
        asset.put("version", "2.0");
        asset.put("generator", generator);
        mergeGraph(tree, scene.graph().toGltf(meshIndex));

        var document = new DocumentBuilder(factory);
        for (var entry : scene.geometry().entrySet()) {
            int mesh = append(entry.getKey(), entry.getValue(), document);
            if (mesh != meshIndex.get(entry.getKey())) {
                throw new LayoutException(
                "Mesh " + entry.getKey() + " appended at " + mesh + ", expected " + meshIndex.get(entry.getKey()));
            }
        }

        tree.set("accessors", document.accessors());
        tree.set("meshes", document.meshes());
        // an empty materials array still tells consumers materials exist, so drop it
        if (document.materialCount() > 0) {
            tree.set("materials", document.materials());
        }

        log.debug("Built glTF structure: {} meshes, {} accessors, {} materials, {} buffer items",
                  document.meshes().size(), document.accessorCount(), document.materialCount(),
                  document.items().size());
        return new GltfStructure(tree, document.items());
    }

    private int append(String name, Geometry geometry, DocumentBuilder document) {
        if (geometry instanceof TriangleMesh mesh) {
            return appendMesh(name, mesh, document);
        }
        if (geometry instanceof LinePath path) {
            return appendPath(name, path, document);
        }
        throw new LayoutException("Unsupported geometry " + geometry.getClass().getSimpleName());
    }

    private int appendMesh(String name, TriangleMesh mesh, DocumentBuilder document) {
        var attributes = factory.objectNode();

        var faces = mesh.faces();
        int indexView = document.addBufferItem(name, uint32(faces));
        int indices = document.addAccessor(indexView, ComponentType.UNSIGNED_INT, AccessorType.SCALAR, faces.length,
                                           ints(0), ints(mesh.maxFaceIndex()), false);

        var vertices = mesh.vertices();
        int positionView = document.addBufferItem(name, float32(vertices));
        attributes.put("POSITION",
                       document.addAccessor(positionView, ComponentType.FLOAT, AccessorType.VEC3,
                                            mesh.vertexCount(), floats(mesh.min()), floats(mesh.max()), false));

        var primitive = factory.objectNode();
        var visuals = mesh.visuals();
        if (visuals instanceof ColorVisuals colors && colors.hasVertexColors()) {
            if (colors.colorCount() != mesh.vertexCount()) {
                throw new LayoutException(
                String.format("Mesh %s has %d vertex colors for %d vertices", name, colors.colorCount(),
                              mesh.vertexCount()));
            }
            int colorView = document.addBufferItem(name, colors.vertexColors());
            attributes.put("COLOR_0",
                           document.addAccessor(colorView, ComponentType.UNSIGNED_BYTE, AccessorType.VEC4,
                                                mesh.vertexCount(), null, null, true));
        } else if (visuals instanceof TextureVisuals texture) {
            primitive.put("material", document.addMaterial(materials.toJson(texture.material())));
        } else {
            primitive.put("material", document.addMaterial(materials.fromColor(visuals.mainColor(), 0f, 0f)));
        }

        if (includeNormals) {
            int normalView = document.addBufferItem(name, float32(mesh.vertexNormals()));
            attributes.put("NORMAL",
                           document.addAccessor(normalView, ComponentType.FLOAT, AccessorType.VEC3,
                                                mesh.vertexCount(), null, null, false));
        }

        primitive.set("attributes", attributes);
        primitive.put("indices", indices);
        primitive.put("mode", PrimitiveMode.TRIANGLES.code());
        return document.addMesh(meshRecord(name, mesh, primitive));
    }

    private int appendPath(String name, LinePath path, DocumentBuilder document) {
        var lineList = path.toLineList();
        int view = document.addBufferItem(name, float32(lineList));
        var attributes = factory.objectNode();
        attributes.put("POSITION", document.addAccessor(view, ComponentType.FLOAT, AccessorType.VEC3,
                                                        path.lineVertexCount(), floats(path.min()),
                                                        floats(path.max()), false));

        var primitive = factory.objectNode();
        primitive.set("attributes", attributes);
        primitive.put("mode", PrimitiveMode.LINES.code());
        primitive.put("material", document.addMaterial(materials.defaultLineMaterial()));
        return document.addMesh(meshRecord(name, path, primitive));
    }

    private ObjectNode meshRecord(String name, Geometry geometry, ObjectNode primitive) {
        var mesh = factory.objectNode();
        mesh.put("name", name);
        mesh.putArray("primitives").add(primitive);
        // opaque to glTF, carried for the geometry model
        geometry.units().ifPresent(units -> mesh.putObject("extras").put("units", units));
        return mesh;
    }

    private void mergeGraph(ObjectNode tree, FlattenedGraph graph) {
        var nodes = tree.putArray("nodes");
        for (var node : graph.nodes()) {
            var json = nodes.addObject();
            json.put("name", node.name());
            if (node.matrix() != null) {
                var matrix = json.putArray("matrix");
                for (var v : node.matrix()) {
                    matrix.add(v);
                }
            }
            if (!node.children().isEmpty()) {
                var children = json.putArray("children");
                node.children().forEach(children::add);
            }
            if (node.mesh() != null) {
                json.put("mesh", node.mesh());
            }
        }
        var roots = tree.putArray("scenes").addObject().putArray("nodes");
        graph.roots().forEach(roots::add);
    }

    static byte[] uint32(int[] values) {
        var buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asIntBuffer().put(values);
        return buffer.array();
    }

    static byte[] float32(float[] values) {
        var buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(values);
        return buffer.array();
    }

    private ArrayNode ints(int value) {
        return factory.arrayNode().add(value);
    }

    private ArrayNode floats(float[] values) {
        var array = factory.arrayNode();
        for (var v : values) {
            array.add(v);
        }
        return array;
    }
}
