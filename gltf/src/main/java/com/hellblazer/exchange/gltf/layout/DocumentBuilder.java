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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.exchange.gltf.GltfException.LayoutException;
import com.hellblazer.exchange.gltf.io.GlbFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only owner of the indexed glTF arrays. Every append returns the index it assigned, which is the array length
 * at the moment of the append, so references are only ever handed out for entries that exist.
 *
 * @author hal.hildebrand
 */
public class DocumentBuilder {

    private final JsonNodeFactory  factory;
    private final ArrayNode        accessors;
    private final ArrayNode        meshes;
    private final ArrayNode        materials;
    private final List<BufferItem> items = new ArrayList<>();

    public DocumentBuilder(JsonNodeFactory factory) {
        this.factory = factory;
        this.accessors = factory.arrayNode();
        this.meshes = factory.arrayNode();
        this.materials = factory.arrayNode();
    }

    /**
     * Append a chunk of buffer data, zero padded to a 4 byte boundary.
     *
     * @return the buffer view index that will expose the chunk
     */
    public int addBufferItem(String geometry, byte[] data) {
        var padded = GlbFormat.pad(data);
        if (padded.length % GlbFormat.ALIGNMENT != 0) {
            throw new LayoutException("Buffer item for " + geometry + " is not 4 byte aligned");
        }
        items.add(new BufferItem(geometry, padded));
        return items.size() - 1;
    }

    /**
     * Append an accessor over a chunk that has already been added.
     *
     * @return accessor index
     */
    public int addAccessor(int bufferView, ComponentType componentType, AccessorType type, int count,
                           ArrayNode min, ArrayNode max, boolean normalized) {
        if (bufferView < 0 || bufferView >= items.size()) {
            throw new LayoutException("Accessor references buffer view " + bufferView + " of " + items.size());
        }
        var accessor = factory.objectNode();
        accessor.put("bufferView", bufferView);
        accessor.put("componentType", componentType.code());
        if (normalized) {
            accessor.put("normalized", true);
        }
        accessor.put("count", count);
        accessor.put("type", type.name());
        accessor.put("byteOffset", 0);
        if (max != null) {
            accessor.set("max", max);
        }
        if (min != null) {
            accessor.set("min", min);
        }
        accessors.add(accessor);
        return accessors.size() - 1;
    }

    /**
     * @return mesh index
     */
    public int addMesh(ObjectNode mesh) {
        checkReference(mesh.path("primitives"));
        meshes.add(mesh);
        return meshes.size() - 1;
    }

    /**
     * Append a material unless an identical one exists.
     *
     * @return index of the new or existing material
     */
    public int addMaterial(ObjectNode material) {
        for (int i = 0; i < materials.size(); i++) {
            if (materials.get(i).equals(material)) {
                return i;
            }
        }
        materials.add(material);
        return materials.size() - 1;
    }

    public int materialCount() {
        return materials.size();
    }

    public int accessorCount() {
        return accessors.size();
    }

    public ArrayNode accessors() {
        return accessors;
    }

    public ArrayNode meshes() {
        return meshes;
    }

    public ArrayNode materials() {
        return materials;
    }

    public List<BufferItem> items() {
        return Collections.unmodifiableList(items);
    }

    private void checkReference(JsonNode primitives) {
        for (var primitive : primitives) {
            var indices = primitive.path("indices");
            if (!indices.isMissingNode()) {
                checkAccessor(indices.asInt());
            }
            primitive.path("attributes").forEach(a -> checkAccessor(a.asInt()));
            var material = primitive.path("material");
            if (!material.isMissingNode() && material.asInt() >= materials.size()) {
                throw new LayoutException("Primitive references material " + material.asInt() + " of "
                                          + materials.size());
            }
        }
    }

    private void checkAccessor(int index) {
        if (index < 0 || index >= accessors.size()) {
            throw new LayoutException("Primitive references accessor " + index + " of " + accessors.size());
        }
    }
}
