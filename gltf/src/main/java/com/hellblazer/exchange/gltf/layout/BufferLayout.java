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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.exchange.gltf.GltfException.LayoutException;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns buffer items to glTF buffers and writes the {@code buffers} and {@code bufferViews} arrays. Buffer view
 * {@code i} always exposes item {@code i}.
 *
 * @author hal.hildebrand
 */
public final class BufferLayout {

    private BufferLayout() {
        // Utility class
    }

    /**
     * Single embedded buffer 0 holding every item in emission order.
     *
     * @return the buffer contents, to become the GLB BIN chunk
     */
    public static byte[] embedded(GltfStructure structure) {
        var tree = structure.tree();
        var views = tree.putArray("bufferViews");
        var data = new ByteArrayOutputStream(structure.totalLength());
        for (var item : structure.items()) {
            addView(views, 0, data.size(), item);
            data.writeBytes(item.data());
        }
        tree.putArray("buffers").addObject().put("byteLength", data.size());
        return data.toByteArray();
    }

    /**
     * One external buffer per geometry holding that geometry's items in emission order, named
     * {@code mesh_<geometry>.bin}.
     *
     * @return buffer file name to contents, in buffer index order
     */
    public static Map<String, byte[]> external(GltfStructure structure) {
        var tree = structure.tree();
        var views = tree.putArray("bufferViews");
        var buffers = tree.putArray("buffers");
        var files = new LinkedHashMap<String, byte[]>();

        List<BufferItem> pending = new ArrayList<>();
        var items = structure.items();
        for (int i = 0; i < items.size(); i++) {
            pending.add(items.get(i));
            boolean last = i == items.size() - 1 || !items.get(i + 1).geometry().equals(items.get(i).geometry());
            if (last) {
                var name = bufferName(items.get(i).geometry());
                if (files.containsKey(name)) {
                    throw new LayoutException("Items of geometry " + items.get(i).geometry() + " are not contiguous");
                }
                var data = new ByteArrayOutputStream();
                for (var item : pending) {
                    addView(views, buffers.size(), data.size(), item);
                    data.writeBytes(item.data());
                }
                var buffer = buffers.addObject();
                buffer.put("uri", name);
                buffer.put("byteLength", data.size());
                files.put(name, data.toByteArray());
                pending.clear();
            }
        }
        return files;
    }

    public static String bufferName(String geometry) {
        return "mesh_" + geometry + ".bin";
    }

    private static void addView(ArrayNode views, int buffer, int offset, BufferItem item) {
        ObjectNode view = views.addObject();
        view.put("buffer", buffer);
        view.put("byteOffset", offset);
        view.put("byteLength", item.length());
    }
}
