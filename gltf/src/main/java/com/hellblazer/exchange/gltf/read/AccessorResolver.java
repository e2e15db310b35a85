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
import com.hellblazer.exchange.gltf.layout.AccessorType;
import com.hellblazer.exchange.gltf.layout.ComponentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Slices buffer views out of raw buffers and reinterprets accessor byte ranges as typed data.
 *
 * @author hal.hildebrand
 */
public class AccessorResolver {
    private static final Logger log = LoggerFactory.getLogger(AccessorResolver.class);

    /**
     * Materialize every buffer view as a slice of its buffer.
     *
     * @throws FormatException when a view names a missing buffer or extends past its end
     */
    public List<ByteBuffer> views(JsonNode document, List<ByteBuffer> buffers) {
        var views = new ArrayList<ByteBuffer>();
        int index = 0;
        for (var view : document.path("bufferViews")) {
            int buffer = required(view, "buffer", "bufferView", index);
            int offset = view.path("byteOffset").asInt(0);
            int length = required(view, "byteLength", "bufferView", index);
            if (buffer < 0 || buffer >= buffers.size()) {
                throw new FormatException(
                "Buffer view " + index + " references buffer " + buffer + " of " + buffers.size());
            }
            var source = buffers.get(buffer);
            if (offset < 0 || length < 0 || (long) offset + length > source.remaining()) {
                throw new FormatException(String.format(
                "Buffer view %d expects %d bytes at offset %d but buffer %d holds %d bytes", index, length, offset,
                buffer, source.remaining()));
            }
            views.add(source.slice(source.position() + offset, length).order(ByteOrder.LITTLE_ENDIAN));
            index++;
        }
        return views;
    }

    /**
     * Resolve every accessor of the document against the materialized views.
     *
     * @throws FormatException for unknown component types or shapes, or a byte span that does not fit its view
     */
    public List<AccessorData> accessors(JsonNode document, List<ByteBuffer> views) {
        var result = new ArrayList<AccessorData>();
        var viewNodes = document.path("bufferViews");
        int index = 0;
        for (var accessor : document.path("accessors")) {
            result.add(resolve(index++, accessor, viewNodes, views));
        }
        log.debug("Resolved {} accessors over {} buffer views", result.size(), views.size());
        return result;
    }

    private AccessorData resolve(int index, JsonNode accessor, JsonNode viewNodes, List<ByteBuffer> views) {
        var componentType = ComponentType.fromCode(required(accessor, "componentType", "accessor", index));
        var type = AccessorType.fromName(accessor.path("type").asText());
        int count = required(accessor, "count", "accessor", index);
        boolean normalized = accessor.path("normalized").asBoolean(false);
        if (count < 0) {
            throw new FormatException("Accessor " + index + " has negative count " + count);
        }

        if (!accessor.has("bufferView")) {
            return AccessorData.zeros(componentType, type, count, normalized);
        }
        int viewIndex = accessor.get("bufferView").asInt();
        if (viewIndex < 0 || viewIndex >= views.size()) {
            throw new FormatException("Accessor " + index + " references buffer view " + viewIndex + " of "
                                      + views.size());
        }
        var view = views.get(viewIndex);
        int start = accessor.path("byteOffset").asInt(0);
        int elementSize = componentType.byteSize() * type.componentCount();
        int stride = Math.max(elementSize, viewNodes.path(viewIndex).path("byteStride").asInt(0));

        long span = count == 0 ? 0 : (long) stride * (count - 1) + elementSize;
        if (start < 0 || start + span > view.remaining()) {
            long available = Math.max(0, view.remaining() - Math.max(start, 0));
            long elements = available < elementSize ? 0 : (available - elementSize) / stride + 1;
            throw new FormatException(String.format(
            "Accessor %d declares %d elements but buffer view %d holds %d", index, count, viewIndex, elements));
        }
        return new AccessorData(componentType, type, count, normalized, view.slice(start, (int) span), stride);
    }

    private static int required(JsonNode node, String field, String kind, int index) {
        var value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new FormatException(kind + " " + index + " is missing " + field);
        }
        return value.asInt();
    }
}
