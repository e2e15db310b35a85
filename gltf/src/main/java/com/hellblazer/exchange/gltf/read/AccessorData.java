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

import com.hellblazer.exchange.gltf.layout.AccessorType;
import com.hellblazer.exchange.gltf.layout.ComponentType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Typed view over the bytes an accessor describes. Elements are {@link AccessorType#componentCount()} components
 * wide and {@link #stride()} bytes apart; matrices are read column after column without per-column padding.
 *
 * @author hal.hildebrand
 */
public final class AccessorData {

    private final ComponentType componentType;
    private final AccessorType  type;
    private final int           count;
    private final boolean       normalized;
    private final ByteBuffer    data;
    private final int           stride;

    /**
     * @param data   little-endian bytes, element 0 at position 0
     * @param stride bytes between the starts of consecutive elements
     */
    public AccessorData(ComponentType componentType, AccessorType type, int count, boolean normalized,
                        ByteBuffer data, int stride) {
        this.componentType = componentType;
        this.type = type;
        this.count = count;
        this.normalized = normalized;
        this.data = data.slice().order(ByteOrder.LITTLE_ENDIAN);
        this.stride = stride;
    }

    /**
     * Accessor with no buffer view: every component is zero.
     */
    public static AccessorData zeros(ComponentType componentType, AccessorType type, int count, boolean normalized) {
        int elementSize = componentType.byteSize() * type.componentCount();
        return new AccessorData(componentType, type, count, normalized, ByteBuffer.allocate(elementSize * count),
                                elementSize);
    }

    public ComponentType componentType() {
        return componentType;
    }

    public AccessorType type() {
        return type;
    }

    /**
     * @return number of elements
     */
    public int count() {
        return count;
    }

    public int componentCount() {
        return type.componentCount();
    }

    public boolean normalized() {
        return normalized;
    }

    public int stride() {
        return stride;
    }

    public int getInt(int element, int component) {
        return componentType.readInt(data, offset(element, component));
    }

    /**
     * Component as float, honouring the accessor's normalized flag.
     */
    public float getFloat(int element, int component) {
        return componentType.readFloat(data, offset(element, component), normalized);
    }

    /**
     * Component mapped into [0, 1] (or [-1, 1] for signed types) regardless of the normalized flag; floats are
     * returned unchanged.
     */
    public float getNormalized(int element, int component) {
        return componentType.readFloat(data, offset(element, component), true);
    }

    /**
     * @return all components, element after element
     */
    public float[] asFloats() {
        int width = componentCount();
        var result = new float[count * width];
        for (int e = 0; e < count; e++) {
            for (int c = 0; c < width; c++) {
                result[e * width + c] = getFloat(e, c);
            }
        }
        return result;
    }

    /**
     * @return all components as integers, unsigned types widened
     */
    public int[] asInts() {
        int width = componentCount();
        var result = new int[count * width];
        for (int e = 0; e < count; e++) {
            for (int c = 0; c < width; c++) {
                result[e * width + c] = getInt(e, c);
            }
        }
        return result;
    }

    private int offset(int element, int component) {
        if (element < 0 || element >= count || component < 0 || component >= componentCount()) {
            throw new IndexOutOfBoundsException(
            String.format("Element %d component %d outside %d x %d", element, component, count, componentCount()));
        }
        return element * stride + component * componentType.byteSize();
    }

    @Override
    public String toString() {
        return String.format("AccessorData[%s %s x %d%s]", componentType, type, count,
                             normalized ? ", normalized" : "");
    }
}
