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

import com.hellblazer.exchange.gltf.GltfException.FormatException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ComponentTypeTest {

    @Test
    void testCodesAndSizes() {
        assertEquals(ComponentType.BYTE, ComponentType.fromCode(5120));
        assertEquals(ComponentType.UNSIGNED_BYTE, ComponentType.fromCode(5121));
        assertEquals(ComponentType.SHORT, ComponentType.fromCode(5122));
        assertEquals(ComponentType.UNSIGNED_SHORT, ComponentType.fromCode(5123));
        assertEquals(ComponentType.UNSIGNED_INT, ComponentType.fromCode(5125));
        assertEquals(ComponentType.FLOAT, ComponentType.fromCode(5126));
        assertEquals(1, ComponentType.BYTE.byteSize());
        assertEquals(2, ComponentType.UNSIGNED_SHORT.byteSize());
        assertEquals(4, ComponentType.UNSIGNED_INT.byteSize());
        assertEquals(4, ComponentType.FLOAT.byteSize());
        assertThrows(FormatException.class, () -> ComponentType.fromCode(5124));
    }

    @Test
    void testAccessorShapes() {
        assertEquals(1, AccessorType.SCALAR.componentCount());
        assertEquals(3, AccessorType.VEC3.componentCount());
        assertEquals(4, AccessorType.MAT2.componentCount());
        assertEquals(9, AccessorType.MAT3.componentCount());
        assertEquals(16, AccessorType.MAT4.componentCount());
        assertTrue(AccessorType.MAT3.isMatrix());
        assertFalse(AccessorType.VEC4.isMatrix());
        assertEquals(AccessorType.VEC2, AccessorType.fromName("VEC2"));
        assertThrows(FormatException.class, () -> AccessorType.fromName("VEC5"));
    }

    @Test
    void testUnsignedReads() {
        var buffer = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(0, (byte) 0xFF);
        buffer.putShort(2, (short) 0xFFFF);
        assertEquals(255, ComponentType.UNSIGNED_BYTE.readInt(buffer, 0));
        assertEquals(-1, ComponentType.BYTE.readInt(buffer, 0));
        assertEquals(65535, ComponentType.UNSIGNED_SHORT.readInt(buffer, 2));
        assertEquals(-1, ComponentType.SHORT.readInt(buffer, 2));
    }

    @Test
    void testNormalizedReads() {
        var buffer = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(0, (byte) 0xFF);
        buffer.put(1, (byte) 0x80);
        buffer.putInt(4, -1);
        assertEquals(1f, ComponentType.UNSIGNED_BYTE.readFloat(buffer, 0, true));
        assertEquals(255f, ComponentType.UNSIGNED_BYTE.readFloat(buffer, 0, false));
        assertEquals(-1f, ComponentType.BYTE.readFloat(buffer, 1, true));
        assertEquals(1f, ComponentType.UNSIGNED_INT.readFloat(buffer, 4, true), 1e-6f);
        assertEquals(4294967295f, ComponentType.UNSIGNED_INT.readFloat(buffer, 4, false));
    }

    @Test
    void testUnsignedIntBeyondIntRange() {
        var buffer = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(0, 0x80000000);
        assertThrows(FormatException.class, () -> ComponentType.UNSIGNED_INT.readInt(buffer, 0));
    }

    @Test
    void testPrimitiveModes() {
        assertEquals(PrimitiveMode.TRIANGLES, PrimitiveMode.fromCode(4));
        assertEquals(PrimitiveMode.LINES, PrimitiveMode.fromCode(1));
        assertEquals(PrimitiveMode.OTHER, PrimitiveMode.fromCode(0));
    }
}
