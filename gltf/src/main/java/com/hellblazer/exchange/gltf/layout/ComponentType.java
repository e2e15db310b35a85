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

import java.nio.ByteBuffer;

/**
 * glTF accessor component types and their little-endian binary encoding.
 *
 * @author hal.hildebrand
 */
public enum ComponentType {
    BYTE(5120, 1) {
        @Override
        public int readInt(ByteBuffer buffer, int offset) {
            return buffer.get(offset);
        }

        @Override
        float normalize(int value) {
            return Math.max(value / 127f, -1f);
        }
    },
    UNSIGNED_BYTE(5121, 1) {
        @Override
        public int readInt(ByteBuffer buffer, int offset) {
            return buffer.get(offset) & 0xFF;
        }

        @Override
        float normalize(int value) {
            return value / 255f;
        }
    },
    SHORT(5122, 2) {
        @Override
        public int readInt(ByteBuffer buffer, int offset) {
            return buffer.getShort(offset);
        }

        @Override
        float normalize(int value) {
            return Math.max(value / 32767f, -1f);
        }
    },
    UNSIGNED_SHORT(5123, 2) {
        @Override
        public int readInt(ByteBuffer buffer, int offset) {
            return buffer.getShort(offset) & 0xFFFF;
        }

        @Override
        float normalize(int value) {
            return value / 65535f;
        }
    },
    UNSIGNED_INT(5125, 4) {
        @Override
        public int readInt(ByteBuffer buffer, int offset) {
            int value = buffer.getInt(offset);
            if (value < 0) {
                throw new FormatException("Unsigned index " + Integer.toUnsignedString(value) + " exceeds int range");
            }
            return value;
        }

        @Override
        float normalize(int value) {
            return (float) (Integer.toUnsignedLong(value) / 4294967295.0);
        }
    },
    FLOAT(5126, 4) {
        @Override
        public int readInt(ByteBuffer buffer, int offset) {
            return (int) buffer.getFloat(offset);
        }

        @Override
        public float readFloat(ByteBuffer buffer, int offset, boolean normalized) {
            return buffer.getFloat(offset);
        }

        @Override
        float normalize(int value) {
            return value;
        }
    };

    private final int code;
    private final int byteSize;

    ComponentType(int code, int byteSize) {
        this.code = code;
        this.byteSize = byteSize;
    }

    public static ComponentType fromCode(int code) {
        for (var type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new FormatException("Unknown accessor componentType " + code);
    }

    public int code() {
        return code;
    }

    public int byteSize() {
        return byteSize;
    }

    /**
     * Read one component as an integer; unsigned types are widened, floats truncated.
     *
     * @param buffer little-endian buffer
     * @param offset absolute byte offset
     */
    public abstract int readInt(ByteBuffer buffer, int offset);

    /**
     * Read one component as a float, mapping normalized integers into [0, 1] or [-1, 1].
     *
     * @param buffer     little-endian buffer
     * @param offset     absolute byte offset
     * @param normalized whether integer values are normalized
     */
    public float readFloat(ByteBuffer buffer, int offset, boolean normalized) {
        int value = this == UNSIGNED_INT ? buffer.getInt(offset) : readInt(buffer, offset);
        if (this == UNSIGNED_INT && !normalized) {
            return (float) Integer.toUnsignedLong(value);
        }
        return normalized ? normalize(value) : value;
    }

    abstract float normalize(int value);
}
