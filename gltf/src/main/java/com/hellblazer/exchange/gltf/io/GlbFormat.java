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
package com.hellblazer.exchange.gltf.io;

import com.hellblazer.exchange.gltf.GltfException.FormatException;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * GLB container layout.
 *
 * <p><b>File Layout:</b>
 * <pre>
 * [Header: 12 bytes]
 *   magic(4) + version(4) + totalLength(4)
 * [JSON chunk]
 *   chunkLength(4) + chunkType(4) + UTF-8 JSON, space padded to a 4 byte boundary
 * [BIN chunk]*
 *   chunkLength(4) + chunkType(4) + binary payload
 * </pre>
 * All integers are little-endian.
 *
 * @author hal.hildebrand
 */
public final class GlbFormat {

    // "glTF" in ASCII (little-endian)
    public static final int MAGIC_NUMBER = 0x46546C67;

    public static final int VERSION = 2;

    public static final int HEADER_SIZE       = 12;
    public static final int CHUNK_HEADER_SIZE = 8;
    public static final int ALIGNMENT         = 4;

    /**
     * Fixed bytes ahead of the JSON text: file header plus the JSON chunk header.
     */
    public static final int JSON_CONTENT_OFFSET = HEADER_SIZE + CHUNK_HEADER_SIZE;

    public enum ChunkType {
        JSON(0x4E4F534A), // "JSON"
        BIN(0x004E4942);  // "BIN\0"

        private final int id;

        ChunkType(int id) {
            this.id = id;
        }

        public static ChunkType fromId(int id) {
            for (var type : values()) {
                if (type.id == id) {
                    return type;
                }
            }
            return null;
        }

        public int id() {
            return id;
        }
    }

    private GlbFormat() {
        // Utility class
    }

    /**
     * Zero pad {@code data} to the next multiple of {@link #ALIGNMENT}.
     *
     * @return {@code data} itself when already aligned
     */
    public static byte[] pad(byte[] data) {
        int remainder = data.length % ALIGNMENT;
        if (remainder == 0) {
            return data;
        }
        return Arrays.copyOf(data, data.length + ALIGNMENT - remainder);
    }

    /**
     * Number of filler bytes that bring {@code length} to the next multiple of {@link #ALIGNMENT}.
     */
    public static int padding(long length) {
        return (int) ((ALIGNMENT - length % ALIGNMENT) % ALIGNMENT);
    }

    /**
     * The 12 byte file header.
     */
    public static class Header {
        public int magic   = MAGIC_NUMBER;
        public int version = VERSION;
        public int length;

        public Header() {
        }

        public Header(int length) {
            this.length = length;
        }

        public void write(ByteBuffer buffer) {
            buffer.putInt(magic);
            buffer.putInt(version);
            buffer.putInt(length);
        }

        public static Header read(ByteBuffer buffer) {
            var header = new Header();
            header.magic = buffer.getInt();
            header.version = buffer.getInt();
            header.length = buffer.getInt();
            return header;
        }

        /**
         * @throws FormatException when this is not a GLB 2.0 header
         */
        public void validate() {
            if (magic != MAGIC_NUMBER) {
                throw new FormatException("Not a GLB file: bad magic number 0x" + Integer.toHexString(magic));
            }
            if (version != VERSION) {
                throw new FormatException("Unsupported GLB version " + version + ", expected " + VERSION);
            }
        }

        @Override
        public String toString() {
            return String.format("GlbHeader[v%d, length=%d]", version, Integer.toUnsignedLong(length));
        }
    }
}
