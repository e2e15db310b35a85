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
package com.hellblazer.exchange.gltf;

/**
 * Base exception for glTF encoding and decoding.
 * <p>
 * Subtypes:
 * <ul>
 * <li>{@link FormatException} - the input is not a well formed glTF or GLB document</li>
 * <li>{@link LayoutException} - an internal layout invariant was violated while building a document</li>
 * </ul>
 * Degraded loads (missing image decoder, an image that fails to decode, UVs without a material) are logged and never
 * raised.
 */
public sealed class GltfException extends RuntimeException
    permits GltfException.FormatException, GltfException.LayoutException {

    /**
     * Constructs a new glTF exception with the specified detail message.
     *
     * @param message the detail message
     */
    public GltfException(String message) {
        super(message);
    }

    /**
     * Constructs a new glTF exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public GltfException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Malformed input.
     * <p>
     * Thrown for a wrong GLB magic or version, a first chunk that is not JSON, a later chunk that is not BIN, a
     * truncated chunk, unparseable JSON, or a buffer view or accessor that does not fit the bytes it refers to.
     */
    public static final class FormatException extends GltfException {

        public FormatException(String message) {
            super(message);
        }

        public FormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Broken construction invariant.
     * <p>
     * Indicates a defect in the document builder rather than bad input: unaligned chunk content, a reference to an
     * index that has not been appended yet, or per-vertex data whose shape does not match the vertex count.
     */
    public static final class LayoutException extends GltfException {

        public LayoutException(String message) {
            super(message);
        }
    }
}
