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

/**
 * Primitive topologies this codec writes. Anything else read from a document is {@link #OTHER}.
 *
 * @author hal.hildebrand
 */
public enum PrimitiveMode {
    LINES(1),
    TRIANGLES(4),
    OTHER(-1);

    private final int code;

    PrimitiveMode(int code) {
        this.code = code;
    }

    /**
     * @param code glTF mode, absent means triangles
     */
    public static PrimitiveMode fromCode(int code) {
        for (var mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        return OTHER;
    }

    public int code() {
        return code;
    }
}
