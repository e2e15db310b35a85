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

/**
 * glTF accessor element shapes.
 *
 * @author hal.hildebrand
 */
public enum AccessorType {
    SCALAR(1, 1),
    VEC2(1, 2),
    VEC3(1, 3),
    VEC4(1, 4),
    MAT2(2, 2),
    MAT3(3, 3),
    MAT4(4, 4);

    private final int rows;
    private final int columns;

    AccessorType(int rows, int columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public static AccessorType fromName(String name) {
        for (var type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        throw new FormatException("Unknown accessor type " + name);
    }

    /**
     * @return number of components per element
     */
    public int componentCount() {
        return rows * columns;
    }

    public boolean isMatrix() {
        return rows > 1;
    }
}
