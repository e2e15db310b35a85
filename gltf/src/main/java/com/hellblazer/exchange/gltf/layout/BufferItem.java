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

import java.util.Objects;

/**
 * One 4 byte aligned chunk of buffer data, owned by the geometry that emitted it. The position of an item in the
 * emission order is the index of the buffer view that exposes it.
 *
 * @author hal.hildebrand
 */
public record BufferItem(String geometry, byte[] data) {

    public BufferItem {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(data, "data");
    }

    public int length() {
        return data.length;
    }
}
