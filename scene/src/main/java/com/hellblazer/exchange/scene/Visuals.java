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
package com.hellblazer.exchange.scene;

/**
 * How a mesh is coloured: plain colours, or a texture mapped through UV coordinates.
 *
 * @author hal.hildebrand
 */
public sealed interface Visuals permits ColorVisuals, TextureVisuals {

    /**
     * The single most representative RGBA colour, used when a flat material has to stand in for the visuals.
     *
     * @return {r, g, b, a} in 0..255
     */
    int[] mainColor();
}
