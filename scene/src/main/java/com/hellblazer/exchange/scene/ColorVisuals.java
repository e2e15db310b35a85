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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Plain colour visuals: either one RGBA colour per vertex, or a single uniform colour for the whole mesh.
 *
 * @author hal.hildebrand
 */
public final class ColorVisuals implements Visuals {

    public static final int[] DEFAULT_COLOR = { 102, 102, 102, 255 };

    private final byte[] vertexColors;
    private final int[]  uniformColor;

    private ColorVisuals(byte[] vertexColors, int[] uniformColor) {
        this.vertexColors = vertexColors;
        this.uniformColor = uniformColor;
    }

    /**
     * @return visuals with no colour information, rendered with {@link #DEFAULT_COLOR}
     */
    public static ColorVisuals none() {
        return new ColorVisuals(null, DEFAULT_COLOR.clone());
    }

    public static ColorVisuals uniform(int r, int g, int b, int a) {
        return new ColorVisuals(null, new int[] { channel(r), channel(g), channel(b), channel(a) });
    }

    /**
     * @param rgba four bytes per vertex, unsigned
     */
    public static ColorVisuals perVertex(byte[] rgba) {
        Objects.requireNonNull(rgba, "rgba");
        if (rgba.length % 4 != 0) {
            throw new IllegalArgumentException("Vertex colors must be RGBA, length " + rgba.length);
        }
        return new ColorVisuals(rgba.clone(), null);
    }

    private static int channel(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Color channel out of range: " + value);
        }
        return value;
    }

    public boolean hasVertexColors() {
        return vertexColors != null;
    }

    /**
     * @return RGBA bytes, four per vertex, or null when the colour is uniform
     */
    public byte[] vertexColors() {
        return vertexColors == null ? null : vertexColors.clone();
    }

    /**
     * @return number of coloured vertices, zero for uniform colour
     */
    public int colorCount() {
        return vertexColors == null ? 0 : vertexColors.length / 4;
    }

    @Override
    public int[] mainColor() {
        if (vertexColors == null || vertexColors.length == 0) {
            return uniformColor == null ? DEFAULT_COLOR.clone() : uniformColor.clone();
        }
        // most frequent colour, first appearance wins ties
        var counts = new LinkedHashMap<Integer, Integer>();
        for (int i = 0; i < vertexColors.length; i += 4) {
            int packed = ((vertexColors[i] & 0xFF) << 24) | ((vertexColors[i + 1] & 0xFF) << 16)
            | ((vertexColors[i + 2] & 0xFF) << 8) | (vertexColors[i + 3] & 0xFF);
            counts.merge(packed, 1, Integer::sum);
        }
        int best = 0;
        int bestCount = 0;
        for (var entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return new int[] { (best >>> 24) & 0xFF, (best >>> 16) & 0xFF, (best >>> 8) & 0xFF, best & 0xFF };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColorVisuals other)) {
            return false;
        }
        return Arrays.equals(vertexColors, other.vertexColors) && Arrays.equals(uniformColor, other.uniformColor);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(vertexColors) + Arrays.hashCode(uniformColor);
    }

    @Override
    public String toString() {
        return hasVertexColors() ? String.format("ColorVisuals[%d vertex colors]", colorCount())
                                 : "ColorVisuals[uniform " + Arrays.toString(uniformColor) + "]";
    }
}
