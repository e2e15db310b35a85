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

import java.util.Objects;

/**
 * Texture visuals: one UV pair per vertex, origin at the lower left, and the material the UVs index into.
 *
 * @author hal.hildebrand
 */
public final class TextureVisuals implements Visuals {

    private final float[]     uv;
    private final PbrMaterial material;

    public TextureVisuals(float[] uv, PbrMaterial material) {
        Objects.requireNonNull(uv, "uv");
        if (uv.length % 2 != 0) {
            throw new IllegalArgumentException("UV coordinates must be pairs, length " + uv.length);
        }
        this.uv = uv.clone();
        this.material = Objects.requireNonNull(material, "material");
    }

    public float[] uv() {
        return uv.clone();
    }

    public int uvCount() {
        return uv.length / 2;
    }

    public PbrMaterial material() {
        return material;
    }

    @Override
    public int[] mainColor() {
        var factor = material.baseColorFactor();
        var rgba = new int[4];
        for (int i = 0; i < 4; i++) {
            rgba[i] = Math.round(Math.max(0f, Math.min(1f, factor[i])) * 255f);
        }
        return rgba;
    }

    @Override
    public String toString() {
        return String.format("TextureVisuals[%d uv, %s]", uvCount(), material);
    }
}
