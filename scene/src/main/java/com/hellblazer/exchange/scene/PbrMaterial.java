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

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Physically based metallic-roughness material. Field names follow the glTF material schema once its
 * {@code pbrMetallicRoughness} block has been flattened into the top level.
 *
 * @author hal.hildebrand
 */
public final class PbrMaterial {

    /**
     * The texture-bearing fields of a material, keyed by their glTF field name.
     */
    public enum TextureSlot {
        BASE_COLOR("baseColorTexture"),
        METALLIC_ROUGHNESS("metallicRoughnessTexture"),
        NORMAL("normalTexture"),
        OCCLUSION("occlusionTexture"),
        EMISSIVE("emissiveTexture");

        private final String field;

        TextureSlot(String field) {
            this.field = field;
        }

        public static Optional<TextureSlot> fromField(String field) {
            for (var slot : values()) {
                if (slot.field.equals(field)) {
                    return Optional.of(slot);
                }
            }
            return Optional.empty();
        }

        public String field() {
            return field;
        }
    }

    private final String                             name;
    private final float[]                            baseColorFactor;
    private final float                              metallicFactor;
    private final float                              roughnessFactor;
    private final float[]                            emissiveFactor;
    private final String                             alphaMode;
    private final float                              alphaCutoff;
    private final boolean                            doubleSided;
    private final Map<TextureSlot, BufferedImage>    textures;
    private final Map<String, Object>                extras;

    private PbrMaterial(Builder builder) {
        this.name = builder.name;
        this.baseColorFactor = builder.baseColorFactor.clone();
        this.metallicFactor = builder.metallicFactor;
        this.roughnessFactor = builder.roughnessFactor;
        this.emissiveFactor = builder.emissiveFactor.clone();
        this.alphaMode = builder.alphaMode;
        this.alphaCutoff = builder.alphaCutoff;
        this.doubleSided = builder.doubleSided;
        this.textures = Collections.unmodifiableMap(new EnumMap<>(builder.textures));
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extras));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public float[] baseColorFactor() {
        return baseColorFactor.clone();
    }

    public float metallicFactor() {
        return metallicFactor;
    }

    public float roughnessFactor() {
        return roughnessFactor;
    }

    public float[] emissiveFactor() {
        return emissiveFactor.clone();
    }

    public String alphaMode() {
        return alphaMode;
    }

    public float alphaCutoff() {
        return alphaCutoff;
    }

    public boolean doubleSided() {
        return doubleSided;
    }

    public Optional<BufferedImage> texture(TextureSlot slot) {
        return Optional.ofNullable(textures.get(slot));
    }

    public Map<TextureSlot, BufferedImage> textures() {
        return textures;
    }

    /**
     * @return scalar fields with no dedicated property, in declaration order
     */
    public Map<String, Object> extras() {
        return extras;
    }

    @Override
    public String toString() {
        return String.format("PbrMaterial[%s, base=%s, metallic=%.3f, roughness=%.3f, textures=%s]",
                             name == null ? "unnamed" : name, Arrays.toString(baseColorFactor), metallicFactor,
                             roughnessFactor, textures.keySet());
    }

    public static final class Builder {
        private final Map<TextureSlot, BufferedImage> textures        = new EnumMap<>(TextureSlot.class);
        private final Map<String, Object>             extras          = new LinkedHashMap<>();
        private       String                          name;
        private       float[]                         baseColorFactor = { 1f, 1f, 1f, 1f };
        private       float                           metallicFactor  = 1f;
        private       float                           roughnessFactor = 1f;
        private       float[]                         emissiveFactor  = { 0f, 0f, 0f };
        private       String                          alphaMode       = "OPAQUE";
        private       float                           alphaCutoff     = 0.5f;
        private       boolean                         doubleSided;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder baseColorFactor(float[] rgba) {
            this.baseColorFactor = components(rgba, 4, "baseColorFactor");
            return this;
        }

        public Builder metallicFactor(float metallic) {
            this.metallicFactor = metallic;
            return this;
        }

        public Builder roughnessFactor(float roughness) {
            this.roughnessFactor = roughness;
            return this;
        }

        public Builder emissiveFactor(float[] rgb) {
            this.emissiveFactor = components(rgb, 3, "emissiveFactor");
            return this;
        }

        public Builder alphaMode(String alphaMode) {
            this.alphaMode = Objects.requireNonNull(alphaMode, "alphaMode");
            return this;
        }

        public Builder alphaCutoff(float alphaCutoff) {
            this.alphaCutoff = alphaCutoff;
            return this;
        }

        public Builder doubleSided(boolean doubleSided) {
            this.doubleSided = doubleSided;
            return this;
        }

        /**
         * @param image decoded image, null leaves the slot empty
         */
        public Builder texture(TextureSlot slot, BufferedImage image) {
            Objects.requireNonNull(slot, "slot");
            if (image == null) {
                textures.remove(slot);
            } else {
                textures.put(slot, image);
            }
            return this;
        }

        public Builder extra(String field, Object value) {
            extras.put(Objects.requireNonNull(field, "field"), value);
            return this;
        }

        public PbrMaterial build() {
            return new PbrMaterial(this);
        }

        private static float[] components(float[] values, int expected, String field) {
            Objects.requireNonNull(values, field);
            if (values.length != expected) {
                throw new IllegalArgumentException(
                field + " requires " + expected + " components, got " + values.length);
            }
            return values.clone();
        }
    }
}
