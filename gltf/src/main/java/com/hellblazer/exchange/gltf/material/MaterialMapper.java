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
package com.hellblazer.exchange.gltf.material;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import com.hellblazer.exchange.scene.PbrMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps between glTF material blocks and {@link PbrMaterial}.
 * <p>
 * Reading is a fixed two pass transform: {@link MaterialFields#flatten} splits each entry into scalars and texture
 * references, then every texture reference is resolved through {@code textures[index].source} to a decoded image.
 *
 * @author hal.hildebrand
 */
public class MaterialMapper {
    private static final Logger log = LoggerFactory.getLogger(MaterialMapper.class);

    private final JsonNodeFactory factory;
    private final ObjectMapper    objectMapper;

    public MaterialMapper() {
        this(new ObjectMapper());
    }

    public MaterialMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.factory = objectMapper.getNodeFactory();
    }

    /**
     * Build one material per entry of the document's {@code materials} array.
     *
     * @param document glTF document
     * @param images   decoded images by image index, entries may be null
     */
    public List<PbrMaterial> parse(JsonNode document, List<BufferedImage> images) {
        var materials = new ArrayList<PbrMaterial>();
        for (var entry : document.path("materials")) {
            materials.add(build(MaterialFields.flatten(entry), document.path("textures"), images));
        }
        log.debug("Parsed {} materials over {} images", materials.size(), images.size());
        return materials;
    }

    PbrMaterial build(MaterialFields fields, JsonNode textures, List<BufferedImage> images) {
        var builder = PbrMaterial.builder();
        fields.scalars().forEach((key, value) -> {
            switch (key) {
                case "name" -> builder.name(value.asText());
                case "baseColorFactor" -> builder.baseColorFactor(floats(value, 4, key));
                case "metallicFactor" -> builder.metallicFactor((float) value.asDouble());
                case "roughnessFactor" -> builder.roughnessFactor((float) value.asDouble());
                case "emissiveFactor" -> builder.emissiveFactor(floats(value, 3, key));
                case "alphaMode" -> builder.alphaMode(value.asText());
                case "alphaCutoff" -> builder.alphaCutoff((float) value.asDouble());
                case "doubleSided" -> builder.doubleSided(value.asBoolean());
                default -> builder.extra(key, objectMapper.convertValue(value, Object.class));
            }
        });
        fields.textureRefs().forEach((key, index) -> {
            var image = resolveImage(textures, index, images);
            PbrMaterial.TextureSlot.fromField(key)
                                   .ifPresentOrElse(slot -> builder.texture(slot, image),
                                                    () -> builder.extra(key, image));
        });
        return builder.build();
    }

    private static BufferedImage resolveImage(JsonNode textures, int index, List<BufferedImage> images) {
        var texture = textures.path(index);
        if (texture.isMissingNode()) {
            throw new FormatException("Material references texture " + index + " of " + textures.size());
        }
        var source = texture.path("source");
        if (!source.canConvertToInt()) {
            log.warn("Texture {} has no image source", index);
            return null;
        }
        int image = source.asInt();
        if (image < 0 || image >= images.size()) {
            throw new FormatException("Texture " + index + " references image " + image + " of " + images.size());
        }
        return images.get(image);
    }

    private static float[] floats(JsonNode value, int expected, String field) {
        if (!value.isArray() || value.size() != expected) {
            throw new FormatException(field + " must be an array of " + expected + " numbers");
        }
        var result = new float[expected];
        for (int i = 0; i < expected; i++) {
            result[i] = (float) value.get(i).asDouble();
        }
        return result;
    }

    /**
     * Flat material for a mesh rendered in a single colour.
     *
     * @param rgba colour in 0..255
     */
    public ObjectNode fromColor(int[] rgba, float metallic, float roughness) {
        var factor = new float[4];
        for (int i = 0; i < 4; i++) {
            factor[i] = rgba[i] / 255f;
        }
        return pbr(factor, metallic, roughness);
    }

    /**
     * Black, fully transparent material used for line paths.
     */
    public ObjectNode defaultLineMaterial() {
        return pbr(new float[] { 0f, 0f, 0f, 0f }, 0f, 0f);
    }

    /**
     * Material block for the scalar properties of {@code material}. Textures are not written.
     */
    public ObjectNode toJson(PbrMaterial material) {
        var node = factory.objectNode();
        material.name().ifPresent(name -> node.put("name", name));
        var block = pbr(material.baseColorFactor(), material.metallicFactor(), material.roughnessFactor());
        node.setAll(block);
        var emissive = material.emissiveFactor();
        if (emissive[0] != 0f || emissive[1] != 0f || emissive[2] != 0f) {
            node.set("emissiveFactor", array(emissive));
        }
        if (!"OPAQUE".equals(material.alphaMode())) {
            node.put("alphaMode", material.alphaMode());
            if ("MASK".equals(material.alphaMode())) {
                node.put("alphaCutoff", material.alphaCutoff());
            }
        }
        if (material.doubleSided()) {
            node.put("doubleSided", true);
        }
        return node;
    }

    private ObjectNode pbr(float[] baseColor, float metallic, float roughness) {
        var block = factory.objectNode();
        block.set("baseColorFactor", array(baseColor));
        block.put("metallicFactor", metallic);
        block.put("roughnessFactor", roughness);
        var material = factory.objectNode();
        material.set(MaterialFields.PBR_BLOCK, block);
        return material;
    }

    private ArrayNode array(float[] values) {
        var array = factory.arrayNode();
        for (var v : values) {
            array.add(v);
        }
        return array;
    }
}
