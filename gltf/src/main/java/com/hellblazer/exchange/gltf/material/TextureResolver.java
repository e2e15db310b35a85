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
import com.hellblazer.exchange.gltf.ResourceResolver;
import com.hellblazer.exchange.scene.PbrMaterial;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Turns the {@code materials}, {@code textures} and {@code images} of a document into {@link PbrMaterial}s. Which
 * implementation is in use depends on whether an {@link ImageDecoder} was configured.
 *
 * @author hal.hildebrand
 */
public interface TextureResolver {

    /**
     * Resolver used when no image decoder is available: materials are skipped.
     */
    static TextureResolver untextured() {
        return new UntexturedResolver();
    }

    static TextureResolver decoding(ImageDecoder decoder) {
        return new DecodingTextureResolver(decoder, new MaterialMapper());
    }

    static TextureResolver decoding(ImageDecoder decoder, MaterialMapper mapper) {
        return new DecodingTextureResolver(decoder, mapper);
    }

    /**
     * @param document  glTF document
     * @param views     resolved buffer views by index
     * @param resources resolver for images stored outside the buffers
     * @return materials by material index, empty when materials are not read at all
     */
    List<PbrMaterial> materials(JsonNode document, List<ByteBuffer> views, ResourceResolver resources);
}
