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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * No image decoding available. Materials and textures are dropped and textured meshes load without their UVs.
 *
 * @author hal.hildebrand
 */
class UntexturedResolver implements TextureResolver {
    private static final Logger log = LoggerFactory.getLogger(UntexturedResolver.class);

    @Override
    public List<PbrMaterial> materials(JsonNode document, List<ByteBuffer> views, ResourceResolver resources) {
        if (document.path("materials").size() > 0) {
            log.warn("Unable to load {} materials without an image decoder", document.path("materials").size());
        }
        return List.of();
    }
}
