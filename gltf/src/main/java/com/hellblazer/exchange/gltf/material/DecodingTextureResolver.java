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
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import com.hellblazer.exchange.gltf.ResourceResolver;
import com.hellblazer.exchange.scene.PbrMaterial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes every image of a document once, then maps the materials over the decoded images. An image that fails to
 * decode is left null; the other images and every material are still produced.
 *
 * @author hal.hildebrand
 */
class DecodingTextureResolver implements TextureResolver {
    private static final Logger log = LoggerFactory.getLogger(DecodingTextureResolver.class);

    private final ImageDecoder   decoder;
    private final MaterialMapper mapper;

    DecodingTextureResolver(ImageDecoder decoder, MaterialMapper mapper) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public List<PbrMaterial> materials(JsonNode document, List<ByteBuffer> views, ResourceResolver resources) {
        var images = decodeImages(document, views, resources);
        return mapper.parse(document, images);
    }

    List<BufferedImage> decodeImages(JsonNode document, List<ByteBuffer> views, ResourceResolver resources) {
        var images = new ArrayList<BufferedImage>();
        int index = 0;
        for (var image : document.path("images")) {
            images.add(decode(index++, image, views, resources));
        }
        return images;
    }

    private BufferedImage decode(int index, JsonNode image, List<ByteBuffer> views, ResourceResolver resources) {
        var mimeType = image.path("mimeType").isTextual() ? image.get("mimeType").asText() : null;
        byte[] blob;
        if (image.has("bufferView")) {
            int view = image.get("bufferView").asInt();
            if (view < 0 || view >= views.size()) {
                throw new FormatException("Image " + index + " references buffer view " + view + " of " + views.size());
            }
            var slice = views.get(view).duplicate();
            blob = new byte[slice.remaining()];
            slice.get(blob);
        } else if (image.has("uri")) {
            try {
                blob = resources.load(image.get("uri").asText());
            } catch (IOException e) {
                log.error("Failed to load image {}", index, e);
                return null;
            }
        } else {
            log.warn("Image {} has neither bufferView nor uri", index);
            return null;
        }
        try {
            var decoded = decoder.decode(blob, mimeType);
            if (decoded == null) {
                log.error("Decoder returned no image for image {}", index);
                return null;
            }
            log.debug("Decoded image {}: {}x{}", index, decoded.getWidth(), decoded.getHeight());
            return decoded;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to decode image {}", index, e);
            return null;
        }
    }
}
