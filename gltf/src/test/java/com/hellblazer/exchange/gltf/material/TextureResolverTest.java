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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import com.hellblazer.exchange.gltf.ResourceResolver;
import com.hellblazer.exchange.scene.PbrMaterial.TextureSlot;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TextureResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Records what it is asked to decode and returns an image whose width is the encoded length.
     */
    private static class RecordingDecoder implements ImageDecoder {
        final List<String> mimeTypes = new ArrayList<>();

        @Override
        public BufferedImage decode(byte[] data, String mimeType) throws IOException {
            mimeTypes.add(mimeType);
            if (data.length == 0) {
                throw new IOException("empty image");
            }
            return new BufferedImage(data.length, 1, BufferedImage.TYPE_INT_ARGB);
        }
    }

    @Test
    void testUntexturedSkipsMaterials() throws IOException {
        var document = mapper.readTree("{\"materials\": [{\"name\": \"m\"}]}");
        assertTrue(TextureResolver.untextured().materials(document, List.of(), ResourceResolver.none()).isEmpty());
    }

    @Test
    void testImageSources() throws IOException {
        var encoded = Base64.getEncoder().encodeToString(new byte[] { 1, 2, 3 });
        var document = mapper.readTree("""
                                       {"images": [
                                         {"bufferView": 0, "mimeType": "image/png"},
                                         {"uri": "side.png"},
                                         {"uri": "data:image/png;base64,%s"}
                                       ]}""".formatted(encoded));
        var decoder = new RecordingDecoder();
        var resolver = new DecodingTextureResolver(decoder, new MaterialMapper(mapper));
        var views = List.of(ByteBuffer.wrap(new byte[] { 9, 9, 9, 9, 9 }));
        var images = resolver.decodeImages(document, views, ResourceResolver.fromMap(Map.of("side.png", new byte[7])));

        assertEquals(3, images.size());
        assertEquals(5, images.get(0).getWidth());
        assertEquals(7, images.get(1).getWidth());
        assertEquals(3, images.get(2).getWidth());
        assertEquals("image/png", decoder.mimeTypes.get(0));
        assertNull(decoder.mimeTypes.get(1));
    }

    @Test
    void testFailedImageDoesNotStopOthers() throws IOException {
        var document = mapper.readTree("""
                                       {"images": [{"uri": "missing.png"}, {"uri": "empty.png"}, {"uri": "ok.png"}],
                                        "textures": [{"source": 0}, {"source": 2}],
                                        "materials": [
                                          {"pbrMetallicRoughness": {"baseColorTexture": {"index": 0}}},
                                          {"pbrMetallicRoughness": {"baseColorTexture": {"index": 1}}}
                                        ]}""");
        var resources = ResourceResolver.fromMap(Map.of("empty.png", new byte[0], "ok.png", new byte[2]));
        var materials = TextureResolver.decoding(new RecordingDecoder()).materials(document, List.of(), resources);

        assertEquals(2, materials.size());
        assertTrue(materials.get(0).texture(TextureSlot.BASE_COLOR).isEmpty());
        assertEquals(2, materials.get(1).texture(TextureSlot.BASE_COLOR).orElseThrow().getWidth());
    }

    @Test
    void testUncheckedDecoderFailureIsIsolated() throws IOException {
        var document = mapper.readTree("""
                                       {"images": [{"uri": "corrupt.png"}, {"uri": "ok.png"}],
                                        "textures": [{"source": 0}, {"source": 1}],
                                        "materials": [
                                          {"pbrMetallicRoughness": {"baseColorTexture": {"index": 0}}},
                                          {"pbrMetallicRoughness": {"baseColorTexture": {"index": 1}}}
                                        ]}""");
        var resources = ResourceResolver.fromMap(Map.of("corrupt.png", new byte[] { 1 }, "ok.png", new byte[4]));
        ImageDecoder decoder = (data, mimeType) -> {
            if (data.length == 1) {
                throw new IllegalArgumentException("corrupt");
            }
            return new BufferedImage(data.length, 1, BufferedImage.TYPE_INT_ARGB);
        };
        var materials = TextureResolver.decoding(decoder).materials(document, List.of(), resources);

        assertEquals(2, materials.size());
        assertTrue(materials.get(0).texture(TextureSlot.BASE_COLOR).isEmpty());
        assertEquals(4, materials.get(1).texture(TextureSlot.BASE_COLOR).orElseThrow().getWidth());
    }

    @Test
    void testImageViewOutOfRangeIsFatal() throws IOException {
        var document = mapper.readTree("{\"images\": [{\"bufferView\": 3}]}");
        var resolver = new DecodingTextureResolver(new RecordingDecoder(), new MaterialMapper(mapper));
        assertThrows(FormatException.class, () -> resolver.decodeImages(document, List.of(), ResourceResolver.none()));
    }

    @Test
    void testImageIODecoder() throws IOException {
        var source = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        source.setRGB(1, 1, 0xFF0000);
        var out = new ByteArrayOutputStream();
        ImageIO.write(source, "png", out);

        var decoder = new ImageIODecoder();
        var decoded = decoder.decode(out.toByteArray(), "image/png");
        assertEquals(3, decoded.getWidth());
        assertEquals(2, decoded.getHeight());
        assertEquals(0xFF0000, decoded.getRGB(1, 1) & 0xFFFFFF);
        assertThrows(IOException.class, () -> decoder.decode(new byte[] { 1, 2, 3 }, "image/png"));
    }
}
