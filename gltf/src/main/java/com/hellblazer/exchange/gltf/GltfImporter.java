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
package com.hellblazer.exchange.gltf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import com.hellblazer.exchange.gltf.io.GlbContainer;
import com.hellblazer.exchange.gltf.io.GlbReader;
import com.hellblazer.exchange.gltf.material.ImageDecoder;
import com.hellblazer.exchange.gltf.material.MaterialMapper;
import com.hellblazer.exchange.gltf.material.TextureResolver;
import com.hellblazer.exchange.gltf.read.AccessorResolver;
import com.hellblazer.exchange.gltf.read.GraphReconstructor;
import com.hellblazer.exchange.gltf.read.MeshAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads GLB containers and glTF documents into a {@link SceneDescriptor}.
 * <p>
 * Without an {@link ImageDecoder} materials are not read and meshes carry no texture visuals.
 *
 * @author hal.hildebrand
 * @see GltfExporter
 */
public class GltfImporter {
    private static final Logger log = LoggerFactory.getLogger(GltfImporter.class);

    private final GltfOptions      options;
    private final ObjectMapper     objectMapper;
    private final TextureResolver  textures;
    private final GlbReader        glbReader;
    private final AccessorResolver accessorResolver = new AccessorResolver();
    private final MeshAssembler    meshAssembler    = new MeshAssembler();

    public GltfImporter() {
        this(GltfOptions.defaults(), (ImageDecoder) null);
    }

    /**
     * @param decoder image decoder, or {@code null} to skip materials
     */
    public GltfImporter(GltfOptions options, ImageDecoder decoder) {
        this(options, decoder == null ? TextureResolver.untextured()
                                      : TextureResolver.decoding(decoder, new MaterialMapper()));
    }

    public GltfImporter(GltfOptions options, TextureResolver textures) {
        this(options, textures, new ObjectMapper());
    }

    public GltfImporter(GltfOptions options, TextureResolver textures, ObjectMapper objectMapper) {
        this.options = options;
        this.textures = textures;
        this.objectMapper = objectMapper;
        this.glbReader = new GlbReader(objectMapper);
    }

    public SceneDescriptor loadGlb(byte[] data) {
        return load(glbReader.read(data));
    }

    public SceneDescriptor loadGlb(InputStream input) throws IOException {
        return load(glbReader.read(input));
    }

    public SceneDescriptor loadGlb(Path inputFile) throws IOException {
        return load(glbReader.read(inputFile));
    }

    /**
     * Load a glTF JSON document whose buffers and images are fetched through {@code resources}.
     */
    public SceneDescriptor loadGltf(byte[] json, ResourceResolver resources) throws IOException {
        JsonNode document;
        try {
            document = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FormatException("Invalid glTF JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new FormatException("glTF document root must be a JSON object");
        }

        var buffers = new ArrayList<ByteBuffer>();
        int index = 0;
        for (var buffer : document.path("buffers")) {
            var uri = buffer.path("uri");
            if (!uri.isTextual()) {
                throw new FormatException("Buffer " + index + " has no uri");
            }
            buffers.add(ByteBuffer.wrap(resources.load(uri.asText())).order(ByteOrder.LITTLE_ENDIAN));
            index++;
        }
        return read(document, buffers, resources);
    }

    /**
     * Load a glTF JSON file, resolving relative URIs against its directory.
     */
    public SceneDescriptor loadGltf(Path documentFile) throws IOException {
        var parent = documentFile.toAbsolutePath().getParent();
        return loadGltf(Files.readAllBytes(documentFile), ResourceResolver.fromDirectory(parent));
    }

    private SceneDescriptor load(GlbContainer container) {
        return read(container.document(), container.buffers(), ResourceResolver.none());
    }

    /**
     * Resolve a parsed document against its already loaded buffers.
     */
    public SceneDescriptor read(JsonNode document, List<ByteBuffer> buffers, ResourceResolver resources) {
        var views = accessorResolver.views(document, buffers);
        var accessors = accessorResolver.accessors(document, views);
        var materials = textures.materials(document, views, resources);
        var meshes = meshAssembler.assemble(document, accessors, materials);
        var reconstructor = new GraphReconstructor(options.baseFrame(), options.newFrameNamer());
        var graph = reconstructor.reconstruct(document, meshes);
        log.info("Imported {} geometries, {} graph edges, base frame {}", meshes.geometry().size(),
                 graph.edges().size(), graph.baseFrame());
        return new SceneDescriptor(meshes.geometry(), graph.edges(), graph.baseFrame());
    }
}
