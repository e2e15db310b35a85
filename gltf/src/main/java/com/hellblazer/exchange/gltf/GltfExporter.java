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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.io.GlbWriter;
import com.hellblazer.exchange.gltf.layout.BufferLayout;
import com.hellblazer.exchange.gltf.layout.GltfStructure;
import com.hellblazer.exchange.gltf.layout.StructureBuilder;
import com.hellblazer.exchange.gltf.material.MaterialMapper;
import com.hellblazer.exchange.scene.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a {@link Scene} as a single GLB container or as a directory of a glTF JSON document plus one {@code .bin}
 * buffer per geometry.
 *
 * @author hal.hildebrand
 * @see GltfImporter
 */
public class GltfExporter {
    private static final Logger log = LoggerFactory.getLogger(GltfExporter.class);

    private final GltfOptions      options;
    private final ObjectMapper     objectMapper;
    private final StructureBuilder structureBuilder;
    private final GlbWriter        glbWriter;

    public GltfExporter() {
        this(GltfOptions.defaults());
    }

    public GltfExporter(GltfOptions options) {
        this(options, new ObjectMapper());
    }

    public GltfExporter(GltfOptions options, ObjectMapper objectMapper) {
        this.options = options;
        this.objectMapper = objectMapper;
        this.structureBuilder = new StructureBuilder(objectMapper.getNodeFactory(), new MaterialMapper(objectMapper),
                                                     options.generator(), options.includeNormals());
        this.glbWriter = new GlbWriter(objectMapper);
    }

    public GltfOptions options() {
        return options;
    }

    /**
     * Build the document tree and buffer items without laying out buffers.
     */
    public GltfStructure structure(Scene scene) {
        return structureBuilder.build(scene);
    }

    /**
     * @return a complete GLB container holding every buffer item in one BIN chunk
     */
    public byte[] exportGlb(Scene scene) {
        var structure = structure(scene);
        var binary = BufferLayout.embedded(structure);
        var glb = glbWriter.write(structure.tree(), binary);
        log.info("Exported {} geometries to GLB: {} bytes ({} bytes binary)", scene.geometry().size(), glb.length,
                 binary.length);
        return glb;
    }

    /**
     * @return file name to contents; the JSON document comes first, followed by one buffer file per geometry
     */
    public Map<String, byte[]> exportDirectory(Scene scene) {
        var structure = structure(scene);
        var buffers = BufferLayout.external(structure);
        var files = new LinkedHashMap<String, byte[]>();
        try {
            files.put(options.documentName(), objectMapper.writeValueAsBytes(structure.tree()));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize glTF document", e);
        }
        buffers.forEach((name, data) -> {
            if (files.putIfAbsent(name, data) != null) {
                throw new GltfException.LayoutException("Buffer file " + name + " collides with the document name");
            }
        });
        log.info("Exported {} geometries to {} files", scene.geometry().size(), files.size());
        return files;
    }

    public void writeGlb(Scene scene, Path outputFile) throws IOException {
        Files.write(outputFile, exportGlb(scene));
    }

    /**
     * Write {@link #exportDirectory(Scene)} into {@code directory}, creating it if needed.
     */
    public void writeDirectory(Scene scene, Path directory) throws IOException {
        Files.createDirectories(directory);
        for (var entry : exportDirectory(scene).entrySet()) {
            Files.write(directory.resolve(entry.getKey()), entry.getValue());
        }
        log.debug("Wrote glTF directory {}", directory);
    }
}
