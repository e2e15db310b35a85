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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.layout.StructureBuilder;
import com.hellblazer.exchange.gltf.read.FrameNamer;
import com.hellblazer.exchange.scene.SceneGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Export and import settings.
 *
 * @param includeNormals write a NORMAL accessor for every triangle mesh
 * @param generator      value of {@code asset.generator}
 * @param baseFrame      preferred name of the synthetic root frame on import
 * @param frameNaming    how instance frame suffixes are minted on import
 * @param randomSeed     seed for {@link FrameNaming#RANDOM}
 * @param documentName   file name of the JSON document in a directory export
 * @author hal.hildebrand
 */
public record GltfOptions(boolean includeNormals, String generator, String baseFrame, FrameNaming frameNaming,
                          long randomSeed, String documentName) {

    public static final String RESOURCE = "/gltf-exchange.json";

    private static final Logger log = LoggerFactory.getLogger(GltfOptions.class);

    public enum FrameNaming {
        SEQUENTIAL,
        RANDOM
    }

    public GltfOptions {
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(baseFrame, "baseFrame");
        Objects.requireNonNull(frameNaming, "frameNaming");
        Objects.requireNonNull(documentName, "documentName");
    }

    /**
     * Settings compiled into the code, used when no configuration resource is available.
     */
    public static GltfOptions builtIn() {
        return new GltfOptions(false, StructureBuilder.DEFAULT_GENERATOR, SceneGraph.DEFAULT_BASE_FRAME,
                               FrameNaming.SEQUENTIAL, 0L, "model.gltf");
    }

    /**
     * Settings from the {@value #RESOURCE} classpath resource, falling back to {@link #builtIn()} for anything it
     * does not specify.
     */
    public static GltfOptions defaults() {
        return Defaults.INSTANCE;
    }

    /**
     * Load settings from a JSON classpath resource.
     *
     * @param resource absolute resource name
     */
    public static GltfOptions load(String resource) {
        var fallback = builtIn();
        try (InputStream is = GltfOptions.class.getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Options resource not found: {}", resource);
                return fallback;
            }
            var root = new ObjectMapper().readTree(is);
            if (root == null || !root.isObject()) {
                log.warn("Invalid options format in {}: expected an object", resource);
                return fallback;
            }
            var options = parse(root, fallback);
            log.debug("Loaded options from {}: {}", resource, options);
            return options;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load options from {}: {}", resource, e.getMessage());
            return fallback;
        }
    }

    static GltfOptions parse(JsonNode node, GltfOptions fallback) {
        return new GltfOptions(node.path("includeNormals").asBoolean(fallback.includeNormals),
                               node.path("generator").asText(fallback.generator),
                               node.path("baseFrame").asText(fallback.baseFrame),
                               node.has("frameNaming") ? FrameNaming.valueOf(
                               node.get("frameNaming").asText().toUpperCase(Locale.ROOT)) : fallback.frameNaming,
                               node.path("randomSeed").asLong(fallback.randomSeed),
                               node.path("documentName").asText(fallback.documentName));
    }

    public GltfOptions withIncludeNormals(boolean includeNormals) {
        return new GltfOptions(includeNormals, generator, baseFrame, frameNaming, randomSeed, documentName);
    }

    public GltfOptions withGenerator(String generator) {
        return new GltfOptions(includeNormals, generator, baseFrame, frameNaming, randomSeed, documentName);
    }

    public GltfOptions withBaseFrame(String baseFrame) {
        return new GltfOptions(includeNormals, generator, baseFrame, frameNaming, randomSeed, documentName);
    }

    public GltfOptions withFrameNaming(FrameNaming frameNaming, long randomSeed) {
        return new GltfOptions(includeNormals, generator, baseFrame, frameNaming, randomSeed, documentName);
    }

    public GltfOptions withDocumentName(String documentName) {
        return new GltfOptions(includeNormals, generator, baseFrame, frameNaming, randomSeed, documentName);
    }

    /**
     * @return a fresh namer; each import gets its own so names do not depend on earlier calls
     */
    public FrameNamer newFrameNamer() {
        return frameNaming == FrameNaming.RANDOM ? FrameNamer.random(new Random(randomSeed)) : FrameNamer.sequential();
    }

    private static final class Defaults {
        private static final GltfOptions INSTANCE = load(RESOURCE);
    }
}
