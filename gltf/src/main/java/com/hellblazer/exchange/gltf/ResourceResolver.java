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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies the bytes behind a relative URI in a glTF document: external buffers and images of the text form.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ResourceResolver {

    /**
     * @param uri relative URI as written in the document
     * @return the resource contents
     * @throws IOException when the resource cannot be found or read
     */
    byte[] get(String uri) throws IOException;

    /**
     * Resolve {@code uri}, decoding base64 {@code data:} URIs inline and delegating everything else to
     * {@link #get(String)}.
     */
    default byte[] load(String uri) throws IOException {
        if (uri.startsWith("data:")) {
            int comma = uri.indexOf(',');
            if (comma < 0 || !uri.substring(0, comma).endsWith(";base64")) {
                throw new IOException("Only base64 data URIs are supported");
            }
            try {
                return Base64.getDecoder().decode(uri.substring(comma + 1));
            } catch (IllegalArgumentException e) {
                throw new IOException("Malformed base64 data URI", e);
            }
        }
        return get(uri);
    }

    /**
     * Resolver over an in-memory file map, such as the result of {@link GltfExporter#exportDirectory}.
     */
    static ResourceResolver fromMap(Map<String, byte[]> files) {
        Objects.requireNonNull(files, "files");
        return uri -> {
            var data = files.get(uri);
            if (data == null) {
                throw new NoSuchFileException(uri);
            }
            return data;
        };
    }

    /**
     * Resolver over files relative to {@code directory}. URIs escaping the directory are rejected.
     */
    static ResourceResolver fromDirectory(Path directory) {
        var root = directory.toAbsolutePath().normalize();
        return uri -> {
            var file = root.resolve(uri).normalize();
            if (!file.startsWith(root)) {
                throw new IOException("Resource " + uri + " is outside " + root);
            }
            return Files.readAllBytes(file);
        };
    }

    /**
     * Resolver for self-contained documents; only {@code data:} URIs resolve.
     */
    static ResourceResolver none() {
        return uri -> {
            throw new NoSuchFileException(uri, null, "no external resources available");
        };
    }
}
