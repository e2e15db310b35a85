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
package com.hellblazer.exchange.gltf.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.GltfException.LayoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Packs a glTF document and its binary buffer into a GLB container.
 *
 * @author hal.hildebrand
 * @see GlbReader
 * @see GlbFormat
 */
public class GlbWriter {
    private static final Logger log = LoggerFactory.getLogger(GlbWriter.class);

    private final ObjectMapper objectMapper;

    public GlbWriter() {
        this(new ObjectMapper());
    }

    public GlbWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encode a GLB container.
     *
     * @param document glTF JSON document
     * @param binary   the single BIN chunk payload, already 4 byte aligned
     * @return header, JSON chunk and BIN chunk
     */
    public byte[] write(JsonNode document, byte[] binary) {
        var content = jsonContent(document);
        if (binary.length % GlbFormat.ALIGNMENT != 0) {
            throw new LayoutException("Binary chunk length " + binary.length + " is not 4 byte aligned");
        }

        long total = (long) GlbFormat.HEADER_SIZE + 2L * GlbFormat.CHUNK_HEADER_SIZE + content.length
        + binary.length;
        if (total > Integer.toUnsignedLong(-1)) {
            throw new LayoutException("GLB length " + total + " exceeds 32 bit range");
        }

        var buffer = ByteBuffer.allocate((int) total).order(ByteOrder.LITTLE_ENDIAN);
        new GlbFormat.Header((int) total).write(buffer);

        buffer.putInt(content.length);
        buffer.putInt(GlbFormat.ChunkType.JSON.id());
        buffer.put(content);

        buffer.putInt(binary.length);
        buffer.putInt(GlbFormat.ChunkType.BIN.id());
        buffer.put(binary);

        log.debug("Packed GLB: {} bytes total, JSON {} bytes, BIN {} bytes", total, content.length, binary.length);
        return buffer.array();
    }

    /**
     * Encode a GLB container and write it to a file.
     */
    public void write(JsonNode document, byte[] binary, Path outputFile) throws IOException {
        var bytes = write(document, binary);
        Files.write(outputFile, bytes);
        log.info("Wrote GLB to {}: {} bytes", outputFile, bytes.length);
    }

    /**
     * UTF-8 JSON text padded with spaces so the BIN chunk that follows starts on a 4 byte boundary, counting the 20
     * fixed bytes ahead of the text.
     */
    byte[] jsonContent(JsonNode document) {
        byte[] text;
        try {
            text = objectMapper.writeValueAsString(document).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to serialize glTF document", e);
        }
        int padding = GlbFormat.padding(GlbFormat.JSON_CONTENT_OFFSET + text.length);
        var content = new byte[text.length + padding];
        System.arraycopy(text, 0, content, 0, text.length);
        for (int i = text.length; i < content.length; i++) {
            content[i] = ' ';
        }
        if (content.length % GlbFormat.ALIGNMENT != 0) {
            throw new LayoutException("JSON chunk length " + content.length + " is not 4 byte aligned");
        }
        return content;
    }
}
