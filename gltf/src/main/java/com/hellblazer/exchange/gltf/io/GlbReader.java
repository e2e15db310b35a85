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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Unpacks a GLB container into its JSON document and BIN chunks.
 *
 * @author hal.hildebrand
 * @see GlbWriter
 * @see GlbFormat
 */
public class GlbReader {
    private static final Logger log = LoggerFactory.getLogger(GlbReader.class);

    private final ObjectMapper objectMapper;

    public GlbReader() {
        this(new ObjectMapper());
    }

    public GlbReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GlbContainer read(Path inputFile) throws IOException {
        var container = read(Files.readAllBytes(inputFile));
        log.debug("Read GLB from {}", inputFile);
        return container;
    }

    public GlbContainer read(InputStream input) throws IOException {
        return read(input.readAllBytes());
    }

    public GlbContainer read(byte[] data) {
        return read(ByteBuffer.wrap(data));
    }

    /**
     * Decode a GLB container starting at the buffer's position.
     *
     * @throws FormatException for a bad header, a first chunk that is not JSON, unparseable JSON, a later chunk that
     *                         is not BIN, or a chunk shorter than declared
     */
    public GlbContainer read(ByteBuffer data) {
        var buffer = data.slice().order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.remaining() < GlbFormat.HEADER_SIZE) {
            throw new FormatException("Truncated GLB header: " + buffer.remaining() + " bytes");
        }
        var header = GlbFormat.Header.read(buffer);
        header.validate();
        log.debug("Read header: {}", header);

        if (buffer.remaining() < GlbFormat.CHUNK_HEADER_SIZE) {
            throw new FormatException("Missing JSON chunk header");
        }
        int jsonLength = buffer.getInt();
        int jsonType = buffer.getInt();
        if (GlbFormat.ChunkType.fromId(jsonType) != GlbFormat.ChunkType.JSON) {
            throw new FormatException("First chunk is not JSON: type 0x" + Integer.toHexString(jsonType));
        }
        var json = readChunk(buffer, jsonLength, "JSON");
        var document = parse(json);

        long length = Integer.toUnsignedLong(header.length);
        var chunks = new ArrayList<ByteBuffer>();
        while (buffer.position() < length) {
            if (buffer.remaining() < GlbFormat.CHUNK_HEADER_SIZE) {
                // trailing padding or early end of data
                break;
            }
            int chunkLength = buffer.getInt();
            int chunkType = buffer.getInt();
            if (GlbFormat.ChunkType.fromId(chunkType) != GlbFormat.ChunkType.BIN) {
                throw new FormatException("Chunk " + (chunks.size() + 1) + " is not BIN: type 0x"
                                          + Integer.toHexString(chunkType));
            }
            chunks.add(readChunk(buffer, chunkLength, "BIN"));
        }

        log.debug("Unpacked GLB: JSON {} bytes, {} binary chunks", jsonLength, chunks.size());
        return new GlbContainer(document, chunks);
    }

    private ByteBuffer readChunk(ByteBuffer buffer, int declared, String kind) {
        long length = Integer.toUnsignedLong(declared);
        if (length > buffer.remaining()) {
            throw new FormatException(
            String.format("%s chunk declares %d bytes but only %d remain", kind, length, buffer.remaining()));
        }
        var chunk = buffer.slice(buffer.position(), (int) length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(buffer.position() + (int) length);
        return chunk;
    }

    private JsonNode parse(ByteBuffer json) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(json)
                                         .toString();
        } catch (CharacterCodingException e) {
            throw new FormatException("JSON chunk is not valid UTF-8", e);
        }
        try {
            var document = objectMapper.readTree(text);
            if (document == null || !document.isObject()) {
                throw new FormatException("JSON chunk does not hold a glTF object");
            }
            return document;
        } catch (IOException e) {
            throw new FormatException("Unable to parse JSON chunk: " + e.getMessage(), e);
        }
    }
}
