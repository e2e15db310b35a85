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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.exchange.gltf.GltfException.LayoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GlbWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final GlbWriter    writer = new GlbWriter(mapper);

    @Test
    void testLayout() throws IOException {
        var document = mapper.readTree("{\"asset\":{\"version\":\"2.0\"}}");
        var binary = new byte[] { 1, 2, 3, 4, 5, 6, 7, 8 };
        var glb = writer.write(document, binary);

        var buffer = ByteBuffer.wrap(glb).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(GlbFormat.MAGIC_NUMBER, buffer.getInt());
        assertEquals(2, buffer.getInt());
        assertEquals(glb.length, buffer.getInt());

        int jsonLength = buffer.getInt();
        assertEquals(GlbFormat.ChunkType.JSON.id(), buffer.getInt());
        assertEquals(0, jsonLength % 4);
        assertEquals(28 + jsonLength + binary.length, glb.length);

        var json = new byte[jsonLength];
        buffer.get(json);
        assertEquals(document, mapper.readTree(new String(json, StandardCharsets.UTF_8)));

        assertEquals(binary.length, buffer.getInt());
        assertEquals(GlbFormat.ChunkType.BIN.id(), buffer.getInt());
        var payload = new byte[binary.length];
        buffer.get(payload);
        assertArrayEquals(binary, payload);
        assertFalse(buffer.hasRemaining());
    }

    @Test
    void testJsonPaddedWithSpaces() throws IOException {
        // {"a":1} is 7 bytes; 20 + 7 needs one byte of padding
        var content = writer.jsonContent(mapper.readTree("{\"a\":1}"));
        assertEquals(8, content.length);
        assertEquals(' ', content[7]);
        assertEquals(0, (GlbFormat.JSON_CONTENT_OFFSET + content.length) % 4);
    }

    @Test
    void testAlignedJsonNotPadded() throws IOException {
        // {"ab":1} is 8 bytes, already aligned
        var content = writer.jsonContent(mapper.readTree("{\"ab\":1}"));
        assertEquals(8, content.length);
        assertEquals('}', content[7]);
    }

    @Test
    void testEmptyBinaryChunkStillWritten() throws IOException {
        var glb = writer.write(mapper.readTree("{}"), new byte[0]);
        var buffer = ByteBuffer.wrap(glb).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(12);
        int jsonLength = buffer.getInt();
        buffer.position(20 + jsonLength);
        assertEquals(0, buffer.getInt());
        assertEquals(GlbFormat.ChunkType.BIN.id(), buffer.getInt());
    }

    @Test
    void testUnalignedBinaryRejected() {
        assertThrows(LayoutException.class, () -> writer.write(mapper.createObjectNode(), new byte[3]));
    }

    @Test
    void testWriteFile() throws IOException {
        var file = tempDir.resolve("test.glb");
        writer.write(mapper.createObjectNode(), new byte[4], file);
        var bytes = Files.readAllBytes(file);
        assertEquals(bytes.length, ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getInt(8));
    }
}
