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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ResourceResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void testDataUri() throws IOException {
        assertArrayEquals(new byte[] { 1, 2, 3 }, ResourceResolver.none().load("data:application/octet-stream;base64,AQID"));
        assertThrows(IOException.class, () -> ResourceResolver.none().load("data:text/plain,hello"));
        assertThrows(IOException.class, () -> ResourceResolver.none().load("data:;base64,@@@"));
    }

    @Test
    void testNoneResolvesNothing() {
        assertThrows(NoSuchFileException.class, () -> ResourceResolver.none().load("buffer.bin"));
    }

    @Test
    void testFromMap() throws IOException {
        var resolver = ResourceResolver.fromMap(Map.of("a.bin", new byte[] { 7 }));
        assertArrayEquals(new byte[] { 7 }, resolver.load("a.bin"));
        assertThrows(NoSuchFileException.class, () -> resolver.load("b.bin"));
    }

    @Test
    void testFromDirectory() throws IOException {
        Files.write(tempDir.resolve("a.bin"), new byte[] { 4, 5 });
        var resolver = ResourceResolver.fromDirectory(tempDir);
        assertArrayEquals(new byte[] { 4, 5 }, resolver.load("a.bin"));
        assertThrows(IOException.class, () -> resolver.load("../escape.bin"));
    }
}
