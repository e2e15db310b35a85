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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.exchange.gltf.GltfException.FormatException;
import com.hellblazer.exchange.gltf.io.GlbWriter;
import com.hellblazer.exchange.gltf.layout.AccessorType;
import com.hellblazer.exchange.gltf.material.ImageDecoder;
import com.hellblazer.exchange.gltf.material.TextureResolver;
import com.hellblazer.exchange.scene.ColorVisuals;
import com.hellblazer.exchange.scene.GraphEdge;
import com.hellblazer.exchange.scene.LinePath;
import com.hellblazer.exchange.scene.PbrMaterial;
import com.hellblazer.exchange.scene.Scene;
import com.hellblazer.exchange.scene.TextureVisuals;
import com.hellblazer.exchange.scene.TriangleMesh;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GltfImporterTest {

    private static final float[] VERTICES = { 0, 0, 0, 1, 0, 0, 1, 1, 0, 0, 1, 0.5f };
    private static final int[]   FACES    = { 0, 1, 2, 0, 2, 3 };

    @TempDir
    Path tempDir;

    private final GltfExporter exporter = new GltfExporter(GltfOptions.builtIn());
    private final GltfImporter importer = new GltfImporter(GltfOptions.builtIn(), (ImageDecoder) null);

    private static Matrix4d translation(double x, double y, double z) {
        var m = GraphEdge.identity();
        m.setTranslation(new Vector3d(x, y, z));
        return m;
    }

    private static Point3d worldPosition(Scene scene, String geometry) {
        var frame = scene.graph()
                         .edges()
                         .stream()
                         .filter(e -> geometry.equals(e.geometry()))
                         .findFirst()
                         .orElseThrow()
                         .frameTo();
        var point = new Point3d();
        scene.graph().worldTransform(frame).transform(point);
        return point;
    }

    @Test
    void testGlbRoundTrip() {
        var scene = new Scene();
        scene.add("quad", new TriangleMesh(VERTICES, FACES).withUnits("meters"));

        var descriptor = importer.loadGlb(exporter.exportGlb(scene));
        assertEquals(1, descriptor.geometry().size());
        var mesh = descriptor.geometry().get("quad");
        assertArrayEquals(VERTICES, mesh.vertices());
        assertArrayEquals(FACES, mesh.faces());
        assertEquals("meters", mesh.units().orElseThrow());
        assertEquals(1, descriptor.instances().size());
        assertEquals("quad", descriptor.instances().get(0).geometry());
    }

    @Test
    void testTransformsSurviveRoundTrip() {
        var scene = new Scene();
        var mesh = new TriangleMesh(VERTICES, FACES);
        scene.add("base", mesh, translation(1, 0, 0), "world");
        scene.add("top", mesh, translation(0, 0, 5), "base");

        var imported = importer.loadGlb(exporter.exportGlb(scene)).toScene();
        assertEquals(new Point3d(1, 0, 0), worldPosition(imported, "base"));
        assertEquals(new Point3d(1, 0, 5), worldPosition(imported, "top"));
    }

    @Test
    void testBaseFrameRenamedWhenNodeClaimsIt() {
        var scene = new Scene();
        scene.add("quad", new TriangleMesh(VERTICES, FACES));
        var descriptor = importer.loadGlb(exporter.exportGlb(scene));
        // the exported root node is itself named "world"
        assertNotEquals("world", descriptor.baseFrame());
        var rebuilt = descriptor.toScene();
        assertTrue(rebuilt.graph().contains("world"));
        assertEquals(1, rebuilt.graph().nodesGeometry().size());
    }

    @Test
    void testVertexColorsRoundTrip() {
        var colors = new byte[] { 10, 20, 30, (byte) 255, 40, 50, 60, (byte) 255, 70, 80, 90, 100, 1, 2, 3, 4 };
        var scene = new Scene();
        scene.add("colored", new TriangleMesh(VERTICES, FACES).withVisuals(ColorVisuals.perVertex(colors)));
        var mesh = importer.loadGlb(exporter.exportGlb(scene)).geometry().get("colored");
        var visuals = assertInstanceOf(ColorVisuals.class, mesh.visuals());
        assertArrayEquals(colors, visuals.vertexColors());
    }

    @Test
    void testLinePathsNotImported() {
        var scene = new Scene();
        scene.add("quad", new TriangleMesh(VERTICES, FACES));
        scene.add("path", LinePath.polyline(new float[] { 0, 0, 0, 1, 1, 1 }, 3));
        var descriptor = importer.loadGlb(exporter.exportGlb(scene));
        assertEquals(1, descriptor.geometry().size());
        assertTrue(descriptor.geometry().containsKey("quad"));
    }

    @Test
    void testDirectoryRoundTrip() throws IOException {
        var scene = new Scene();
        scene.add("a", new TriangleMesh(VERTICES, FACES));
        scene.add("b", new TriangleMesh(VERTICES, new int[] { 3, 2, 1 }));
        var files = exporter.exportDirectory(scene);

        var descriptor = importer.loadGltf(files.get("model.gltf"), ResourceResolver.fromMap(files));
        assertArrayEquals(FACES, descriptor.geometry().get("a").faces());
        assertArrayEquals(new int[] { 3, 2, 1 }, descriptor.geometry().get("b").faces());

        exporter.writeDirectory(scene, tempDir);
        var fromDisk = importer.loadGltf(tempDir.resolve("model.gltf"));
        assertArrayEquals(VERTICES, fromDisk.geometry().get("b").vertices());
    }

    @Test
    void testMissingBufferFile() {
        var scene = new Scene();
        scene.add("a", new TriangleMesh(VERTICES, FACES));
        var files = new HashMap<>(exporter.exportDirectory(scene));
        files.remove("mesh_a.bin");
        assertThrows(IOException.class,
                     () -> importer.loadGltf(files.get("model.gltf"), ResourceResolver.fromMap(files)));
    }

    @Test
    void testDataUriBuffer() throws IOException {
        var fixture = new DocumentFixture();
        fixture.mesh("tri", fixture.triangles(fixture.floats(AccessorType.VEC3, 0, 0, 0, 1, 0, 0, 0, 1, 0), -1));
        fixture.node("instance", 0);
        fixture.scene(0);
        var document = fixture.document();
        var buffer = document.putArray("buffers").addObject();
        buffer.put("uri", "data:application/octet-stream;base64,"
                          + Base64.getEncoder().encodeToString(fixture.binary()));
        buffer.put("byteLength", fixture.binary().length);

        var descriptor = importer.loadGltf(document.toString().getBytes(StandardCharsets.UTF_8),
                                           ResourceResolver.none());
        assertArrayEquals(new int[] { 0, 1, 2 }, descriptor.geometry().get("tri").faces());
        assertEquals("world", descriptor.baseFrame());
    }

    @Test
    void testBufferWithoutUri() {
        var json = "{\"asset\": {\"version\": \"2.0\"}, \"buffers\": [{\"byteLength\": 4}]}";
        assertThrows(FormatException.class,
                     () -> importer.loadGltf(json.getBytes(StandardCharsets.UTF_8), ResourceResolver.none()));
        assertThrows(FormatException.class,
                     () -> importer.loadGltf("not json".getBytes(StandardCharsets.UTF_8), ResourceResolver.none()));
    }

    @Test
    void testTexturedMeshWithDecoder() throws IOException {
        var fixture = new DocumentFixture();
        var primitive = fixture.triangles(fixture.floats(AccessorType.VEC3, 0, 0, 0, 1, 0, 0, 0, 1, 0), -1);
        ((ObjectNode) primitive.get("attributes")).put("TEXCOORD_0", fixture.floats(AccessorType.VEC2, 0, 0, 1, 0, 0, 1));
        primitive.put("material", 0);
        int image = fixture.view(new byte[] { 1, 2, 3, 4, 5, 6 });
        fixture.mesh("textured", primitive);
        fixture.node("n", 0);
        fixture.scene(0);
        var document = fixture.embedded();
        document.putArray("images").addObject().put("bufferView", image).put("mimeType", "image/png");
        document.putArray("textures").addObject().put("source", 0);
        document.putArray("materials")
                .addObject()
                .putObject("pbrMetallicRoughness")
                .putObject("baseColorTexture")
                .put("index", 0);
        var glb = new GlbWriter().write(document, fixture.binary());

        ImageDecoder decoder = (data, mimeType) -> new BufferedImage(data.length, 1, BufferedImage.TYPE_INT_RGB);
        var textured = new GltfImporter(GltfOptions.builtIn(), decoder);
        var mesh = textured.loadGlb(new ByteArrayInputStream(glb)).geometry().get("textured");
        var visuals = assertInstanceOf(TextureVisuals.class, mesh.visuals());
        assertEquals(6, visuals.material().texture(PbrMaterial.TextureSlot.BASE_COLOR).orElseThrow().getWidth());
        assertEquals(1f, visuals.uv()[1]);

        var untextured = importer.loadGlb(glb).geometry().get("textured");
        assertInstanceOf(ColorVisuals.class, untextured.visuals());
    }

    @Test
    void testRandomFrameNaming() {
        var scene = new Scene();
        scene.add("quad", new TriangleMesh(VERTICES, FACES));
        var glb = exporter.exportGlb(scene);
        var options = GltfOptions.builtIn().withFrameNaming(GltfOptions.FrameNaming.RANDOM, 7L);
        var first = new GltfImporter(options, TextureResolver.untextured()).loadGlb(glb);
        var second = new GltfImporter(options, TextureResolver.untextured()).loadGlb(glb);
        assertEquals(first.instances().get(0).frameTo(), second.instances().get(0).frameTo());
        assertTrue(first.instances().get(0).frameTo().matches("quad_[0-9A-F]{6}"));
    }
}
