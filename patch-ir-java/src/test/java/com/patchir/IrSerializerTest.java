package com.patchir;

import com.patchir.build.IrBuilder;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrSerializer;
import com.patchir.registry.ObjectRegistry;
import com.patchir.source.SourceCanvas;
import com.patchir.source.SourcePatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.patchir.source.SourceObject.object;
import static org.junit.jupiter.api.Assertions.*;

class IrSerializerTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures");

    private static IrPatch build(String fixture) {
        return new IrBuilder(ObjectRegistry.withBuiltins()).buildFromFile(FIXTURES.resolve(fixture));
    }

    @Test
    void writesNamedFileAndReadsItBack(@TempDir Path tmp) {
        IrPatch ir = build("subpatch-gain.json");
        IrSerializer serializer = new IrSerializer();

        Path written = serializer.write(ir, tmp.resolve("out"));
        assertEquals(tmp.resolve("out").resolve("subpatch-gain.ir.json"), written);
        assertTrue(Files.isRegularFile(written));

        IrPatch read = serializer.read(written);
        assertEquals(ir.patch.graphHash, read.patch.graphHash);
        assertEquals(ir.nodes.size(), read.nodes.size());
        assertEquals(ir.edges.size(), read.edges.size());
        assertEquals(ir.canvases.size(), read.canvases.size());
        assertEquals(serializer.toJson(ir), serializer.toJson(read));
    }

    @Test
    void nonAsciiArgsSurviveTheFile(@TempDir Path tmp) throws IOException {
        SourceCanvas canvas = SourceCanvas.named("greeting")
                .add(object("print", "gr\u00fc\u00dfe").at(10, 10));
        IrPatch ir = new IrBuilder(ObjectRegistry.withBuiltins()).build(SourcePatch.of("greeting", canvas));
        IrSerializer serializer = new IrSerializer();

        Path written = serializer.write(ir, tmp);
        assertTrue(new String(Files.readAllBytes(written), StandardCharsets.UTF_8).contains("gr\u00fc\u00dfe"));

        IrPatch read = serializer.read(written);
        assertEquals(List.of("gr\u00fc\u00dfe"), read.nodes.get(0).args);
        assertEquals(ir.patch.graphHash, read.patch.graphHash);
    }

    @Test
    void outputUsesSnakeCaseAndLowercaseTags() {
        String json = new IrSerializer().toJson(build("simple-osc.json"));

        assertTrue(json.contains("\"ir_version\": \"0.1\""));
        assertTrue(json.contains("\"graph_hash\""));
        assertTrue(json.contains("\"root_canvas\": \"c0\""));
        assertTrue(json.contains("\"original_id\""));
        assertTrue(json.contains("\"kind\": \"wire\""));
        assertTrue(json.contains("\"domain\": \"signal\""));
        assertFalse(json.contains("graphHash"));
    }

    @Test
    void nodesAndWiresAreSortedSymbolEdgesLast() {
        IrPatch ir = build("send-receive.json");
        Collections.reverse(ir.nodes);
        Collections.reverse(ir.edges);
        IrPatch read = new IrSerializer().fromJson(new IrSerializer().toJson(ir));

        List<String> ids = read.nodes.stream().map(n -> n.id).collect(Collectors.toList());
        List<String> sorted = new ArrayList<>(ids);
        Collections.sort(sorted);
        assertEquals(sorted, ids);

        boolean seenSymbol = false;
        for (IrEdge e : read.edges) {
            if (e.kind == EdgeKind.SYMBOL) seenSymbol = true;
            else assertFalse(seenSymbol, "wire after symbol edge");
        }
    }

    @Test
    void unnamedPatchIsWrittenAsUntitled(@TempDir Path tmp) {
        IrPatch ir = build("simple-osc.json");
        ir.patch.name = null;
        Path written = new IrSerializer().write(ir, tmp);
        assertEquals("untitled.ir.json", written.getFileName().toString());
    }

    @Test
    void missingFileThrows(@TempDir Path tmp) {
        assertThrows(IrSerializer.SerializerException.class,
                () -> new IrSerializer().read(tmp.resolve("nope.ir.json")));
    }

    @Test
    void invalidJsonThrows(@TempDir Path tmp) throws IOException {
        Path bad = tmp.resolve("bad.ir.json");
        Files.writeString(bad, "{ not json");
        assertThrows(IrSerializer.SerializerException.class, () -> new IrSerializer().read(bad));
    }

    @Test
    void documentWithoutPatchMetadataThrows() {
        assertThrows(IrSerializer.SerializerException.class, () -> new IrSerializer().fromJson("{\"nodes\": []}"));
        assertThrows(IrSerializer.SerializerException.class, () -> new IrSerializer().fromJson(""));
    }
}
