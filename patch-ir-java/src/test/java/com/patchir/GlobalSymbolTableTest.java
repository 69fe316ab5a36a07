package com.patchir;

import com.patchir.build.IrBuilder;
import com.patchir.ir.GlobalSymbolTable;
import com.patchir.ir.GlobalSymbolTable.CrossPatchConnection;
import com.patchir.ir.GlobalSymbolTable.Endpoint;
import com.patchir.ir.GlobalSymbolTable.Entry;
import com.patchir.ir.GlobalSymbolTable.OrphanedSymbols;
import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrModel.SymbolKind;
import com.patchir.ir.IrModel.SymbolNamespace;
import com.patchir.registry.ObjectRegistry;
import com.patchir.source.SourceCanvas;
import com.patchir.source.SourcePatch;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static com.patchir.source.SourceObject.object;
import static org.junit.jupiter.api.Assertions.*;

class GlobalSymbolTableTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures");

    private static IrPatch sendReceive;
    private static IrPatch mixer;

    @BeforeAll
    static void buildPatches() {
        IrBuilder builder = new IrBuilder(ObjectRegistry.withBuiltins());
        sendReceive = builder.buildFromFile(FIXTURES.resolve("send-receive.json"));
        SourceCanvas canvas = SourceCanvas.named("mixer")
                .add(object("catch~", "bus").at(10, 10))
                .add(object("s", "volume").at(100, 10));
        mixer = builder.build(SourcePatch.of("mixer", canvas));
    }

    private static GlobalSymbolTable bothPatches() {
        GlobalSymbolTable table = new GlobalSymbolTable();
        table.addPatch(sendReceive);
        table.addPatch(mixer);
        return table;
    }

    @Test
    void symbolsMergeAcrossPatches() {
        GlobalSymbolTable table = bothPatches();

        assertEquals(4, table.size());
        assertEquals(List.of("mixer.pd", "send-receive.pd"), List.copyOf(table.patches()));

        Entry bus = table.getSymbol(SymbolKind.THROW_CATCH, "bus");
        assertNotNull(bus);
        assertEquals(2, bus.endpoints.size());
        assertTrue(bus.hasRole(GlobalSymbolTable.WRITER));
        assertTrue(bus.hasRole(GlobalSymbolTable.READER));
        for (Endpoint e : bus.endpoints) {
            assertEquals(Domain.SIGNAL, e.domain);
        }

        assertEquals(2, table.getWriters(SymbolKind.SEND_RECEIVE, "freq", SymbolNamespace.GLOBAL).size());
        assertEquals(3, table.getReaders(SymbolKind.SEND_RECEIVE, "freq", SymbolNamespace.GLOBAL).size());
        assertEquals(Domain.CONTROL,
                table.getReaders(SymbolKind.SEND_RECEIVE, "freq", SymbolNamespace.GLOBAL).get(0).domain);
        assertTrue(table.getReaders(SymbolKind.SEND_RECEIVE, "nothing", SymbolNamespace.GLOBAL).isEmpty());
        assertEquals(1, table.findByName("freq").size());
        assertNull(table.getSymbol(SymbolKind.VALUE, "freq"));
    }

    @Test
    void crossPatchConnectionsListReadersWithoutLocalWriters() {
        List<CrossPatchConnection> connections = bothPatches().getCrossPatchConnections();

        CrossPatchConnection bus = connections.stream()
                .filter(c -> c.symbol().equals("bus")).findFirst().orElseThrow();
        assertEquals(SymbolKind.THROW_CATCH, bus.kind());
        assertEquals(List.of("send-receive.pd"), bus.writerPatches());
        assertEquals(List.of("mixer.pd"), bus.readerPatches());

        assertTrue(connections.stream().noneMatch(c -> c.symbol().equals("freq")));
        assertTrue(connections.stream().noneMatch(c -> c.symbol().equals("volume")));
    }

    @Test
    void orphanedSymbolsAreOneSided() {
        OrphanedSymbols orphaned = bothPatches().getOrphanedSymbols();

        assertEquals(1, orphaned.writersOnly().size());
        assertEquals("volume", orphaned.writersOnly().get(0).resolved);
        assertTrue(orphaned.readersOnly().stream().anyMatch(e -> e.resolved.equals("$0-local")));
        assertTrue(orphaned.readersOnly().stream().noneMatch(e -> e.resolved.equals("bus")));
    }

    @Test
    void singlePatchLeavesThrowWithoutCatchOrphaned() {
        GlobalSymbolTable table = new GlobalSymbolTable();
        table.addPatch(sendReceive);
        assertTrue(table.getOrphanedSymbols().writersOnly().stream().anyMatch(e -> e.resolved.equals("bus")));
    }

    @Test
    void nodeIdsCanBeMapped() {
        String local = mixer.symbols.stream()
                .filter(s -> s.resolved.equals("volume")).findFirst().orElseThrow()
                .writers.get(0).node;
        GlobalSymbolTable table = new GlobalSymbolTable();
        table.addPatchSymbols(mixer.symbols, "mixer.pd", Map.of(local, "mixer.pd#" + local));

        Endpoint writer = table.getWriters(SymbolKind.SEND_RECEIVE, "volume", SymbolNamespace.GLOBAL).get(0);
        assertEquals("mixer.pd#" + local, writer.node);
        assertEquals("mixer.pd", writer.patch);
        // unmapped ids pass through
        assertFalse(table.getReaders(SymbolKind.THROW_CATCH, "bus", SymbolNamespace.GLOBAL).get(0).node.contains("#"));
    }

    @Test
    void savedTableLoadsBack(@TempDir Path tmp) {
        GlobalSymbolTable table = bothPatches();
        Path file = tmp.resolve("index").resolve("symbols.json");
        table.save(file);

        GlobalSymbolTable loaded = GlobalSymbolTable.load(file);
        assertEquals(table.size(), loaded.size());
        assertEquals(table.patches(), loaded.patches());
        assertEquals(table.getCrossPatchConnections(), loaded.getCrossPatchConnections());
        assertEquals(table.toJson(), loaded.toJson());
    }

    @Test
    void documentCarriesIndexVersion() {
        String json = bothPatches().toJson();
        assertTrue(json.contains("\"index_version\": \"0.1\""));
        assertTrue(json.contains("\"instance_local\": true"));
        assertTrue(json.contains("\"kind\": \"throw_catch\""));
    }

    @Test
    void loadRejectsMissingAndMalformedFiles(@TempDir Path tmp) throws IOException {
        assertThrows(GlobalSymbolTable.SymbolTableException.class,
                () -> GlobalSymbolTable.load(tmp.resolve("missing.json")));

        Path noKind = tmp.resolve("no-kind.json");
        Files.writeString(noKind, "{\"index_version\": \"0.1\", \"symbols\": [{\"resolved\": \"x\"}]}");
        assertThrows(GlobalSymbolTable.SymbolTableException.class, () -> GlobalSymbolTable.load(noKind));

        Path garbage = tmp.resolve("garbage.json");
        Files.writeString(garbage, "[1, 2");
        assertThrows(GlobalSymbolTable.SymbolTableException.class, () -> GlobalSymbolTable.load(garbage));
    }
}
