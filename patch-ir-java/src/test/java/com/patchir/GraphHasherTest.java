package com.patchir;

import com.patchir.ir.GraphHasher;
import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrEdgeEndpoint;
import com.patchir.ir.IrModel.IrLayout;
import com.patchir.ir.IrModel.IrNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphHasherTest {

    private static IrNode node(String id, String type, String... args) {
        IrNode n = new IrNode();
        n.id = id;
        n.type = type;
        n.args = new ArrayList<>(List.of(args));
        return n;
    }

    private static IrEdge wire(String src, int outlet, String dst, int inlet) {
        IrEdge e = new IrEdge();
        e.kind = EdgeKind.WIRE;
        e.domain = Domain.SIGNAL;
        e.from = IrEdgeEndpoint.outlet(src, outlet);
        e.to = IrEdgeEndpoint.inlet(dst, inlet);
        return e;
    }

    private static IrEdge symbolEdge(String src, String dst) {
        IrEdge e = wire(src, 0, dst, 0);
        e.kind = EdgeKind.SYMBOL;
        e.symbol = "freq";
        e.confidence = 0.9;
        return e;
    }

    private static List<IrNode> nodes() {
        return List.of(node("c0::c", "print", "café"), node("c0::a", "osc~", "440"), node("c0::b", "dac~"));
    }

    @Test
    void emptyGraphHashesTheEmptyCanonicalDocument() {
        // sha256 of {"edges": [], "nodes": []}
        assertEquals("f5f601586348141cb59f4afc4fab6c1a56cf15d36b9b45c2bfbfcc92b9154bcc",
                GraphHasher.compute(List.of(), List.of()));
    }

    @Test
    void hashMatchesCanonicalJsonWithAsciiEscapes() {
        List<IrEdge> edges = List.of(wire("c0::a", 0, "c0::b", 1), wire("c0::a", 0, "c0::b", 0));
        assertEquals("80a9d28b77eaf4ef89d9ecd3b0b674e16e8abe1d946c696d14c60d5b061c85bc",
                GraphHasher.compute(nodes(), edges));
    }

    @Test
    void hashIgnoresListOrder() {
        List<IrNode> reversedNodes = new ArrayList<>(nodes());
        Collections.reverse(reversedNodes);
        String a = GraphHasher.compute(nodes(), List.of(wire("c0::a", 0, "c0::b", 0), wire("c0::a", 0, "c0::b", 1)));
        String b = GraphHasher.compute(reversedNodes, List.of(wire("c0::a", 0, "c0::b", 1), wire("c0::a", 0, "c0::b", 0)));
        assertEquals(a, b);
    }

    @Test
    void hashIgnoresLayoutAndSymbolEdges() {
        List<IrNode> moved = nodes();
        for (IrNode n : moved) n.layout = IrLayout.at(999, 999);
        String plain = GraphHasher.compute(nodes(), List.of(wire("c0::a", 0, "c0::b", 0)));
        String withExtras = GraphHasher.compute(moved,
                List.of(wire("c0::a", 0, "c0::b", 0), symbolEdge("c0::c", "c0::a")));
        assertEquals(plain, withExtras);
    }

    @Test
    void hashChangesWithArgsAndWiring() {
        String base = GraphHasher.compute(nodes(), List.of(wire("c0::a", 0, "c0::b", 0)));
        List<IrNode> changedArgs = List.of(node("c0::c", "print", "café"), node("c0::a", "osc~", "220"), node("c0::b", "dac~"));
        assertNotEquals(base, GraphHasher.compute(changedArgs, List.of(wire("c0::a", 0, "c0::b", 0))));
        assertNotEquals(base, GraphHasher.compute(nodes(), List.of(wire("c0::a", 0, "c0::b", 1))));
    }

    @Test
    void sha256HexIsLowercaseHex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                GraphHasher.sha256Hex("".getBytes(StandardCharsets.UTF_8)));
    }
}
