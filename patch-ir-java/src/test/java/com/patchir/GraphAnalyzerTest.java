package com.patchir;

import com.patchir.graph_analysis.GraphAnalyzer;
import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrAnalysis;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrEdgeEndpoint;
import com.patchir.ir.IrModel.IrInterface;
import com.patchir.ir.IrModel.IrLayout;
import com.patchir.ir.IrModel.IrNode;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrModel.IrPatchInfo;
import com.patchir.ir.IrModel.IrScc;
import com.patchir.ir.IrModel.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphAnalyzerTest {

    static IrNode node(String id, String type, String canvas, int x) {
        IrNode n = new IrNode();
        n.id = id;
        n.canvas = canvas;
        n.kind = NodeKind.OBJECT;
        n.type = type;
        n.domain = type.endsWith("~") ? Domain.SIGNAL : Domain.CONTROL;
        n.layout = IrLayout.at(x, 0);
        return n;
    }

    static IrNode node(String id, String type) {
        return node(id, type, "c0", 0);
    }

    static IrEdge wire(String from, String to, Domain domain) {
        IrEdge e = new IrEdge();
        e.kind = EdgeKind.WIRE;
        e.domain = domain;
        e.from = IrEdgeEndpoint.outlet(from, 0);
        e.to = IrEdgeEndpoint.inlet(to, 0);
        return e;
    }

    static IrEdge wire(String from, String to) {
        return wire(from, to, Domain.CONTROL);
    }

    static IrEdge symbolEdge(String from, String to, String symbol) {
        IrEdge e = new IrEdge();
        e.kind = EdgeKind.SYMBOL;
        e.domain = Domain.CONTROL;
        e.from = IrEdgeEndpoint.outlet(from, 0);
        e.to = IrEdgeEndpoint.inlet(to, 0);
        e.symbol = symbol;
        e.confidence = 0.9;
        return e;
    }

    static IrPatch patch(List<IrNode> nodes, IrEdge... edges) {
        IrPatch ir = new IrPatch();
        ir.patch = new IrPatchInfo();
        ir.patch.name = "test";
        ir.patch.path = "test.pd";
        ir.patch.rootCanvas = "c0";
        ir.nodes.addAll(nodes);
        ir.edges.addAll(List.of(edges));
        return ir;
    }

    // --- SCCs ---

    @Test
    void ringIsReportedAsOneFeedbackCycle() {
        IrPatch ir = patch(
                List.of(node("d", "f"), node("c", "+"), node("b", "*"), node("a", "t")),
                wire("d", "a"), wire("a", "b"), wire("b", "c"), wire("c", "a"));
        List<IrScc> sccs = new GraphAnalyzer(ir).findSccs();

        assertEquals(1, sccs.size());
        assertEquals("scc1", sccs.get(0).id);
        assertEquals(List.of("a", "b", "c"), sccs.get(0).nodes);
        assertEquals(IrScc.FEEDBACK_CYCLE, sccs.get(0).reason);
    }

    @Test
    void chainAndSelfLoopHaveNoCycle() {
        IrPatch ir = patch(
                List.of(node("a", "f"), node("b", "+"), node("c", "print")),
                wire("a", "b"), wire("b", "c"), wire("b", "b"));
        assertTrue(new GraphAnalyzer(ir).findSccs().isEmpty());
    }

    @Test
    void symbolEdgesCloseCyclesOnlyWhenIncluded() {
        IrPatch ir = patch(
                List.of(node("s", "s"), node("r", "r"), node("f", "f")),
                wire("r", "f"), wire("f", "s"), symbolEdge("s", "r", "loop"));

        assertTrue(new GraphAnalyzer(ir).findSccs().isEmpty());
        List<IrScc> withSymbols = new GraphAnalyzer(ir, true).findSccs();
        assertEquals(1, withSymbols.size());
        assertEquals(List.of("f", "r", "s"), withSymbols.get(0).nodes);
    }

    // --- Interface ---

    @Test
    void interfacePortsAreNumberedByX() {
        IrPatch ir = patch(List.of(
                node("in-right", "inlet", "c0", 300),
                node("in-left", "inlet~", "c0", 50),
                node("in-mid", "inlet", "c0", 150),
                node("out", "outlet~", "c0", 10),
                node("nested", "outlet", "c1", 400)));
        IrInterface iface = new GraphAnalyzer(ir).findInterfacePorts();

        assertEquals(3, iface.inlets.size());
        assertEquals("in-left", iface.inlets.get(0).node);
        assertEquals(Domain.SIGNAL, iface.inlets.get(0).domain);
        assertEquals("in-mid", iface.inlets.get(1).node);
        assertEquals(1, iface.inlets.get(1).index);
        assertEquals("in-right", iface.inlets.get(2).node);
        assertEquals(Domain.CONTROL, iface.inlets.get(2).domain);

        assertEquals(2, iface.outlets.size());
        assertEquals("out", iface.outlets.get(0).node);
        assertEquals("nested", iface.outlets.get(1).node);
        assertEquals(Domain.CONTROL, iface.outlets.get(1).domain);
    }

    @Test
    void markersInsideSubpatchesCountTowardTheInterface() {
        IrPatch ir = patch(List.of(
                node("outer", "osc~", "c0", 0),
                node("in", "inlet~", "c1", 20),
                node("out", "outlet~", "c2", 5)));
        IrInterface iface = new GraphAnalyzer(ir).findInterfacePorts();

        assertEquals(1, iface.inlets.size());
        assertEquals("in", iface.inlets.get(0).node);
        assertEquals(1, iface.outlets.size());
        assertEquals(0, iface.outlets.get(0).index);

        IrInterface root = new GraphAnalyzer(ir).forCanvas("c0").findInterfacePorts();
        assertTrue(root.inlets.isEmpty());
        assertTrue(root.outlets.isEmpty());
    }

    @Test
    void analyzeFillsAllSections() {
        IrPatch ir = patch(List.of(node("a", "f"), node("b", "+")), wire("a", "b"), wire("b", "a"));
        IrAnalysis analysis = new GraphAnalyzer(ir).analyze();

        assertEquals(1, analysis.sccs.size());
        assertNotNull(analysis.interfaces);
        assertNotNull(analysis.symbolsAsInterface);
        assertFalse(analysis.symbolsAsInterface.enabled);
    }

    // --- Order and neighbours ---

    @Test
    void topologicalOrderIncludesIsolatedNodes() {
        IrPatch ir = patch(
                List.of(node("c", "print"), node("lonely", "loadbang"), node("b", "+"), node("a", "f")),
                wire("a", "b"), wire("b", "c"));
        List<String> order = new GraphAnalyzer(ir).getTopologicalOrder();

        assertEquals(4, order.size());
        assertTrue(order.contains("lonely"));
        assertTrue(order.indexOf("a") < order.indexOf("b"));
        assertTrue(order.indexOf("b") < order.indexOf("c"));
    }

    @Test
    void topologicalOrderSurvivesCycles() {
        IrPatch ir = patch(
                List.of(node("a", "f"), node("b", "+"), node("c", "print")),
                wire("a", "b"), wire("b", "a"), wire("b", "c"));
        List<String> order = new GraphAnalyzer(ir).getTopologicalOrder();
        assertEquals(3, order.size());
        assertTrue(order.indexOf("b") < order.indexOf("c"));
    }

    @Test
    void degreesCountEveryWire() {
        IrPatch ir = patch(
                List.of(node("gain", "*~"), node("dac", "dac~")),
                wire("gain", "dac", Domain.SIGNAL), wire("gain", "dac", Domain.SIGNAL));
        GraphAnalyzer analyzer = new GraphAnalyzer(ir);

        assertEquals(2, analyzer.getOutDegree("gain"));
        assertEquals(2, analyzer.getInDegree("dac"));
        assertEquals(List.of("gain", "gain"), analyzer.getPredecessors("dac"));
        assertTrue(analyzer.getSuccessors("dac").isEmpty());
        assertEquals(0, analyzer.getInDegree("nowhere"));
    }

    // --- Tracing ---

    @Test
    void traceToOutputFollowsEveryBranchOnce() {
        IrPatch ir = patch(
                List.of(node("osc", "osc~"), node("gain", "*~"), node("lop", "lop~"), node("dac", "dac~")),
                wire("osc", "gain", Domain.SIGNAL), wire("osc", "lop", Domain.SIGNAL),
                wire("gain", "dac", Domain.SIGNAL), wire("gain", "dac", Domain.SIGNAL),
                wire("lop", "dac", Domain.SIGNAL));
        List<List<String>> paths = new GraphAnalyzer(ir).traceToOutput("osc");

        assertEquals(2, paths.size());
        assertTrue(paths.contains(List.of("osc", "gain", "dac")));
        assertTrue(paths.contains(List.of("osc", "lop", "dac")));
    }

    @Test
    void traceFromInputReturnsSourceFirst() {
        IrPatch ir = patch(
                List.of(node("adc", "adc~"), node("hip", "hip~"), node("env", "env~")),
                wire("adc", "hip", Domain.SIGNAL), wire("hip", "env", Domain.SIGNAL));
        assertEquals(List.of(List.of("adc", "hip", "env")), new GraphAnalyzer(ir).traceFromInput("env"));
    }

    @Test
    void traceStopsAtMaxDepth() {
        IrPatch ir = patch(
                List.of(node("a", "osc~"), node("b", "*~"), node("c", "hip~"), node("dac", "dac~")),
                wire("a", "b"), wire("b", "c"), wire("c", "dac"));
        GraphAnalyzer analyzer = new GraphAnalyzer(ir);

        assertTrue(analyzer.traceToOutput("a", 1).isEmpty());
        assertEquals(1, analyzer.traceToOutput("a", 3).size());
    }

    @Test
    void traceIgnoresCyclesAndUnreachableOutputs() {
        IrPatch ir = patch(
                List.of(node("a", "f"), node("b", "+"), node("dac", "dac~")),
                wire("a", "b"), wire("b", "a"));
        assertTrue(new GraphAnalyzer(ir).traceToOutput("a").isEmpty());
    }

    // --- Linear chains ---

    @Test
    void linearChainsStopAtFanOut() {
        IrPatch ir = patch(
                List.of(node("a", "osc~"), node("b", "*~"), node("c", "hip~"), node("d", "dac~"),
                        node("e", "metro"), node("f", "print"),
                        node("x", "t"), node("y", "print"), node("z", "print")),
                wire("a", "b", Domain.SIGNAL), wire("b", "c", Domain.SIGNAL), wire("c", "d", Domain.SIGNAL),
                wire("e", "f"),
                wire("x", "y"), wire("x", "z"));
        List<List<String>> chains = new GraphAnalyzer(ir).findLinearChains();

        assertEquals(List.of(List.of("a", "b", "c", "d"), List.of("e", "f")), chains);
    }

    @Test
    void linearChainsCanBeRestrictedToOneDomain() {
        IrPatch ir = patch(
                List.of(node("a", "osc~"), node("b", "*~"), node("c", "hip~"), node("e", "metro"), node("f", "print")),
                wire("a", "b", Domain.SIGNAL), wire("b", "c", Domain.SIGNAL), wire("e", "f"));
        List<List<String>> chains = new GraphAnalyzer(ir).findLinearChains(Domain.SIGNAL);
        assertEquals(List.of(List.of("a", "b", "c")), chains);
    }

    // --- Sub-analysis ---

    @Test
    void forCanvasKeepsOnlyThatCanvas() {
        IrPatch ir = patch(
                List.of(node("outer", "osc~", "c0", 0),
                        node("in", "inlet~", "c1", 20), node("gain", "*~", "c1", 20), node("out", "outlet~", "c1", 20)),
                wire("outer", "in", Domain.SIGNAL), wire("in", "gain", Domain.SIGNAL), wire("gain", "out", Domain.SIGNAL));
        GraphAnalyzer inner = new GraphAnalyzer(ir).forCanvas("c1");

        assertEquals(3, inner.ir().nodes.size());
        assertEquals(2, inner.ir().edges.size());
        assertTrue(inner.getPredecessors("in").isEmpty());
        assertEquals(1, inner.findInterfacePorts().inlets.size());
        assertEquals(1, inner.findInterfacePorts().outlets.size());
        assertEquals(List.of(List.of("in", "gain", "out")), inner.traceToOutput("in"));
    }

    @Test
    void forCanvasKeepsSymbolEdgeSetting() {
        IrPatch ir = patch(
                List.of(node("s", "s", "c1", 0), node("r", "r", "c1", 10), node("f", "f", "c1", 20)),
                wire("r", "f"), wire("f", "s"), symbolEdge("s", "r", "loop"));

        assertTrue(new GraphAnalyzer(ir).forCanvas("c1").findSccs().isEmpty());
        GraphAnalyzer inner = new GraphAnalyzer(ir, true).forCanvas("c1");
        assertEquals(3, inner.ir().edges.size());
        assertEquals(1, inner.findSccs().size());
        assertEquals(List.of("s"), inner.getPredecessors("r"));
    }
}
