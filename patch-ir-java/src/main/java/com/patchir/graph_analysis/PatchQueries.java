package com.patchir.graph_analysis;

import com.google.gson.annotations.SerializedName;
import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrAbstractionUse;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrExternalRef;
import com.patchir.ir.IrModel.IrIolet;
import com.patchir.ir.IrModel.IrInterface;
import com.patchir.ir.IrModel.IrNode;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrModel.IrScc;
import com.patchir.ir.IrModel.IrSymbol;
import com.patchir.ir.IrModel.IrSymbolEndpoint;
import com.patchir.ir.IrModel.SymbolKind;
import com.patchir.ir.IrModel.SymbolNamespace;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Higher-level questions asked of one built IR patch.
 */
public final class PatchQueries {

    static final Set<String> SELF_FED_INLETS = Set.of(
            "inlet", "inlet~", "adc~", "r", "receive", "r~", "receive~", "catch~");
    static final Set<String> SELF_DRAINED_OUTLETS = Set.of(
            "outlet", "outlet~", "dac~", "s", "send", "s~", "send~", "throw~");

    private PatchQueries() {}

    public record FlowEdge(String from, String to, Double confidence) {}

    public record SymbolFlow(String symbol, boolean found, SymbolKind kind, SymbolNamespace namespace,
                             @SerializedName("instance_local") boolean instanceLocal,
                             List<String> writers, List<String> readers, List<FlowEdge> edges) {}

    public record CycleEdge(String from, String to, Domain domain) {}

    public record FeedbackPath(String id, List<String> nodes, List<CycleEdge> edges, String reason) {}

    public record OrphanedPorts(@SerializedName("unconnected_inlets") List<String> unconnectedInlets,
                                @SerializedName("unconnected_outlets") List<String> unconnectedOutlets) {}

    public record DependencyTree(String patch, List<IrAbstractionUse> abstractions, List<IrExternalRef> externals) {}

    public record PatchSummary(
            String patch,
            @SerializedName("total_nodes") int totalNodes,
            @SerializedName("total_edges") int totalEdges,
            @SerializedName("wire_edges") int wireEdges,
            @SerializedName("symbol_edges") int symbolEdges,
            @SerializedName("by_kind") Map<String, Integer> byKind,
            @SerializedName("by_domain") Map<String, Integer> byDomain,
            int symbols,
            int canvases,
            @SerializedName("interface_inlets") int interfaceInlets,
            @SerializedName("interface_outlets") int interfaceOutlets,
            @SerializedName("has_feedback") boolean hasFeedback,
            int errors,
            int warnings) {}

    // --- Tracing ---

    /** Paths from the node to dac~ or an outlet marker, following symbol edges when asked. */
    public static List<List<String>> traceToDac(IrPatch ir, String nodeId, boolean includeSymbolEdges) {
        return new GraphAnalyzer(ir, includeSymbolEdges).traceToOutput(nodeId);
    }

    /** Paths from adc~ or an inlet marker to the node, following symbol edges when asked. */
    public static List<List<String>> traceFromAdc(IrPatch ir, String nodeId, boolean includeSymbolEdges) {
        return new GraphAnalyzer(ir, includeSymbolEdges).traceFromInput(nodeId);
    }

    // --- Symbols and cycles ---

    public static SymbolFlow symbolFlow(IrPatch ir, String symbolName) {
        IrSymbol symbol = null;
        for (IrSymbol s : ir.symbols) {
            if (s.resolved.equals(symbolName)) {
                symbol = s;
                break;
            }
        }
        if (symbol == null) {
            return new SymbolFlow(symbolName, false, null, null, false, List.of(), List.of(), List.of());
        }
        List<FlowEdge> edges = new ArrayList<>();
        for (IrEdge e : ir.edges) {
            if (e.kind == EdgeKind.SYMBOL && symbolName.equals(e.symbol)) {
                edges.add(new FlowEdge(e.from.node, e.to.node, e.confidence));
            }
        }
        return new SymbolFlow(symbolName, true, symbol.kind, symbol.namespace, symbol.instanceLocal,
                nodeIds(symbol.writers), nodeIds(symbol.readers), edges);
    }

    private static List<String> nodeIds(List<IrSymbolEndpoint> endpoints) {
        List<String> ids = new ArrayList<>();
        for (IrSymbolEndpoint ep : endpoints) ids.add(ep.node);
        return ids;
    }

    public static List<FeedbackPath> findFeedbackPaths(IrPatch ir) {
        List<FeedbackPath> result = new ArrayList<>();
        for (IrScc scc : new GraphAnalyzer(ir).findSccs()) {
            Set<String> members = new HashSet<>(scc.nodes);
            List<CycleEdge> edges = new ArrayList<>();
            for (IrEdge e : ir.edges) {
                if (e.kind == EdgeKind.WIRE && members.contains(e.from.node) && members.contains(e.to.node)) {
                    edges.add(new CycleEdge(e.from.node, e.to.node, e.domain));
                }
            }
            result.add(new FeedbackPath(scc.id, scc.nodes, edges, scc.reason));
        }
        return result;
    }

    // --- Chains and patterns ---

    /**
     * Follows signal wires from the start node while each step has exactly one
     * signal successor and that successor exactly one signal predecessor.
     */
    public static List<String> getSignalChain(IrPatch ir, String startNode) {
        List<String> chain = new ArrayList<>();
        chain.add(startNode);
        Set<String> visited = new HashSet<>(chain);
        String current = startNode;
        while (true) {
            List<String> next = signalNeighbours(ir, current, true);
            if (next.size() != 1) break;
            String candidate = next.get(0);
            if (visited.contains(candidate)) break;
            if (signalNeighbours(ir, candidate, false).size() != 1) break;
            chain.add(candidate);
            visited.add(candidate);
            current = candidate;
        }
        return chain;
    }

    private static List<String> signalNeighbours(IrPatch ir, String nodeId, boolean outgoing) {
        List<String> result = new ArrayList<>();
        for (IrEdge e : ir.edges) {
            if (e.kind != EdgeKind.WIRE || e.domain != Domain.SIGNAL) continue;
            if (outgoing && e.from.node.equals(nodeId)) result.add(e.to.node);
            if (!outgoing && e.to.node.equals(nodeId)) result.add(e.from.node);
        }
        return result;
    }

    /**
     * Node sequences whose types match {@code pattern} along wire edges,
     * e.g. {@code ["osc~", "*~", "dac~"]}.
     */
    public static List<List<String>> findSimilarPatterns(IrPatch ir, List<String> pattern) {
        List<List<String>> matches = new ArrayList<>();
        if (pattern.isEmpty()) return matches;
        GraphAnalyzer analyzer = new GraphAnalyzer(ir);
        Map<String, IrNode> byId = new LinkedHashMap<>();
        for (IrNode n : ir.nodes) byId.put(n.id, n);
        for (IrNode start : ir.nodes) {
            if (start.type.equals(pattern.get(0))) {
                matchFrom(start.id, 0, pattern, new ArrayList<>(), analyzer, byId, matches);
            }
        }
        return matches;
    }

    private static void matchFrom(String current, int index, List<String> pattern, List<String> path,
                                  GraphAnalyzer analyzer, Map<String, IrNode> byId, List<List<String>> out) {
        IrNode node = byId.get(current);
        if (node == null || !node.type.equals(pattern.get(index))) return;
        path.add(current);
        if (index == pattern.size() - 1) {
            out.add(new ArrayList<>(path));
        } else {
            for (String next : new LinkedHashSet<>(analyzer.getSuccessors(current))) {
                matchFrom(next, index + 1, pattern, path, analyzer, byId, out);
            }
        }
        path.remove(path.size() - 1);
    }

    // --- Bookkeeping ---

    /**
     * Ports with no wire attached, as {@code nodeId:index}. Boundary markers and
     * named-channel objects are skipped on the side that is fed or drained implicitly.
     */
    public static OrphanedPorts findOrphanedConnections(IrPatch ir) {
        Set<String> connectedOutlets = new HashSet<>();
        Set<String> connectedInlets = new HashSet<>();
        for (IrEdge e : ir.edges) {
            if (e.kind != EdgeKind.WIRE) continue;
            connectedOutlets.add(e.from.node + ":" + (e.from.outlet != null ? e.from.outlet : 0));
            connectedInlets.add(e.to.node + ":" + (e.to.inlet != null ? e.to.inlet : 0));
        }
        List<String> inlets = new ArrayList<>();
        List<String> outlets = new ArrayList<>();
        for (IrNode n : ir.nodes) {
            if (n.io == null) continue;
            for (IrIolet port : n.io.inlets) {
                String key = n.id + ":" + port.index;
                if (!connectedInlets.contains(key) && !SELF_FED_INLETS.contains(n.type)) inlets.add(key);
            }
            for (IrIolet port : n.io.outlets) {
                String key = n.id + ":" + port.index;
                if (!connectedOutlets.contains(key) && !SELF_DRAINED_OUTLETS.contains(n.type)) outlets.add(key);
            }
        }
        return new OrphanedPorts(inlets, outlets);
    }

    public static DependencyTree dependencyTree(IrPatch ir) {
        String patch = ir.patch != null ? ir.patch.path : "unknown";
        if (ir.refs == null) return new DependencyTree(patch, List.of(), List.of());
        return new DependencyTree(patch, ir.refs.abstractions, ir.refs.externals);
    }

    public static PatchSummary summarize(IrPatch ir) {
        Map<String, Integer> byKind = new TreeMap<>();
        Map<String, Integer> byDomain = new TreeMap<>();
        for (IrNode n : ir.nodes) {
            byKind.merge(n.kind.tag(), 1, Integer::sum);
            byDomain.merge(n.domain.tag(), 1, Integer::sum);
        }
        int wires = 0;
        int symbolEdges = 0;
        for (IrEdge e : ir.edges) {
            if (e.kind == EdgeKind.WIRE) wires++;
            else if (e.kind == EdgeKind.SYMBOL) symbolEdges++;
        }
        IrInterface iface = new GraphAnalyzer(ir).findInterfacePorts();
        boolean feedback = ir.analysis != null && !ir.analysis.sccs.isEmpty();
        int errors = ir.diagnostics != null ? ir.diagnostics.errors.size() : 0;
        int warnings = ir.diagnostics != null ? ir.diagnostics.warnings.size() : 0;
        return new PatchSummary(
                ir.patch != null ? ir.patch.path : "unknown",
                ir.nodes.size(), ir.edges.size(), wires, symbolEdges,
                byKind, byDomain, ir.symbols.size(), ir.canvases.size(),
                iface.inlets.size(), iface.outlets.size(), feedback, errors, warnings);
    }
}
