package com.patchir.graph_analysis;

import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrAnalysis;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrExposedSymbol;
import com.patchir.ir.IrModel.IrInterface;
import com.patchir.ir.IrModel.IrInterfacePort;
import com.patchir.ir.IrModel.IrNode;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrModel.IrPatchInfo;
import com.patchir.ir.IrModel.IrScc;
import com.patchir.ir.IrModel.IrSymbol;
import com.patchir.ir.IrModel.IrSymbolsAsInterface;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural analysis over a built IR: feedback cycles, interface ports,
 * exposed symbols, topological order, path tracing and linear chains.
 *
 * Adjacency is built from wire edges, optionally joined by symbol edges.
 * Node order follows the IR's node list so results are deterministic.
 */
public class GraphAnalyzer {

    public static final int DEFAULT_MAX_DEPTH = 100;

    static final Set<String> OUTPUT_TYPES = Set.of("dac~", "outlet", "outlet~");
    static final Set<String> INPUT_TYPES = Set.of("adc~", "inlet", "inlet~");
    static final Set<String> INLET_MARKERS = Set.of("inlet", "inlet~");
    static final Set<String> OUTLET_MARKERS = Set.of("outlet", "outlet~");

    private final IrPatch ir;
    private final boolean includeSymbolEdges;
    private final Map<String, IrNode> nodesById = new HashMap<>();
    private final Map<String, List<String>> successors = new LinkedHashMap<>();
    private final Map<String, List<String>> predecessors = new LinkedHashMap<>();
    private final List<String> universe = new ArrayList<>();

    public GraphAnalyzer(IrPatch ir) {
        this(ir, false);
    }

    /**
     * @param includeSymbolEdges whether symbol edges count as connections
     */
    public GraphAnalyzer(IrPatch ir, boolean includeSymbolEdges) {
        this.ir = ir;
        this.includeSymbolEdges = includeSymbolEdges;
        Set<String> seen = new LinkedHashSet<>();
        for (IrNode n : ir.nodes) {
            nodesById.put(n.id, n);
            seen.add(n.id);
        }
        for (IrEdge e : ir.edges) {
            if (e.kind != EdgeKind.WIRE && !(includeSymbolEdges && e.kind == EdgeKind.SYMBOL)) continue;
            successors.computeIfAbsent(e.from.node, k -> new ArrayList<>()).add(e.to.node);
            predecessors.computeIfAbsent(e.to.node, k -> new ArrayList<>()).add(e.from.node);
            seen.add(e.from.node);
            seen.add(e.to.node);
        }
        universe.addAll(seen);
    }

    public IrPatch ir() {
        return ir;
    }

    /** Runs SCC detection, interface inference and exposed-symbol inference. */
    public IrAnalysis analyze() {
        IrAnalysis analysis = new IrAnalysis();
        analysis.sccs = findSccs();
        analysis.interfaces = findInterfacePorts();
        analysis.symbolsAsInterface = findSymbolsAsInterface(ir.symbols);
        return analysis;
    }

    // --- Strongly connected components ---

    /**
     * Tarjan's algorithm with an explicit stack. Only components with more than
     * one node are reported, members sorted by id.
     */
    public List<IrScc> findSccs() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowlink = new HashMap<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (String start : universe) {
            if (index.containsKey(start)) continue;
            Deque<Frame> work = new ArrayDeque<>();
            work.push(new Frame(start));
            index.put(start, counter);
            lowlink.put(start, counter);
            counter++;
            stack.push(start);
            onStack.add(start);

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                List<String> next = successors.getOrDefault(frame.node, List.of());
                if (frame.cursor < next.size()) {
                    String succ = next.get(frame.cursor++);
                    if (!index.containsKey(succ)) {
                        index.put(succ, counter);
                        lowlink.put(succ, counter);
                        counter++;
                        stack.push(succ);
                        onStack.add(succ);
                        work.push(new Frame(succ));
                    } else if (onStack.contains(succ)) {
                        lowlink.put(frame.node, Math.min(lowlink.get(frame.node), index.get(succ)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().node;
                    lowlink.put(parent, Math.min(lowlink.get(parent), lowlink.get(frame.node)));
                }
                if (lowlink.get(frame.node).equals(index.get(frame.node))) {
                    List<String> component = new ArrayList<>();
                    String w;
                    do {
                        w = stack.pop();
                        onStack.remove(w);
                        component.add(w);
                    } while (!w.equals(frame.node));
                    if (component.size() > 1) {
                        Collections.sort(component);
                        components.add(component);
                    }
                }
            }
        }

        List<IrScc> result = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            IrScc scc = new IrScc();
            scc.id = "scc" + (i + 1);
            scc.nodes = components.get(i);
            scc.reason = IrScc.FEEDBACK_CYCLE;
            result.add(scc);
        }
        return result;
    }

    private static final class Frame {
        final String node;
        int cursor;

        Frame(String node) { this.node = node; }
    }

    // --- Interface ---

    /**
     * Inlet and outlet markers of every canvas, numbered by ascending x.
     * Marker ports carry signal domain for the {@code ~} variants. Use
     * {@link #forCanvas} for the ports of a single canvas.
     */
    public IrInterface findInterfacePorts() {
        List<IrNode> inlets = new ArrayList<>();
        List<IrNode> outlets = new ArrayList<>();
        for (IrNode n : ir.nodes) {
            if (INLET_MARKERS.contains(n.type)) inlets.add(n);
            else if (OUTLET_MARKERS.contains(n.type)) outlets.add(n);
        }
        IrInterface iface = new IrInterface();
        iface.inlets = toPorts(inlets);
        iface.outlets = toPorts(outlets);
        return iface;
    }

    private static List<IrInterfacePort> toPorts(List<IrNode> markers) {
        // List.sort is stable, so equal x keeps node-list order
        markers.sort(Comparator.comparingInt(n -> n.layout != null ? n.layout.x : 0));
        List<IrInterfacePort> ports = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            IrNode m = markers.get(i);
            IrInterfacePort port = new IrInterfacePort();
            port.node = m.id;
            port.index = i;
            port.domain = m.type.endsWith("~") ? Domain.SIGNAL : Domain.CONTROL;
            ports.add(port);
        }
        return ports;
    }

    /** One-sided, non instance-local symbols: the patch's implicit interface. */
    public IrSymbolsAsInterface findSymbolsAsInterface(List<IrSymbol> symbols) {
        IrSymbolsAsInterface result = new IrSymbolsAsInterface();
        for (IrSymbol s : symbols) {
            if (s.instanceLocal) continue;
            boolean writers = !s.writers.isEmpty();
            boolean readers = !s.readers.isEmpty();
            if (writers == readers) continue;
            IrExposedSymbol exposed = new IrExposedSymbol();
            exposed.kind = s.kind;
            exposed.name = s.resolved;
            exposed.role = readers ? IrExposedSymbol.READER : IrExposedSymbol.WRITER;
            result.exposed.add(exposed);
        }
        result.enabled = !result.exposed.isEmpty();
        return result;
    }

    // --- Ordering and neighbours ---

    /**
     * Reverse postorder of a depth-first walk started from nodes without
     * predecessors, then from anything left over. Back edges are skipped, so
     * cycles do not prevent an order.
     */
    public List<String> getTopologicalOrder() {
        Set<String> visited = new HashSet<>();
        Set<String> inProgress = new HashSet<>();
        List<String> postorder = new ArrayList<>();

        List<String> starts = new ArrayList<>();
        for (String n : universe) {
            if (!predecessors.containsKey(n)) starts.add(n);
        }
        starts.addAll(universe);

        for (String start : starts) {
            if (visited.contains(start)) continue;
            Deque<Frame> work = new ArrayDeque<>();
            work.push(new Frame(start));
            inProgress.add(start);
            while (!work.isEmpty()) {
                Frame frame = work.peek();
                List<String> next = successors.getOrDefault(frame.node, List.of());
                if (frame.cursor < next.size()) {
                    String succ = next.get(frame.cursor++);
                    if (!visited.contains(succ) && !inProgress.contains(succ)) {
                        inProgress.add(succ);
                        work.push(new Frame(succ));
                    }
                    continue;
                }
                work.pop();
                inProgress.remove(frame.node);
                visited.add(frame.node);
                postorder.add(frame.node);
            }
        }
        Collections.reverse(postorder);
        return postorder;
    }

    public List<String> getPredecessors(String nodeId) {
        return predecessors.getOrDefault(nodeId, List.of());
    }

    public List<String> getSuccessors(String nodeId) {
        return successors.getOrDefault(nodeId, List.of());
    }

    public int getInDegree(String nodeId) {
        return getPredecessors(nodeId).size();
    }

    public int getOutDegree(String nodeId) {
        return getSuccessors(nodeId).size();
    }

    // --- Path tracing ---

    public List<List<String>> traceToOutput(String nodeId) {
        return traceToOutput(nodeId, DEFAULT_MAX_DEPTH);
    }

    /** All simple paths from the node to a dac~ or outlet marker, at most {@code maxDepth} hops. */
    public List<List<String>> traceToOutput(String nodeId, int maxDepth) {
        List<List<String>> paths = new ArrayList<>();
        List<String> path = new ArrayList<>();
        path.add(nodeId);
        walk(nodeId, path, 0, maxDepth, successors, OUTPUT_TYPES, paths);
        return paths;
    }

    public List<List<String>> traceFromInput(String nodeId) {
        return traceFromInput(nodeId, DEFAULT_MAX_DEPTH);
    }

    /** All simple paths from an adc~ or inlet marker to the node, source first. */
    public List<List<String>> traceFromInput(String nodeId, int maxDepth) {
        List<List<String>> paths = new ArrayList<>();
        List<String> path = new ArrayList<>();
        path.add(nodeId);
        walk(nodeId, path, 0, maxDepth, predecessors, INPUT_TYPES, paths);
        for (List<String> p : paths) Collections.reverse(p);
        return paths;
    }

    // recursion depth is bounded by maxDepth
    private void walk(String current, List<String> path, int depth, int maxDepth,
                      Map<String, List<String>> adjacency, Set<String> targets, List<List<String>> out) {
        if (depth > maxDepth) return;
        IrNode node = nodesById.get(current);
        if (node != null && targets.contains(node.type)) {
            out.add(new ArrayList<>(path));
            return;
        }
        // parallel wires between two nodes give one path
        for (String next : new LinkedHashSet<>(adjacency.getOrDefault(current, List.of()))) {
            if (path.contains(next)) continue;
            path.add(next);
            walk(next, path, depth + 1, maxDepth, adjacency, targets, out);
            path.remove(path.size() - 1);
        }
    }

    // --- Linear chains ---

    public List<List<String>> findLinearChains() {
        return findLinearChains(null);
    }

    /**
     * Maximal runs of nodes connected one-to-one. A chain starts at a node with
     * one successor and not exactly one predecessor; chains shorter than two
     * nodes are dropped.
     *
     * @param domain only follow wire edges of this domain, or null for all
     */
    public List<List<String>> findLinearChains(Domain domain) {
        Map<String, List<String>> succ = successors;
        Map<String, List<String>> pred = predecessors;
        List<String> nodes = universe;
        if (domain != null) {
            succ = new LinkedHashMap<>();
            pred = new LinkedHashMap<>();
            for (IrEdge e : ir.edges) {
                if (e.kind != EdgeKind.WIRE || e.domain != domain) continue;
                succ.computeIfAbsent(e.from.node, k -> new ArrayList<>()).add(e.to.node);
                pred.computeIfAbsent(e.to.node, k -> new ArrayList<>()).add(e.from.node);
            }
        }

        List<List<String>> chains = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : nodes) {
            if (visited.contains(start)) continue;
            if (succ.getOrDefault(start, List.of()).size() != 1) continue;
            if (pred.getOrDefault(start, List.of()).size() == 1) continue;

            List<String> chain = new ArrayList<>();
            chain.add(start);
            visited.add(start);
            String current = start;
            while (true) {
                List<String> next = succ.getOrDefault(current, List.of());
                if (next.size() != 1) break;
                String candidate = next.get(0);
                if (visited.contains(candidate)) break;
                if (pred.getOrDefault(candidate, List.of()).size() != 1) break;
                chain.add(candidate);
                visited.add(candidate);
                current = candidate;
                if (succ.getOrDefault(candidate, List.of()).size() != 1) break;
            }
            if (chain.size() >= 2) chains.add(chain);
        }
        return chains;
    }

    // --- Sub-analysis ---

    /** Analyzer restricted to the nodes of one canvas and the edges between them. */
    public GraphAnalyzer forCanvas(String canvasId) {
        IrPatch sub = new IrPatch();
        sub.irVersion = ir.irVersion;
        sub.patch = new IrPatchInfo();
        if (ir.patch != null) {
            sub.patch.name = ir.patch.name;
            sub.patch.path = ir.patch.path;
        }
        sub.patch.rootCanvas = canvasId;
        Set<String> ids = new HashSet<>();
        for (IrNode n : ir.nodes) {
            if (canvasId.equals(n.canvas)) {
                sub.nodes.add(n);
                ids.add(n.id);
            }
        }
        for (IrEdge e : ir.edges) {
            if (ids.contains(e.from.node) && ids.contains(e.to.node)) sub.edges.add(e);
        }
        return new GraphAnalyzer(sub, includeSymbolEdges);
    }
}
