package com.patchir.build;

import com.patchir.graph_analysis.GraphAnalyzer;
import com.patchir.ir.GraphHasher;
import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrAbstractionRef;
import com.patchir.ir.IrModel.IrAbstractionUse;
import com.patchir.ir.IrModel.IrCanvas;
import com.patchir.ir.IrModel.IrComment;
import com.patchir.ir.IrModel.IrDiagnostic;
import com.patchir.ir.IrModel.IrDiagnostics;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrEdgeEndpoint;
import com.patchir.ir.IrModel.IrEnrichment;
import com.patchir.ir.IrModel.IrExternalRef;
import com.patchir.ir.IrModel.IrIolet;
import com.patchir.ir.IrModel.IrLayout;
import com.patchir.ir.IrModel.IrNode;
import com.patchir.ir.IrModel.IrNodeIo;
import com.patchir.ir.IrModel.IrNodeMeta;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrModel.IrPatchInfo;
import com.patchir.ir.IrModel.IrRefs;
import com.patchir.ir.IrModel.IrText;
import com.patchir.ir.IrModel.NodeKind;
import com.patchir.registry.IoCount;
import com.patchir.registry.ObjectRegistry;
import com.patchir.source.SourceCanvas;
import com.patchir.source.SourceEdge;
import com.patchir.source.SourceKind;
import com.patchir.source.SourceObject;
import com.patchir.source.SourcePatch;
import com.patchir.source.SourceTreeReader;
import com.patchir.source.SourceTreeReader.SourceReadException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds an {@link IrPatch} from a parsed patch tree.
 *
 * Pipeline:
 *   1. Walk canvases depth-first; sub-patches are built before their parent's wires
 *   2. Per canvas: normalize elements, assign IDs, build nodes, validate and rewrite wires
 *   3. Append symbol edges, collect references and comments
 *   4. Compute the graph hash and run the analyzer
 *
 * The builder holds only the registry and the abstraction resolver; all per-build
 * state lives in a {@link BuildState} created by each {@link #build} call.
 */
public class IrBuilder {

    static final Set<String> ATOM_TYPES = Set.of("floatatom", "symbolatom", "listbox");
    static final Set<String> GUI_TYPES = Set.of("bng", "tgl", "nbx", "hsl", "vsl", "hradio", "vradio", "vu", "cnv");
    static final Set<String> INLET_MARKERS = Set.of("inlet", "inlet~");
    static final Set<String> OUTLET_MARKERS = Set.of("outlet", "outlet~");

    static final String TYPE_MESSAGE = "message";
    static final String TYPE_COMMENT = "comment";
    static final String TYPE_SUBPATCH = "pd";

    private static final Comparator<IrEdge> WIRE_ORDER = Comparator
            .comparing((IrEdge e) -> e.from.node)
            .thenComparingInt(e -> e.from.outlet)
            .thenComparing(e -> e.to.node)
            .thenComparingInt(e -> e.to.inlet);

    private final ObjectRegistry registry;
    private final AbstractionResolver resolver;

    /** Seals the registry; it must be fully populated before the first build. */
    public IrBuilder(ObjectRegistry registry) {
        this(registry, AbstractionResolver.NONE);
    }

    public IrBuilder(ObjectRegistry registry, AbstractionResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
        registry.seal();
    }

    public ObjectRegistry registry() {
        return registry;
    }

    /**
     * Reads a source tree file and builds it. The content hash is taken over the file bytes.
     *
     * @throws SourceReadException if the file cannot be read or parsed
     */
    public IrPatch buildFromFile(Path sourceFile) {
        byte[] content;
        try {
            content = Files.readAllBytes(sourceFile);
        } catch (IOException e) {
            throw new SourceReadException("Failed to read source file: " + sourceFile + ": " + e.getMessage(), e);
        }
        SourcePatch source = new SourceTreeReader().read(sourceFile);
        return build(source, source.path, content);
    }

    public IrPatch build(SourcePatch source) {
        return build(source, source.path, null);
    }

    /**
     * Builds the IR for one patch.
     *
     * @param source      parsed patch tree
     * @param patchPath   path recorded in the patch metadata; defaults to {@code <name>.pd}
     * @param fileContent raw bytes for the content hash, or null
     */
    public IrPatch build(SourcePatch source, String patchPath, byte[] fileContent) {
        if (source == null || source.root == null) {
            throw new SourceReadException("Source patch has no root canvas");
        }
        BuildState state = new BuildState(registry);
        String name = source.name != null ? source.name : "untitled";

        String rootId = state.nextCanvasId();
        CanvasResult root = processCanvas(source.root, rootId, null, rootId, state);

        List<IrEdge> wires = new ArrayList<>(root.wires());
        wires.sort(WIRE_ORDER);
        for (int i = 0; i < wires.size(); i++) {
            wires.get(i).id = "e" + (i + 1);
        }

        IrPatch ir = new IrPatch();
        ir.patch = new IrPatchInfo();
        ir.patch.name = name;
        ir.patch.path = patchPath != null ? patchPath : name + ".pd";
        ir.patch.sha256 = fileContent != null ? GraphHasher.sha256Hex(fileContent) : null;
        ir.patch.rootCanvas = rootId;
        ir.canvases = root.canvases();
        ir.nodes = root.nodes();
        ir.edges = wires;
        ir.edges.addAll(state.symbols.generateSymbolEdges());
        ir.symbols = state.symbols.getSymbols();

        ir.refs = new IrRefs();
        ir.refs.abstractions = new ArrayList<>(state.abstractions.values());
        ir.refs.externals = new ArrayList<>(state.externals.values());

        ir.text = new IrText();
        for (IrNode n : ir.nodes) {
            if (n.kind == NodeKind.COMMENT && n.text != null && !n.text.isBlank()) {
                IrComment c = new IrComment();
                c.node = n.id;
                c.canvas = n.canvas;
                c.text = n.text;
                ir.text.comments.add(c);
            }
        }
        ir.diagnostics = state.diagnostics;
        ir.enrichment = new IrEnrichment();

        ir.patch.graphHash = GraphHasher.compute(ir);
        ir.analysis = new GraphAnalyzer(ir).analyze();
        return ir;
    }

    // --- Per-build state ---

    private static final class BuildState {
        private int canvasCounter;
        final SymbolExtractor symbols;
        final IrDiagnostics diagnostics = new IrDiagnostics();
        final Map<String, IrAbstractionUse> abstractions = new LinkedHashMap<>();
        final Map<String, IrExternalRef> externals = new LinkedHashMap<>();
        final Map<String, Optional<Path>> resolved = new HashMap<>();

        BuildState(ObjectRegistry registry) {
            symbols = new SymbolExtractor(registry);
        }

        String nextCanvasId() {
            return "c" + canvasCounter++;
        }

        void warn(String code, String message, String node) {
            diagnostics.warnings.add(IrDiagnostic.of(code, message, node));
        }
    }

    /**
     * Output of one canvas and everything below it. The boundary markers are
     * ordered by x and give the sub-patch's port numbering.
     */
    record CanvasResult(List<IrCanvas> canvases, List<IrNode> nodes, List<IrEdge> wires,
                        List<IrNode> inletMarkers, List<IrNode> outletMarkers) {}

    /** A canvas element after type and argument normalization. */
    private record Element(int originalId, NodeKind kind, String type, List<String> args,
                           String text, IrLayout layout, SourceCanvas subCanvas) {}

    // --- Canvas processing ---

    private CanvasResult processCanvas(SourceCanvas canvas, String canvasId, String parentId,
                                       String canvasPath, BuildState state) {
        IrCanvas irCanvas = new IrCanvas();
        irCanvas.id = canvasId;
        irCanvas.kind = parentId == null ? IrCanvas.ROOT : IrCanvas.SUBPATCH;
        irCanvas.name = canvas.name != null ? canvas.name : canvasId;
        irCanvas.parentCanvas = parentId;

        List<IrCanvas> canvases = new ArrayList<>();
        canvases.add(irCanvas);
        List<IrNode> childNodes = new ArrayList<>();
        List<IrEdge> wires = new ArrayList<>();

        Map<Integer, Element> elements = new LinkedHashMap<>();
        List<NodeIdGenerator.NodeInput> inputs = new ArrayList<>();
        List<SourceObject> objects = canvas.objects != null ? canvas.objects : List.of();
        for (SourceObject obj : objects) {
            // ids are unique in a well-formed tree; a repeated id keeps its first element
            if (obj == null || elements.containsKey(obj.id)) continue;
            Element el = normalize(obj, state);
            elements.put(el.originalId(), el);
            inputs.add(new NodeIdGenerator.NodeInput(el.originalId(), el.type(), el.args(), el.kind().tag(),
                    preliminaryDomain(el), el.layout() != null ? el.layout().x : null,
                    el.layout() != null ? el.layout().y : null));
        }
        List<NodeIdGenerator.EdgeInput> edgeInputs = new ArrayList<>();
        List<SourceEdge> sourceEdges = canvas.edges != null ? canvas.edges : List.of();
        for (SourceEdge e : sourceEdges) {
            if (e == null) continue;
            edgeInputs.add(new NodeIdGenerator.EdgeInput(e.source, e.sourcePort, e.sink, e.sinkPort));
        }

        List<NodeIdGenerator.NodeInput> ordered = NodeIdGenerator.canonicalOrder(inputs, edgeInputs);

        // Sub-patches first: the parent needs their boundary markers
        Map<Integer, CanvasResult> subpatches = new HashMap<>();
        for (NodeIdGenerator.NodeInput in : ordered) {
            Element el = elements.get(in.originalId());
            if (el.kind() != NodeKind.SUBPATCH) continue;
            String subId = state.nextCanvasId();
            CanvasResult sub = processCanvas(el.subCanvas(), subId, canvasId,
                    NodeIdGenerator.canvasPath(subId, canvasPath), state);
            subpatches.put(el.originalId(), sub);
            canvases.addAll(sub.canvases());
            childNodes.addAll(sub.nodes());
            wires.addAll(sub.wires());
        }

        Map<Integer, String> ids = new NodeIdGenerator().generateIds(inputs, edgeInputs, canvasPath);

        List<IrNode> nodes = new ArrayList<>();
        Map<String, IrNode> nodesById = new HashMap<>();
        for (NodeIdGenerator.NodeInput in : ordered) {
            Element el = elements.get(in.originalId());
            IrNode node = createNode(el, ids.get(el.originalId()), canvasId, subpatches.get(el.originalId()), state);
            nodes.add(node);
            nodesById.put(node.id, node);
        }
        for (IrNode n : childNodes) nodesById.put(n.id, n);

        wires.addAll(buildWires(edgeInputs, elements, ids, subpatches, nodesById, state));

        List<IrNode> allNodes = new ArrayList<>(nodes);
        allNodes.addAll(childNodes);
        return new CanvasResult(canvases, allNodes, wires,
                boundaryMarkers(nodes, INLET_MARKERS), boundaryMarkers(nodes, OUTLET_MARKERS));
    }

    private Element normalize(SourceObject obj, BuildState state) {
        IrLayout layout = obj.position != null ? IrLayout.at(obj.position.x, obj.position.y) : null;
        SourceKind kind = obj.kind != null ? obj.kind : SourceKind.OBJECT;
        switch (kind) {
            case COMMENT -> {
                String text = obj.text != null ? obj.text : String.join(" ", nonNull(obj.args));
                return new Element(obj.id, NodeKind.COMMENT, TYPE_COMMENT, List.of(), text, layout, null);
            }
            case MESSAGE -> {
                List<String> content = obj.text != null ? splitWords(obj.text) : resplit(nonNull(obj.args));
                return new Element(obj.id, NodeKind.MESSAGE, TYPE_MESSAGE, content, null, layout, null);
            }
            case CANVAS -> {
                SourceCanvas sub = obj.canvas != null ? obj.canvas : SourceCanvas.named(null);
                List<String> args = sub.name != null ? splitWords(sub.name) : List.of();
                return new Element(obj.id, NodeKind.SUBPATCH, TYPE_SUBPATCH, args, null, layout, sub);
            }
            default -> {
                List<String> tokens = new ArrayList<>(splitWords(obj.className != null ? obj.className : ""));
                tokens.addAll(resplit(nonNull(obj.args)));
                String type = tokens.isEmpty() ? "" : tokens.get(0);
                List<String> args = tokens.isEmpty() ? List.of() : List.copyOf(tokens.subList(1, tokens.size()));
                return new Element(obj.id, classify(kind, type, state), type, args, null, layout, null);
            }
        }
    }

    private NodeKind classify(SourceKind kind, String type, BuildState state) {
        if (kind == SourceKind.GUI || GUI_TYPES.contains(type)) return NodeKind.GUI;
        if (kind == SourceKind.ATOM || ATOM_TYPES.contains(type)) return NodeKind.ATOM;
        if (type.isEmpty() || registry.isKnown(type)) return NodeKind.OBJECT;
        if (resolve(type, state).isPresent() || hasPathSeparator(type)) return NodeKind.ABSTRACTION_INSTANCE;
        return NodeKind.OBJECT;
    }

    private Optional<Path> resolve(String type, BuildState state) {
        return state.resolved.computeIfAbsent(type, resolver::resolve);
    }

    private static boolean hasPathSeparator(String type) {
        return type.indexOf('/') >= 0 || type.indexOf('\\') >= 0;
    }

    private Domain preliminaryDomain(Element el) {
        return switch (el.kind()) {
            case COMMENT -> Domain.UNKNOWN;
            case MESSAGE, SUBPATCH -> Domain.CONTROL;
            default -> registry.getDomain(el.type());
        };
    }

    private IrNode createNode(Element el, String id, String canvasId, CanvasResult sub, BuildState state) {
        IrNode node = new IrNode();
        node.id = id;
        node.canvas = canvasId;
        node.kind = el.kind();
        node.type = el.type();
        node.args = new ArrayList<>(el.args());
        node.layout = el.layout();
        node.meta = new IrNodeMeta();
        node.meta.originalId = el.originalId();
        node.text = el.text();

        if (el.kind() == NodeKind.SUBPATCH) {
            node.io = subpatchIo(sub);
            node.domain = subpatchDomain(node.io);
        } else if (el.kind() == NodeKind.COMMENT) {
            node.io = new IrNodeIo();
            node.domain = Domain.UNKNOWN;
        } else {
            node.domain = preliminaryDomain(el);
            node.io = objectIo(el.type(), el.args(), node.domain);
        }

        if (el.kind() == NodeKind.OBJECT || el.kind() == NodeKind.ABSTRACTION_INSTANCE) {
            recordReference(node, state);
            state.symbols.extractFromNode(node.id, node.type, node.args);
        }
        return node;
    }

    /** Tracks abstraction uses and unresolved externals, warning on the latter. */
    private void recordReference(IrNode node, BuildState state) {
        String type = node.type;
        if (type.isEmpty() || registry.isKnown(type)) return;

        Optional<Path> path = resolve(type, state);
        node.ref = new IrAbstractionRef();
        node.ref.name = type;
        node.ref.path = path.map(Path::toString).orElse(null);
        node.ref.resolved = path.isPresent();

        if (node.kind == NodeKind.ABSTRACTION_INSTANCE) {
            IrAbstractionUse use = state.abstractions.computeIfAbsent(type, k -> {
                IrAbstractionUse u = new IrAbstractionUse();
                u.name = k;
                u.path = path.map(Path::toString).orElse(null);
                u.resolved = path.isPresent();
                return u;
            });
            use.instances.add(node.id);
        }
        if (path.isEmpty()) {
            IrExternalRef ext = state.externals.computeIfAbsent(type, k -> {
                IrExternalRef r = new IrExternalRef();
                r.name = k;
                r.known = false;
                return r;
            });
            ext.instances.add(node.id);
            state.warn(IrDiagnostic.UNKNOWN_OBJECT, type + " not in registry", node.id);
        }
    }

    private IrNodeIo objectIo(String type, List<String> args, Domain domain) {
        IoCount count = registry.getIoCount(type, args);
        IrNodeIo io = new IrNodeIo();
        for (int i = 0; i < count.inlets(); i++) {
            Domain d = registry.getPortDomain(type, true, i);
            io.inlets.add(IrIolet.of(i, d != null ? d : defaultPortDomain(domain, true, i),
                    registry.getPortName(type, true, i)));
        }
        for (int i = 0; i < count.outlets(); i++) {
            Domain d = registry.getPortDomain(type, false, i);
            io.outlets.add(IrIolet.of(i, d != null ? d : defaultPortDomain(domain, false, i),
                    registry.getPortName(type, false, i)));
        }
        return io;
    }

    /** Signal objects take signal or control on the first inlet and signal elsewhere. */
    static Domain defaultPortDomain(Domain nodeDomain, boolean inlet, int index) {
        if (nodeDomain != Domain.SIGNAL) return Domain.CONTROL;
        return inlet && index == 0 ? Domain.MIXED : Domain.SIGNAL;
    }

    private static IrNodeIo subpatchIo(CanvasResult sub) {
        IrNodeIo io = new IrNodeIo();
        for (int i = 0; i < sub.inletMarkers().size(); i++) {
            io.inlets.add(IrIolet.of(i, markerDomain(sub.inletMarkers().get(i)), null));
        }
        for (int i = 0; i < sub.outletMarkers().size(); i++) {
            io.outlets.add(IrIolet.of(i, markerDomain(sub.outletMarkers().get(i)), null));
        }
        return io;
    }

    private static Domain markerDomain(IrNode marker) {
        return marker.type.endsWith("~") ? Domain.SIGNAL : Domain.CONTROL;
    }

    private static Domain subpatchDomain(IrNodeIo io) {
        int ports = io.inlets.size() + io.outlets.size();
        long signal = io.inlets.stream().filter(p -> p.domain == Domain.SIGNAL).count()
                + io.outlets.stream().filter(p -> p.domain == Domain.SIGNAL).count();
        if (ports > 0 && signal == ports) return Domain.SIGNAL;
        if (signal > 0) return Domain.MIXED;
        return Domain.CONTROL;
    }

    private static List<IrNode> boundaryMarkers(List<IrNode> nodes, Set<String> markerTypes) {
        List<IrNode> markers = new ArrayList<>();
        for (IrNode n : nodes) {
            if (n.kind == NodeKind.OBJECT && markerTypes.contains(n.type)) markers.add(n);
        }
        markers.sort(Comparator.comparingInt((IrNode n) -> n.layout != null ? n.layout.x : 0)
                .thenComparingInt(n -> n.meta.originalId));
        return markers;
    }

    // --- Wires ---

    private List<IrEdge> buildWires(List<NodeIdGenerator.EdgeInput> edgeInputs, Map<Integer, Element> elements,
                                    Map<Integer, String> ids, Map<Integer, CanvasResult> subpatches,
                                    Map<String, IrNode> nodesById, BuildState state) {
        List<NodeIdGenerator.EdgeInput> resolvable = new ArrayList<>();
        for (NodeIdGenerator.EdgeInput e : edgeInputs) {
            if (ids.containsKey(e.src()) && ids.containsKey(e.dst())) {
                resolvable.add(e);
            } else {
                state.warn(IrDiagnostic.DANGLING_CONNECTION, "Connection " + e.src() + ":" + e.srcPort()
                        + " -> " + e.dst() + ":" + e.dstPort() + " references a missing object", null);
            }
        }
        // diagnostics follow the generated ids, not the declaration order
        resolvable.sort(Comparator.comparing((NodeIdGenerator.EdgeInput e) -> ids.get(e.src()))
                .thenComparingInt(NodeIdGenerator.EdgeInput::srcPort)
                .thenComparing(e -> ids.get(e.dst()))
                .thenComparingInt(NodeIdGenerator.EdgeInput::dstPort));

        List<IrEdge> wires = new ArrayList<>();
        for (NodeIdGenerator.EdgeInput e : resolvable) {
            Element src = elements.get(e.src());
            Element dst = elements.get(e.dst());
            String srcId = ids.get(e.src());
            String dstId = ids.get(e.dst());

            int outlets = portLimit(src, subpatches.get(e.src()), false);
            if (outlets >= 0 && (e.srcPort() < 0 || e.srcPort() >= outlets)) {
                state.warn(IrDiagnostic.INVALID_CONNECTION, "Connection from " + src.type() + " outlet "
                        + e.srcPort() + " invalid (only has " + outlets + " outlet(s))", srcId);
                continue;
            }
            int inlets = portLimit(dst, subpatches.get(e.dst()), true);
            if (inlets >= 0 && (e.dstPort() < 0 || e.dstPort() >= inlets)) {
                state.warn(IrDiagnostic.INVALID_CONNECTION, "Connection to " + dst.type() + " inlet "
                        + e.dstPort() + " invalid (only has " + inlets + " inlet(s))", dstId);
                continue;
            }

            int srcPort = e.srcPort();
            int dstPort = e.dstPort();
            CanvasResult srcSub = subpatches.get(e.src());
            if (srcSub != null) {
                srcId = srcSub.outletMarkers().get(srcPort).id;
                srcPort = 0;
            }
            CanvasResult dstSub = subpatches.get(e.dst());
            if (dstSub != null) {
                dstId = dstSub.inletMarkers().get(dstPort).id;
                dstPort = 0;
            }

            IrNode srcNode = nodesById.get(srcId);
            IrEdge edge = new IrEdge();
            edge.kind = EdgeKind.WIRE;
            edge.domain = srcNode != null && srcNode.domain != Domain.UNKNOWN ? srcNode.domain : Domain.CONTROL;
            edge.from = IrEdgeEndpoint.outlet(srcId, srcPort);
            edge.to = IrEdgeEndpoint.inlet(dstId, dstPort);
            wires.add(edge);
        }
        return wires;
    }

    /**
     * Number of ports a wire endpoint may use, or -1 when the element's arity
     * is not known well enough to validate against.
     */
    private int portLimit(Element el, CanvasResult sub, boolean inlet) {
        if (sub != null) {
            return inlet ? sub.inletMarkers().size() : sub.outletMarkers().size();
        }
        if (el.kind() == NodeKind.MESSAGE || el.kind() == NodeKind.COMMENT) return -1;
        if (!registry.isKnown(el.type())) return -1;
        IoCount count = registry.getIoCount(el.type(), el.args());
        return inlet ? count.inlets() : count.outlets();
    }

    // --- Text helpers ---

    static List<String> splitWords(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return List.of();
        return List.of(trimmed.split("\\s+"));
    }

    /** Splits whitespace-joined argument blobs back into single arguments. */
    static List<String> resplit(List<String> args) {
        List<String> result = new ArrayList<>();
        for (String arg : args) {
            if (arg != null) result.addAll(splitWords(arg));
        }
        return result;
    }

    private static List<String> nonNull(List<String> list) {
        return list != null ? list : List.of();
    }
}
