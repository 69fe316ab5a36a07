package com.patchir.ir;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * POJOs matching IR schema v0.1.
 * Field names use @SerializedName for JSON snake_case mapping; enum constants
 * serialize as their lowercase tag.
 */
public final class IrModel {

    public static final String IR_VERSION = "0.1";

    private IrModel() {}

    // --- Enumerations ---

    public enum NodeKind {
        @SerializedName("object")               OBJECT("object"),
        @SerializedName("message")              MESSAGE("message"),
        @SerializedName("atom")                 ATOM("atom"),
        @SerializedName("gui")                  GUI("gui"),
        @SerializedName("comment")              COMMENT("comment"),
        @SerializedName("abstraction_instance") ABSTRACTION_INSTANCE("abstraction_instance"),
        @SerializedName("subpatch")             SUBPATCH("subpatch");

        private final String tag;
        NodeKind(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    public enum EdgeKind {
        @SerializedName("wire")   WIRE("wire"),
        @SerializedName("symbol") SYMBOL("symbol");

        private final String tag;
        EdgeKind(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    public enum Domain {
        @SerializedName("signal")  SIGNAL("signal"),
        @SerializedName("control") CONTROL("control"),
        @SerializedName("mixed")   MIXED("mixed"),
        @SerializedName("unknown") UNKNOWN("unknown");

        private final String tag;
        Domain(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    public enum SymbolKind {
        @SerializedName("send_receive") SEND_RECEIVE("send_receive"),
        @SerializedName("throw_catch")  THROW_CATCH("throw_catch"),
        @SerializedName("value")        VALUE("value"),
        @SerializedName("array")        ARRAY("array"),
        @SerializedName("table")        TABLE("table");

        private final String tag;
        SymbolKind(String tag) { this.tag = tag; }
        public String tag() { return tag; }

        public static SymbolKind fromTag(String tag) {
            for (SymbolKind k : values()) {
                if (k.tag.equals(tag)) return k;
            }
            throw new IllegalArgumentException("Unknown symbol kind: " + tag);
        }
    }

    public enum SymbolNamespace {
        @SerializedName("global")       GLOBAL("global"),
        @SerializedName("instance")     INSTANCE("instance"),
        @SerializedName("hierarchical") HIERARCHICAL("hierarchical");

        private final String tag;
        SymbolNamespace(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    // --- Top-level document ---

    public static class IrPatch {
        @SerializedName("ir_version")  public String irVersion = IR_VERSION;
        @SerializedName("patch")       public IrPatchInfo patch;
        @SerializedName("canvases")    public List<IrCanvas> canvases = new ArrayList<>();
        @SerializedName("nodes")       public List<IrNode> nodes = new ArrayList<>();
        @SerializedName("edges")       public List<IrEdge> edges = new ArrayList<>();
        @SerializedName("symbols")     public List<IrSymbol> symbols = new ArrayList<>();
        @SerializedName("refs")        public IrRefs refs;
        @SerializedName("analysis")    public IrAnalysis analysis;
        @SerializedName("text")        public IrText text;
        @SerializedName("diagnostics") public IrDiagnostics diagnostics;
        @SerializedName("enrichment")  public IrEnrichment enrichment;

        public IrNode getNode(String nodeId) {
            for (IrNode n : nodes) {
                if (n.id.equals(nodeId)) return n;
            }
            return null;
        }

        public IrCanvas getCanvas(String canvasId) {
            for (IrCanvas c : canvases) {
                if (c.id.equals(canvasId)) return c;
            }
            return null;
        }

        public List<IrNode> nodesInCanvas(String canvasId) {
            return nodes.stream().filter(n -> canvasId.equals(n.canvas)).collect(Collectors.toList());
        }

        public List<IrEdge> edgesFrom(String nodeId) {
            return edges.stream().filter(e -> e.from.node.equals(nodeId)).collect(Collectors.toList());
        }

        public List<IrEdge> edgesTo(String nodeId) {
            return edges.stream().filter(e -> e.to.node.equals(nodeId)).collect(Collectors.toList());
        }

        public String graphHash() {
            return patch != null ? patch.graphHash : null;
        }
    }

    public static class IrPatchInfo {
        @SerializedName("name")        public String name;
        @SerializedName("path")        public String path;
        @SerializedName("sha256")      public String sha256;      // nullable
        @SerializedName("graph_hash")  public String graphHash;
        @SerializedName("root_canvas") public String rootCanvas;
    }

    // --- Graph ---

    public static class IrCanvas {
        public static final String ROOT = "root";
        public static final String SUBPATCH = "subpatch";

        @SerializedName("id")            public String id;
        @SerializedName("kind")          public String kind;         // root, subpatch
        @SerializedName("name")          public String name;
        @SerializedName("parent_canvas") public String parentCanvas; // nullable for root
    }

    public static class IrNode {
        @SerializedName("id")     public String id;
        @SerializedName("canvas") public String canvas;
        @SerializedName("kind")   public NodeKind kind;
        @SerializedName("type")   public String type;
        @SerializedName("args")   public List<String> args = new ArrayList<>();
        @SerializedName("domain") public Domain domain = Domain.UNKNOWN;
        @SerializedName("io")     public IrNodeIo io;
        @SerializedName("layout") public IrLayout layout;
        @SerializedName("meta")   public IrNodeMeta meta;
        @SerializedName("ref")    public IrAbstractionRef ref;
        @SerializedName("text")   public String text;   // comments only

        public int inletCount()  { return io != null ? io.inlets.size() : 0; }
        public int outletCount() { return io != null ? io.outlets.size() : 0; }
    }

    public static class IrNodeIo {
        @SerializedName("inlets")  public List<IrIolet> inlets = new ArrayList<>();
        @SerializedName("outlets") public List<IrIolet> outlets = new ArrayList<>();
    }

    public static class IrIolet {
        @SerializedName("index")  public int index;
        @SerializedName("domain") public Domain domain = Domain.UNKNOWN;
        @SerializedName("name")   public String name;   // nullable

        public static IrIolet of(int index, Domain domain, String name) {
            IrIolet iolet = new IrIolet();
            iolet.index = index;
            iolet.domain = domain;
            iolet.name = name;
            return iolet;
        }
    }

    public static class IrLayout {
        @SerializedName("x") public int x;
        @SerializedName("y") public int y;

        public static IrLayout at(int x, int y) {
            IrLayout layout = new IrLayout();
            layout.x = x;
            layout.y = y;
            return layout;
        }
    }

    public static class IrNodeMeta {
        @SerializedName("original_id") public Integer originalId;
    }

    public static class IrAbstractionRef {
        @SerializedName("name")     public String name;
        @SerializedName("path")     public String path;   // nullable until resolved
        @SerializedName("resolved") public boolean resolved;
    }

    public static class IrEdge {
        @SerializedName("id")         public String id;
        @SerializedName("kind")       public EdgeKind kind;
        @SerializedName("domain")     public Domain domain;
        @SerializedName("from")       public IrEdgeEndpoint from;
        @SerializedName("to")         public IrEdgeEndpoint to;
        @SerializedName("symbol")     public String symbol;      // symbol edges only
        @SerializedName("confidence") public Double confidence;  // symbol edges only
    }

    public static class IrEdgeEndpoint {
        @SerializedName("node")   public String node;
        @SerializedName("outlet") public Integer outlet;
        @SerializedName("inlet")  public Integer inlet;

        public static IrEdgeEndpoint outlet(String node, int outlet) {
            IrEdgeEndpoint ep = new IrEdgeEndpoint();
            ep.node = node;
            ep.outlet = outlet;
            return ep;
        }

        public static IrEdgeEndpoint inlet(String node, int inlet) {
            IrEdgeEndpoint ep = new IrEdgeEndpoint();
            ep.node = node;
            ep.inlet = inlet;
            return ep;
        }
    }

    // --- Symbols ---

    public static class IrSymbol {
        @SerializedName("id")             public String id;
        @SerializedName("kind")           public SymbolKind kind;
        @SerializedName("raw")            public String raw;
        @SerializedName("resolved")       public String resolved;
        @SerializedName("namespace")      public SymbolNamespace namespace;
        @SerializedName("instance_local") public boolean instanceLocal;
        @SerializedName("writers")        public List<IrSymbolEndpoint> writers = new ArrayList<>();
        @SerializedName("readers")        public List<IrSymbolEndpoint> readers = new ArrayList<>();
    }

    public static class IrSymbolEndpoint {
        @SerializedName("node") public String node;
        @SerializedName("port") public Integer port;

        public static IrSymbolEndpoint of(String node) {
            IrSymbolEndpoint ep = new IrSymbolEndpoint();
            ep.node = node;
            return ep;
        }
    }

    // --- References ---

    public static class IrRefs {
        @SerializedName("abstractions") public List<IrAbstractionUse> abstractions = new ArrayList<>();
        @SerializedName("externals")    public List<IrExternalRef> externals = new ArrayList<>();
    }

    public static class IrAbstractionUse {
        @SerializedName("name")      public String name;
        @SerializedName("path")      public String path;
        @SerializedName("resolved")  public boolean resolved;
        @SerializedName("instances") public List<String> instances = new ArrayList<>();
    }

    public static class IrExternalRef {
        @SerializedName("name")      public String name;
        @SerializedName("instances") public List<String> instances = new ArrayList<>();
        @SerializedName("known")     public boolean known;
    }

    // --- Analysis ---

    public static class IrAnalysis {
        @SerializedName("sccs")                 public List<IrScc> sccs = new ArrayList<>();
        @SerializedName("interfaces")           public IrInterface interfaces;
        @SerializedName("symbols_as_interface") public IrSymbolsAsInterface symbolsAsInterface;
    }

    public static class IrScc {
        public static final String FEEDBACK_CYCLE = "feedback_cycle";

        @SerializedName("id")     public String id;
        @SerializedName("nodes")  public List<String> nodes = new ArrayList<>();
        @SerializedName("reason") public String reason = FEEDBACK_CYCLE;
    }

    public static class IrInterface {
        @SerializedName("inlets")  public List<IrInterfacePort> inlets = new ArrayList<>();
        @SerializedName("outlets") public List<IrInterfacePort> outlets = new ArrayList<>();
    }

    public static class IrInterfacePort {
        @SerializedName("node")   public String node;
        @SerializedName("index")  public int index;
        @SerializedName("domain") public Domain domain;
    }

    public static class IrSymbolsAsInterface {
        @SerializedName("enabled") public boolean enabled;
        @SerializedName("exposed") public List<IrExposedSymbol> exposed = new ArrayList<>();
    }

    public static class IrExposedSymbol {
        public static final String READER = "reader";
        public static final String WRITER = "writer";

        @SerializedName("kind") public SymbolKind kind;
        @SerializedName("name") public String name;
        @SerializedName("role") public String role;  // reader, writer
    }

    // --- Text, diagnostics, enrichment ---

    public static class IrText {
        @SerializedName("comments") public List<IrComment> comments = new ArrayList<>();
    }

    public static class IrComment {
        @SerializedName("node")   public String node;
        @SerializedName("canvas") public String canvas;
        @SerializedName("text")   public String text;
    }

    public static class IrDiagnostics {
        @SerializedName("errors")   public List<IrDiagnostic> errors = new ArrayList<>();
        @SerializedName("warnings") public List<IrDiagnostic> warnings = new ArrayList<>();

        public boolean isEmpty() { return errors.isEmpty() && warnings.isEmpty(); }
    }

    public static class IrDiagnostic {
        public static final String UNKNOWN_OBJECT = "UNKNOWN_OBJECT";
        public static final String INVALID_CONNECTION = "INVALID_CONNECTION";
        public static final String DANGLING_CONNECTION = "DANGLING_CONNECTION";

        @SerializedName("code")    public String code;
        @SerializedName("message") public String message;
        @SerializedName("node")    public String node;   // nullable

        public static IrDiagnostic of(String code, String message, String node) {
            IrDiagnostic d = new IrDiagnostic();
            d.code = code;
            d.message = message;
            d.node = node;
            return d;
        }
    }

    public static class IrEnrichment {
        @SerializedName("based_on_ir_sha")  public String basedOnIrSha;
        @SerializedName("summary")          public String summary;
        @SerializedName("roles")            public List<String> roles = new ArrayList<>();
        @SerializedName("inlet_semantics")  public Map<String, String> inletSemantics = new LinkedHashMap<>();
        @SerializedName("outlet_semantics") public Map<String, String> outletSemantics = new LinkedHashMap<>();
        @SerializedName("notes")            public List<String> notes = new ArrayList<>();

        public boolean isStale(String currentGraphHash) {
            return basedOnIrSha != null && !basedOnIrSha.equals(currentGraphHash);
        }
    }
}
