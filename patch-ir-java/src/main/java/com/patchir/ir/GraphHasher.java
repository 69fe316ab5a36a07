package com.patchir.ir;

import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrNode;
import com.patchir.ir.IrModel.IrPatch;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes the structural graph hash used for change detection.
 *
 * The canonical form is
 * <pre>{"edges": [[src, outlet, dst, inlet], ...], "nodes": [[id, type, [args...]], ...]}</pre>
 * with nodes sorted by id and wire edges sorted by their full tuple. Layout, comments text,
 * symbol edges and diagnostics do not contribute. Strings are escaped to ASCII so the
 * digest only depends on the structural content.
 */
public final class GraphHasher {

    private GraphHasher() {}

    record NodeTuple(String id, String type, List<String> args) {}

    record EdgeTuple(String src, int outlet, String dst, int inlet) {}

    private static final Comparator<EdgeTuple> EDGE_ORDER = Comparator
            .comparing(EdgeTuple::src)
            .thenComparingInt(EdgeTuple::outlet)
            .thenComparing(EdgeTuple::dst)
            .thenComparingInt(EdgeTuple::inlet);

    public static String compute(IrPatch patch) {
        return compute(patch.nodes, patch.edges);
    }

    public static String compute(List<IrNode> nodes, List<IrEdge> edges) {
        return sha256Hex(canonicalForm(nodes, edges).getBytes(StandardCharsets.US_ASCII));
    }

    static String canonicalForm(List<IrNode> nodes, List<IrEdge> edges) {
        List<NodeTuple> nodeTuples = new ArrayList<>();
        for (IrNode n : nodes) {
            nodeTuples.add(new NodeTuple(n.id, n.type, n.args != null ? n.args : List.of()));
        }
        nodeTuples.sort(Comparator.comparing(NodeTuple::id));

        List<EdgeTuple> edgeTuples = new ArrayList<>();
        for (IrEdge e : edges) {
            if (e.kind != EdgeKind.WIRE) continue;
            edgeTuples.add(new EdgeTuple(
                    e.from.node, e.from.outlet != null ? e.from.outlet : 0,
                    e.to.node, e.to.inlet != null ? e.to.inlet : 0));
        }
        edgeTuples.sort(EDGE_ORDER);

        StringBuilder sb = new StringBuilder();
        sb.append("{\"edges\": [");
        for (int i = 0; i < edgeTuples.size(); i++) {
            EdgeTuple t = edgeTuples.get(i);
            if (i > 0) sb.append(", ");
            sb.append('[');
            appendString(sb, t.src());
            sb.append(", ").append(t.outlet()).append(", ");
            appendString(sb, t.dst());
            sb.append(", ").append(t.inlet()).append(']');
        }
        sb.append("], \"nodes\": [");
        for (int i = 0; i < nodeTuples.size(); i++) {
            NodeTuple t = nodeTuples.get(i);
            if (i > 0) sb.append(", ");
            sb.append('[');
            appendString(sb, t.id());
            sb.append(", ");
            appendString(sb, t.type());
            sb.append(", [");
            for (int a = 0; a < t.args().size(); a++) {
                if (a > 0) sb.append(", ");
                appendString(sb, t.args().get(a));
            }
            sb.append("]]");
        }
        sb.append("]}");
        return sb.toString();
    }

    private static void appendString(StringBuilder sb, String value) {
        if (value == null) {
            sb.append("null");
            return;
        }
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"'  -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    public static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
