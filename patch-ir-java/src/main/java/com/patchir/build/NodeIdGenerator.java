package com.patchir.build;

import com.patchir.ir.GraphHasher;
import com.patchir.ir.IrModel.Domain;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generates deterministic node IDs for one canvas following the convention:
 *   path::type:symbol[:domain]   (tier 1, named-channel objects with an argument)
 *   path::type#index             (tier 2, inlet/outlet boundary markers)
 *   path::h{hash8}               (tier 3, connected nodes, from local topology)
 *   path::n{seq}                 (tier 4, everything else)
 * An ID that is already taken in the canvas gets a {@code #k} suffix.
 *
 * Nodes are visited in {@link #canonicalOrder} so the mapping does not depend
 * on the order in which the source lists its elements.
 *
 * Boundary markers are numbered by x position, not creation order: a
 * sub-patch's k-th port is its k-th marker from the left, and reordering the
 * source must not renumber them.
 */
public class NodeIdGenerator {

    static final Set<String> SYMBOL_ANCHORS = Set.of(
            "s", "send", "r", "receive",
            "s~", "send~", "r~", "receive~",
            "throw~", "catch~",
            "value", "v",
            "table", "array",
            "soundfiler",
            "text",
            "delwrite~", "delread~", "delread4~",
            "tabread~", "tabread4~", "tabosc4~", "tabwrite~",
            "tabread", "tabwrite", "tabread4");

    static final Set<String> INTERFACE_MARKERS = Set.of("inlet", "inlet~", "outlet", "outlet~");

    static final int MAX_SYMBOL_LENGTH = 32;

    /** One node of the canvas as seen by the generator. */
    public record NodeInput(int originalId, String type, List<String> args, String kind,
                            Domain domain, Integer x, Integer y) {}

    /** One wire of the canvas, by original ids. */
    public record EdgeInput(int src, int srcPort, int dst, int dstPort) {}

    private final Map<String, Integer> counters = new HashMap<>();
    private final Set<String> taken = new HashSet<>();

    /**
     * Assigns an ID to every node of one canvas.
     *
     * @return original id to generated id, in canonical order
     */
    public Map<Integer, String> generateIds(List<NodeInput> nodes, List<EdgeInput> edges, String canvasPath) {
        counters.clear();
        taken.clear();

        Map<Integer, NodeInput> byId = new HashMap<>();
        for (NodeInput n : nodes) byId.put(n.originalId(), n);

        Map<Integer, List<String>> predSigs = new HashMap<>();
        Map<Integer, List<String>> succSigs = new HashMap<>();
        for (EdgeInput e : edges) {
            NodeInput src = byId.get(e.src());
            NodeInput dst = byId.get(e.dst());
            if (src == null || dst == null) continue;
            succSigs.computeIfAbsent(e.src(), k -> new ArrayList<>()).add(nodeSignature(dst.type(), dst.args()));
            predSigs.computeIfAbsent(e.dst(), k -> new ArrayList<>()).add(nodeSignature(src.type(), src.args()));
        }

        Map<Integer, Integer> interfaceIndex = interfaceIndices(nodes);

        Map<Integer, String> result = new LinkedHashMap<>();
        for (NodeInput node : canonicalOrder(nodes, edges)) {
            String id = tier1(canvasPath, node);
            if (id == null && interfaceIndex.containsKey(node.originalId())) {
                id = makeUnique(canvasPath + "::" + node.type() + "#" + interfaceIndex.get(node.originalId()));
            }
            if (id == null) {
                List<String> preds = predSigs.getOrDefault(node.originalId(), List.of());
                List<String> succs = succSigs.getOrDefault(node.originalId(), List.of());
                if (!preds.isEmpty() || !succs.isEmpty()) {
                    id = tier3(canvasPath, node, preds, succs);
                }
            }
            if (id == null) {
                String key = canvasPath + ":" + node.kind();
                int seq = counters.merge(key, 1, Integer::sum);
                id = makeUnique(canvasPath + "::n" + seq);
            }
            result.put(node.originalId(), id);
        }
        return result;
    }

    private String tier1(String canvasPath, NodeInput node) {
        String baseType = baseType(node.type());
        if (!SYMBOL_ANCHORS.contains(baseType) || node.args().isEmpty()) return null;
        String base = canvasPath + "::" + baseType + ":" + sanitizeSymbol(node.args().get(0));
        if (node.domain() != null && node.domain() != Domain.UNKNOWN) {
            base += ":" + node.domain().tag();
        }
        return makeUnique(base);
    }

    private String tier3(String canvasPath, NodeInput node, List<String> preds, List<String> succs) {
        List<String> sortedPreds = new ArrayList<>(preds);
        List<String> sortedSuccs = new ArrayList<>(succs);
        sortedPreds.sort(null);
        sortedSuccs.sort(null);
        String combined = nodeSignature(node.type(), node.args())
                + "|" + String.join(",", sortedPreds)
                + "|" + String.join(",", sortedSuccs);
        return makeUnique(canvasPath + "::h" + hash8(combined));
    }

    private String makeUnique(String base) {
        if (taken.add(base)) return base;
        int k = 1;
        while (taken.contains(base + "#" + k)) k++;
        String unique = base + "#" + k;
        taken.add(unique);
        return unique;
    }

    /**
     * Positional index of each boundary marker among markers of the same type,
     * ordered by x then by original id.
     */
    static Map<Integer, Integer> interfaceIndices(List<NodeInput> nodes) {
        List<NodeInput> markers = new ArrayList<>();
        for (NodeInput n : nodes) {
            if (INTERFACE_MARKERS.contains(n.type())) markers.add(n);
        }
        markers.sort(Comparator.comparingInt((NodeInput n) -> n.x() != null ? n.x() : 0)
                .thenComparingInt(NodeInput::originalId));
        Map<String, Integer> perType = new HashMap<>();
        Map<Integer, Integer> result = new HashMap<>();
        for (NodeInput m : markers) {
            result.put(m.originalId(), perType.merge(m.type(), 1, Integer::sum) - 1);
        }
        return result;
    }

    /**
     * Orders nodes by their content and wiring rather than by declaration order:
     * kind, type, args, neighbour signatures with port numbers, layout, then original id.
     */
    public static List<NodeInput> canonicalOrder(List<NodeInput> nodes, List<EdgeInput> edges) {
        Map<Integer, NodeInput> byId = new HashMap<>();
        for (NodeInput n : nodes) byId.put(n.originalId(), n);

        Map<Integer, List<String>> wiring = new HashMap<>();
        for (EdgeInput e : edges) {
            NodeInput src = byId.get(e.src());
            NodeInput dst = byId.get(e.dst());
            if (src == null || dst == null) continue;
            wiring.computeIfAbsent(e.src(), k -> new ArrayList<>())
                    .add(">" + e.srcPort() + ":" + nodeSignature(dst.type(), dst.args()) + ":" + e.dstPort());
            wiring.computeIfAbsent(e.dst(), k -> new ArrayList<>())
                    .add("<" + e.dstPort() + ":" + nodeSignature(src.type(), src.args()) + ":" + e.srcPort());
        }
        Map<Integer, String> wiringKey = new HashMap<>();
        for (Map.Entry<Integer, List<String>> entry : wiring.entrySet()) {
            List<String> parts = new ArrayList<>(entry.getValue());
            parts.sort(null);
            wiringKey.put(entry.getKey(), String.join(",", parts));
        }

        List<NodeInput> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparing((NodeInput n) -> n.kind() != null ? n.kind() : "")
                .thenComparing(n -> n.type() != null ? n.type() : "")
                .thenComparing(n -> String.join("\u0000", n.args()))
                .thenComparing(n -> wiringKey.getOrDefault(n.originalId(), ""))
                .thenComparingInt(n -> n.x() != null ? n.x() : 0)
                .thenComparingInt(n -> n.y() != null ? n.y() : 0)
                .thenComparingInt(NodeInput::originalId));
        return ordered;
    }

    /** First 8 hex chars of sha256("type|a,b,..."). */
    static String nodeSignature(String type, List<String> args) {
        return hash8(type + "|" + String.join(",", args));
    }

    static String hash8(String content) {
        return GraphHasher.sha256Hex(content.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
    }

    /** Type without a library prefix ({@code cyclone/counter} becomes {@code counter}). */
    static String baseType(String type) {
        int slash = type.lastIndexOf('/');
        return slash >= 0 ? type.substring(slash + 1) : type;
    }

    static String sanitizeSymbol(String symbol) {
        String sanitized = symbol.replace('/', '_').replace('\\', '_').replace(' ', '_').replace('\t', '_');
        return sanitized.length() > MAX_SYMBOL_LENGTH ? sanitized.substring(0, MAX_SYMBOL_LENGTH) : sanitized;
    }

    /** Canvas path used to namespace IDs: {@code parent/child}, or the id itself for the root. */
    public static String canvasPath(String canvasId, String parentPath) {
        return parentPath != null ? parentPath + "/" + canvasId : canvasId;
    }
}
