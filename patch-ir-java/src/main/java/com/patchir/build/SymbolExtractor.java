package com.patchir.build;

import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrEdgeEndpoint;
import com.patchir.ir.IrModel.IrSymbol;
import com.patchir.ir.IrModel.IrSymbolEndpoint;
import com.patchir.ir.IrModel.SymbolKind;
import com.patchir.ir.IrModel.SymbolNamespace;
import com.patchir.registry.ObjectRegistry;
import com.patchir.registry.ObjectSpec.SymbolSemantics;
import com.patchir.registry.ObjectSpec.SymbolSemantics.Role;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collects named-channel objects (send/receive, throw/catch, value, arrays,
 * delay lines) into symbols and expands them into virtual edges.
 * Types outside the built-in table are looked up in the registry, so overlay
 * objects that declare symbol semantics join symbols too.
 * One instance per build.
 */
public class SymbolExtractor {

    /** Symbol kind and role of a named-channel type. */
    public record Classification(SymbolKind kind, Role role) {}

    private static final Map<String, Classification> TYPES = new LinkedHashMap<>();

    static {
        for (String t : List.of("send", "s", "send~", "s~")) put(t, SymbolKind.SEND_RECEIVE, Role.WRITER);
        for (String t : List.of("receive", "r", "receive~", "r~")) put(t, SymbolKind.SEND_RECEIVE, Role.READER);
        put("throw~", SymbolKind.THROW_CATCH, Role.WRITER);
        put("catch~", SymbolKind.THROW_CATCH, Role.READER);
        // value cells both read and write; they are filed as readers
        put("value", SymbolKind.VALUE, Role.READER);
        put("v", SymbolKind.VALUE, Role.READER);
        for (String t : List.of("tabwrite", "tabwrite~", "tabsend~")) put(t, SymbolKind.ARRAY, Role.WRITER);
        for (String t : List.of("tabread", "tabread~", "tabread4~", "tabosc4~", "tabplay~", "tabreceive~")) {
            put(t, SymbolKind.ARRAY, Role.READER);
        }
        put("delwrite~", SymbolKind.TABLE, Role.WRITER);
        for (String t : List.of("delread~", "delread4~", "vd~")) put(t, SymbolKind.TABLE, Role.READER);
    }

    private static void put(String type, SymbolKind kind, Role role) {
        TYPES.put(type, new Classification(kind, role));
    }

    static final Pattern INSTANCE_LOCAL = Pattern.compile("^\\$0[-_]");

    static final double CONFIDENCE_INSTANCE = 0.7;
    static final double CONFIDENCE_GLOBAL = 0.9;
    static final double CONFIDENCE_HIERARCHICAL = 1.0;

    private final ObjectRegistry registry;
    private final Map<String, IrSymbol> symbols = new LinkedHashMap<>();

    public SymbolExtractor() {
        this(null);
    }

    /** @param registry consulted for types the built-in table does not know, may be null */
    public SymbolExtractor(ObjectRegistry registry) {
        this.registry = registry;
    }

    /** Kind and role for a type (library prefix ignored), or null if it is not a named channel. */
    public static Classification classify(String type) {
        return TYPES.get(NodeIdGenerator.baseType(type));
    }

    /** Built-in classification first, then the registry's symbol semantics. */
    public Classification classifyNode(String type) {
        Classification c = classify(type);
        if (c != null || registry == null) return c;
        SymbolSemantics semantics = registry.getSymbolSemantics(type);
        if (semantics == null || semantics.kind == null || semantics.role == null) return null;
        return new Classification(semantics.kind, semantics.role);
    }

    public static SymbolNamespace namespaceOf(String raw) {
        if (INSTANCE_LOCAL.matcher(raw).find()) return SymbolNamespace.INSTANCE;
        if (raw.contains("/") && !raw.startsWith("/")) return SymbolNamespace.HIERARCHICAL;
        return SymbolNamespace.GLOBAL;
    }

    /**
     * Records the node as a writer or reader of the symbol named by its first argument.
     *
     * @return the symbol the node joined, or null if the node is not a named channel
     */
    public IrSymbol extractFromNode(String nodeId, String type, List<String> args) {
        Classification c = classifyNode(type);
        if (c == null || args == null || args.isEmpty()) return null;

        String raw = args.get(0);
        SymbolNamespace namespace = namespaceOf(raw);
        String key = c.kind().tag() + ":" + raw + ":" + namespace.tag();

        IrSymbol symbol = symbols.get(key);
        if (symbol == null) {
            symbol = new IrSymbol();
            symbol.id = "sym" + (symbols.size() + 1);
            symbol.kind = c.kind();
            symbol.raw = raw;
            symbol.resolved = raw;
            symbol.namespace = namespace;
            symbol.instanceLocal = namespace == SymbolNamespace.INSTANCE;
            symbols.put(key, symbol);
        }
        if (c.role() == Role.WRITER) {
            symbol.writers.add(IrSymbolEndpoint.of(nodeId));
        } else {
            symbol.readers.add(IrSymbolEndpoint.of(nodeId));
        }
        return symbol;
    }

    public List<IrSymbol> getSymbols() {
        return new ArrayList<>(symbols.values());
    }

    /** One symbol edge per (writer, reader) pair of every symbol. */
    public List<IrEdge> generateSymbolEdges() {
        List<IrEdge> edges = new ArrayList<>();
        for (IrSymbol symbol : symbols.values()) {
            Domain domain = edgeDomain(symbol);
            double confidence = confidence(symbol);
            for (IrSymbolEndpoint writer : symbol.writers) {
                for (IrSymbolEndpoint reader : symbol.readers) {
                    IrEdge edge = new IrEdge();
                    edge.id = "e_sym" + (edges.size() + 1);
                    edge.kind = EdgeKind.SYMBOL;
                    edge.domain = domain;
                    edge.from = IrEdgeEndpoint.outlet(writer.node, 0);
                    edge.to = IrEdgeEndpoint.inlet(reader.node, 0);
                    edge.symbol = symbol.resolved;
                    edge.confidence = confidence;
                    edges.add(edge);
                }
            }
        }
        return edges;
    }

    /** Signal for throw/catch and for send/receive names carrying {@code ~}; control otherwise. */
    public static Domain edgeDomain(IrSymbol symbol) {
        if (symbol.kind == SymbolKind.THROW_CATCH) return Domain.SIGNAL;
        if (symbol.kind == SymbolKind.SEND_RECEIVE && symbol.raw.contains("~")) return Domain.SIGNAL;
        return Domain.CONTROL;
    }

    static double confidence(IrSymbol symbol) {
        if (symbol.instanceLocal) return CONFIDENCE_INSTANCE;
        if (symbol.namespace == SymbolNamespace.GLOBAL) return CONFIDENCE_GLOBAL;
        return CONFIDENCE_HIERARCHICAL;
    }
}
