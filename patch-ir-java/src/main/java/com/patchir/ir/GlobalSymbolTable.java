package com.patchir.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.patchir.ir.IrModel.Domain;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrModel.IrSymbol;
import com.patchir.ir.IrModel.IrSymbolEndpoint;
import com.patchir.ir.IrModel.SymbolKind;
import com.patchir.ir.IrModel.SymbolNamespace;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Symbols of many patches merged by (kind, resolved name, namespace).
 * Not thread-safe; feed it from one thread.
 */
public class GlobalSymbolTable {

    public static final String INDEX_VERSION = "0.1";
    public static final String WRITER = "writer";
    public static final String READER = "reader";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class Endpoint {
        @SerializedName("role")   public String role;
        @SerializedName("patch")  public String patch;
        @SerializedName("node")   public String node;
        @SerializedName("domain") public Domain domain = Domain.CONTROL;
    }

    public static class Entry {
        @SerializedName("kind")           public SymbolKind kind;
        @SerializedName("resolved")       public String resolved;
        @SerializedName("namespace")      public SymbolNamespace namespace;
        @SerializedName("instance_local") public boolean instanceLocal;
        @SerializedName("endpoints")      public List<Endpoint> endpoints = new ArrayList<>();

        public boolean hasRole(String role) {
            return endpoints.stream().anyMatch(e -> role.equals(e.role));
        }
    }

    /** On-disk form. */
    public static class Document {
        @SerializedName("index_version") public String indexVersion = INDEX_VERSION;
        @SerializedName("symbols")       public List<Entry> symbols = new ArrayList<>();
    }

    public record CrossPatchConnection(String symbol, SymbolKind kind,
                                       List<String> writerPatches, List<String> readerPatches) {}

    public record OrphanedSymbols(List<Entry> writersOnly, List<Entry> readersOnly) {}

    public static class SymbolTableException extends RuntimeException {
        public SymbolTableException(String msg) { super(msg); }
        public SymbolTableException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Set<String> patches = new TreeSet<>();

    static String key(SymbolKind kind, String resolved, SymbolNamespace namespace) {
        return kind.tag() + ":" + resolved + ":" + namespace.tag();
    }

    // --- Accumulation ---

    /** Adds every symbol of a built patch under the patch's path. */
    public void addPatch(IrPatch ir) {
        addPatchSymbols(ir.symbols, ir.patch.path, null);
    }

    public void addPatchSymbols(List<IrSymbol> symbols, String patchPath, Map<String, String> nodeIdMap) {
        for (IrSymbol s : symbols) addSymbol(s, patchPath, nodeIdMap);
    }

    /**
     * Merges one symbol into the table.
     *
     * @param nodeIdMap optional local-to-global node id mapping; unmapped ids are kept
     */
    public void addSymbol(IrSymbol symbol, String patchPath, Map<String, String> nodeIdMap) {
        patches.add(patchPath);
        Entry entry = entries.computeIfAbsent(key(symbol.kind, symbol.resolved, symbol.namespace), k -> {
            Entry e = new Entry();
            e.kind = symbol.kind;
            e.resolved = symbol.resolved;
            e.namespace = symbol.namespace;
            e.instanceLocal = symbol.instanceLocal;
            return e;
        });
        Domain domain = symbol.kind == SymbolKind.THROW_CATCH
                || (symbol.kind == SymbolKind.SEND_RECEIVE && symbol.raw.contains("~"))
                ? Domain.SIGNAL : Domain.CONTROL;
        for (IrSymbolEndpoint w : symbol.writers) entry.endpoints.add(endpoint(WRITER, patchPath, w, domain, nodeIdMap));
        for (IrSymbolEndpoint r : symbol.readers) entry.endpoints.add(endpoint(READER, patchPath, r, domain, nodeIdMap));
    }

    private static Endpoint endpoint(String role, String patch, IrSymbolEndpoint ep, Domain domain,
                                     Map<String, String> nodeIdMap) {
        Endpoint e = new Endpoint();
        e.role = role;
        e.patch = patch;
        e.node = nodeIdMap != null ? nodeIdMap.getOrDefault(ep.node, ep.node) : ep.node;
        e.domain = domain;
        return e;
    }

    // --- Lookup ---

    public Entry getSymbol(SymbolKind kind, String resolved, SymbolNamespace namespace) {
        return entries.get(key(kind, resolved, namespace));
    }

    public Entry getSymbol(SymbolKind kind, String resolved) {
        return getSymbol(kind, resolved, SymbolNamespace.GLOBAL);
    }

    /** Entries with this resolved name across all kinds and namespaces. */
    public List<Entry> findByName(String name) {
        List<Entry> result = new ArrayList<>();
        for (Entry e : entries.values()) {
            if (e.resolved.equals(name)) result.add(e);
        }
        return result;
    }

    public List<Endpoint> getWriters(SymbolKind kind, String resolved, SymbolNamespace namespace) {
        return withRole(getSymbol(kind, resolved, namespace), WRITER);
    }

    public List<Endpoint> getReaders(SymbolKind kind, String resolved, SymbolNamespace namespace) {
        return withRole(getSymbol(kind, resolved, namespace), READER);
    }

    private static List<Endpoint> withRole(Entry entry, String role) {
        List<Endpoint> result = new ArrayList<>();
        if (entry == null) return result;
        for (Endpoint e : entry.endpoints) {
            if (role.equals(e.role)) result.add(e);
        }
        return result;
    }

    /** Symbols read in patches that do not write them themselves. */
    public List<CrossPatchConnection> getCrossPatchConnections() {
        List<CrossPatchConnection> result = new ArrayList<>();
        for (Entry entry : entries.values()) {
            Set<String> writerPatches = new TreeSet<>();
            Set<String> readerPatches = new TreeSet<>();
            for (Endpoint e : entry.endpoints) {
                (WRITER.equals(e.role) ? writerPatches : readerPatches).add(e.patch);
            }
            readerPatches.removeAll(writerPatches);
            if (!readerPatches.isEmpty()) {
                result.add(new CrossPatchConnection(entry.resolved, entry.kind,
                        new ArrayList<>(writerPatches), new ArrayList<>(readerPatches)));
            }
        }
        return result;
    }

    public OrphanedSymbols getOrphanedSymbols() {
        List<Entry> writersOnly = new ArrayList<>();
        List<Entry> readersOnly = new ArrayList<>();
        for (Entry entry : entries.values()) {
            boolean writers = entry.hasRole(WRITER);
            boolean readers = entry.hasRole(READER);
            if (writers && !readers) writersOnly.add(entry);
            else if (readers && !writers) readersOnly.add(entry);
        }
        return new OrphanedSymbols(writersOnly, readersOnly);
    }

    public List<Entry> entries() {
        return new ArrayList<>(entries.values());
    }

    public Set<String> patches() {
        return patches;
    }

    public int size() {
        return entries.size();
    }

    // --- Persistence ---

    public Document toDocument() {
        Document doc = new Document();
        doc.symbols = entries();
        return doc;
    }

    public String toJson() {
        return GSON.toJson(toDocument());
    }

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SymbolTableException("Could not create directory for " + path, e);
        }
        try (Writer w = new FileWriter(path.toFile(), StandardCharsets.UTF_8)) {
            GSON.toJson(toDocument(), w);
        } catch (IOException e) {
            throw new SymbolTableException("Failed to write symbol table " + path + ": " + e.getMessage(), e);
        }
        System.err.println("[patch-ir] Symbol table written: " + path + " (" + entries.size() + " symbols)");
    }

    /**
     * Loads a table written by {@link #save}.
     *
     * @throws SymbolTableException if the file is missing or malformed
     */
    public static GlobalSymbolTable load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SymbolTableException("Symbol table not found: " + path);
        }
        Document doc;
        try (Reader r = new FileReader(path.toFile(), StandardCharsets.UTF_8)) {
            doc = GSON.fromJson(r, Document.class);
        } catch (IOException e) {
            throw new SymbolTableException("Failed to read symbol table " + path + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new SymbolTableException("Invalid symbol table " + path + ": " + e.getMessage(), e);
        }
        if (doc == null || doc.symbols == null) {
            throw new SymbolTableException("Symbol table is empty or invalid: " + path);
        }
        GlobalSymbolTable table = new GlobalSymbolTable();
        for (Entry entry : doc.symbols) {
            if (entry.kind == null || entry.resolved == null || entry.namespace == null) {
                throw new SymbolTableException("Symbol table entry missing kind, resolved or namespace: " + path);
            }
            if (entry.endpoints == null) entry.endpoints = new ArrayList<>();
            for (Endpoint e : entry.endpoints) {
                if (e.domain == null) e.domain = Domain.CONTROL;
                if (e.patch != null) table.patches.add(e.patch);
            }
            table.entries.put(key(entry.kind, entry.resolved, entry.namespace), entry);
        }
        return table;
    }
}
