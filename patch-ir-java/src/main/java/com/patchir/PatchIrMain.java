package com.patchir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.patchir.build.AbstractionResolver;
import com.patchir.build.IrBuilder;
import com.patchir.config.BuildConfig;
import com.patchir.config.BuildConfigReader;
import com.patchir.enrich.EnrichmentCache;
import com.patchir.enrich.EnrichmentManager;
import com.patchir.graph_analysis.GraphAnalyzer;
import com.patchir.graph_analysis.PatchQueries;
import com.patchir.ir.GlobalSymbolTable;
import com.patchir.ir.IrModel.IrDiagnostic;
import com.patchir.ir.IrModel.IrPatch;
import com.patchir.ir.IrSerializer;
import com.patchir.registry.ObjectRegistry;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar patch-ir-java.jar build --source <tree.json> [--output <dir>] [--config <file>]
 *                                     [--registry <file>]... [--abstractions <dir>]...
 *                                     [--enrichment-dir <dir>] [--no-enrichment]
 *   java -jar patch-ir-java.jar symbols --output <file> <ir.json>...
 *   java -jar patch-ir-java.jar summary <ir.json>
 *   java -jar patch-ir-java.jar trace [--config <file>] [--depth <n>] [--no-symbols] [--from-input] <ir.json> <node>
 *   java -jar patch-ir-java.jar registry --output <file> [--registry <file>]...
 */
public class PatchIrMain {

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[patch-ir] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar patch-ir-java.jar build --source <tree.json> [--output <dir>] ...");
            System.err.println("       java -jar patch-ir-java.jar symbols --output <file> <ir.json>...");
            System.err.println("       java -jar patch-ir-java.jar summary <ir.json>");
            System.err.println("       java -jar patch-ir-java.jar trace [--depth <n>] [--no-symbols] [--from-input] <ir.json> <node>");
            System.err.println("       java -jar patch-ir-java.jar registry --output <file>");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[patch-ir] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        switch (args[0]) {
            case "build"    -> runBuild(args);
            case "symbols"  -> runSymbols(args);
            case "summary"  -> runSummary(args);
            case "trace"    -> runTrace(args);
            case "registry" -> runRegistry(args);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    // --- build ---

    static Path runBuild(String[] args) {
        String sourcePath = null;
        String outputDir = null;
        String configPath = null;
        String enrichmentDir = null;
        boolean enrich = true;
        List<String> registryFiles = new ArrayList<>();
        List<String> abstractionPaths = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source"         -> sourcePath    = requireNext(args, i++, "--source");
                case "--output"         -> outputDir     = requireNext(args, i++, "--output");
                case "--config"         -> configPath    = requireNext(args, i++, "--config");
                case "--enrichment-dir" -> enrichmentDir = requireNext(args, i++, "--enrichment-dir");
                case "--registry"       -> registryFiles.add(requireNext(args, i++, "--registry"));
                case "--abstractions"   -> abstractionPaths.add(requireNext(args, i++, "--abstractions"));
                case "--no-enrichment"  -> enrich = false;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (sourcePath == null) throw new UsageException("--source is required");

        // 1. Configuration; flags win over the file
        BuildConfig config = new BuildConfig();
        if (configPath != null) {
            System.err.println("[patch-ir] Reading config: " + configPath);
            config = new BuildConfigReader().read(Paths.get(configPath));
        }
        Path source = Paths.get(sourcePath);
        Path output = Paths.get(outputDir != null ? outputDir : config.getOutputDir());
        List<String> overlays = new ArrayList<>(config.getRegistryFiles());
        overlays.addAll(registryFiles);
        List<Path> searchPaths = new ArrayList<>();
        for (String p : config.getAbstractionPaths()) searchPaths.add(Paths.get(p));
        for (String p : abstractionPaths) searchPaths.add(Paths.get(p));
        Path sourceDir = source.toAbsolutePath().getParent();
        if (sourceDir != null) searchPaths.add(sourceDir);

        // 2. Registry
        ObjectRegistry registry = loadRegistry(overlays);

        // 3. Build
        System.err.println("[patch-ir] Building IR from: " + source);
        IrBuilder builder = new IrBuilder(registry, AbstractionResolver.searchPaths(searchPaths));
        IrPatch ir = builder.buildFromFile(source);
        System.err.println("[patch-ir] Build complete: "
                + ir.nodes.size() + " nodes, "
                + ir.edges.size() + " edges, "
                + ir.symbols.size() + " symbols, "
                + ir.diagnostics.warnings.size() + " warnings");
        for (IrDiagnostic w : ir.diagnostics.warnings) {
            System.err.println("[patch-ir] WARNING: " + w.code + ": " + w.message);
        }

        // 4. Enrichment sidecar, if one matches this graph
        if (enrich) {
            String dir = enrichmentDir != null ? enrichmentDir : config.getEnrichmentDir();
            Path cacheDir = dir != null ? Paths.get(dir) : sourceDir;
            new EnrichmentManager(new EnrichmentCache(cacheDir)).loadAndApply(ir, true);
        }

        // 5. Serialize
        System.err.println("[patch-ir] Writing output to: " + output);
        Path written = new IrSerializer().write(ir, output);
        System.err.println("[patch-ir] Done.");
        return written;
    }

    private static ObjectRegistry loadRegistry(List<String> overlays) {
        ObjectRegistry registry = ObjectRegistry.withBuiltins();
        for (String overlay : overlays) {
            System.err.println("[patch-ir] Loading registry overlay: " + overlay);
            registry.loadJson(Paths.get(overlay));
        }
        System.err.println("[patch-ir] Registry ready: " + registry.size() + " object types");
        return registry;
    }

    // --- symbols ---

    static GlobalSymbolTable runSymbols(String[] args) {
        String outputFile = null;
        List<String> inputs = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output" -> outputFile = requireNext(args, i++, "--output");
                default -> {
                    if (args[i].startsWith("--")) throw new UsageException("Unknown flag: " + args[i]);
                    inputs.add(args[i]);
                }
            }
        }
        if (outputFile == null) throw new UsageException("--output is required");
        if (inputs.isEmpty()) throw new UsageException("At least one IR file is required");

        IrSerializer serializer = new IrSerializer();
        GlobalSymbolTable table = new GlobalSymbolTable();
        for (String input : inputs) {
            System.err.println("[patch-ir] Indexing symbols of: " + input);
            table.addPatch(serializer.read(Paths.get(input)));
        }
        System.err.println("[patch-ir] Cross-patch connections: " + table.getCrossPatchConnections().size());
        table.save(Paths.get(outputFile));
        return table;
    }

    // --- summary ---

    static PatchQueries.PatchSummary runSummary(String[] args) {
        if (args.length != 2) throw new UsageException("summary takes exactly one IR file");
        IrPatch ir = new IrSerializer().read(Paths.get(args[1]));
        PatchQueries.PatchSummary summary = PatchQueries.summarize(ir);
        System.out.println(PRETTY.toJson(summary));
        return summary;
    }

    // --- trace ---

    static List<List<String>> runTrace(String[] args) {
        String configPath = null;
        Integer depth = null;
        boolean symbols = true;
        boolean fromInput = false;
        List<String> positional = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config"     -> configPath = requireNext(args, i++, "--config");
                case "--depth"      -> depth = parseDepth(requireNext(args, i++, "--depth"));
                case "--no-symbols" -> symbols = false;
                case "--from-input" -> fromInput = true;
                default -> {
                    if (args[i].startsWith("--")) throw new UsageException("Unknown flag: " + args[i]);
                    positional.add(args[i]);
                }
            }
        }
        if (positional.size() != 2) throw new UsageException("trace takes an IR file and a node id");

        BuildConfig config = configPath != null ? new BuildConfigReader().read(Paths.get(configPath)) : new BuildConfig();
        int maxDepth = depth != null ? depth : config.getMaxTraceDepth();
        boolean includeSymbolEdges = symbols && config.isIncludeSymbolEdges();

        IrPatch ir = new IrSerializer().read(Paths.get(positional.get(0)));
        String nodeId = positional.get(1);
        if (ir.getNode(nodeId) == null) {
            throw new IllegalArgumentException("No node " + nodeId + " in " + positional.get(0));
        }
        GraphAnalyzer analyzer = new GraphAnalyzer(ir, includeSymbolEdges);
        List<List<String>> paths = fromInput
                ? analyzer.traceFromInput(nodeId, maxDepth)
                : analyzer.traceToOutput(nodeId, maxDepth);
        System.err.println("[patch-ir] " + paths.size() + " path(s) " + (fromInput ? "into " : "from ") + nodeId);
        System.out.println(PRETTY.toJson(paths));
        return paths;
    }

    private static int parseDepth(String value) {
        int depth;
        try {
            depth = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException("--depth must be a positive integer: " + value);
        }
        if (depth <= 0) throw new UsageException("--depth must be a positive integer: " + value);
        return depth;
    }

    // --- registry ---

    static Path runRegistry(String[] args) {
        String outputFile = null;
        List<String> overlays = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output"   -> outputFile = requireNext(args, i++, "--output");
                case "--registry" -> overlays.add(requireNext(args, i++, "--registry"));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (outputFile == null) throw new UsageException("--output is required");

        Path output = Paths.get(outputFile);
        ObjectRegistry registry = loadRegistry(overlays);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = new FileWriter(output.toFile(), StandardCharsets.UTF_8)) {
                PRETTY.toJson(registry.toExport(), w);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write registry export " + output + ": " + e.getMessage(), e);
        }
        System.err.println("[patch-ir] Registry written: " + output);
        return output;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
