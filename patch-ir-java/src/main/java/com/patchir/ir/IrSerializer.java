package com.patchir.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.patchir.ir.IrModel.EdgeKind;
import com.patchir.ir.IrModel.IrEdge;
import com.patchir.ir.IrModel.IrPatch;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes IR patches to {@code <name>.ir.json} and reads them back.
 * Canvases and nodes are sorted by id and wire edges precede symbol edges,
 * so the same IR always produces the same bytes.
 */
public class IrSerializer {

    public static final String IR_SUFFIX = ".ir.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg) { super(msg); }
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code ir} to {@code outputDir/<patch name>.ir.json}.
     *
     * @param ir        built IR patch; its arrays are sorted in place
     * @param outputDir directory to write into (created if absent)
     * @return the written file
     */
    public Path write(IrPatch ir, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }
        String name = ir.patch != null && ir.patch.name != null ? ir.patch.name : "untitled";
        Path irPath = outputDir.resolve(name + IR_SUFFIX);
        try (Writer w = new FileWriter(irPath.toFile(), StandardCharsets.UTF_8)) {
            GSON.toJson(sortForOutput(ir), w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + irPath + ": " + e.getMessage(), e);
        }
        System.err.println("[patch-ir] IR written: " + irPath);
        return irPath;
    }

    public String toJson(IrPatch ir) {
        return GSON.toJson(sortForOutput(ir));
    }

    /**
     * Reads an IR document.
     *
     * @throws SerializerException if the file is missing or not a valid IR document
     */
    public IrPatch read(Path irPath) {
        if (!Files.isRegularFile(irPath)) {
            throw new SerializerException("IR file not found: " + irPath);
        }
        try (Reader r = new FileReader(irPath.toFile(), StandardCharsets.UTF_8)) {
            return checked(GSON.fromJson(r, IrPatch.class), irPath.toString());
        } catch (IOException e) {
            throw new SerializerException("Failed to read " + irPath + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new SerializerException("Invalid IR document " + irPath + ": " + e.getMessage(), e);
        }
    }

    public IrPatch fromJson(String json) {
        try {
            return checked(GSON.fromJson(json, IrPatch.class), "<string>");
        } catch (JsonParseException e) {
            throw new SerializerException("Invalid IR document: " + e.getMessage(), e);
        }
    }

    private static IrPatch checked(IrPatch ir, String origin) {
        if (ir == null || ir.patch == null) {
            throw new SerializerException("Not an IR document (no patch metadata): " + origin);
        }
        return ir;
    }

    private static IrPatch sortForOutput(IrPatch ir) {
        ir.canvases = new ArrayList<>(ir.canvases);
        ir.canvases.sort(Comparator.comparing(c -> c.id));
        ir.nodes = new ArrayList<>(ir.nodes);
        ir.nodes.sort(Comparator.comparing(n -> n.id));

        List<IrEdge> wires = new ArrayList<>();
        List<IrEdge> symbolEdges = new ArrayList<>();
        for (IrEdge e : ir.edges) {
            (e.kind == EdgeKind.WIRE ? wires : symbolEdges).add(e);
        }
        wires.sort(Comparator.comparing((IrEdge e) -> e.from.node)
                .thenComparingInt(e -> e.from.outlet != null ? e.from.outlet : 0)
                .thenComparing(e -> e.to.node)
                .thenComparingInt(e -> e.to.inlet != null ? e.to.inlet : 0));
        ir.edges = wires;
        ir.edges.addAll(symbolEdges);

        if (ir.text != null) {
            ir.text.comments = new ArrayList<>(ir.text.comments);
            ir.text.comments.sort(Comparator.comparing(c -> c.node));
        }
        return ir;
    }
}
