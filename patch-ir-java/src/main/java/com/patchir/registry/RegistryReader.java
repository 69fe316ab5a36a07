package com.patchir.registry;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.patchir.ir.IrModel.Domain;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and validates registry overlay files.
 * A document is only returned once every entry in it has been checked, so a
 * malformed file never leaves a registry half-updated.
 */
public class RegistryReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and validates the overlay at {@code path}.
     *
     * @throws RegistryParseException if the file is missing, malformed, or contains an invalid entry
     */
    public RegistryDocument read(Path path) {
        if (!path.toFile().exists()) {
            throw new RegistryParseException("Registry file not found: " + path);
        }
        RegistryDocument doc;
        try (FileReader reader = new FileReader(path.toFile(), StandardCharsets.UTF_8)) {
            doc = GSON.fromJson(reader, RegistryDocument.class);
        } catch (FileNotFoundException e) {
            throw new RegistryParseException("Registry file not found: " + path, e);
        } catch (IOException e) {
            throw new RegistryParseException("Failed to read registry file: " + path + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new RegistryParseException("Registry file is not valid JSON: " + path + ": " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new RegistryParseException("Registry file is empty: " + path);
        }
        validate(doc, path.toString());
        return doc;
    }

    /** Parses an overlay from a JSON string, with the same validation as {@link #read(Path)}. */
    public RegistryDocument parse(String json) {
        RegistryDocument doc;
        try {
            doc = GSON.fromJson(json, RegistryDocument.class);
        } catch (JsonParseException e) {
            throw new RegistryParseException("Registry document is not valid JSON: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new RegistryParseException("Registry document is empty");
        }
        validate(doc, "<string>");
        return doc;
    }

    static void validate(RegistryDocument doc, String origin) {
        List<String> problems = new ArrayList<>();
        if (doc.objects == null) doc.objects = new ArrayList<>();
        if (doc.overrides == null) doc.overrides = new ArrayList<>();
        if (doc.sources == null) doc.sources = new ArrayList<>();

        for (int i = 0; i < doc.objects.size(); i++) {
            ObjectSpec spec = doc.objects.get(i);
            if (spec == null) {
                problems.add("objects[" + i + "] is null");
                continue;
            }
            if (spec.key == null || spec.key.isBlank()) {
                problems.add("objects[" + i + "] has no key");
                continue;
            }
            if (spec.inlets == null) spec.inlets = new ArrayList<>();
            if (spec.outlets == null) spec.outlets = new ArrayList<>();
            if (spec.args == null) spec.args = new ArrayList<>();
            if (spec.aliases == null) spec.aliases = new ArrayList<>();
            if (spec.library == null) spec.library = "unknown";
            if (spec.kind == null) spec.kind = ObjectSpec.KIND_CONTROL;
            // Gson leaves unrecognised enum tags as null
            if (spec.domain == null) spec.domain = spec.key.endsWith("~") ? Domain.SIGNAL : Domain.CONTROL;
            for (ObjectSpec.IoletSpec iolet : concat(spec.inlets, spec.outlets)) {
                if (iolet == null || !isIoletDomain(iolet.domain)) {
                    problems.add("objects[" + i + "] (" + spec.key + ") has an invalid port domain");
                    break;
                }
            }
            if (spec.symbolSemantics != null
                    && (spec.symbolSemantics.kind == null || spec.symbolSemantics.role == null)) {
                problems.add("objects[" + i + "] (" + spec.key + ") has invalid symbol_semantics");
            }
        }
        for (int i = 0; i < doc.overrides.size(); i++) {
            OverrideRule rule = doc.overrides.get(i);
            if (rule == null || rule.matchKey() == null) {
                problems.add("overrides[" + i + "] has no match key");
            } else if (rule.formula() == null) {
                problems.add("overrides[" + i + "] has unsupported rule: " + rule.rule);
            }
        }
        if (!problems.isEmpty()) {
            throw new RegistryParseException("Invalid registry document " + origin + ": " + String.join("; ", problems));
        }
    }

    private static boolean isIoletDomain(String domain) {
        return ObjectSpec.IoletSpec.SIGNAL.equals(domain)
                || ObjectSpec.IoletSpec.CONTROL.equals(domain)
                || ObjectSpec.IoletSpec.SIGNAL_OR_CONTROL.equals(domain);
    }

    private static List<ObjectSpec.IoletSpec> concat(List<ObjectSpec.IoletSpec> a, List<ObjectSpec.IoletSpec> b) {
        List<ObjectSpec.IoletSpec> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }

    public static class RegistryParseException extends RuntimeException {
        public RegistryParseException(String message) { super(message); }
        public RegistryParseException(String message, Throwable cause) { super(message, cause); }
    }
}
