package com.patchir.enrich;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.patchir.ir.IrModel.IrEnrichment;
import com.patchir.ir.IrModel.IrPatch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates, stores and applies enrichment for built IR patches.
 * The sidecar is keyed by the patch path, or by the patch name when the
 * patch was not read from a file.
 */
public class EnrichmentManager {

    public static final String GENERATOR_MANUAL = "manual";
    public static final String GENERATOR_LLM = "llm";

    private static final Gson GSON = new Gson();
    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern BARE_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private final EnrichmentCache cache;

    public static class EnrichmentParseException extends RuntimeException {
        public EnrichmentParseException(String msg) { super(msg); }
        public EnrichmentParseException(String msg, Throwable cause) { super(msg, cause); }
    }

    public EnrichmentManager() {
        this(new EnrichmentCache());
    }

    public EnrichmentManager(EnrichmentCache cache) {
        this.cache = cache;
    }

    public EnrichmentCache cache() {
        return cache;
    }

    /** Empty enrichment stamped with the patch's current graph hash. */
    public EnrichmentData createEnrichment(IrPatch ir, String generator) {
        EnrichmentData data = new EnrichmentData();
        String key = patchKey(ir);
        data.patch = key != null ? key : "";
        data.basedOnIrSha = ir.graphHash();
        data.generatedAt = Instant.now().toString();
        data.generator = generator;
        return data;
    }

    /**
     * Copies the annotations into {@code ir.enrichment}.
     *
     * @throws StaleEnrichmentException if the data was written for a different graph hash
     */
    public IrPatch apply(IrPatch ir, EnrichmentData data) {
        String current = ir.graphHash();
        if (data.basedOnIrSha != null && current != null && !data.basedOnIrSha.equals(current)) {
            throw new StaleEnrichmentException(data.patch, data.basedOnIrSha, current);
        }
        return attach(ir, data);
    }

    private static IrPatch attach(IrPatch ir, EnrichmentData data) {
        String current = ir.graphHash();
        IrEnrichment enrichment = new IrEnrichment();
        enrichment.basedOnIrSha = data.basedOnIrSha != null ? data.basedOnIrSha : current;
        enrichment.summary = data.summary;
        enrichment.roles = data.roles != null ? new ArrayList<>(data.roles) : new ArrayList<>();
        enrichment.inletSemantics = data.inletSemantics != null
                ? new LinkedHashMap<>(data.inletSemantics) : new LinkedHashMap<>();
        enrichment.outletSemantics = data.outletSemantics != null
                ? new LinkedHashMap<>(data.outletSemantics) : new LinkedHashMap<>();
        enrichment.notes = data.notes != null ? new ArrayList<>(data.notes) : new ArrayList<>();
        ir.enrichment = enrichment;
        return ir;
    }

    /**
     * Applies the cached sidecar if there is one. With {@code validate}, a sidecar
     * written for another graph hash is skipped with a warning instead.
     */
    public IrPatch loadAndApply(IrPatch ir, boolean validate) {
        String key = patchKey(ir);
        if (key == null) return ir;
        Optional<EnrichmentData> cached = cache.get(key);
        if (cached.isEmpty()) return ir;
        EnrichmentData data = cached.get();
        String current = ir.graphHash();
        if (validate && current != null && !current.equals(data.basedOnIrSha)) {
            System.err.println("[patch-ir] WARNING: skipping stale enrichment for " + key);
            return ir;
        }
        return validate ? apply(ir, data) : attach(ir, data);
    }

    public Path saveEnrichment(IrPatch ir, EnrichmentData data) {
        String key = patchKey(ir);
        if (key == null) {
            throw new IllegalArgumentException("IR patch has neither a path nor a name");
        }
        return cache.save(key, data);
    }

    /**
     * Extracts the JSON object from a free-text annotation response: the first
     * {@code ```json} fenced block, otherwise the outermost braces.
     *
     * @throws EnrichmentParseException if no JSON object is found or it does not parse
     */
    public EnrichmentData parseLlmResponse(String response, IrPatch ir) {
        String json;
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            json = fenced.group(1);
        } else {
            Matcher bare = BARE_OBJECT.matcher(response);
            if (!bare.find()) {
                throw new EnrichmentParseException("Could not find JSON in annotation response");
            }
            json = bare.group();
        }
        EnrichmentData parsed;
        try {
            parsed = GSON.fromJson(json, EnrichmentData.class);
        } catch (JsonParseException e) {
            throw new EnrichmentParseException("Annotation response is not valid JSON: " + e.getMessage(), e);
        }
        if (parsed == null) {
            throw new EnrichmentParseException("Annotation response contained an empty JSON document");
        }
        parsed.normalized();

        EnrichmentData data = createEnrichment(ir, GENERATOR_LLM);
        data.summary = parsed.summary;
        data.roles = parsed.roles;
        data.nodeRoles = parsed.nodeRoles;
        data.inletSemantics = parsed.inletSemantics;
        data.outletSemantics = parsed.outletSemantics;
        data.notes = parsed.notes;
        return data;
    }

    private static String patchKey(IrPatch ir) {
        if (ir.patch == null) return null;
        if (ir.patch.path != null && !ir.patch.path.isEmpty()) return ir.patch.path;
        return ir.patch.name;
    }
}
