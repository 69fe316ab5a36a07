package com.patchir.enrich;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores enrichment sidecars either in one cache directory or next to the
 * patch they describe.
 */
public class EnrichmentCache {

    public static final String SUFFIX = ".enrichment.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path cacheDir;

    public static class EnrichmentReadException extends RuntimeException {
        public EnrichmentReadException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** Sidecars live next to their patches. */
    public EnrichmentCache() {
        this(null);
    }

    public EnrichmentCache(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    public Path enrichmentPath(String patchPath) {
        Path patch = Paths.get(patchPath);
        String fileName = patch.getFileName() != null ? patch.getFileName().toString() : patchPath;
        String stem = stripExtension(fileName);
        if (cacheDir != null) {
            return cacheDir.resolve(stem + SUFFIX);
        }
        Path parent = patch.getParent();
        return parent != null ? parent.resolve(stem + SUFFIX) : Paths.get(stem + SUFFIX);
    }

    static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * @throws EnrichmentReadException if the sidecar exists but cannot be read or parsed
     */
    public Optional<EnrichmentData> get(String patchPath) {
        Path file = enrichmentPath(patchPath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (Reader r = new FileReader(file.toFile(), StandardCharsets.UTF_8)) {
            EnrichmentData data = GSON.fromJson(r, EnrichmentData.class);
            return Optional.ofNullable(data).map(EnrichmentData::normalized);
        } catch (IOException e) {
            throw new EnrichmentReadException("Failed to read enrichment " + file + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new EnrichmentReadException("Invalid enrichment file " + file + ": " + e.getMessage(), e);
        }
    }

    public Path save(String patchPath, EnrichmentData data) {
        Path file = enrichmentPath(patchPath);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
                GSON.toJson(data, w);
            }
        } catch (IOException e) {
            throw new EnrichmentReadException("Failed to write enrichment " + file + ": " + e.getMessage(), e);
        }
        System.err.println("[patch-ir] Enrichment written: " + file);
        return file;
    }

    /** Deletes the sidecar; returns whether one existed. */
    public boolean invalidate(String patchPath) {
        Path file = enrichmentPath(patchPath);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new EnrichmentReadException("Failed to delete enrichment " + file + ": " + e.getMessage(), e);
        }
    }

    /** True when a sidecar exists and was written for {@code graphHash}. */
    public boolean isValid(String patchPath, String graphHash) {
        return get(patchPath)
                .map(data -> Objects.equals(data.basedOnIrSha, graphHash))
                .orElse(false);
    }
}
