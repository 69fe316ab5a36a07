package com.patchir.source;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Reads a parsed patch tree from its JSON form.
 */
public class SourceTreeReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a source tree from the given path.
     *
     * @throws SourceReadException if the file is missing, malformed, or has no root canvas
     */
    public SourcePatch read(Path path) {
        if (!path.toFile().exists()) {
            throw new SourceReadException("Source file not found: " + path);
        }
        SourcePatch patch;
        try (FileReader reader = new FileReader(path.toFile(), StandardCharsets.UTF_8)) {
            patch = GSON.fromJson(reader, SourcePatch.class);
        } catch (FileNotFoundException e) {
            throw new SourceReadException("Source file not found: " + path, e);
        } catch (IOException e) {
            throw new SourceReadException("Failed to read source file: " + path + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new SourceReadException("Source file is not valid JSON: " + path + ": " + e.getMessage(), e);
        }
        if (patch == null) {
            throw new SourceReadException("Source file is empty or invalid JSON: " + path);
        }
        if (patch.root == null) {
            throw new SourceReadException("Source file has no root canvas: " + path);
        }
        if (patch.name == null) {
            String file = path.getFileName().toString();
            patch.name = file.endsWith(".json") ? file.substring(0, file.length() - 5) : file;
        }
        return patch;
    }

    public static class SourceReadException extends RuntimeException {
        public SourceReadException(String message) { super(message); }
        public SourceReadException(String message, Throwable cause) { super(message, cause); }
    }
}
