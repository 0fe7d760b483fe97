package com.ghosttrace.analyzer.manifest;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

public class ManifestReader {

    private static final Gson GSON = new Gson();

    /**
     * Parses the manifest at {@code manifestPath} and checks that every module names a blob,
     * module names are unique, and the poll interval is positive.
     *
     * @throws ManifestReadException if the file is missing, unreadable, not JSON, or fails validation
     */
    public AnalysisManifest read(Path manifestPath) {
        AnalysisManifest manifest;
        try (Reader in = Files.newBufferedReader(manifestPath, StandardCharsets.UTF_8)) {
            manifest = GSON.fromJson(in, AnalysisManifest.class);
        } catch (NoSuchFileException e) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath, e);
        } catch (JsonParseException e) {
            throw new ManifestReadException("Manifest is not valid JSON: " + manifestPath + " (" + e.getMessage() + ")", e);
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read manifest: " + manifestPath + " (" + e.getMessage() + ")", e);
        }
        if (manifest == null) {
            throw new ManifestReadException("Manifest file is empty: " + manifestPath);
        }
        validate(manifest, manifestPath);
        return manifest;
    }

    private static void validate(AnalysisManifest manifest, Path source) {
        Set<String> seen = new HashSet<>();
        for (AnalysisManifest.ModuleEntry module : manifest.getModules()) {
            if (module == null || module.getName() == null || module.getBlob() == null) {
                throw new ManifestReadException("Manifest module entries need both name and blob: " + source);
            }
            if (!seen.add(module.getName())) {
                throw new ManifestReadException("Duplicate module '" + module.getName() + "' in " + source);
            }
        }
        if (manifest.getPollIntervalMs() <= 0) {
            throw new ManifestReadException("poll_interval_ms must be positive: " + manifest.getPollIntervalMs());
        }
    }

    public static class ManifestReadException extends RuntimeException {
        public ManifestReadException(String message) { super(message); }
        public ManifestReadException(String message, Throwable cause) { super(message, cause); }
    }
}
