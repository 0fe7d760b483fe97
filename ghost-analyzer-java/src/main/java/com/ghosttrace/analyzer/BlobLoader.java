package com.ghosttrace.analyzer;

import com.ghosttrace.analyzer.bytecode.BlobFormat;
import com.ghosttrace.analyzer.manifest.AnalysisManifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads instruction blobs from disk, keyed by module name.
 */
public class BlobLoader {

    /** Loads the blobs a manifest lists; relative paths resolve against {@code baseDir}. */
    public Map<String, byte[]> load(AnalysisManifest manifest, Path baseDir) {
        Map<String, byte[]> blobs = new TreeMap<>();
        for (AnalysisManifest.ModuleEntry module : manifest.getModules()) {
            blobs.put(module.getName(), read(baseDir.resolve(module.getBlob())));
        }
        return blobs;
    }

    /** Loads individual blob files; the module name is the file name without extension. */
    public Map<String, byte[]> load(List<Path> files) {
        Map<String, byte[]> blobs = new TreeMap<>();
        for (Path file : files) {
            blobs.put(moduleName(file), read(file));
        }
        return blobs;
    }

    /** Loads every {@code *.ghbc} file directly under {@code dir}. */
    public Map<String, byte[]> loadDirectory(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            List<Path> files = entries
                .filter(p -> p.getFileName().toString().endsWith(BlobFormat.FILE_EXTENSION))
                .sorted()
                .collect(Collectors.toList());
            return load(files);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list blob directory: " + dir, e);
        }
    }

    static String moduleName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read blob: " + file, e);
        }
    }
}
