package com.ghosttrace.agent;

import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Writes a {@link GhostReport} as pretty-printed JSON. Modules and functions are sorted by name.
 */
public class GhostReportWriter {

    public static final String REPORT_FILE = "ghost_report.json";

    public void write(GhostReport report, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        if (report.modules != null) {
            report.modules = new ArrayList<>(report.modules);
            report.modules.sort(Comparator.comparing(m -> m.name));
        }
        if (report.variables != null) {
            report.variables = new ArrayList<>(report.variables);
            report.variables.sort(Comparator.comparing(v -> v.function));
        }

        try (Writer w = Files.newBufferedWriter(outputPath)) {
            new GsonBuilder().setPrettyPrinting().serializeNulls().create().toJson(report, w);
        }
        System.err.println("[ghost-agent] " + REPORT_FILE + " written: " + outputPath);
    }
}
